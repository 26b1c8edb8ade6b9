package uk.gegc.fluency.shared.cache;

import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Positive;
import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;
import org.springframework.validation.annotation.Validated;

import java.time.Duration;

/**
 * Settings for the content detail cache.
 */
@Data
@Validated
@Component
@ConfigurationProperties(prefix = "fluency.cache")
public class CacheProperties {

    /**
     * When false every cache read is a miss and every write is skipped.
     */
    private boolean enabled = true;

    @NotNull
    private ContentCacheStore.CacheType type = ContentCacheStore.CacheType.MEMORY;

    /**
     * Time-to-live of a detail entry. Superseded versions are left to expire.
     */
    @NotNull
    private Duration ttl = Duration.ofHours(24);

    /**
     * Upper bound on entries held by the in-memory backend.
     */
    @Positive
    private long maxSize = 10_000;
}
