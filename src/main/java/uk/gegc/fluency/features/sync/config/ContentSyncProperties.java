package uk.gegc.fluency.features.sync.config;

import jakarta.validation.constraints.Max;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotNull;
import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;
import org.springframework.validation.annotation.Validated;

import java.time.Duration;

/**
 * Settings for the content sync outbox relay.
 */
@Data
@Validated
@Component
@ConfigurationProperties(prefix = "fluency.sync")
public class ContentSyncProperties {

    /**
     * Attempts after which a task is no longer retried by the sweep.
     * Default: 10
     */
    @Min(1)
    private int maxAttempts = 10;

    /**
     * Maximum tasks drained per sweep.
     * Default: 100
     */
    @Min(1)
    @Max(1000)
    private int batchSize = 100;

    /**
     * Delay between outbox sweeps, in milliseconds.
     * Default: 15000 (15 seconds)
     */
    @Min(100)
    private long relayFixedDelayMs = 15_000;

    /**
     * Delay before the first sweep after startup, in milliseconds.
     * Default: 15000 (15 seconds)
     */
    @Min(0)
    private long relayInitialDelayMs = 15_000;

    /**
     * How long processed tasks are kept before the cleanup deletes them.
     * Default: 7 days
     */
    @NotNull
    private Duration retention = Duration.ofDays(7);

    /**
     * Delay between cleanups of processed tasks, in milliseconds.
     * Default: 3600000 (1 hour)
     */
    @Min(1000)
    private long cleanupFixedDelayMs = 3_600_000;
}
