package uk.gegc.fluency.shared.config;

import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.data.redis.core.StringRedisTemplate;
import uk.gegc.fluency.shared.cache.CacheProperties;
import uk.gegc.fluency.shared.cache.CaffeineContentCacheStore;
import uk.gegc.fluency.shared.cache.ContentCacheStore;
import uk.gegc.fluency.shared.cache.RedisContentCacheStore;

/**
 * Selects the {@link ContentCacheStore} backend from {@code fluency.cache.type}.
 * <ul>
 *   <li>REDIS: Spring Data Redis, shared between instances</li>
 *   <li>MEMORY: Caffeine, per process (default)</li>
 * </ul>
 */
@Slf4j
@Configuration
public class CacheStoreConfig {

    @Bean
    @ConditionalOnProperty(name = "fluency.cache.type", havingValue = "REDIS")
    public ContentCacheStore redisContentCacheStore(StringRedisTemplate redisTemplate) {
        log.info("Activating Redis content cache store");
        return new RedisContentCacheStore(redisTemplate);
    }

    @Bean
    @ConditionalOnProperty(name = "fluency.cache.type", havingValue = "MEMORY", matchIfMissing = true)
    public ContentCacheStore caffeineContentCacheStore(CacheProperties properties) {
        log.info("Activating in-memory content cache store (max {} entries)", properties.getMaxSize());
        return new CaffeineContentCacheStore(properties.getMaxSize());
    }
}
