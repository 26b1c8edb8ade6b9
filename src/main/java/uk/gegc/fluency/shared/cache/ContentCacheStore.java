package uk.gegc.fluency.shared.cache;

import java.time.Duration;
import java.util.Optional;

/**
 * Key/value store behind the detail cache, with pluggable backends.
 *
 * <p>Supported backends:
 * <ul>
 *   <li>MEMORY - in-process Caffeine cache (default, single node)</li>
 *   <li>REDIS - shared Redis instance via Spring Data Redis</li>
 * </ul>
 *
 * <p>Configure via:
 * <pre>
 * fluency.cache.type=MEMORY|REDIS
 * fluency.cache.ttl=24h
 * </pre>
 *
 * Implementations propagate backend failures as runtime exceptions; deciding whether a failure
 * matters is the caller's business.
 */
public interface ContentCacheStore {

    /**
     * @return the cached value, or empty if absent or expired
     */
    Optional<String> get(String key);

    void put(String key, String value, Duration ttl);

    boolean delete(String key);

    /**
     * Deletes every key starting with {@code prefix}.
     *
     * @return number of keys removed
     */
    long deleteByPrefix(String prefix);

    enum CacheType {
        MEMORY,
        REDIS
    }
}
