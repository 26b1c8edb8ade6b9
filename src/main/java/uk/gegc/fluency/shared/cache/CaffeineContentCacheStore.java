package uk.gegc.fluency.shared.cache;

import com.github.benmanes.caffeine.cache.Cache;
import com.github.benmanes.caffeine.cache.Caffeine;
import com.github.benmanes.caffeine.cache.Expiry;

import java.time.Duration;
import java.util.List;
import java.util.Optional;

/**
 * In-memory cache backed by Caffeine. Not shared across instances.
 * Entries carry their own TTL so that {@link #put(String, String, Duration)} honours it.
 */
public class CaffeineContentCacheStore implements ContentCacheStore {

    private final Cache<String, Entry> cache;

    public CaffeineContentCacheStore(long maximumSize) {
        this.cache = Caffeine.newBuilder()
                .maximumSize(maximumSize)
                .expireAfter(new Expiry<String, Entry>() {
                    @Override
                    public long expireAfterCreate(String key, Entry entry, long currentTime) {
                        return entry.ttl().toNanos();
                    }

                    @Override
                    public long expireAfterUpdate(String key, Entry entry, long currentTime, long currentDuration) {
                        return entry.ttl().toNanos();
                    }

                    @Override
                    public long expireAfterRead(String key, Entry entry, long currentTime, long currentDuration) {
                        return currentDuration;
                    }
                })
                .build();
    }

    @Override
    public Optional<String> get(String key) {
        Entry entry = cache.getIfPresent(key);
        return entry == null ? Optional.empty() : Optional.of(entry.value());
    }

    @Override
    public void put(String key, String value, Duration ttl) {
        cache.put(key, new Entry(value, ttl));
    }

    @Override
    public boolean delete(String key) {
        return cache.asMap().remove(key) != null;
    }

    @Override
    public long deleteByPrefix(String prefix) {
        long removed = 0;
        for (String key : List.copyOf(cache.asMap().keySet())) {
            if (key.startsWith(prefix) && cache.asMap().remove(key) != null) {
                removed++;
            }
        }
        return removed;
    }

    private record Entry(String value, Duration ttl) {
    }
}
