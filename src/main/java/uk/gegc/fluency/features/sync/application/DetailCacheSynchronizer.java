package uk.gegc.fluency.features.sync.application;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.extern.slf4j.Slf4j;
import uk.gegc.fluency.features.sync.domain.model.CompletionStatus;
import uk.gegc.fluency.features.sync.domain.model.ContentKind;
import uk.gegc.fluency.shared.cache.CacheProperties;
import uk.gegc.fluency.shared.cache.ContentCacheStore;

import java.util.Optional;
import java.util.UUID;

/**
 * Writes and reads detail views under version-qualified keys
 * {@code <prefix>:<id>:<status>:<version>}.
 * <p>
 * A new version lands under a new key and earlier keys are left to expire, so a reader holding an
 * old key never sees newer content. Cache failures are logged and counted, never thrown.
 */
@Slf4j
public class DetailCacheSynchronizer<D extends ContentDetail> {

    private final ContentKind kind;
    private final Class<D> detailType;
    private final ContentCacheStore cacheStore;
    private final ObjectMapper objectMapper;
    private final CacheProperties cacheProperties;
    private final ContentSyncMetrics metrics;

    public DetailCacheSynchronizer(ContentKind kind,
                                   Class<D> detailType,
                                   ContentCacheStore cacheStore,
                                   ObjectMapper objectMapper,
                                   CacheProperties cacheProperties,
                                   ContentSyncMetrics metrics) {
        this.kind = kind;
        this.detailType = detailType;
        this.cacheStore = cacheStore;
        this.objectMapper = objectMapper;
        this.cacheProperties = cacheProperties;
        this.metrics = metrics;
    }

    public String cacheKey(UUID id, CompletionStatus status, int version) {
        return itemPrefix(id) + status.value() + ":" + version;
    }

    public void sync(D detail, CompletionStatus status) {
        if (!cacheProperties.isEnabled()) {
            return;
        }
        String key = cacheKey(detail.id(), status, detail.version());
        try {
            cacheStore.put(key, objectMapper.writeValueAsString(detail), cacheProperties.getTtl());
            // sub-record edits keep the version, so the same version may have been cached under the other status
            cacheStore.delete(cacheKey(detail.id(), opposite(status), detail.version()));
            log.debug("Cached {} under {}", kind, key);
        } catch (JsonProcessingException e) {
            log.error("Failed to serialize {} detail {} for caching", kind, detail.id(), e);
            metrics.recordCacheFailure(kind, "sync");
        } catch (RuntimeException e) {
            log.warn("Failed to cache {} detail under {}: {}", kind, key, e.getMessage());
            metrics.recordCacheFailure(kind, "sync");
        }
    }

    /**
     * Read-path variant of {@link #sync}: stores the detail only when nothing is cached for its version
     * under either status, and never deletes. A reader holding a stale same-version snapshot cannot
     * displace an entry the relay wrote.
     */
    public void fill(D detail, CompletionStatus status) {
        if (!cacheProperties.isEnabled()) {
            return;
        }
        String key = cacheKey(detail.id(), status, detail.version());
        try {
            if (cacheStore.get(key).isPresent()
                    || cacheStore.get(cacheKey(detail.id(), opposite(status), detail.version())).isPresent()) {
                return;
            }
            cacheStore.put(key, objectMapper.writeValueAsString(detail), cacheProperties.getTtl());
            log.debug("Filled {} cache entry {}", kind, key);
        } catch (JsonProcessingException e) {
            log.error("Failed to serialize {} detail {} for caching", kind, detail.id(), e);
            metrics.recordCacheFailure(kind, "fill");
        } catch (RuntimeException e) {
            log.warn("Failed to fill {} cache entry {}: {}", kind, key, e.getMessage());
            metrics.recordCacheFailure(kind, "fill");
        }
    }

    /**
     * Looks up the detail at exactly {@code version}, complete entry first.
     * Anything unreadable counts as a miss.
     */
    public Optional<D> fetch(UUID id, int version) {
        if (!cacheProperties.isEnabled()) {
            return Optional.empty();
        }
        for (CompletionStatus status : new CompletionStatus[]{CompletionStatus.COMPLETE, CompletionStatus.UNCOMPLETE}) {
            String key = cacheKey(id, status, version);
            try {
                Optional<String> cached = cacheStore.get(key);
                if (cached.isPresent()) {
                    return Optional.of(objectMapper.readValue(cached.get(), detailType));
                }
            } catch (JsonProcessingException e) {
                log.warn("Discarding unreadable cache entry {}: {}", key, e.getOriginalMessage());
                metrics.recordCacheFailure(kind, "fetch");
            } catch (RuntimeException e) {
                log.warn("Failed to read cache entry {}: {}", key, e.getMessage());
                metrics.recordCacheFailure(kind, "fetch");
            }
        }
        return Optional.empty();
    }

    /**
     * Removes every cached version and status of one item.
     */
    public void evict(UUID id) {
        evictPrefix(itemPrefix(id));
    }

    /**
     * Removes every cached entry of this content kind.
     */
    public void evictAll() {
        evictPrefix(kind.cacheKeyPrefix() + ":");
    }

    public ContentKind kind() {
        return kind;
    }

    private void evictPrefix(String prefix) {
        if (!cacheProperties.isEnabled()) {
            return;
        }
        try {
            long removed = cacheStore.deleteByPrefix(prefix);
            log.debug("Evicted {} cache entries with prefix {}", removed, prefix);
        } catch (RuntimeException e) {
            log.warn("Failed to evict cache entries with prefix {}: {}", prefix, e.getMessage());
            metrics.recordCacheFailure(kind, "evict");
        }
    }

    private static CompletionStatus opposite(CompletionStatus status) {
        return status == CompletionStatus.COMPLETE ? CompletionStatus.UNCOMPLETE : CompletionStatus.COMPLETE;
    }

    private String itemPrefix(UUID id) {
        return kind.cacheKeyPrefix() + ":" + id + ":";
    }
}
