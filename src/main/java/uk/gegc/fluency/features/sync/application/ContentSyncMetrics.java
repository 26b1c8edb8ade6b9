package uk.gegc.fluency.features.sync.application;

import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;
import uk.gegc.fluency.features.sync.domain.model.ContentKind;
import uk.gegc.fluency.features.sync.domain.model.SyncOperation;

/**
 * Micrometer counters for cache/search synchronization. Every counter is tagged with the content kind.
 */
@Component
@RequiredArgsConstructor
public class ContentSyncMetrics {

    public static final String CACHE_FAILURES = "content.sync.cache.failures";
    public static final String SEARCH_FAILURES = "content.sync.search.failures";
    public static final String OUTBOX_PROCESSED = "content.sync.outbox.processed";
    public static final String OUTBOX_FAILED = "content.sync.outbox.failed";
    public static final String OUTBOX_EXHAUSTED = "content.sync.outbox.exhausted";

    private final MeterRegistry meterRegistry;

    public void recordCacheFailure(ContentKind kind, String operation) {
        Counter.builder(CACHE_FAILURES)
                .description("Cache reads or writes that failed and were ignored")
                .tag("kind", kind.name())
                .tag("operation", operation)
                .register(meterRegistry)
                .increment();
    }

    public void recordSearchFailure(ContentKind kind, String operation) {
        Counter.builder(SEARCH_FAILURES)
                .description("Search index operations that failed")
                .tag("kind", kind.name())
                .tag("operation", operation)
                .register(meterRegistry)
                .increment();
    }

    public void recordTaskProcessed(ContentKind kind, SyncOperation operation) {
        Counter.builder(OUTBOX_PROCESSED)
                .description("Outbox tasks whose projections were refreshed")
                .tag("kind", kind.name())
                .tag("operation", operation.name())
                .register(meterRegistry)
                .increment();
    }

    public void recordTaskFailed(ContentKind kind, SyncOperation operation) {
        Counter.builder(OUTBOX_FAILED)
                .description("Outbox task attempts that failed and will be retried")
                .tag("kind", kind.name())
                .tag("operation", operation.name())
                .register(meterRegistry)
                .increment();
    }

    public void recordTaskExhausted(ContentKind kind) {
        Counter.builder(OUTBOX_EXHAUSTED)
                .description("Outbox tasks that ran out of attempts")
                .tag("kind", kind.name())
                .register(meterRegistry)
                .increment();
    }
}
