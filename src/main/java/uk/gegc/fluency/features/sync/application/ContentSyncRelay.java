package uk.gegc.fluency.features.sync.application;

import java.util.UUID;

/**
 * Drains the content sync outbox into the cache and search projections.
 */
public interface ContentSyncRelay {

    /**
     * Processes a single task if it is still pending. Failures are recorded on the task, not thrown.
     */
    void process(UUID taskId);

    /**
     * Processes a batch of pending tasks that still have attempts left, oldest first.
     *
     * @return number of tasks that completed successfully
     */
    int drainPending();

    /**
     * Deletes processed tasks older than the configured retention.
     *
     * @return number of tasks deleted
     */
    int purgeProcessed();

    OutboxStatus status();

    record OutboxStatus(long pending, long exhausted) {
    }
}
