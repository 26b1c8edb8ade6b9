package uk.gegc.fluency.features.sync.application.scheduler;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;
import uk.gegc.fluency.features.sync.application.ContentSyncRelay;

/**
 * Retries outbox tasks that the post-commit dispatch missed or failed, and deletes processed tasks
 * once they are past retention.
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class ContentSyncRelayScheduler {

    private final ContentSyncRelay relay;

    @Scheduled(fixedDelayString = "${fluency.sync.relay-fixed-delay-ms:15000}",
            initialDelayString = "${fluency.sync.relay-initial-delay-ms:15000}")
    public void drainOutbox() {
        log.debug("Running scheduled content sync sweep");
        try {
            relay.drainPending();
        } catch (Exception e) {
            // keep the scheduler alive
            log.error("Error during scheduled content sync sweep", e);
        }
    }

    @Scheduled(fixedDelayString = "${fluency.sync.cleanup-fixed-delay-ms:3600000}",
            initialDelayString = "${fluency.sync.cleanup-fixed-delay-ms:3600000}")
    public void purgeProcessedTasks() {
        log.debug("Running scheduled cleanup of processed content sync tasks");
        try {
            relay.purgeProcessed();
        } catch (Exception e) {
            log.error("Error during scheduled cleanup of processed content sync tasks", e);
        }
    }
}
