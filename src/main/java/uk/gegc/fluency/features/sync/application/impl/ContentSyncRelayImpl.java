package uk.gegc.fluency.features.sync.application.impl;

import lombok.extern.slf4j.Slf4j;
import org.springframework.data.domain.PageRequest;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;
import uk.gegc.fluency.features.sync.application.ContentSyncHandler;
import uk.gegc.fluency.features.sync.application.ContentSyncMetrics;
import uk.gegc.fluency.features.sync.application.ContentSyncRelay;
import uk.gegc.fluency.features.sync.config.ContentSyncProperties;
import uk.gegc.fluency.features.sync.domain.model.ContentKind;
import uk.gegc.fluency.features.sync.domain.model.ContentSyncTask;
import uk.gegc.fluency.features.sync.domain.repository.ContentSyncTaskRepository;

import java.time.Clock;
import java.time.Instant;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.UUID;

/**
 * A task is marked processed only once its handler returned normally, which means the search index
 * accepted the change. Otherwise the attempt is counted and the error kept for the next sweep.
 */
@Slf4j
@Service
public class ContentSyncRelayImpl implements ContentSyncRelay {

    private static final int MAX_ERROR_LENGTH = 1000;

    private final ContentSyncTaskRepository taskRepository;
    private final Map<ContentKind, ContentSyncHandler> handlers;
    private final ContentSyncProperties properties;
    private final ContentSyncMetrics metrics;
    private final Clock clock;

    public ContentSyncRelayImpl(ContentSyncTaskRepository taskRepository,
                                List<ContentSyncHandler> handlers,
                                ContentSyncProperties properties,
                                ContentSyncMetrics metrics,
                                Clock clock) {
        this.taskRepository = taskRepository;
        this.properties = properties;
        this.metrics = metrics;
        this.clock = clock;
        this.handlers = new EnumMap<>(ContentKind.class);
        for (ContentSyncHandler handler : handlers) {
            ContentSyncHandler previous = this.handlers.put(handler.kind(), handler);
            if (previous != null) {
                throw new IllegalStateException("Duplicate content sync handler for " + handler.kind());
            }
        }
    }

    @Override
    public void process(UUID taskId) {
        ContentSyncTask task = taskRepository.findById(taskId).orElse(null);
        if (task == null) {
            log.warn("Content sync task {} not found", taskId);
            return;
        }
        if (task.isProcessed()) {
            log.debug("Content sync task {} already processed", taskId);
            return;
        }
        execute(task);
    }

    @Override
    public int drainPending() {
        List<ContentSyncTask> tasks = taskRepository.findRetryable(
                properties.getMaxAttempts(), PageRequest.of(0, properties.getBatchSize()));
        int succeeded = 0;
        for (ContentSyncTask task : tasks) {
            if (execute(task)) {
                succeeded++;
            }
        }
        if (!tasks.isEmpty()) {
            log.info("Content sync sweep processed {}/{} pending tasks", succeeded, tasks.size());
        }
        long exhausted = taskRepository.countExhausted(properties.getMaxAttempts());
        if (exhausted > 0) {
            log.warn("{} content sync tasks exhausted their {} attempts and need manual attention",
                    exhausted, properties.getMaxAttempts());
        }
        return succeeded;
    }

    @Override
    @Transactional
    public int purgeProcessed() {
        Instant cutoff = Instant.now(clock).minus(properties.getRetention());
        int deleted = taskRepository.deleteByProcessedAtBefore(cutoff);
        if (deleted > 0) {
            log.info("Purged {} processed content sync tasks older than {}", deleted, cutoff);
        }
        return deleted;
    }

    @Override
    public OutboxStatus status() {
        return new OutboxStatus(
                taskRepository.countByProcessedAtIsNull(),
                taskRepository.countExhausted(properties.getMaxAttempts()));
    }

    private boolean execute(ContentSyncTask task) {
        task.setAttempts(task.getAttempts() + 1);
        ContentSyncHandler handler = handlers.get(task.getKind());
        try {
            if (handler == null) {
                throw new IllegalStateException("No content sync handler registered for " + task.getKind());
            }
            switch (task.getOperation()) {
                case UPSERT -> handler.upsert(task.getItemId());
                case REMOVE -> handler.remove(task.getItemId());
            }
            task.setProcessedAt(Instant.now(clock));
            task.setLastError(null);
            taskRepository.save(task);
            metrics.recordTaskProcessed(task.getKind(), task.getOperation());
            return true;
        } catch (RuntimeException e) {
            task.setLastError(truncate(e.getClass().getSimpleName() + ": " + e.getMessage()));
            taskRepository.save(task);
            metrics.recordTaskFailed(task.getKind(), task.getOperation());
            if (task.getAttempts() >= properties.getMaxAttempts()) {
                log.error("Content sync task {} ({} {} {}) failed permanently after {} attempts",
                        task.getId(), task.getOperation(), task.getKind(), task.getItemId(), task.getAttempts(), e);
                metrics.recordTaskExhausted(task.getKind());
            } else {
                log.warn("Content sync task {} ({} {} {}) failed on attempt {}: {}",
                        task.getId(), task.getOperation(), task.getKind(), task.getItemId(),
                        task.getAttempts(), e.getMessage());
            }
            return false;
        }
    }

    private static String truncate(String message) {
        return message.length() <= MAX_ERROR_LENGTH ? message : message.substring(0, MAX_ERROR_LENGTH);
    }
}
