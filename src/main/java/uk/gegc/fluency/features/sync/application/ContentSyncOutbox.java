package uk.gegc.fluency.features.sync.application;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.context.ApplicationEventPublisher;
import org.springframework.stereotype.Component;
import org.springframework.transaction.annotation.Propagation;
import org.springframework.transaction.annotation.Transactional;
import uk.gegc.fluency.features.sync.domain.event.ContentChangedEvent;
import uk.gegc.fluency.features.sync.domain.model.ContentKind;
import uk.gegc.fluency.features.sync.domain.model.ContentSyncTask;
import uk.gegc.fluency.features.sync.domain.model.SyncOperation;
import uk.gegc.fluency.features.sync.domain.repository.ContentSyncTaskRepository;

import java.time.Clock;
import java.time.Instant;
import java.util.UUID;

/**
 * Records that an item's projections need refreshing. Must join the transaction that changed the item,
 * so the task commits or rolls back together with the change.
 */
@Slf4j
@Component
@RequiredArgsConstructor
@Transactional(propagation = Propagation.MANDATORY)
public class ContentSyncOutbox {

    private final ContentSyncTaskRepository taskRepository;
    private final ApplicationEventPublisher eventPublisher;
    private final Clock clock;

    public ContentSyncTask enqueue(ContentKind kind, UUID itemId, SyncOperation operation) {
        ContentSyncTask task = new ContentSyncTask();
        task.setKind(kind);
        task.setItemId(itemId);
        task.setOperation(operation);
        task.setCreatedAt(Instant.now(clock));
        task.setAttempts(0);

        ContentSyncTask saved = taskRepository.save(task);
        log.debug("Queued {} {} for {}", operation, kind, itemId);
        eventPublisher.publishEvent(new ContentChangedEvent(this, saved.getId()));
        return saved;
    }

    public ContentSyncTask upsert(ContentKind kind, UUID itemId) {
        return enqueue(kind, itemId, SyncOperation.UPSERT);
    }

    public ContentSyncTask remove(ContentKind kind, UUID itemId) {
        return enqueue(kind, itemId, SyncOperation.REMOVE);
    }
}
