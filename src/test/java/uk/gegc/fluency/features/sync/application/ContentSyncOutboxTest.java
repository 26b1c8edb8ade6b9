package uk.gegc.fluency.features.sync.application;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.springframework.context.ApplicationEventPublisher;
import uk.gegc.fluency.BaseUnitTest;
import uk.gegc.fluency.features.sync.domain.event.ContentChangedEvent;
import uk.gegc.fluency.features.sync.domain.model.ContentKind;
import uk.gegc.fluency.features.sync.domain.model.ContentSyncTask;
import uk.gegc.fluency.features.sync.domain.model.SyncOperation;
import uk.gegc.fluency.features.sync.domain.repository.ContentSyncTaskRepository;

import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.UUID;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

@DisplayName("ContentSyncOutbox")
class ContentSyncOutboxTest extends BaseUnitTest {

    private static final Instant NOW = Instant.parse("2025-02-02T02:02:02Z");

    @Mock
    private ContentSyncTaskRepository taskRepository;

    @Mock
    private ApplicationEventPublisher eventPublisher;

    private ContentSyncOutbox outbox;

    @BeforeEach
    void setUp() {
        outbox = new ContentSyncOutbox(taskRepository, eventPublisher, Clock.fixed(NOW, ZoneOffset.UTC));
    }

    @Test
    @DisplayName("enqueue stores a fresh task and announces it")
    void enqueue_savesAndPublishes() {
        UUID itemId = UUID.randomUUID();
        UUID taskId = UUID.randomUUID();
        when(taskRepository.save(any(ContentSyncTask.class))).thenAnswer(invocation -> {
            ContentSyncTask task = invocation.getArgument(0);
            task.setId(taskId);
            return task;
        });

        ContentSyncTask task = outbox.remove(ContentKind.GRAMMAR, itemId);

        assertThat(task.getKind()).isEqualTo(ContentKind.GRAMMAR);
        assertThat(task.getItemId()).isEqualTo(itemId);
        assertThat(task.getOperation()).isEqualTo(SyncOperation.REMOVE);
        assertThat(task.getCreatedAt()).isEqualTo(NOW);
        assertThat(task.getAttempts()).isZero();
        assertThat(task.isProcessed()).isFalse();

        ArgumentCaptor<ContentChangedEvent> event = ArgumentCaptor.forClass(ContentChangedEvent.class);
        verify(eventPublisher).publishEvent(event.capture());
        assertThat(event.getValue().getTaskId()).isEqualTo(taskId);
    }
}
