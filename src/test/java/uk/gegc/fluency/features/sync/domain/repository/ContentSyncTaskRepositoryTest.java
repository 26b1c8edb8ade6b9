package uk.gegc.fluency.features.sync.domain.repository;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.jdbc.AutoConfigureTestDatabase;
import org.springframework.boot.test.autoconfigure.orm.jpa.DataJpaTest;
import org.springframework.boot.test.autoconfigure.orm.jpa.TestEntityManager;
import org.springframework.data.domain.PageRequest;
import org.springframework.test.context.ActiveProfiles;
import uk.gegc.fluency.features.sync.domain.model.ContentKind;
import uk.gegc.fluency.features.sync.domain.model.ContentSyncTask;
import uk.gegc.fluency.features.sync.domain.model.SyncOperation;

import java.time.Instant;
import java.util.UUID;

import static org.assertj.core.api.Assertions.assertThat;

@DataJpaTest
@ActiveProfiles("test")
@AutoConfigureTestDatabase(replace = AutoConfigureTestDatabase.Replace.NONE)
@DisplayName("ContentSyncTaskRepository")
class ContentSyncTaskRepositoryTest {

    private static final Instant T0 = Instant.parse("2025-01-01T10:00:00Z");

    @Autowired
    private ContentSyncTaskRepository repository;

    @Autowired
    private TestEntityManager entityManager;

    @Test
    @DisplayName("findRetryable returns pending tasks with attempts left, oldest first")
    void findRetryable() {
        ContentSyncTask newer = persist(T0.plusSeconds(10), 0, null);
        ContentSyncTask older = persist(T0, 2, null);
        persist(T0.plusSeconds(5), 3, null);
        persist(T0.plusSeconds(1), 0, T0.plusSeconds(2));

        assertThat(repository.findRetryable(3, PageRequest.of(0, 10)))
                .extracting(ContentSyncTask::getId)
                .containsExactly(older.getId(), newer.getId());
        assertThat(repository.findRetryable(3, PageRequest.of(0, 1)))
                .extracting(ContentSyncTask::getId)
                .containsExactly(older.getId());
    }

    @Test
    @DisplayName("counts pending and exhausted tasks")
    void counts() {
        persist(T0, 0, null);
        persist(T0, 3, null);
        persist(T0, 5, null);
        persist(T0, 1, T0.plusSeconds(1));

        assertThat(repository.countByProcessedAtIsNull()).isEqualTo(3);
        assertThat(repository.countExhausted(3)).isEqualTo(2);
    }

    @Test
    @DisplayName("deleteByProcessedAtBefore removes only tasks processed before the cutoff")
    void deleteByProcessedAtBefore() {
        ContentSyncTask pending = persist(T0, 0, null);
        ContentSyncTask exhausted = persist(T0, 3, null);
        persist(T0, 1, T0.plusSeconds(10));
        ContentSyncTask recent = persist(T0, 1, T0.plusSeconds(100));
        ContentSyncTask atCutoff = persist(T0, 1, T0.plusSeconds(50));

        int deleted = repository.deleteByProcessedAtBefore(T0.plusSeconds(50));

        assertThat(deleted).isEqualTo(1);
        assertThat(repository.findAll())
                .extracting(ContentSyncTask::getId)
                .containsExactlyInAnyOrder(pending.getId(), exhausted.getId(), recent.getId(), atCutoff.getId());
    }

    private ContentSyncTask persist(Instant createdAt, int attempts, Instant processedAt) {
        ContentSyncTask task = new ContentSyncTask();
        task.setKind(ContentKind.WRITING);
        task.setItemId(UUID.randomUUID());
        task.setOperation(SyncOperation.UPSERT);
        task.setCreatedAt(createdAt);
        task.setAttempts(attempts);
        task.setProcessedAt(processedAt);
        return entityManager.persistAndFlush(task);
    }
}
