package uk.gegc.fluency.features.sync.domain.repository;

import org.springframework.data.domain.Pageable;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Modifying;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import uk.gegc.fluency.features.sync.domain.model.ContentSyncTask;

import java.time.Instant;
import java.util.List;
import java.util.UUID;

public interface ContentSyncTaskRepository extends JpaRepository<ContentSyncTask, UUID> {

    @Query("""
            SELECT t FROM ContentSyncTask t
            WHERE t.processedAt IS NULL
              AND t.attempts < :maxAttempts
            ORDER BY t.createdAt ASC
            """)
    List<ContentSyncTask> findRetryable(@Param("maxAttempts") int maxAttempts, Pageable pageable);

    @Query("""
            SELECT COUNT(t) FROM ContentSyncTask t
            WHERE t.processedAt IS NULL
              AND t.attempts >= :maxAttempts
            """)
    long countExhausted(@Param("maxAttempts") int maxAttempts);

    long countByProcessedAtIsNull();

    /**
     * Bulk-deletes tasks processed before {@code cutoff}. Pending and exhausted tasks are kept.
     *
     * @return number of rows deleted
     */
    @Modifying(clearAutomatically = true)
    @Query("DELETE FROM ContentSyncTask t WHERE t.processedAt IS NOT NULL AND t.processedAt < :cutoff")
    int deleteByProcessedAtBefore(@Param("cutoff") Instant cutoff);
}
