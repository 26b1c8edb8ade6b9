package uk.gegc.fluency.features.writing.domain.repository;

import org.springframework.data.jpa.repository.JpaRepository;
import uk.gegc.fluency.features.writing.domain.model.WritingSentenceCompletion;

import java.util.List;
import java.util.UUID;

public interface WritingSentenceCompletionRepository extends JpaRepository<WritingSentenceCompletion, UUID> {

    List<WritingSentenceCompletion> findAllByWritingQuestion_IdOrderByCreatedAtAscIdAsc(UUID writingQuestionId);
}
