package uk.gegc.fluency.features.writing.domain.repository;

import org.springframework.data.jpa.repository.JpaRepository;
import uk.gegc.fluency.features.writing.domain.model.WritingEssay;

import java.util.List;
import java.util.UUID;

public interface WritingEssayRepository extends JpaRepository<WritingEssay, UUID> {

    List<WritingEssay> findAllByWritingQuestion_IdOrderByCreatedAtAscIdAsc(UUID writingQuestionId);
}
