package uk.gegc.fluency.features.writing.domain.repository;

import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.JpaSpecificationExecutor;
import uk.gegc.fluency.features.writing.domain.model.WritingQuestion;

import java.util.UUID;

public interface WritingQuestionRepository extends JpaRepository<WritingQuestion, UUID>,
        JpaSpecificationExecutor<WritingQuestion> {
}
