package uk.gegc.fluency.features.grammar.domain.repository;

import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.JpaSpecificationExecutor;
import uk.gegc.fluency.features.grammar.domain.model.GrammarQuestion;

import java.util.UUID;

public interface GrammarQuestionRepository extends JpaRepository<GrammarQuestion, UUID>,
        JpaSpecificationExecutor<GrammarQuestion> {
}
