package uk.gegc.fluency.features.grammar.domain.repository;

import org.springframework.data.jpa.repository.JpaRepository;
import uk.gegc.fluency.features.grammar.domain.model.GrammarFillInTheBlankQuestion;

import java.util.Optional;
import java.util.UUID;

public interface GrammarFillInTheBlankQuestionRepository extends JpaRepository<GrammarFillInTheBlankQuestion, UUID> {

    Optional<GrammarFillInTheBlankQuestion> findByGrammarQuestion_Id(UUID grammarQuestionId);
}
