package uk.gegc.fluency.features.grammar.domain.repository;

import org.springframework.data.jpa.repository.JpaRepository;
import uk.gegc.fluency.features.grammar.domain.model.GrammarChoiceOneQuestion;

import java.util.Optional;
import java.util.UUID;

public interface GrammarChoiceOneQuestionRepository extends JpaRepository<GrammarChoiceOneQuestion, UUID> {

    Optional<GrammarChoiceOneQuestion> findByGrammarQuestion_Id(UUID grammarQuestionId);
}
