package uk.gegc.fluency.features.grammar.domain.repository;

import org.springframework.data.jpa.repository.JpaRepository;
import uk.gegc.fluency.features.grammar.domain.model.GrammarFillInTheBlankAnswer;

import java.util.List;
import java.util.UUID;

public interface GrammarFillInTheBlankAnswerRepository extends JpaRepository<GrammarFillInTheBlankAnswer, UUID> {

    List<GrammarFillInTheBlankAnswer> findAllByFillInTheBlankQuestion_IdOrderByCreatedAtAscIdAsc(UUID questionId);
}
