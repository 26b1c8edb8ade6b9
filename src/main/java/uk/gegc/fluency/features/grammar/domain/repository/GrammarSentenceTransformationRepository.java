package uk.gegc.fluency.features.grammar.domain.repository;

import org.springframework.data.jpa.repository.JpaRepository;
import uk.gegc.fluency.features.grammar.domain.model.GrammarSentenceTransformation;

import java.util.Optional;
import java.util.UUID;

public interface GrammarSentenceTransformationRepository extends JpaRepository<GrammarSentenceTransformation, UUID> {

    Optional<GrammarSentenceTransformation> findByGrammarQuestion_Id(UUID grammarQuestionId);
}
