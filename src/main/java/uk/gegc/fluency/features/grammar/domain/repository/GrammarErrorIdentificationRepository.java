package uk.gegc.fluency.features.grammar.domain.repository;

import org.springframework.data.jpa.repository.JpaRepository;
import uk.gegc.fluency.features.grammar.domain.model.GrammarErrorIdentification;

import java.util.Optional;
import java.util.UUID;

public interface GrammarErrorIdentificationRepository extends JpaRepository<GrammarErrorIdentification, UUID> {

    Optional<GrammarErrorIdentification> findByGrammarQuestion_Id(UUID grammarQuestionId);
}
