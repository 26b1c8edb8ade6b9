package uk.gegc.fluency.features.grammar.domain.repository;

import org.springframework.data.jpa.repository.JpaRepository;
import uk.gegc.fluency.features.grammar.domain.model.GrammarChoiceOneOption;

import java.util.List;
import java.util.UUID;

public interface GrammarChoiceOneOptionRepository extends JpaRepository<GrammarChoiceOneOption, UUID> {

    List<GrammarChoiceOneOption> findAllByChoiceOneQuestion_IdOrderByCreatedAtAscIdAsc(UUID questionId);
}
