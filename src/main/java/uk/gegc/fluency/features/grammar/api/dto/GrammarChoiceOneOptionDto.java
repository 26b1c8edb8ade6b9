package uk.gegc.fluency.features.grammar.api.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import io.swagger.v3.oas.annotations.media.Schema;

import java.util.UUID;

@Schema(name = "GrammarChoiceOneOption", description = "One option of a single-choice question")
public record GrammarChoiceOneOptionDto(
        UUID id,
        @JsonProperty("options") String option,
        @JsonProperty("is_correct") boolean correct
) {
}
