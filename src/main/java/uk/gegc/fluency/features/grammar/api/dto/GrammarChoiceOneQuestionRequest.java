package uk.gegc.fluency.features.grammar.api.dto;

import io.swagger.v3.oas.annotations.media.Schema;
import jakarta.validation.constraints.NotBlank;

@Schema(name = "GrammarChoiceOneQuestionRequest", description = "Stem of a single-choice question")
public record GrammarChoiceOneQuestionRequest(
        @NotBlank(message = "question is required")
        String question,

        @NotBlank(message = "explain is required")
        String explain
) {
}
