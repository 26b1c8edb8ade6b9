package uk.gegc.fluency.features.grammar.api.dto;

import io.swagger.v3.oas.annotations.media.Schema;
import jakarta.validation.constraints.NotBlank;

@Schema(name = "GrammarFillInTheBlankQuestionRequest", description = "Sentence containing the blank")
public record GrammarFillInTheBlankQuestionRequest(
        @Schema(example = "She ___ to school every day.")
        @NotBlank(message = "question is required")
        String question
) {
}
