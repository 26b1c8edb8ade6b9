package uk.gegc.fluency.features.grammar.api.dto;

import io.swagger.v3.oas.annotations.media.Schema;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.Size;

@Schema(name = "GrammarFillInTheBlankAnswerRequest", description = "Accepted answer for the blank")
public record GrammarFillInTheBlankAnswerRequest(
        @Schema(example = "goes")
        @NotBlank(message = "answer is required")
        @Size(max = 500, message = "answer must be at most 500 characters")
        String answer,

        @NotBlank(message = "explain is required")
        String explain
) {
}
