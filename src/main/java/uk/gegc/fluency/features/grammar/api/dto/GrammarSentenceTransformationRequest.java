package uk.gegc.fluency.features.grammar.api.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import io.swagger.v3.oas.annotations.media.Schema;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.Size;

@Schema(name = "GrammarSentenceTransformationRequest", description = "Sentence to rewrite")
public record GrammarSentenceTransformationRequest(
        @JsonProperty("original_sentence")
        @NotBlank(message = "original_sentence is required")
        String originalSentence,

        @Schema(description = "Word the rewritten sentence must start with", nullable = true)
        @JsonProperty("beginning_word")
        @Size(max = 255)
        String beginningWord,

        @JsonProperty("example_correct_sentence")
        @NotBlank(message = "example_correct_sentence is required")
        String exampleCorrectSentence,

        @NotBlank(message = "explain is required")
        String explain
) {
}
