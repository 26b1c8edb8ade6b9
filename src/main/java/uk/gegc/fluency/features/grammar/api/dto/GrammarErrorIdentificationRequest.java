package uk.gegc.fluency.features.grammar.api.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import io.swagger.v3.oas.annotations.media.Schema;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.Size;

@Schema(name = "GrammarErrorIdentificationRequest", description = "Sentence with one wrong word and its correction")
public record GrammarErrorIdentificationRequest(
        @JsonProperty("error_sentence")
        @NotBlank(message = "error_sentence is required")
        String errorSentence,

        @JsonProperty("error_word")
        @NotBlank(message = "error_word is required")
        @Size(max = 255)
        String errorWord,

        @JsonProperty("correct_word")
        @NotBlank(message = "correct_word is required")
        @Size(max = 255)
        String correctWord,

        @NotBlank(message = "explain is required")
        String explain
) {
}
