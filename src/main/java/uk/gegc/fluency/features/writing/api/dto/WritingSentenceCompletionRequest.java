package uk.gegc.fluency.features.writing.api.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import io.swagger.v3.oas.annotations.media.Schema;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotEmpty;
import jakarta.validation.constraints.Pattern;

import java.util.List;

@Schema(name = "WritingSentenceCompletionRequest", description = "Content of a sentence completion")
public record WritingSentenceCompletionRequest(
        @JsonProperty("example_sentence")
        @NotBlank(message = "example_sentence is required")
        String exampleSentence,

        @JsonProperty("given_part_sentence")
        @NotBlank(message = "given_part_sentence is required")
        String givenPartSentence,

        @NotBlank(message = "position is required")
        @Pattern(regexp = "start|end", message = "position must be start or end")
        String position,

        @JsonProperty("required_words")
        @NotEmpty(message = "at least one required word is needed")
        List<@NotBlank String> requiredWords,

        @NotBlank(message = "explain is required")
        String explain,

        @JsonProperty("min_words")
        @Min(value = 1, message = "min_words must be at least 1")
        int minWords,

        @JsonProperty("max_words")
        @Min(value = 1, message = "max_words must be at least 1")
        int maxWords
) {
}
