package uk.gegc.fluency.features.writing.api.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import io.swagger.v3.oas.annotations.media.Schema;

import java.util.List;
import java.util.UUID;

@Schema(name = "WritingSentenceCompletion", description = "Sentence the learner has to complete")
public record WritingSentenceCompletionDto(
        UUID id,
        @JsonProperty("example_sentence") String exampleSentence,
        @JsonProperty("given_part_sentence") String givenPartSentence,
        @Schema(description = "Where the given part sits", allowableValues = {"start", "end"})
        String position,
        @JsonProperty("required_words") List<String> requiredWords,
        String explain,
        @JsonProperty("min_words") int minWords,
        @JsonProperty("max_words") int maxWords
) {
}
