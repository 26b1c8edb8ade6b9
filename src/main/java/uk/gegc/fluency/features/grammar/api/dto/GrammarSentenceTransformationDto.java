package uk.gegc.fluency.features.grammar.api.dto;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import io.swagger.v3.oas.annotations.media.Schema;

import java.util.UUID;

@Schema(name = "GrammarSentenceTransformation", description = "Sentence to rewrite, optionally with a forced first word")
public record GrammarSentenceTransformationDto(
        UUID id,
        @JsonProperty("original_sentence") String originalSentence,
        @JsonInclude(JsonInclude.Include.NON_NULL)
        @JsonProperty("beginning_word") String beginningWord,
        @JsonProperty("example_correct_sentence") String exampleCorrectSentence,
        String explain
) {
}
