package uk.gegc.fluency.features.grammar.api.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import io.swagger.v3.oas.annotations.media.Schema;

import java.util.UUID;

@Schema(name = "GrammarErrorIdentification", description = "Sentence with one wrong word and its correction")
public record GrammarErrorIdentificationDto(
        UUID id,
        @JsonProperty("error_sentence") String errorSentence,
        @JsonProperty("error_word") String errorWord,
        @JsonProperty("correct_word") String correctWord,
        String explain
) {
}
