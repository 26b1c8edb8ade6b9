package uk.gegc.fluency.features.grammar.api.dto;

import io.swagger.v3.oas.annotations.media.Schema;

import java.util.UUID;

@Schema(name = "GrammarFillInTheBlankAnswer", description = "Accepted answer for the blank")
public record GrammarFillInTheBlankAnswerDto(
        UUID id,
        String answer,
        String explain
) {
}
