package uk.gegc.fluency.features.grammar.api.dto;

import io.swagger.v3.oas.annotations.media.Schema;

import java.util.UUID;

@Schema(name = "GrammarFillInTheBlankQuestion", description = "Sentence containing the blank")
public record GrammarFillInTheBlankQuestionDto(
        UUID id,
        String question
) {
}
