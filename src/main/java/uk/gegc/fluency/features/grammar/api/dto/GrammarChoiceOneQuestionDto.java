package uk.gegc.fluency.features.grammar.api.dto;

import io.swagger.v3.oas.annotations.media.Schema;

import java.util.UUID;

@Schema(name = "GrammarChoiceOneQuestion", description = "Stem of a single-choice question")
public record GrammarChoiceOneQuestionDto(
        UUID id,
        String question,
        String explain
) {
}
