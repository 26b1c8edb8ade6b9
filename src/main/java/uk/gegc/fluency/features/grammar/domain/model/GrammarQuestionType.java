package uk.gegc.fluency.features.grammar.domain.model;

public enum GrammarQuestionType {
    FILL_IN_THE_BLANK,
    CHOICE_ONE,
    ERROR_IDENTIFICATION,
    SENTENCE_TRANSFORMATION
}
