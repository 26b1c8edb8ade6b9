package uk.gegc.fluency.features.writing.domain.model;

public enum WritingQuestionType {
    SENTENCE_COMPLETION,
    ESSAY
}
