package uk.gegc.fluency.shared.exception;

public class UnsupportedQuestionTypeException extends RuntimeException {
    public UnsupportedQuestionTypeException(String message) {
        super(message);
    }
}
