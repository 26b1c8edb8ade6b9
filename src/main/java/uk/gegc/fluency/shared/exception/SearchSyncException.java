package uk.gegc.fluency.shared.exception;

/**
 * Wraps any failure talking to the search backend. Callers on the request path never see it;
 * the sync relay catches it and schedules a retry.
 */
public class SearchSyncException extends RuntimeException {
    public SearchSyncException(String message, Throwable cause) {
        super(message, cause);
    }

    public SearchSyncException(String message) {
        super(message);
    }
}
