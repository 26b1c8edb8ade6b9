package uk.gegc.fluency.features.sync.domain.model;

public enum CompletionStatus {

    COMPLETE("complete"),
    UNCOMPLETE("uncomplete");

    private final String value;

    CompletionStatus(String value) {
        this.value = value;
    }

    /**
     * Wire form used in cache keys and search documents.
     */
    public String value() {
        return value;
    }

    /**
     * @throws IllegalArgumentException if {@code value} is not a wire value
     */
    public static CompletionStatus fromValue(String value) {
        for (CompletionStatus status : values()) {
            if (status.value.equalsIgnoreCase(value)) {
                return status;
            }
        }
        throw new IllegalArgumentException("Unknown completion status: " + value);
    }

    public static CompletionStatus of(boolean complete) {
        return complete ? COMPLETE : UNCOMPLETE;
    }
}
