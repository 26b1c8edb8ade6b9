package uk.gegc.fluency.features.sync.application;

import uk.gegc.fluency.features.sync.domain.model.CompletionStatus;

/**
 * Decides whether a detail carries all sub-records its type requires. Pure; unknown types are incomplete.
 */
public interface CompletionEvaluator<D extends ContentDetail> {

    boolean isComplete(D detail);

    default CompletionStatus evaluate(D detail) {
        return CompletionStatus.of(isComplete(detail));
    }
}
