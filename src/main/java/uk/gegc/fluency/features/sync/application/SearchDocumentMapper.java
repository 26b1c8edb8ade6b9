package uk.gegc.fluency.features.sync.application;

import uk.gegc.fluency.features.sync.domain.model.CompletionStatus;

import java.util.Map;

/**
 * Flattens a detail into the source of its search document.
 */
@FunctionalInterface
public interface SearchDocumentMapper<D extends ContentDetail> {

    Map<String, Object> toDocument(D detail, CompletionStatus status);
}
