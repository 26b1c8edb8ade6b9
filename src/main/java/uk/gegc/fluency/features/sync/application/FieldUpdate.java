package uk.gegc.fluency.features.sync.application;

import uk.gegc.fluency.features.sync.domain.model.ContentItem;

/**
 * A single-field change to a content item. Each content kind declares a closed set of these.
 *
 * @param <E> item type the update applies to
 */
public interface FieldUpdate<E extends ContentItem> {

    /**
     * Wire name of the field this update targets.
     */
    String field();

    /**
     * @throws uk.gegc.fluency.shared.exception.ValidationException if the new value is not acceptable
     */
    void validate();

    /**
     * Writes the new value onto the item. Called only after {@link #validate()} succeeded.
     */
    void applyTo(E item);
}
