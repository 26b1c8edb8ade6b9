package uk.gegc.fluency.features.sync.application;

import uk.gegc.fluency.features.sync.domain.model.ContentItem;

import java.util.UUID;

/**
 * Builds the detail view of an item from the relational store. Always reads current state.
 *
 * @param <E> item entity
 * @param <D> detail view
 */
public interface DetailAssembler<E extends ContentItem, D extends ContentDetail> {

    /**
     * @throws uk.gegc.fluency.shared.exception.ResourceNotFoundException if there is no such item
     * @throws uk.gegc.fluency.shared.exception.UnsupportedQuestionTypeException if the item's type has no mapping
     */
    D assemble(UUID itemId);

    D assemble(E item);

    boolean exists(UUID itemId);
}
