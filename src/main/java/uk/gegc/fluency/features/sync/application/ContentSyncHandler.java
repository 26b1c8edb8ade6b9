package uk.gegc.fluency.features.sync.application;

import uk.gegc.fluency.features.sync.domain.model.ContentKind;

import java.util.UUID;

/**
 * Refreshes the cache and search projections of one item of a given kind.
 */
public interface ContentSyncHandler {

    ContentKind kind();

    /**
     * Assembles the current detail, caches it and indexes it. An item that no longer exists is removed instead.
     *
     * @throws uk.gegc.fluency.shared.exception.SearchSyncException if the index could not be updated
     */
    void upsert(UUID itemId);

    /**
     * Evicts every cached version of the item and deletes its search document.
     */
    void remove(UUID itemId);
}
