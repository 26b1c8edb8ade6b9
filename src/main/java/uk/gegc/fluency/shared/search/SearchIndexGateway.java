package uk.gegc.fluency.shared.search;

/**
 * Thin document-store abstraction over the full-text index.
 * Documents are opaque JSON strings addressed by index name and id.
 * <p>
 * Every method throws {@link uk.gegc.fluency.shared.exception.SearchSyncException} when the backend fails.
 */
public interface SearchIndexGateway {

    boolean indexExists(String index);

    /**
     * Creates {@code index} from a definition of the form {@code {"settings": {...}, "mappings": {...}}}.
     */
    void createIndex(String index, String definitionJson);

    /**
     * @return false if the index did not exist
     */
    boolean deleteIndex(String index);

    /**
     * Writes the whole document, replacing any existing document with the same id.
     */
    void putDocument(String index, String id, String documentJson);

    /**
     * @return false if there was no such document
     */
    boolean deleteDocument(String index, String id);

    boolean documentExists(String index, String id);

    /**
     * Pages through the documents matching {@code filter}. A missing index yields an empty page.
     *
     * @param page     1-based page number
     * @param pageSize documents per page
     */
    SearchPage search(String index, SearchFilter filter, int page, int pageSize);

    enum SearchType {
        MEMORY,
        ELASTICSEARCH
    }
}
