package uk.gegc.fluency.features.sync.domain.model;

/**
 * A kind of learning content that is mirrored into the detail cache and the search index.
 */
public enum ContentKind {

    WRITING("writing_question", "writing_questions"),
    GRAMMAR("grammar_question", "grammar_questions");

    private final String cacheKeyPrefix;
    private final String indexName;

    ContentKind(String cacheKeyPrefix, String indexName) {
        this.cacheKeyPrefix = cacheKeyPrefix;
        this.indexName = indexName;
    }

    public String cacheKeyPrefix() {
        return cacheKeyPrefix;
    }

    public String indexName() {
        return indexName;
    }
}
