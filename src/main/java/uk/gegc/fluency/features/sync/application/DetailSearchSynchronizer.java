package uk.gegc.fluency.features.sync.application;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.extern.slf4j.Slf4j;
import org.springframework.core.io.ClassPathResource;
import org.springframework.core.io.Resource;
import org.springframework.util.StreamUtils;
import uk.gegc.fluency.features.sync.domain.model.CompletionStatus;
import uk.gegc.fluency.features.sync.domain.model.ContentKind;
import uk.gegc.fluency.shared.exception.SearchSyncException;
import uk.gegc.fluency.shared.search.SearchIndexGateway;
import uk.gegc.fluency.shared.search.SearchPage;
import uk.gegc.fluency.shared.search.SearchProperties;

import java.io.IOException;
import java.io.InputStream;
import java.nio.charset.StandardCharsets;
import java.util.UUID;

/**
 * Keeps one search document per item, with document id equal to the item id.
 * <p>
 * Upserts write the whole document, so repeating one is harmless. The index is created from
 * {@code <definition-location>/<index>.json} on first write. Failures surface as
 * {@link SearchSyncException} after being logged and counted.
 */
@Slf4j
public class DetailSearchSynchronizer<D extends ContentDetail> {

    private final ContentKind kind;
    private final SearchIndexGateway gateway;
    private final SearchDocumentMapper<D> documentMapper;
    private final ObjectMapper objectMapper;
    private final SearchProperties searchProperties;
    private final ContentSyncMetrics metrics;

    public DetailSearchSynchronizer(ContentKind kind,
                                    SearchIndexGateway gateway,
                                    SearchDocumentMapper<D> documentMapper,
                                    ObjectMapper objectMapper,
                                    SearchProperties searchProperties,
                                    ContentSyncMetrics metrics) {
        this.kind = kind;
        this.gateway = gateway;
        this.documentMapper = documentMapper;
        this.objectMapper = objectMapper;
        this.searchProperties = searchProperties;
        this.metrics = metrics;
    }

    public void upsert(D detail, CompletionStatus status) {
        String index = kind.indexName();
        try {
            ensureIndex();
            String source = objectMapper.writeValueAsString(documentMapper.toDocument(detail, status));
            gateway.putDocument(index, detail.id().toString(), source);
            log.debug("Indexed {} {} version {} as {}", kind, detail.id(), detail.version(), status.value());
        } catch (JsonProcessingException e) {
            metrics.recordSearchFailure(kind, "upsert");
            throw new SearchSyncException("Failed to serialize search document for " + detail.id(), e);
        } catch (SearchSyncException e) {
            log.warn("Failed to index {} {}: {}", kind, detail.id(), e.getMessage());
            metrics.recordSearchFailure(kind, "upsert");
            throw e;
        }
    }

    /**
     * Deletes the item's document. A missing document or index is not an error.
     */
    public void remove(UUID id) {
        String index = kind.indexName();
        try {
            if (!gateway.indexExists(index)) {
                return;
            }
            boolean removed = gateway.deleteDocument(index, id.toString());
            log.debug("Removed {} {} from index: {}", kind, id, removed);
        } catch (SearchSyncException e) {
            log.warn("Failed to remove {} {} from index: {}", kind, id, e.getMessage());
            metrics.recordSearchFailure(kind, "remove");
            throw e;
        }
    }

    public SearchPage search(ContentSearchCriteria criteria) {
        try {
            SearchPage page = gateway.search(kind.indexName(), criteria.toFilter(), criteria.page(), criteria.pageSize());
            log.debug("Search over {} matched {} documents", kind.indexName(), page.total());
            return page;
        } catch (SearchSyncException e) {
            log.warn("Failed to search {}: {}", kind.indexName(), e.getMessage());
            metrics.recordSearchFailure(kind, "search");
            throw e;
        }
    }

    public boolean exists(UUID id) {
        String index = kind.indexName();
        return gateway.indexExists(index) && gateway.documentExists(index, id.toString());
    }

    /**
     * @return true if the index was created, false if it already existed
     */
    public boolean createIndex() {
        if (gateway.indexExists(kind.indexName())) {
            return false;
        }
        gateway.createIndex(kind.indexName(), loadDefinition());
        return true;
    }

    /**
     * @return true if an index was dropped
     */
    public boolean dropIndex() {
        boolean dropped = gateway.deleteIndex(kind.indexName());
        log.info("Dropped search index {}: {}", kind.indexName(), dropped);
        return dropped;
    }

    private void ensureIndex() {
        try {
            createIndex();
        } catch (SearchSyncException e) {
            // another writer may have created it in between
            if (!gateway.indexExists(kind.indexName())) {
                throw e;
            }
        }
    }

    private String loadDefinition() {
        String location = searchProperties.getDefinitionLocation() + "/" + kind.indexName() + ".json";
        Resource resource = new ClassPathResource(location);
        try (InputStream in = resource.getInputStream()) {
            return StreamUtils.copyToString(in, StandardCharsets.UTF_8);
        } catch (IOException e) {
            throw new SearchSyncException("Missing search index definition " + location, e);
        }
    }
}
