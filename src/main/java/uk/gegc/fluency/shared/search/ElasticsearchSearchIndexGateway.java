package uk.gegc.fluency.shared.search;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.data.domain.PageRequest;
import org.springframework.data.elasticsearch.core.ElasticsearchOperations;
import org.springframework.data.elasticsearch.core.IndexOperations;
import org.springframework.data.elasticsearch.core.SearchHit;
import org.springframework.data.elasticsearch.core.SearchHits;
import org.springframework.data.elasticsearch.core.document.Document;
import org.springframework.data.elasticsearch.core.mapping.IndexCoordinates;
import org.springframework.data.elasticsearch.core.query.Criteria;
import org.springframework.data.elasticsearch.core.query.CriteriaQuery;
import org.springframework.data.elasticsearch.core.query.FetchSourceFilterBuilder;
import org.springframework.data.elasticsearch.core.query.IndexQuery;
import org.springframework.data.elasticsearch.core.query.IndexQueryBuilder;
import org.springframework.data.elasticsearch.core.query.Query;
import uk.gegc.fluency.shared.exception.SearchSyncException;

import java.util.Map;
import java.util.function.Supplier;

/**
 * Elasticsearch backend through Spring Data Elasticsearch's {@link ElasticsearchOperations}.
 * Documents are written as raw JSON sources; there are no mapped entity classes.
 */
@Slf4j
@RequiredArgsConstructor
public class ElasticsearchSearchIndexGateway implements SearchIndexGateway {

    private static final TypeReference<Map<String, Object>> SETTINGS_TYPE = new TypeReference<>() {
    };

    private final ElasticsearchOperations operations;
    private final ObjectMapper objectMapper;

    @Override
    public boolean indexExists(String index) {
        return call("check index " + index, () -> indexOps(index).exists());
    }

    @Override
    public void createIndex(String index, String definitionJson) {
        Map<String, Object> settings;
        Document mapping;
        try {
            JsonNode definition = objectMapper.readTree(definitionJson);
            settings = definition.has("settings")
                    ? objectMapper.convertValue(definition.get("settings"), SETTINGS_TYPE)
                    : Map.of();
            mapping = definition.has("mappings")
                    ? Document.parse(definition.get("mappings").toString())
                    : Document.create();
        } catch (JsonProcessingException e) {
            throw new SearchSyncException("Invalid definition for index " + index, e);
        }
        call("create index " + index, () -> indexOps(index).create(settings, mapping));
        log.info("Created search index {}", index);
    }

    @Override
    public boolean deleteIndex(String index) {
        return call("delete index " + index, () -> indexOps(index).delete());
    }

    @Override
    public void putDocument(String index, String id, String documentJson) {
        IndexQuery query = new IndexQueryBuilder()
                .withId(id)
                .withSource(documentJson)
                .build();
        call("index document " + id + " into " + index, () -> operations.index(query, IndexCoordinates.of(index)));
    }

    @Override
    public boolean deleteDocument(String index, String id) {
        return call("delete document " + id + " from " + index, () -> {
            IndexCoordinates coordinates = IndexCoordinates.of(index);
            if (!operations.exists(id, coordinates)) {
                return false;
            }
            operations.delete(id, coordinates);
            return true;
        });
    }

    @Override
    public boolean documentExists(String index, String id) {
        return call("look up document " + id + " in " + index, () -> operations.exists(id, IndexCoordinates.of(index)));
    }

    @Override
    public SearchPage search(String index, SearchFilter filter, int page, int pageSize) {
        if (!indexExists(index)) {
            return SearchPage.empty();
        }
        Criteria criteria = null;
        if (filter.type() != null) {
            criteria = chain(criteria, Criteria.where("type.keyword").is(filter.type()));
        }
        if (!filter.topics().isEmpty()) {
            criteria = chain(criteria, Criteria.where("topic.keyword").in(filter.topics()));
        }
        if (filter.status() != null) {
            criteria = chain(criteria, Criteria.where("status").is(filter.status()));
        }
        Query query = criteria == null ? Query.findAll() : new CriteriaQuery(criteria);
        query.setPageable(PageRequest.of(page - 1, pageSize));
        query.setTrackTotalHits(true);
        query.addSourceFilter(new FetchSourceFilterBuilder().withIncludes("id").build());

        SearchHits<SearchDocumentRef> hits = call("search " + index,
                () -> operations.search(query, SearchDocumentRef.class, IndexCoordinates.of(index)));
        return new SearchPage(hits.getTotalHits(), hits.getSearchHits().stream().map(SearchHit::getId).toList());
    }

    private static Criteria chain(Criteria existing, Criteria next) {
        return existing == null ? next : existing.and(next);
    }

    private IndexOperations indexOps(String index) {
        return operations.indexOps(IndexCoordinates.of(index));
    }

    private <T> T call(String action, Supplier<T> supplier) {
        try {
            return supplier.get();
        } catch (RuntimeException e) {
            throw new SearchSyncException("Failed to " + action, e);
        }
    }
}
