package uk.gegc.fluency.shared.search;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import uk.gegc.fluency.shared.exception.SearchSyncException;

import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;

/**
 * Per-process index used for local development and tests. Like Elasticsearch, writing into
 * a missing index creates it implicitly.
 */
public class InMemorySearchIndexGateway implements SearchIndexGateway {

    private final ConcurrentMap<String, ConcurrentMap<String, String>> indices = new ConcurrentHashMap<>();
    private final ObjectMapper objectMapper;

    public InMemorySearchIndexGateway() {
        this(new ObjectMapper());
    }

    public InMemorySearchIndexGateway(ObjectMapper objectMapper) {
        this.objectMapper = objectMapper;
    }

    @Override
    public boolean indexExists(String index) {
        return indices.containsKey(index);
    }

    @Override
    public void createIndex(String index, String definitionJson) {
        indices.putIfAbsent(index, new ConcurrentHashMap<>());
    }

    @Override
    public boolean deleteIndex(String index) {
        return indices.remove(index) != null;
    }

    @Override
    public void putDocument(String index, String id, String documentJson) {
        indices.computeIfAbsent(index, name -> new ConcurrentHashMap<>()).put(id, documentJson);
    }

    @Override
    public boolean deleteDocument(String index, String id) {
        Map<String, String> documents = indices.get(index);
        return documents != null && documents.remove(id) != null;
    }

    @Override
    public boolean documentExists(String index, String id) {
        Map<String, String> documents = indices.get(index);
        return documents != null && documents.containsKey(id);
    }

    /**
     * Matches are ordered by document id so paging is stable.
     */
    @Override
    public SearchPage search(String index, SearchFilter filter, int page, int pageSize) {
        Map<String, String> documents = indices.get(index);
        if (documents == null) {
            return SearchPage.empty();
        }
        List<String> matches = new ArrayList<>();
        for (Map.Entry<String, String> entry : documents.entrySet()) {
            if (matches(readDocument(index, entry), filter)) {
                matches.add(entry.getKey());
            }
        }
        matches.sort(null);
        int from = Math.min((page - 1) * pageSize, matches.size());
        int to = Math.min(from + pageSize, matches.size());
        return new SearchPage(matches.size(), List.copyOf(matches.subList(from, to)));
    }

    public Optional<String> findDocument(String index, String id) {
        Map<String, String> documents = indices.get(index);
        return documents == null ? Optional.empty() : Optional.ofNullable(documents.get(id));
    }

    public int documentCount(String index) {
        Map<String, String> documents = indices.get(index);
        return documents == null ? 0 : documents.size();
    }

    private JsonNode readDocument(String index, Map.Entry<String, String> entry) {
        try {
            return objectMapper.readTree(entry.getValue());
        } catch (JsonProcessingException e) {
            throw new SearchSyncException("Unreadable document " + entry.getKey() + " in " + index, e);
        }
    }

    private static boolean matches(JsonNode document, SearchFilter filter) {
        if (filter.type() != null && !filter.type().equals(document.path("type").asText(null))) {
            return false;
        }
        if (filter.status() != null && !filter.status().equals(document.path("status").asText(null))) {
            return false;
        }
        if (filter.topics().isEmpty()) {
            return true;
        }
        List<String> wanted = filter.topics().stream().map(t -> t.toLowerCase(Locale.ROOT)).toList();
        for (JsonNode topic : document.path("topic")) {
            if (wanted.contains(topic.asText().toLowerCase(Locale.ROOT))) {
                return true;
            }
        }
        return false;
    }
}
