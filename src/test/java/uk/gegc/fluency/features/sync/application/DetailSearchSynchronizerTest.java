package uk.gegc.fluency.features.sync.application;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import uk.gegc.fluency.features.sync.domain.model.CompletionStatus;
import uk.gegc.fluency.features.sync.domain.model.ContentKind;
import uk.gegc.fluency.features.writing.api.dto.WritingQuestionDetail;
import uk.gegc.fluency.features.writing.infra.sync.WritingQuestionSearchDocumentMapper;
import uk.gegc.fluency.shared.exception.SearchSyncException;
import uk.gegc.fluency.shared.search.InMemorySearchIndexGateway;
import uk.gegc.fluency.shared.search.SearchFilter;
import uk.gegc.fluency.shared.search.SearchIndexGateway;
import uk.gegc.fluency.shared.search.SearchPage;
import uk.gegc.fluency.shared.search.SearchProperties;
import uk.gegc.fluency.testsupport.WritingDetails;

import java.util.List;
import java.util.UUID;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatCode;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.doThrow;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.when;

@DisplayName("DetailSearchSynchronizer")
class DetailSearchSynchronizerTest {

    private static final String INDEX = "writing_questions";

    private final ObjectMapper objectMapper = new ObjectMapper().findAndRegisterModules();

    private InMemorySearchIndexGateway gateway;
    private SimpleMeterRegistry registry;
    private DetailSearchSynchronizer<WritingQuestionDetail> synchronizer;

    @BeforeEach
    void setUp() {
        gateway = new InMemorySearchIndexGateway();
        registry = new SimpleMeterRegistry();
        synchronizer = newSynchronizer(gateway);
    }

    @Test
    @DisplayName("upsert creates the index and stores the document under the item id")
    void upsert_createsIndexAndDocument() throws Exception {
        UUID id = UUID.randomUUID();

        synchronizer.upsert(WritingDetails.essay(id, 1, List.of()), CompletionStatus.UNCOMPLETE);

        assertThat(gateway.indexExists(INDEX)).isTrue();
        assertThat(synchronizer.exists(id)).isTrue();
        JsonNode document = objectMapper.readTree(gateway.findDocument(INDEX, id.toString()).orElseThrow());
        assertThat(document.get("id").asText()).isEqualTo(id.toString());
        assertThat(document.get("status").asText()).isEqualTo("uncomplete");
        assertThat(document.get("version").asInt()).isEqualTo(1);
        assertThat(document.get("type").asText()).isEqualTo("ESSAY");
        assertThat(document.get("essay").isTextual()).isTrue();
        assertThat(document.has("sentence_completion")).isFalse();
    }

    @Test
    @DisplayName("repeating an upsert leaves a single identical document")
    void upsert_idempotent() {
        UUID id = UUID.randomUUID();
        WritingQuestionDetail detail = WritingDetails.essay(id, 3, List.of(WritingDetails.essayRecord()));

        synchronizer.upsert(detail, CompletionStatus.COMPLETE);
        String first = gateway.findDocument(INDEX, id.toString()).orElseThrow();
        synchronizer.upsert(detail, CompletionStatus.COMPLETE);

        assertThat(gateway.documentCount(INDEX)).isEqualTo(1);
        assertThat(gateway.findDocument(INDEX, id.toString())).contains(first);
    }

    @Test
    @DisplayName("a later upsert overwrites status and version")
    void upsert_overwrites() throws Exception {
        UUID id = UUID.randomUUID();
        synchronizer.upsert(WritingDetails.essay(id, 1, List.of()), CompletionStatus.UNCOMPLETE);
        synchronizer.upsert(WritingDetails.essay(id, 2, List.of(WritingDetails.essayRecord())), CompletionStatus.COMPLETE);

        JsonNode document = objectMapper.readTree(gateway.findDocument(INDEX, id.toString()).orElseThrow());
        assertThat(document.get("status").asText()).isEqualTo("complete");
        assertThat(document.get("version").asInt()).isEqualTo(2);
    }

    @Test
    @DisplayName("remove deletes the document and tolerates a missing one")
    void remove() {
        UUID id = UUID.randomUUID();
        synchronizer.upsert(WritingDetails.essay(id, 1, List.of()), CompletionStatus.UNCOMPLETE);

        synchronizer.remove(id);

        assertThat(synchronizer.exists(id)).isFalse();
        assertThatCode(() -> synchronizer.remove(id)).doesNotThrowAnyException();
    }

    @Test
    @DisplayName("remove on a missing index is a no-op")
    void remove_missingIndex() {
        assertThatCode(() -> synchronizer.remove(UUID.randomUUID())).doesNotThrowAnyException();
        assertThat(gateway.indexExists(INDEX)).isFalse();
    }

    @Test
    @DisplayName("createIndex reports whether it created anything; dropIndex removes documents")
    void indexLifecycle() {
        assertThat(synchronizer.createIndex()).isTrue();
        assertThat(synchronizer.createIndex()).isFalse();

        UUID id = UUID.randomUUID();
        synchronizer.upsert(WritingDetails.essay(id, 1, List.of()), CompletionStatus.UNCOMPLETE);

        assertThat(synchronizer.dropIndex()).isTrue();
        assertThat(synchronizer.exists(id)).isFalse();
        assertThat(synchronizer.dropIndex()).isFalse();
    }

    @Test
    @DisplayName("a backend failure on upsert is counted and rethrown")
    void upsert_failure_rethrown() {
        SearchIndexGateway failing = mock(SearchIndexGateway.class);
        when(failing.indexExists(INDEX)).thenReturn(true);
        doThrow(new SearchSyncException("cluster unavailable"))
                .when(failing).putDocument(eq(INDEX), anyString(), anyString());
        DetailSearchSynchronizer<WritingQuestionDetail> sync = newSynchronizer(failing);

        assertThatThrownBy(() -> sync.upsert(WritingDetails.essay(UUID.randomUUID(), 1, List.of()),
                CompletionStatus.UNCOMPLETE))
                .isInstanceOf(SearchSyncException.class)
                .hasMessageContaining("cluster unavailable");
        assertThat(registry.counter(ContentSyncMetrics.SEARCH_FAILURES,
                "kind", "WRITING", "operation", "upsert").count()).isEqualTo(1.0);
    }

    @Test
    @DisplayName("search finds documents by the completion status they were indexed with")
    void search_byStatus() {
        UUID complete = UUID.randomUUID();
        UUID uncomplete = UUID.randomUUID();
        synchronizer.upsert(WritingDetails.essay(complete, 2, List.of(WritingDetails.essayRecord())),
                CompletionStatus.COMPLETE);
        synchronizer.upsert(WritingDetails.essay(uncomplete, 1, List.of()), CompletionStatus.UNCOMPLETE);

        SearchPage page = synchronizer.search(ContentSearchCriteria.of("ESSAY", "Environment", "complete", 1, 10));

        assertThat(page.total()).isEqualTo(1);
        assertThat(page.documentIds()).containsExactly(complete.toString());
    }

    @Test
    @DisplayName("a backend failure on search is counted and rethrown")
    void search_failure_rethrown() {
        SearchIndexGateway failing = mock(SearchIndexGateway.class);
        when(failing.search(eq(INDEX), any(SearchFilter.class), eq(1), eq(10)))
                .thenThrow(new SearchSyncException("cluster unavailable"));
        DetailSearchSynchronizer<WritingQuestionDetail> sync = newSynchronizer(failing);

        assertThatThrownBy(() -> sync.search(ContentSearchCriteria.of(null, null, null, 1, 10)))
                .isInstanceOf(SearchSyncException.class);
        assertThat(registry.counter(ContentSyncMetrics.SEARCH_FAILURES,
                "kind", "WRITING", "operation", "search").count()).isEqualTo(1.0);
    }

    private DetailSearchSynchronizer<WritingQuestionDetail> newSynchronizer(SearchIndexGateway searchGateway) {
        return new DetailSearchSynchronizer<>(ContentKind.WRITING, searchGateway,
                new WritingQuestionSearchDocumentMapper(objectMapper), objectMapper, new SearchProperties(),
                new ContentSyncMetrics(registry));
    }
}
