package uk.gegc.fluency.shared.config;

import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.data.elasticsearch.core.ElasticsearchOperations;
import uk.gegc.fluency.shared.search.ElasticsearchSearchIndexGateway;
import uk.gegc.fluency.shared.search.InMemorySearchIndexGateway;
import uk.gegc.fluency.shared.search.SearchIndexGateway;

/**
 * Selects the {@link SearchIndexGateway} backend from {@code fluency.search.type}.
 */
@Slf4j
@Configuration
public class SearchIndexConfig {

    @Bean
    @ConditionalOnProperty(name = "fluency.search.type", havingValue = "ELASTICSEARCH")
    public SearchIndexGateway elasticsearchSearchIndexGateway(ElasticsearchOperations operations,
                                                              ObjectMapper objectMapper) {
        log.info("Activating Elasticsearch search index gateway");
        return new ElasticsearchSearchIndexGateway(operations, objectMapper);
    }

    @Bean
    @ConditionalOnProperty(name = "fluency.search.type", havingValue = "MEMORY", matchIfMissing = true)
    public SearchIndexGateway inMemorySearchIndexGateway(ObjectMapper objectMapper) {
        log.info("Activating in-memory search index gateway (documents are not persisted)");
        return new InMemorySearchIndexGateway(objectMapper);
    }
}
