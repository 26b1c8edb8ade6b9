package uk.gegc.fluency.features.grammar.config;

import com.fasterxml.jackson.databind.ObjectMapper;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import uk.gegc.fluency.features.sync.application.ContentSyncHandler;
import uk.gegc.fluency.features.sync.application.ContentSyncMetrics;
import uk.gegc.fluency.features.sync.application.DefaultContentSyncHandler;
import uk.gegc.fluency.features.sync.application.DeltaSyncResolver;
import uk.gegc.fluency.features.sync.application.DetailCacheSynchronizer;
import uk.gegc.fluency.features.sync.application.DetailSearchSynchronizer;
import uk.gegc.fluency.features.sync.domain.model.ContentKind;
import uk.gegc.fluency.features.grammar.api.dto.GrammarQuestionDetail;
import uk.gegc.fluency.features.grammar.domain.model.GrammarQuestion;
import uk.gegc.fluency.features.grammar.domain.repository.GrammarQuestionRepository;
import uk.gegc.fluency.features.grammar.infra.sync.GrammarQuestionCompletionEvaluator;
import uk.gegc.fluency.features.grammar.infra.sync.GrammarQuestionDetailAssembler;
import uk.gegc.fluency.features.grammar.infra.sync.GrammarQuestionSearchDocumentMapper;
import uk.gegc.fluency.shared.cache.CacheProperties;
import uk.gegc.fluency.shared.cache.ContentCacheStore;
import uk.gegc.fluency.shared.search.SearchIndexGateway;
import uk.gegc.fluency.shared.search.SearchProperties;

/**
 * Wires the generic sync pipeline for grammar questions.
 */
@Configuration
public class GrammarQuestionSyncConfig {

    @Bean
    public DetailCacheSynchronizer<GrammarQuestionDetail> grammarQuestionCacheSynchronizer(
            ContentCacheStore cacheStore,
            ObjectMapper objectMapper,
            CacheProperties cacheProperties,
            ContentSyncMetrics metrics) {
        return new DetailCacheSynchronizer<>(ContentKind.GRAMMAR, GrammarQuestionDetail.class,
                cacheStore, objectMapper, cacheProperties, metrics);
    }

    @Bean
    public DetailSearchSynchronizer<GrammarQuestionDetail> grammarQuestionSearchSynchronizer(
            SearchIndexGateway gateway,
            GrammarQuestionSearchDocumentMapper documentMapper,
            ObjectMapper objectMapper,
            SearchProperties searchProperties,
            ContentSyncMetrics metrics) {
        return new DetailSearchSynchronizer<>(ContentKind.GRAMMAR, gateway, documentMapper,
                objectMapper, searchProperties, metrics);
    }

    @Bean
    public DeltaSyncResolver<GrammarQuestion, GrammarQuestionDetail> grammarQuestionDeltaSyncResolver(
            GrammarQuestionRepository repository,
            GrammarQuestionDetailAssembler assembler,
            GrammarQuestionCompletionEvaluator evaluator,
            DetailCacheSynchronizer<GrammarQuestionDetail> grammarQuestionCacheSynchronizer) {
        return new DeltaSyncResolver<>(repository, assembler, evaluator, grammarQuestionCacheSynchronizer);
    }

    @Bean
    public ContentSyncHandler grammarQuestionSyncHandler(
            GrammarQuestionDetailAssembler assembler,
            GrammarQuestionCompletionEvaluator evaluator,
            DetailCacheSynchronizer<GrammarQuestionDetail> grammarQuestionCacheSynchronizer,
            DetailSearchSynchronizer<GrammarQuestionDetail> grammarQuestionSearchSynchronizer) {
        return new DefaultContentSyncHandler<>(ContentKind.GRAMMAR, assembler, evaluator,
                grammarQuestionCacheSynchronizer, grammarQuestionSearchSynchronizer);
    }
}
