package uk.gegc.fluency.features.writing.config;

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
import uk.gegc.fluency.features.writing.api.dto.WritingQuestionDetail;
import uk.gegc.fluency.features.writing.domain.model.WritingQuestion;
import uk.gegc.fluency.features.writing.domain.repository.WritingQuestionRepository;
import uk.gegc.fluency.features.writing.infra.sync.WritingQuestionCompletionEvaluator;
import uk.gegc.fluency.features.writing.infra.sync.WritingQuestionDetailAssembler;
import uk.gegc.fluency.features.writing.infra.sync.WritingQuestionSearchDocumentMapper;
import uk.gegc.fluency.shared.cache.CacheProperties;
import uk.gegc.fluency.shared.cache.ContentCacheStore;
import uk.gegc.fluency.shared.search.SearchIndexGateway;
import uk.gegc.fluency.shared.search.SearchProperties;

/**
 * Wires the generic sync pipeline for writing questions.
 */
@Configuration
public class WritingQuestionSyncConfig {

    @Bean
    public DetailCacheSynchronizer<WritingQuestionDetail> writingQuestionCacheSynchronizer(
            ContentCacheStore cacheStore,
            ObjectMapper objectMapper,
            CacheProperties cacheProperties,
            ContentSyncMetrics metrics) {
        return new DetailCacheSynchronizer<>(ContentKind.WRITING, WritingQuestionDetail.class,
                cacheStore, objectMapper, cacheProperties, metrics);
    }

    @Bean
    public DetailSearchSynchronizer<WritingQuestionDetail> writingQuestionSearchSynchronizer(
            SearchIndexGateway gateway,
            WritingQuestionSearchDocumentMapper documentMapper,
            ObjectMapper objectMapper,
            SearchProperties searchProperties,
            ContentSyncMetrics metrics) {
        return new DetailSearchSynchronizer<>(ContentKind.WRITING, gateway, documentMapper,
                objectMapper, searchProperties, metrics);
    }

    @Bean
    public DeltaSyncResolver<WritingQuestion, WritingQuestionDetail> writingQuestionDeltaSyncResolver(
            WritingQuestionRepository repository,
            WritingQuestionDetailAssembler assembler,
            WritingQuestionCompletionEvaluator evaluator,
            DetailCacheSynchronizer<WritingQuestionDetail> writingQuestionCacheSynchronizer) {
        return new DeltaSyncResolver<>(repository, assembler, evaluator, writingQuestionCacheSynchronizer);
    }

    @Bean
    public ContentSyncHandler writingQuestionSyncHandler(
            WritingQuestionDetailAssembler assembler,
            WritingQuestionCompletionEvaluator evaluator,
            DetailCacheSynchronizer<WritingQuestionDetail> writingQuestionCacheSynchronizer,
            DetailSearchSynchronizer<WritingQuestionDetail> writingQuestionSearchSynchronizer) {
        return new DefaultContentSyncHandler<>(ContentKind.WRITING, assembler, evaluator,
                writingQuestionCacheSynchronizer, writingQuestionSearchSynchronizer);
    }
}
