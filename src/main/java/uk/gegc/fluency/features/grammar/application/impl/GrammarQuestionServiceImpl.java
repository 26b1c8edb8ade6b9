package uk.gegc.fluency.features.grammar.application.impl;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;
import uk.gegc.fluency.features.grammar.api.dto.CreateGrammarQuestionRequest;
import uk.gegc.fluency.features.grammar.api.dto.GrammarQuestionDetail;
import uk.gegc.fluency.features.grammar.api.dto.GrammarQuestionFieldUpdate;
import uk.gegc.fluency.features.grammar.application.GrammarQuestionService;
import uk.gegc.fluency.features.grammar.domain.model.GrammarQuestion;
import uk.gegc.fluency.features.grammar.domain.repository.GrammarQuestionRepository;
import uk.gegc.fluency.features.grammar.infra.mapping.GrammarQuestionMapper;
import uk.gegc.fluency.features.grammar.infra.sync.GrammarQuestionDetailAssembler;
import uk.gegc.fluency.features.sync.api.dto.ContentSearchResult;
import uk.gegc.fluency.features.sync.api.dto.VersionCheck;
import uk.gegc.fluency.features.sync.application.ContentItemConstraints;
import uk.gegc.fluency.features.sync.application.ContentSearchCriteria;
import uk.gegc.fluency.features.sync.application.ContentSyncOutbox;
import uk.gegc.fluency.features.sync.application.ContentVersionMutator;
import uk.gegc.fluency.features.sync.application.DeltaSyncResolver;
import uk.gegc.fluency.features.sync.application.DetailCacheSynchronizer;
import uk.gegc.fluency.features.sync.application.DetailSearchSynchronizer;
import uk.gegc.fluency.features.sync.domain.model.ContentKind;
import uk.gegc.fluency.shared.exception.ResourceNotFoundException;
import uk.gegc.fluency.shared.search.SearchPage;

import java.time.Clock;
import java.time.Instant;
import java.util.List;
import java.util.UUID;

@Slf4j
@Service
@Transactional
@RequiredArgsConstructor
public class GrammarQuestionServiceImpl implements GrammarQuestionService {

    private final GrammarQuestionRepository questionRepository;
    private final GrammarQuestionMapper mapper;
    private final GrammarQuestionDetailAssembler assembler;
    private final ContentVersionMutator versionMutator;
    private final ContentSyncOutbox syncOutbox;
    private final DeltaSyncResolver<GrammarQuestion, GrammarQuestionDetail> deltaSyncResolver;
    private final DetailCacheSynchronizer<GrammarQuestionDetail> cacheSynchronizer;
    private final DetailSearchSynchronizer<GrammarQuestionDetail> searchSynchronizer;
    private final Clock clock;

    @Override
    public GrammarQuestionDetail createQuestion(CreateGrammarQuestionRequest request) {
        ContentItemConstraints.validateTopics(request.topic());
        ContentItemConstraints.validateInstruction(request.instruction());
        ContentItemConstraints.validateImageUrls(request.imageUrls() == null ? List.of() : request.imageUrls());
        ContentItemConstraints.validateMaxTime(request.maxTime());

        GrammarQuestion question = mapper.toEntity(request);
        Instant now = Instant.now(clock);
        question.setVersion(1);
        question.setCreatedAt(now);
        question.setUpdatedAt(now);

        GrammarQuestion saved = questionRepository.save(question);
        syncOutbox.upsert(ContentKind.GRAMMAR, saved.getId());
        log.info("Created grammar question {} of type {}", saved.getId(), saved.getType());
        return assembler.assemble(saved);
    }

    @Override
    @Transactional(readOnly = true)
    public GrammarQuestionDetail getQuestion(UUID id) {
        return deltaSyncResolver.readThrough(findQuestion(id));
    }

    @Override
    @Transactional(readOnly = true)
    public List<GrammarQuestionDetail> getQuestions(List<UUID> ids) {
        return deltaSyncResolver.readThrough(ids);
    }

    @Override
    public GrammarQuestionDetail updateField(UUID id, GrammarQuestionFieldUpdate update) {
        GrammarQuestion question = findQuestion(id);
        versionMutator.apply(question, update);
        GrammarQuestion saved = questionRepository.save(question);
        syncOutbox.upsert(ContentKind.GRAMMAR, saved.getId());
        log.info("Updated {} of grammar question {} to version {}", update.field(), id, saved.getVersion());
        return assembler.assemble(saved);
    }

    @Override
    public void deleteQuestion(UUID id) {
        if (!questionRepository.existsById(id)) {
            throw new ResourceNotFoundException("Grammar question " + id + " not found");
        }
        questionRepository.deleteById(id);
        syncOutbox.remove(ContentKind.GRAMMAR, id);
        log.info("Deleted grammar question {}", id);
    }

    @Override
    @Transactional(readOnly = true)
    public List<GrammarQuestionDetail> getNewUpdates(List<VersionCheck> checks) {
        return deltaSyncResolver.resolve(checks);
    }

    @Override
    @Transactional(readOnly = true)
    public ContentSearchResult<GrammarQuestionDetail> searchQuestions(ContentSearchCriteria criteria) {
        SearchPage hits = searchSynchronizer.search(criteria);
        List<UUID> ids = hits.documentIds().stream().map(UUID::fromString).toList();
        return new ContentSearchResult<>(deltaSyncResolver.readThrough(ids), hits.total(),
                criteria.page(), criteria.pageSize());
    }

    /**
     * The index is dropped before the cache is cleared, so a search failure rolls back the row
     * deletion with the cache still intact.
     */
    @Override
    public void deleteAllQuestions() {
        questionRepository.deleteAllInBatch();
        searchSynchronizer.dropIndex();
        cacheSynchronizer.evictAll();
        log.warn("Purged all grammar questions");
    }

    @Override
    public boolean createSearchIndex() {
        return searchSynchronizer.createIndex();
    }

    @Override
    public boolean dropSearchIndex() {
        return searchSynchronizer.dropIndex();
    }

    private GrammarQuestion findQuestion(UUID id) {
        return questionRepository.findById(id)
                .orElseThrow(() -> new ResourceNotFoundException("Grammar question " + id + " not found"));
    }
}
