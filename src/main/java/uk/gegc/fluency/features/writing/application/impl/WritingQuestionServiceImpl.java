package uk.gegc.fluency.features.writing.application.impl;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;
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
import uk.gegc.fluency.features.writing.api.dto.CreateWritingQuestionRequest;
import uk.gegc.fluency.features.writing.api.dto.WritingQuestionDetail;
import uk.gegc.fluency.features.writing.api.dto.WritingQuestionFieldUpdate;
import uk.gegc.fluency.features.writing.application.WritingQuestionService;
import uk.gegc.fluency.features.writing.domain.model.WritingQuestion;
import uk.gegc.fluency.features.writing.domain.repository.WritingQuestionRepository;
import uk.gegc.fluency.features.writing.infra.mapping.WritingQuestionMapper;
import uk.gegc.fluency.features.writing.infra.sync.WritingQuestionDetailAssembler;
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
public class WritingQuestionServiceImpl implements WritingQuestionService {

    private final WritingQuestionRepository questionRepository;
    private final WritingQuestionMapper mapper;
    private final WritingQuestionDetailAssembler assembler;
    private final ContentVersionMutator versionMutator;
    private final ContentSyncOutbox syncOutbox;
    private final DeltaSyncResolver<WritingQuestion, WritingQuestionDetail> deltaSyncResolver;
    private final DetailCacheSynchronizer<WritingQuestionDetail> cacheSynchronizer;
    private final DetailSearchSynchronizer<WritingQuestionDetail> searchSynchronizer;
    private final Clock clock;

    @Override
    public WritingQuestionDetail createQuestion(CreateWritingQuestionRequest request) {
        ContentItemConstraints.validateTopics(request.topic());
        ContentItemConstraints.validateInstruction(request.instruction());
        ContentItemConstraints.validateImageUrls(request.imageUrls() == null ? List.of() : request.imageUrls());
        ContentItemConstraints.validateMaxTime(request.maxTime());

        WritingQuestion question = mapper.toEntity(request);
        Instant now = Instant.now(clock);
        question.setVersion(1);
        question.setCreatedAt(now);
        question.setUpdatedAt(now);

        WritingQuestion saved = questionRepository.save(question);
        syncOutbox.upsert(ContentKind.WRITING, saved.getId());
        log.info("Created writing question {} of type {}", saved.getId(), saved.getType());
        return assembler.assemble(saved);
    }

    @Override
    @Transactional(readOnly = true)
    public WritingQuestionDetail getQuestion(UUID id) {
        return deltaSyncResolver.readThrough(findQuestion(id));
    }

    @Override
    @Transactional(readOnly = true)
    public List<WritingQuestionDetail> getQuestions(List<UUID> ids) {
        return deltaSyncResolver.readThrough(ids);
    }

    @Override
    public WritingQuestionDetail updateField(UUID id, WritingQuestionFieldUpdate update) {
        WritingQuestion question = findQuestion(id);
        versionMutator.apply(question, update);
        WritingQuestion saved = questionRepository.save(question);
        syncOutbox.upsert(ContentKind.WRITING, saved.getId());
        log.info("Updated {} of writing question {} to version {}", update.field(), id, saved.getVersion());
        return assembler.assemble(saved);
    }

    @Override
    public void deleteQuestion(UUID id) {
        if (!questionRepository.existsById(id)) {
            throw new ResourceNotFoundException("Writing question " + id + " not found");
        }
        questionRepository.deleteById(id);
        syncOutbox.remove(ContentKind.WRITING, id);
        log.info("Deleted writing question {}", id);
    }

    @Override
    @Transactional(readOnly = true)
    public List<WritingQuestionDetail> getNewUpdates(List<VersionCheck> checks) {
        return deltaSyncResolver.resolve(checks);
    }

    @Override
    @Transactional(readOnly = true)
    public ContentSearchResult<WritingQuestionDetail> searchQuestions(ContentSearchCriteria criteria) {
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
        log.warn("Purged all writing questions");
    }

    @Override
    public boolean createSearchIndex() {
        return searchSynchronizer.createIndex();
    }

    @Override
    public boolean dropSearchIndex() {
        return searchSynchronizer.dropIndex();
    }

    private WritingQuestion findQuestion(UUID id) {
        return questionRepository.findById(id)
                .orElseThrow(() -> new ResourceNotFoundException("Writing question " + id + " not found"));
    }
}
