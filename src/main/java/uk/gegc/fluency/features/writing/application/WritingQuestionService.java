package uk.gegc.fluency.features.writing.application;

import uk.gegc.fluency.features.sync.api.dto.ContentSearchResult;
import uk.gegc.fluency.features.sync.api.dto.VersionCheck;
import uk.gegc.fluency.features.sync.application.ContentSearchCriteria;
import uk.gegc.fluency.features.writing.api.dto.CreateWritingQuestionRequest;
import uk.gegc.fluency.features.writing.api.dto.WritingQuestionDetail;
import uk.gegc.fluency.features.writing.api.dto.WritingQuestionFieldUpdate;

import java.util.List;
import java.util.UUID;

public interface WritingQuestionService {

    WritingQuestionDetail createQuestion(CreateWritingQuestionRequest request);

    WritingQuestionDetail getQuestion(UUID id);

    List<WritingQuestionDetail> getQuestions(List<UUID> ids);

    WritingQuestionDetail updateField(UUID id, WritingQuestionFieldUpdate update);

    void deleteQuestion(UUID id);

    /**
     * Returns the details of every listed question whose stored version is newer than the one given.
     */
    List<WritingQuestionDetail> getNewUpdates(List<VersionCheck> checks);

    /**
     * Filters the search index, then loads the matching questions from the store.
     */
    ContentSearchResult<WritingQuestionDetail> searchQuestions(ContentSearchCriteria criteria);

    /**
     * Deletes every writing question, clears the cache prefix and drops the search index.
     */
    void deleteAllQuestions();

    boolean createSearchIndex();

    boolean dropSearchIndex();
}
