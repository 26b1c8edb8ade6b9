package uk.gegc.fluency.features.grammar.application;

import uk.gegc.fluency.features.grammar.api.dto.CreateGrammarQuestionRequest;
import uk.gegc.fluency.features.grammar.api.dto.GrammarQuestionDetail;
import uk.gegc.fluency.features.grammar.api.dto.GrammarQuestionFieldUpdate;
import uk.gegc.fluency.features.sync.api.dto.ContentSearchResult;
import uk.gegc.fluency.features.sync.api.dto.VersionCheck;
import uk.gegc.fluency.features.sync.application.ContentSearchCriteria;

import java.util.List;
import java.util.UUID;

public interface GrammarQuestionService {

    GrammarQuestionDetail createQuestion(CreateGrammarQuestionRequest request);

    GrammarQuestionDetail getQuestion(UUID id);

    List<GrammarQuestionDetail> getQuestions(List<UUID> ids);

    GrammarQuestionDetail updateField(UUID id, GrammarQuestionFieldUpdate update);

    void deleteQuestion(UUID id);

    /**
     * Returns the details of every listed question whose stored version is newer than the one given.
     */
    List<GrammarQuestionDetail> getNewUpdates(List<VersionCheck> checks);

    /**
     * Filters the search index, then loads the matching questions from the store.
     */
    ContentSearchResult<GrammarQuestionDetail> searchQuestions(ContentSearchCriteria criteria);

    /**
     * Deletes every grammar question, clears the cache prefix and drops the search index.
     */
    void deleteAllQuestions();

    boolean createSearchIndex();

    boolean dropSearchIndex();
}
