package uk.gegc.fluency.features.writing.application;

import uk.gegc.fluency.features.writing.api.dto.WritingEssayDto;
import uk.gegc.fluency.features.writing.api.dto.WritingEssayRequest;
import uk.gegc.fluency.features.writing.api.dto.WritingSentenceCompletionDto;
import uk.gegc.fluency.features.writing.api.dto.WritingSentenceCompletionRequest;

import java.util.UUID;

/**
 * Sub-record maintenance. Changes refresh the parent question's projections but leave its version alone.
 */
public interface WritingQuestionPartService {

    WritingSentenceCompletionDto addSentenceCompletion(UUID questionId, WritingSentenceCompletionRequest request);

    WritingSentenceCompletionDto updateSentenceCompletion(UUID completionId, WritingSentenceCompletionRequest request);

    void deleteSentenceCompletion(UUID completionId);

    WritingEssayDto addEssay(UUID questionId, WritingEssayRequest request);

    WritingEssayDto updateEssay(UUID essayId, WritingEssayRequest request);

    void deleteEssay(UUID essayId);
}
