package uk.gegc.fluency.features.grammar.application;

import uk.gegc.fluency.features.grammar.api.dto.GrammarChoiceOneOptionDto;
import uk.gegc.fluency.features.grammar.api.dto.GrammarChoiceOneOptionRequest;
import uk.gegc.fluency.features.grammar.api.dto.GrammarChoiceOneQuestionDto;
import uk.gegc.fluency.features.grammar.api.dto.GrammarChoiceOneQuestionRequest;
import uk.gegc.fluency.features.grammar.api.dto.GrammarErrorIdentificationDto;
import uk.gegc.fluency.features.grammar.api.dto.GrammarErrorIdentificationRequest;
import uk.gegc.fluency.features.grammar.api.dto.GrammarFillInTheBlankAnswerDto;
import uk.gegc.fluency.features.grammar.api.dto.GrammarFillInTheBlankAnswerRequest;
import uk.gegc.fluency.features.grammar.api.dto.GrammarFillInTheBlankQuestionDto;
import uk.gegc.fluency.features.grammar.api.dto.GrammarFillInTheBlankQuestionRequest;
import uk.gegc.fluency.features.grammar.api.dto.GrammarSentenceTransformationDto;
import uk.gegc.fluency.features.grammar.api.dto.GrammarSentenceTransformationRequest;

import java.util.UUID;

/**
 * Sub-record maintenance for grammar questions. Single-record parts are written with put semantics:
 * the first call creates the record, later calls replace its content.
 * Every change refreshes the parent's projections without bumping its version.
 */
public interface GrammarQuestionPartService {

    GrammarFillInTheBlankQuestionDto putFillInTheBlankQuestion(UUID questionId, GrammarFillInTheBlankQuestionRequest request);

    /**
     * Removes the sentence together with its answers.
     */
    void deleteFillInTheBlankQuestion(UUID questionId);

    GrammarFillInTheBlankAnswerDto addFillInTheBlankAnswer(UUID questionId, GrammarFillInTheBlankAnswerRequest request);

    GrammarFillInTheBlankAnswerDto updateFillInTheBlankAnswer(UUID answerId, GrammarFillInTheBlankAnswerRequest request);

    void deleteFillInTheBlankAnswer(UUID answerId);

    GrammarChoiceOneQuestionDto putChoiceOneQuestion(UUID questionId, GrammarChoiceOneQuestionRequest request);

    void deleteChoiceOneQuestion(UUID questionId);

    GrammarChoiceOneOptionDto addChoiceOneOption(UUID questionId, GrammarChoiceOneOptionRequest request);

    GrammarChoiceOneOptionDto updateChoiceOneOption(UUID optionId, GrammarChoiceOneOptionRequest request);

    void deleteChoiceOneOption(UUID optionId);

    GrammarErrorIdentificationDto putErrorIdentification(UUID questionId, GrammarErrorIdentificationRequest request);

    void deleteErrorIdentification(UUID questionId);

    GrammarSentenceTransformationDto putSentenceTransformation(UUID questionId, GrammarSentenceTransformationRequest request);

    void deleteSentenceTransformation(UUID questionId);
}
