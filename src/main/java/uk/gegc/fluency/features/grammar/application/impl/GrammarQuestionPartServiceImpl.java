package uk.gegc.fluency.features.grammar.application.impl;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;
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
import uk.gegc.fluency.features.grammar.application.GrammarQuestionPartService;
import uk.gegc.fluency.features.grammar.domain.model.GrammarChoiceOneOption;
import uk.gegc.fluency.features.grammar.domain.model.GrammarChoiceOneQuestion;
import uk.gegc.fluency.features.grammar.domain.model.GrammarErrorIdentification;
import uk.gegc.fluency.features.grammar.domain.model.GrammarFillInTheBlankAnswer;
import uk.gegc.fluency.features.grammar.domain.model.GrammarFillInTheBlankQuestion;
import uk.gegc.fluency.features.grammar.domain.model.GrammarQuestion;
import uk.gegc.fluency.features.grammar.domain.model.GrammarQuestionType;
import uk.gegc.fluency.features.grammar.domain.model.GrammarSentenceTransformation;
import uk.gegc.fluency.features.grammar.domain.repository.GrammarChoiceOneOptionRepository;
import uk.gegc.fluency.features.grammar.domain.repository.GrammarChoiceOneQuestionRepository;
import uk.gegc.fluency.features.grammar.domain.repository.GrammarErrorIdentificationRepository;
import uk.gegc.fluency.features.grammar.domain.repository.GrammarFillInTheBlankAnswerRepository;
import uk.gegc.fluency.features.grammar.domain.repository.GrammarFillInTheBlankQuestionRepository;
import uk.gegc.fluency.features.grammar.domain.repository.GrammarQuestionRepository;
import uk.gegc.fluency.features.grammar.domain.repository.GrammarSentenceTransformationRepository;
import uk.gegc.fluency.features.grammar.infra.mapping.GrammarQuestionMapper;
import uk.gegc.fluency.features.sync.application.ContentSyncOutbox;
import uk.gegc.fluency.features.sync.domain.model.ContentKind;
import uk.gegc.fluency.shared.exception.ResourceNotFoundException;
import uk.gegc.fluency.shared.exception.ValidationException;

import java.util.UUID;

@Slf4j
@Service
@Transactional
@RequiredArgsConstructor
public class GrammarQuestionPartServiceImpl implements GrammarQuestionPartService {

    private final GrammarQuestionRepository questionRepository;
    private final GrammarFillInTheBlankQuestionRepository fillInTheBlankQuestionRepository;
    private final GrammarFillInTheBlankAnswerRepository fillInTheBlankAnswerRepository;
    private final GrammarChoiceOneQuestionRepository choiceOneQuestionRepository;
    private final GrammarChoiceOneOptionRepository choiceOneOptionRepository;
    private final GrammarErrorIdentificationRepository errorIdentificationRepository;
    private final GrammarSentenceTransformationRepository sentenceTransformationRepository;
    private final GrammarQuestionMapper mapper;
    private final ContentSyncOutbox syncOutbox;

    @Override
    public GrammarFillInTheBlankQuestionDto putFillInTheBlankQuestion(UUID questionId,
                                                                      GrammarFillInTheBlankQuestionRequest request) {
        GrammarQuestion question = findQuestionOfType(questionId, GrammarQuestionType.FILL_IN_THE_BLANK);
        GrammarFillInTheBlankQuestion blank = fillInTheBlankQuestionRepository.findByGrammarQuestion_Id(questionId)
                .orElseGet(() -> {
                    GrammarFillInTheBlankQuestion created = new GrammarFillInTheBlankQuestion();
                    created.setGrammarQuestion(question);
                    return created;
                });
        mapper.apply(request, blank);
        GrammarFillInTheBlankQuestion saved = fillInTheBlankQuestionRepository.save(blank);

        syncOutbox.upsert(ContentKind.GRAMMAR, questionId);
        return mapper.toDto(saved);
    }

    @Override
    public void deleteFillInTheBlankQuestion(UUID questionId) {
        GrammarFillInTheBlankQuestion blank = fillInTheBlankQuestionRepository.findByGrammarQuestion_Id(questionId)
                .orElseThrow(() -> new ResourceNotFoundException(
                        "Fill-in-the-blank question for grammar question " + questionId + " not found"));
        fillInTheBlankQuestionRepository.delete(blank);
        syncOutbox.upsert(ContentKind.GRAMMAR, questionId);
    }

    @Override
    public GrammarFillInTheBlankAnswerDto addFillInTheBlankAnswer(UUID questionId,
                                                                  GrammarFillInTheBlankAnswerRequest request) {
        findQuestionOfType(questionId, GrammarQuestionType.FILL_IN_THE_BLANK);
        GrammarFillInTheBlankQuestion blank = fillInTheBlankQuestionRepository.findByGrammarQuestion_Id(questionId)
                .orElseThrow(() -> new ValidationException(
                        "Grammar question " + questionId + " has no fill-in-the-blank sentence yet"));

        GrammarFillInTheBlankAnswer answer = new GrammarFillInTheBlankAnswer();
        answer.setFillInTheBlankQuestion(blank);
        mapper.apply(request, answer);
        GrammarFillInTheBlankAnswer saved = fillInTheBlankAnswerRepository.save(answer);

        syncOutbox.upsert(ContentKind.GRAMMAR, questionId);
        log.info("Added answer {} to grammar question {}", saved.getId(), questionId);
        return mapper.toDto(saved);
    }

    @Override
    public GrammarFillInTheBlankAnswerDto updateFillInTheBlankAnswer(UUID answerId,
                                                                     GrammarFillInTheBlankAnswerRequest request) {
        GrammarFillInTheBlankAnswer answer = findAnswer(answerId);
        mapper.apply(request, answer);
        GrammarFillInTheBlankAnswer saved = fillInTheBlankAnswerRepository.save(answer);

        syncOutbox.upsert(ContentKind.GRAMMAR, answer.getFillInTheBlankQuestion().getGrammarQuestion().getId());
        return mapper.toDto(saved);
    }

    @Override
    public void deleteFillInTheBlankAnswer(UUID answerId) {
        GrammarFillInTheBlankAnswer answer = findAnswer(answerId);
        UUID questionId = answer.getFillInTheBlankQuestion().getGrammarQuestion().getId();

        fillInTheBlankAnswerRepository.delete(answer);
        syncOutbox.upsert(ContentKind.GRAMMAR, questionId);
    }

    @Override
    public GrammarChoiceOneQuestionDto putChoiceOneQuestion(UUID questionId, GrammarChoiceOneQuestionRequest request) {
        GrammarQuestion question = findQuestionOfType(questionId, GrammarQuestionType.CHOICE_ONE);
        GrammarChoiceOneQuestion choice = choiceOneQuestionRepository.findByGrammarQuestion_Id(questionId)
                .orElseGet(() -> {
                    GrammarChoiceOneQuestion created = new GrammarChoiceOneQuestion();
                    created.setGrammarQuestion(question);
                    return created;
                });
        mapper.apply(request, choice);
        GrammarChoiceOneQuestion saved = choiceOneQuestionRepository.save(choice);

        syncOutbox.upsert(ContentKind.GRAMMAR, questionId);
        return mapper.toDto(saved);
    }

    @Override
    public void deleteChoiceOneQuestion(UUID questionId) {
        GrammarChoiceOneQuestion choice = choiceOneQuestionRepository.findByGrammarQuestion_Id(questionId)
                .orElseThrow(() -> new ResourceNotFoundException(
                        "Choice-one question for grammar question " + questionId + " not found"));
        choiceOneQuestionRepository.delete(choice);
        syncOutbox.upsert(ContentKind.GRAMMAR, questionId);
    }

    @Override
    public GrammarChoiceOneOptionDto addChoiceOneOption(UUID questionId, GrammarChoiceOneOptionRequest request) {
        findQuestionOfType(questionId, GrammarQuestionType.CHOICE_ONE);
        GrammarChoiceOneQuestion choice = choiceOneQuestionRepository.findByGrammarQuestion_Id(questionId)
                .orElseThrow(() -> new ValidationException(
                        "Grammar question " + questionId + " has no choice-one question yet"));

        GrammarChoiceOneOption option = new GrammarChoiceOneOption();
        option.setChoiceOneQuestion(choice);
        mapper.apply(request, option);
        GrammarChoiceOneOption saved = choiceOneOptionRepository.save(option);

        syncOutbox.upsert(ContentKind.GRAMMAR, questionId);
        log.info("Added option {} to grammar question {}", saved.getId(), questionId);
        return mapper.toDto(saved);
    }

    @Override
    public GrammarChoiceOneOptionDto updateChoiceOneOption(UUID optionId, GrammarChoiceOneOptionRequest request) {
        GrammarChoiceOneOption option = findOption(optionId);
        mapper.apply(request, option);
        GrammarChoiceOneOption saved = choiceOneOptionRepository.save(option);

        syncOutbox.upsert(ContentKind.GRAMMAR, option.getChoiceOneQuestion().getGrammarQuestion().getId());
        return mapper.toDto(saved);
    }

    @Override
    public void deleteChoiceOneOption(UUID optionId) {
        GrammarChoiceOneOption option = findOption(optionId);
        UUID questionId = option.getChoiceOneQuestion().getGrammarQuestion().getId();

        choiceOneOptionRepository.delete(option);
        syncOutbox.upsert(ContentKind.GRAMMAR, questionId);
    }

    @Override
    public GrammarErrorIdentificationDto putErrorIdentification(UUID questionId,
                                                                GrammarErrorIdentificationRequest request) {
        GrammarQuestion question = findQuestionOfType(questionId, GrammarQuestionType.ERROR_IDENTIFICATION);
        GrammarErrorIdentification record = errorIdentificationRepository.findByGrammarQuestion_Id(questionId)
                .orElseGet(() -> {
                    GrammarErrorIdentification created = new GrammarErrorIdentification();
                    created.setGrammarQuestion(question);
                    return created;
                });
        mapper.apply(request, record);
        GrammarErrorIdentification saved = errorIdentificationRepository.save(record);

        syncOutbox.upsert(ContentKind.GRAMMAR, questionId);
        return mapper.toDto(saved);
    }

    @Override
    public void deleteErrorIdentification(UUID questionId) {
        GrammarErrorIdentification record = errorIdentificationRepository.findByGrammarQuestion_Id(questionId)
                .orElseThrow(() -> new ResourceNotFoundException(
                        "Error identification for grammar question " + questionId + " not found"));
        errorIdentificationRepository.delete(record);
        syncOutbox.upsert(ContentKind.GRAMMAR, questionId);
    }

    @Override
    public GrammarSentenceTransformationDto putSentenceTransformation(UUID questionId,
                                                                      GrammarSentenceTransformationRequest request) {
        GrammarQuestion question = findQuestionOfType(questionId, GrammarQuestionType.SENTENCE_TRANSFORMATION);
        GrammarSentenceTransformation record = sentenceTransformationRepository.findByGrammarQuestion_Id(questionId)
                .orElseGet(() -> {
                    GrammarSentenceTransformation created = new GrammarSentenceTransformation();
                    created.setGrammarQuestion(question);
                    return created;
                });
        mapper.apply(request, record);
        GrammarSentenceTransformation saved = sentenceTransformationRepository.save(record);

        syncOutbox.upsert(ContentKind.GRAMMAR, questionId);
        return mapper.toDto(saved);
    }

    @Override
    public void deleteSentenceTransformation(UUID questionId) {
        GrammarSentenceTransformation record = sentenceTransformationRepository.findByGrammarQuestion_Id(questionId)
                .orElseThrow(() -> new ResourceNotFoundException(
                        "Sentence transformation for grammar question " + questionId + " not found"));
        sentenceTransformationRepository.delete(record);
        syncOutbox.upsert(ContentKind.GRAMMAR, questionId);
    }

    private GrammarQuestion findQuestionOfType(UUID questionId, GrammarQuestionType expected) {
        GrammarQuestion question = questionRepository.findById(questionId)
                .orElseThrow(() -> new ResourceNotFoundException("Grammar question " + questionId + " not found"));
        if (question.getType() != expected) {
            throw new ValidationException("Grammar question " + questionId + " is of type " + question.getType()
                    + ", expected " + expected);
        }
        return question;
    }

    private GrammarFillInTheBlankAnswer findAnswer(UUID answerId) {
        return fillInTheBlankAnswerRepository.findById(answerId)
                .orElseThrow(() -> new ResourceNotFoundException("Fill-in-the-blank answer " + answerId + " not found"));
    }

    private GrammarChoiceOneOption findOption(UUID optionId) {
        return choiceOneOptionRepository.findById(optionId)
                .orElseThrow(() -> new ResourceNotFoundException("Choice-one option " + optionId + " not found"));
    }
}
