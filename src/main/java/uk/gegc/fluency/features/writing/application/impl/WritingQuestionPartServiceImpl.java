package uk.gegc.fluency.features.writing.application.impl;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;
import uk.gegc.fluency.features.sync.application.ContentSyncOutbox;
import uk.gegc.fluency.features.sync.domain.model.ContentKind;
import uk.gegc.fluency.features.writing.api.dto.WritingEssayDto;
import uk.gegc.fluency.features.writing.api.dto.WritingEssayRequest;
import uk.gegc.fluency.features.writing.api.dto.WritingSentenceCompletionDto;
import uk.gegc.fluency.features.writing.api.dto.WritingSentenceCompletionRequest;
import uk.gegc.fluency.features.writing.application.WritingQuestionPartService;
import uk.gegc.fluency.features.writing.domain.model.WritingEssay;
import uk.gegc.fluency.features.writing.domain.model.WritingQuestion;
import uk.gegc.fluency.features.writing.domain.model.WritingQuestionType;
import uk.gegc.fluency.features.writing.domain.model.WritingSentenceCompletion;
import uk.gegc.fluency.features.writing.domain.repository.WritingEssayRepository;
import uk.gegc.fluency.features.writing.domain.repository.WritingQuestionRepository;
import uk.gegc.fluency.features.writing.domain.repository.WritingSentenceCompletionRepository;
import uk.gegc.fluency.features.writing.infra.mapping.WritingQuestionMapper;
import uk.gegc.fluency.shared.exception.ResourceNotFoundException;
import uk.gegc.fluency.shared.exception.ValidationException;

import java.util.UUID;

@Slf4j
@Service
@Transactional
@RequiredArgsConstructor
public class WritingQuestionPartServiceImpl implements WritingQuestionPartService {

    private final WritingQuestionRepository questionRepository;
    private final WritingSentenceCompletionRepository sentenceCompletionRepository;
    private final WritingEssayRepository essayRepository;
    private final WritingQuestionMapper mapper;
    private final ContentSyncOutbox syncOutbox;

    @Override
    public WritingSentenceCompletionDto addSentenceCompletion(UUID questionId, WritingSentenceCompletionRequest request) {
        requireWordRange(request.minWords(), request.maxWords());
        WritingQuestion question = findQuestionOfType(questionId, WritingQuestionType.SENTENCE_COMPLETION);

        WritingSentenceCompletion completion = new WritingSentenceCompletion();
        completion.setWritingQuestion(question);
        mapper.apply(request, completion);
        WritingSentenceCompletion saved = sentenceCompletionRepository.save(completion);

        syncOutbox.upsert(ContentKind.WRITING, questionId);
        log.info("Added sentence completion {} to writing question {}", saved.getId(), questionId);
        return mapper.toDto(saved);
    }

    @Override
    public WritingSentenceCompletionDto updateSentenceCompletion(UUID completionId, WritingSentenceCompletionRequest request) {
        requireWordRange(request.minWords(), request.maxWords());
        WritingSentenceCompletion completion = sentenceCompletionRepository.findById(completionId)
                .orElseThrow(() -> new ResourceNotFoundException("Sentence completion " + completionId + " not found"));

        mapper.apply(request, completion);
        WritingSentenceCompletion saved = sentenceCompletionRepository.save(completion);

        syncOutbox.upsert(ContentKind.WRITING, completion.getWritingQuestion().getId());
        return mapper.toDto(saved);
    }

    @Override
    public void deleteSentenceCompletion(UUID completionId) {
        WritingSentenceCompletion completion = sentenceCompletionRepository.findById(completionId)
                .orElseThrow(() -> new ResourceNotFoundException("Sentence completion " + completionId + " not found"));
        UUID questionId = completion.getWritingQuestion().getId();

        sentenceCompletionRepository.delete(completion);
        syncOutbox.upsert(ContentKind.WRITING, questionId);
    }

    @Override
    public WritingEssayDto addEssay(UUID questionId, WritingEssayRequest request) {
        requireWordRange(request.minWords(), request.maxWords());
        WritingQuestion question = findQuestionOfType(questionId, WritingQuestionType.ESSAY);

        WritingEssay essay = new WritingEssay();
        essay.setWritingQuestion(question);
        mapper.apply(request, essay);
        WritingEssay saved = essayRepository.save(essay);

        syncOutbox.upsert(ContentKind.WRITING, questionId);
        log.info("Added essay {} to writing question {}", saved.getId(), questionId);
        return mapper.toDto(saved);
    }

    @Override
    public WritingEssayDto updateEssay(UUID essayId, WritingEssayRequest request) {
        requireWordRange(request.minWords(), request.maxWords());
        WritingEssay essay = essayRepository.findById(essayId)
                .orElseThrow(() -> new ResourceNotFoundException("Essay " + essayId + " not found"));

        mapper.apply(request, essay);
        WritingEssay saved = essayRepository.save(essay);

        syncOutbox.upsert(ContentKind.WRITING, essay.getWritingQuestion().getId());
        return mapper.toDto(saved);
    }

    @Override
    public void deleteEssay(UUID essayId) {
        WritingEssay essay = essayRepository.findById(essayId)
                .orElseThrow(() -> new ResourceNotFoundException("Essay " + essayId + " not found"));
        UUID questionId = essay.getWritingQuestion().getId();

        essayRepository.delete(essay);
        syncOutbox.upsert(ContentKind.WRITING, questionId);
    }

    private WritingQuestion findQuestionOfType(UUID questionId, WritingQuestionType expected) {
        WritingQuestion question = questionRepository.findById(questionId)
                .orElseThrow(() -> new ResourceNotFoundException("Writing question " + questionId + " not found"));
        if (question.getType() != expected) {
            throw new ValidationException("Writing question " + questionId + " is of type " + question.getType()
                    + ", expected " + expected);
        }
        return question;
    }

    private static void requireWordRange(int minWords, int maxWords) {
        if (maxWords < minWords) {
            throw new ValidationException("max_words must be greater than or equal to min_words");
        }
    }
}
