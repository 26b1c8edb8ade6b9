package uk.gegc.fluency.features.writing.infra.sync;

import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;
import org.springframework.transaction.annotation.Transactional;
import uk.gegc.fluency.features.sync.application.DetailAssembler;
import uk.gegc.fluency.features.writing.api.dto.WritingQuestionDetail;
import uk.gegc.fluency.features.writing.domain.model.WritingQuestion;
import uk.gegc.fluency.features.writing.domain.repository.WritingEssayRepository;
import uk.gegc.fluency.features.writing.domain.repository.WritingQuestionRepository;
import uk.gegc.fluency.features.writing.domain.repository.WritingSentenceCompletionRepository;
import uk.gegc.fluency.features.writing.infra.mapping.WritingQuestionMapper;
import uk.gegc.fluency.shared.exception.ResourceNotFoundException;
import uk.gegc.fluency.shared.exception.UnsupportedQuestionTypeException;

import java.util.UUID;

@Component
@RequiredArgsConstructor
public class WritingQuestionDetailAssembler implements DetailAssembler<WritingQuestion, WritingQuestionDetail> {

    private final WritingQuestionRepository questionRepository;
    private final WritingSentenceCompletionRepository sentenceCompletionRepository;
    private final WritingEssayRepository essayRepository;
    private final WritingQuestionMapper mapper;

    @Override
    @Transactional(readOnly = true)
    public WritingQuestionDetail assemble(UUID itemId) {
        WritingQuestion question = questionRepository.findById(itemId)
                .orElseThrow(() -> new ResourceNotFoundException("Writing question " + itemId + " not found"));
        return assemble(question);
    }

    @Override
    @Transactional(readOnly = true)
    public WritingQuestionDetail assemble(WritingQuestion question) {
        if (question.getType() == null) {
            throw new UnsupportedQuestionTypeException("Writing question " + question.getId() + " has no type");
        }
        return switch (question.getType()) {
            case SENTENCE_COMPLETION -> mapper.toDetail(question,
                    sentenceCompletionRepository.findAllByWritingQuestion_IdOrderByCreatedAtAscIdAsc(question.getId()),
                    null);
            case ESSAY -> mapper.toDetail(question,
                    null,
                    essayRepository.findAllByWritingQuestion_IdOrderByCreatedAtAscIdAsc(question.getId()));
        };
    }

    @Override
    @Transactional(readOnly = true)
    public boolean exists(UUID itemId) {
        return questionRepository.existsById(itemId);
    }
}
