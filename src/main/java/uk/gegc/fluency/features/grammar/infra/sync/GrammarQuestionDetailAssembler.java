package uk.gegc.fluency.features.grammar.infra.sync;

import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;
import org.springframework.transaction.annotation.Transactional;
import uk.gegc.fluency.features.grammar.api.dto.GrammarChoiceOneQuestionDto;
import uk.gegc.fluency.features.grammar.api.dto.GrammarFillInTheBlankQuestionDto;
import uk.gegc.fluency.features.grammar.api.dto.GrammarQuestionDetail;
import uk.gegc.fluency.features.grammar.domain.model.GrammarChoiceOneQuestion;
import uk.gegc.fluency.features.grammar.domain.model.GrammarFillInTheBlankQuestion;
import uk.gegc.fluency.features.grammar.domain.model.GrammarQuestion;
import uk.gegc.fluency.features.grammar.domain.repository.GrammarChoiceOneOptionRepository;
import uk.gegc.fluency.features.grammar.domain.repository.GrammarChoiceOneQuestionRepository;
import uk.gegc.fluency.features.grammar.domain.repository.GrammarErrorIdentificationRepository;
import uk.gegc.fluency.features.grammar.domain.repository.GrammarFillInTheBlankAnswerRepository;
import uk.gegc.fluency.features.grammar.domain.repository.GrammarFillInTheBlankQuestionRepository;
import uk.gegc.fluency.features.grammar.domain.repository.GrammarQuestionRepository;
import uk.gegc.fluency.features.grammar.domain.repository.GrammarSentenceTransformationRepository;
import uk.gegc.fluency.features.grammar.infra.mapping.GrammarQuestionMapper;
import uk.gegc.fluency.features.sync.application.DetailAssembler;
import uk.gegc.fluency.shared.exception.ResourceNotFoundException;
import uk.gegc.fluency.shared.exception.UnsupportedQuestionTypeException;

import java.util.List;
import java.util.Optional;
import java.util.UUID;

@Component
@RequiredArgsConstructor
public class GrammarQuestionDetailAssembler implements DetailAssembler<GrammarQuestion, GrammarQuestionDetail> {

    private final GrammarQuestionRepository questionRepository;
    private final GrammarFillInTheBlankQuestionRepository fillInTheBlankQuestionRepository;
    private final GrammarFillInTheBlankAnswerRepository fillInTheBlankAnswerRepository;
    private final GrammarChoiceOneQuestionRepository choiceOneQuestionRepository;
    private final GrammarChoiceOneOptionRepository choiceOneOptionRepository;
    private final GrammarErrorIdentificationRepository errorIdentificationRepository;
    private final GrammarSentenceTransformationRepository sentenceTransformationRepository;
    private final GrammarQuestionMapper mapper;

    @Override
    @Transactional(readOnly = true)
    public GrammarQuestionDetail assemble(UUID itemId) {
        GrammarQuestion question = questionRepository.findById(itemId)
                .orElseThrow(() -> new ResourceNotFoundException("Grammar question " + itemId + " not found"));
        return assemble(question);
    }

    @Override
    @Transactional(readOnly = true)
    public GrammarQuestionDetail assemble(GrammarQuestion question) {
        if (question.getType() == null) {
            throw new UnsupportedQuestionTypeException("Grammar question " + question.getId() + " has no type");
        }
        UUID id = question.getId();
        GrammarQuestionDetail.GrammarQuestionDetailBuilder builder = mapper.toDetailBuilder(question);
        switch (question.getType()) {
            case FILL_IN_THE_BLANK -> {
                Optional<GrammarFillInTheBlankQuestion> blank = fillInTheBlankQuestionRepository.findByGrammarQuestion_Id(id);
                builder.fillInTheBlankQuestion(blank.map(mapper::toDto).orElse(null))
                        .fillInTheBlankAnswers(blank
                                .map(q -> fillInTheBlankAnswerRepository
                                        .findAllByFillInTheBlankQuestion_IdOrderByCreatedAtAscIdAsc(q.getId())
                                        .stream().map(mapper::toDto).toList())
                                .orElse(List.of()));
            }
            case CHOICE_ONE -> {
                Optional<GrammarChoiceOneQuestion> choice = choiceOneQuestionRepository.findByGrammarQuestion_Id(id);
                builder.choiceOneQuestion(choice.map(mapper::toDto).orElse(null))
                        .choiceOneOptions(choice
                                .map(q -> choiceOneOptionRepository
                                        .findAllByChoiceOneQuestion_IdOrderByCreatedAtAscIdAsc(q.getId())
                                        .stream().map(mapper::toDto).toList())
                                .orElse(List.of()));
            }
            case ERROR_IDENTIFICATION -> builder.errorIdentification(
                    errorIdentificationRepository.findByGrammarQuestion_Id(id).map(mapper::toDto).orElse(null));
            case SENTENCE_TRANSFORMATION -> builder.sentenceTransformation(
                    sentenceTransformationRepository.findByGrammarQuestion_Id(id).map(mapper::toDto).orElse(null));
        }
        return builder.build();
    }

    @Override
    @Transactional(readOnly = true)
    public boolean exists(UUID itemId) {
        return questionRepository.existsById(itemId);
    }
}
