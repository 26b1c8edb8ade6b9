package uk.gegc.fluency.features.grammar.application.impl;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import uk.gegc.fluency.BaseUnitTest;
import uk.gegc.fluency.features.grammar.api.dto.GrammarChoiceOneOptionDto;
import uk.gegc.fluency.features.grammar.api.dto.GrammarChoiceOneOptionRequest;
import uk.gegc.fluency.features.grammar.api.dto.GrammarErrorIdentificationRequest;
import uk.gegc.fluency.features.grammar.api.dto.GrammarFillInTheBlankAnswerRequest;
import uk.gegc.fluency.features.grammar.api.dto.GrammarFillInTheBlankQuestionDto;
import uk.gegc.fluency.features.grammar.api.dto.GrammarFillInTheBlankQuestionRequest;
import uk.gegc.fluency.features.grammar.api.dto.GrammarSentenceTransformationRequest;
import uk.gegc.fluency.features.grammar.domain.model.GrammarChoiceOneOption;
import uk.gegc.fluency.features.grammar.domain.model.GrammarChoiceOneQuestion;
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

import java.util.Optional;
import java.util.UUID;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.mockito.Mockito.when;

@DisplayName("GrammarQuestionPartServiceImpl")
class GrammarQuestionPartServiceImplTest extends BaseUnitTest {

    @Mock
    private GrammarQuestionRepository questionRepository;
    @Mock
    private GrammarFillInTheBlankQuestionRepository fillInTheBlankQuestionRepository;
    @Mock
    private GrammarFillInTheBlankAnswerRepository fillInTheBlankAnswerRepository;
    @Mock
    private GrammarChoiceOneQuestionRepository choiceOneQuestionRepository;
    @Mock
    private GrammarChoiceOneOptionRepository choiceOneOptionRepository;
    @Mock
    private GrammarErrorIdentificationRepository errorIdentificationRepository;
    @Mock
    private GrammarSentenceTransformationRepository sentenceTransformationRepository;
    @Mock
    private ContentSyncOutbox syncOutbox;

    private GrammarQuestionPartServiceImpl service;

    @BeforeEach
    void setUp() {
        service = new GrammarQuestionPartServiceImpl(questionRepository, fillInTheBlankQuestionRepository,
                fillInTheBlankAnswerRepository, choiceOneQuestionRepository, choiceOneOptionRepository,
                errorIdentificationRepository, sentenceTransformationRepository, new GrammarQuestionMapper(),
                syncOutbox);
    }

    @Test
    @DisplayName("putFillInTheBlankQuestion creates the sentence when none exists")
    void putFillInTheBlankQuestionCreates() {
        GrammarQuestion question = question(GrammarQuestionType.FILL_IN_THE_BLANK);
        when(questionRepository.findById(question.getId())).thenReturn(Optional.of(question));
        when(fillInTheBlankQuestionRepository.findByGrammarQuestion_Id(question.getId())).thenReturn(Optional.empty());
        when(fillInTheBlankQuestionRepository.save(any(GrammarFillInTheBlankQuestion.class)))
                .thenAnswer(invocation -> invocation.getArgument(0));

        GrammarFillInTheBlankQuestionDto dto = service.putFillInTheBlankQuestion(question.getId(),
                new GrammarFillInTheBlankQuestionRequest("She ___ to work every day."));

        ArgumentCaptor<GrammarFillInTheBlankQuestion> captor = ArgumentCaptor.forClass(GrammarFillInTheBlankQuestion.class);
        verify(fillInTheBlankQuestionRepository).save(captor.capture());
        assertThat(captor.getValue().getGrammarQuestion()).isSameAs(question);
        assertThat(dto.question()).isEqualTo("She ___ to work every day.");
        verify(syncOutbox).upsert(ContentKind.GRAMMAR, question.getId());
    }

    @Test
    @DisplayName("putFillInTheBlankQuestion replaces the existing sentence")
    void putFillInTheBlankQuestionReplaces() {
        GrammarQuestion question = question(GrammarQuestionType.FILL_IN_THE_BLANK);
        GrammarFillInTheBlankQuestion existing = new GrammarFillInTheBlankQuestion();
        existing.setId(UUID.randomUUID());
        existing.setGrammarQuestion(question);
        existing.setQuestion("old");
        when(questionRepository.findById(question.getId())).thenReturn(Optional.of(question));
        when(fillInTheBlankQuestionRepository.findByGrammarQuestion_Id(question.getId())).thenReturn(Optional.of(existing));
        when(fillInTheBlankQuestionRepository.save(existing)).thenReturn(existing);

        GrammarFillInTheBlankQuestionDto dto = service.putFillInTheBlankQuestion(question.getId(),
                new GrammarFillInTheBlankQuestionRequest("new"));

        assertThat(dto.id()).isEqualTo(existing.getId());
        assertThat(existing.getQuestion()).isEqualTo("new");
    }

    @Test
    @DisplayName("sub-records of another type are rejected")
    void wrongType() {
        GrammarQuestion question = question(GrammarQuestionType.CHOICE_ONE);
        when(questionRepository.findById(question.getId())).thenReturn(Optional.of(question));

        assertThatThrownBy(() -> service.putErrorIdentification(question.getId(),
                new GrammarErrorIdentificationRequest("He go home.", "go", "goes", "agreement")))
                .isInstanceOf(ValidationException.class)
                .hasMessageContaining("CHOICE_ONE");
        verifyNoInteractions(errorIdentificationRepository, syncOutbox);
    }

    @Test
    @DisplayName("an unknown question is not found")
    void unknownQuestion() {
        UUID id = UUID.randomUUID();
        when(questionRepository.findById(id)).thenReturn(Optional.empty());

        assertThatThrownBy(() -> service.putFillInTheBlankQuestion(id, new GrammarFillInTheBlankQuestionRequest("x")))
                .isInstanceOf(ResourceNotFoundException.class);
        verifyNoInteractions(syncOutbox);
    }

    @Test
    @DisplayName("an answer needs its sentence first")
    void answerWithoutSentence() {
        GrammarQuestion question = question(GrammarQuestionType.FILL_IN_THE_BLANK);
        when(questionRepository.findById(question.getId())).thenReturn(Optional.of(question));
        when(fillInTheBlankQuestionRepository.findByGrammarQuestion_Id(question.getId())).thenReturn(Optional.empty());

        assertThatThrownBy(() -> service.addFillInTheBlankAnswer(question.getId(),
                new GrammarFillInTheBlankAnswerRequest("goes", "third person")))
                .isInstanceOf(ValidationException.class);
        verify(fillInTheBlankAnswerRepository, never()).save(any());
        verifyNoInteractions(syncOutbox);
    }

    @Test
    @DisplayName("deleting an answer refreshes its owning question")
    void deleteAnswer() {
        GrammarQuestion question = question(GrammarQuestionType.FILL_IN_THE_BLANK);
        GrammarFillInTheBlankQuestion blank = new GrammarFillInTheBlankQuestion();
        blank.setGrammarQuestion(question);
        GrammarFillInTheBlankAnswer answer = new GrammarFillInTheBlankAnswer();
        answer.setId(UUID.randomUUID());
        answer.setFillInTheBlankQuestion(blank);
        when(fillInTheBlankAnswerRepository.findById(answer.getId())).thenReturn(Optional.of(answer));

        service.deleteFillInTheBlankAnswer(answer.getId());

        verify(fillInTheBlankAnswerRepository).delete(answer);
        verify(syncOutbox).upsert(ContentKind.GRAMMAR, question.getId());
    }

    @Test
    @DisplayName("addChoiceOneOption stores the correctness flag")
    void addOption() {
        GrammarQuestion question = question(GrammarQuestionType.CHOICE_ONE);
        GrammarChoiceOneQuestion stem = new GrammarChoiceOneQuestion();
        stem.setGrammarQuestion(question);
        when(questionRepository.findById(question.getId())).thenReturn(Optional.of(question));
        when(choiceOneQuestionRepository.findByGrammarQuestion_Id(question.getId())).thenReturn(Optional.of(stem));
        when(choiceOneOptionRepository.save(any(GrammarChoiceOneOption.class)))
                .thenAnswer(invocation -> invocation.getArgument(0));

        GrammarChoiceOneOptionDto dto = service.addChoiceOneOption(question.getId(),
                new GrammarChoiceOneOptionRequest("went", true));

        assertThat(dto.option()).isEqualTo("went");
        assertThat(dto.correct()).isTrue();
        verify(syncOutbox).upsert(ContentKind.GRAMMAR, question.getId());
    }

    @Test
    @DisplayName("updating an unknown option is not found")
    void updateUnknownOption() {
        UUID optionId = UUID.randomUUID();
        when(choiceOneOptionRepository.findById(optionId)).thenReturn(Optional.empty());

        assertThatThrownBy(() -> service.updateChoiceOneOption(optionId, new GrammarChoiceOneOptionRequest("a", false)))
                .isInstanceOf(ResourceNotFoundException.class);
    }

    @Test
    @DisplayName("a blank beginning word is stored as absent")
    void sentenceTransformationBlankBeginning() {
        GrammarQuestion question = question(GrammarQuestionType.SENTENCE_TRANSFORMATION);
        when(questionRepository.findById(question.getId())).thenReturn(Optional.of(question));
        when(sentenceTransformationRepository.findByGrammarQuestion_Id(question.getId())).thenReturn(Optional.empty());
        when(sentenceTransformationRepository.save(any(GrammarSentenceTransformation.class)))
                .thenAnswer(invocation -> invocation.getArgument(0));

        service.putSentenceTransformation(question.getId(), new GrammarSentenceTransformationRequest(
                "It is too cold to swim.", "  ", "It is not warm enough to swim.", "enough"));

        ArgumentCaptor<GrammarSentenceTransformation> captor = ArgumentCaptor.forClass(GrammarSentenceTransformation.class);
        verify(sentenceTransformationRepository).save(captor.capture());
        assertThat(captor.getValue().getBeginningWord()).isNull();
    }

    @Test
    @DisplayName("deleting a missing single record is not found")
    void deleteMissingErrorIdentification() {
        UUID id = UUID.randomUUID();
        when(errorIdentificationRepository.findByGrammarQuestion_Id(id)).thenReturn(Optional.empty());

        assertThatThrownBy(() -> service.deleteErrorIdentification(id)).isInstanceOf(ResourceNotFoundException.class);
        verifyNoInteractions(syncOutbox);
    }

    private static GrammarQuestion question(GrammarQuestionType type) {
        GrammarQuestion question = new GrammarQuestion();
        question.setId(UUID.randomUUID());
        question.setType(type);
        question.setVersion(1);
        return question;
    }
}
