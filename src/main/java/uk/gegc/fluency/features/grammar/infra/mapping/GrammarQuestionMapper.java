package uk.gegc.fluency.features.grammar.infra.mapping;

import org.springframework.stereotype.Component;
import uk.gegc.fluency.features.grammar.api.dto.CreateGrammarQuestionRequest;
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
import uk.gegc.fluency.features.grammar.api.dto.GrammarQuestionDetail;
import uk.gegc.fluency.features.grammar.api.dto.GrammarSentenceTransformationDto;
import uk.gegc.fluency.features.grammar.api.dto.GrammarSentenceTransformationRequest;
import uk.gegc.fluency.features.grammar.domain.model.GrammarChoiceOneOption;
import uk.gegc.fluency.features.grammar.domain.model.GrammarChoiceOneQuestion;
import uk.gegc.fluency.features.grammar.domain.model.GrammarErrorIdentification;
import uk.gegc.fluency.features.grammar.domain.model.GrammarFillInTheBlankAnswer;
import uk.gegc.fluency.features.grammar.domain.model.GrammarFillInTheBlankQuestion;
import uk.gegc.fluency.features.grammar.domain.model.GrammarQuestion;
import uk.gegc.fluency.features.grammar.domain.model.GrammarSentenceTransformation;

import java.util.ArrayList;
import java.util.List;

@Component
public class GrammarQuestionMapper {

    public GrammarQuestion toEntity(CreateGrammarQuestionRequest request) {
        GrammarQuestion question = new GrammarQuestion();
        question.setType(request.type());
        question.setTopic(new ArrayList<>(request.topic()));
        question.setInstruction(request.instruction());
        question.setImageUrls(request.imageUrls() == null ? new ArrayList<>() : new ArrayList<>(request.imageUrls()));
        question.setMaxTime(request.maxTime());
        return question;
    }

    /**
     * Item fields only; the assembler fills the slots of the question's type.
     */
    public GrammarQuestionDetail.GrammarQuestionDetailBuilder toDetailBuilder(GrammarQuestion question) {
        return GrammarQuestionDetail.builder()
                .id(question.getId())
                .type(question.getType())
                .topic(List.copyOf(question.getTopic()))
                .instruction(question.getInstruction())
                .imageUrls(List.copyOf(question.getImageUrls()))
                .maxTime(question.getMaxTime())
                .version(question.getVersion())
                .createdAt(question.getCreatedAt())
                .updatedAt(question.getUpdatedAt());
    }

    public GrammarFillInTheBlankQuestionDto toDto(GrammarFillInTheBlankQuestion question) {
        return new GrammarFillInTheBlankQuestionDto(question.getId(), question.getQuestion());
    }

    public GrammarFillInTheBlankAnswerDto toDto(GrammarFillInTheBlankAnswer answer) {
        return new GrammarFillInTheBlankAnswerDto(answer.getId(), answer.getAnswer(), answer.getExplain());
    }

    public GrammarChoiceOneQuestionDto toDto(GrammarChoiceOneQuestion question) {
        return new GrammarChoiceOneQuestionDto(question.getId(), question.getQuestion(), question.getExplain());
    }

    public GrammarChoiceOneOptionDto toDto(GrammarChoiceOneOption option) {
        return new GrammarChoiceOneOptionDto(option.getId(), option.getOption(), option.isCorrect());
    }

    public GrammarErrorIdentificationDto toDto(GrammarErrorIdentification record) {
        return new GrammarErrorIdentificationDto(
                record.getId(),
                record.getErrorSentence(),
                record.getErrorWord(),
                record.getCorrectWord(),
                record.getExplain()
        );
    }

    public GrammarSentenceTransformationDto toDto(GrammarSentenceTransformation record) {
        return new GrammarSentenceTransformationDto(
                record.getId(),
                record.getOriginalSentence(),
                record.getBeginningWord(),
                record.getExampleCorrectSentence(),
                record.getExplain()
        );
    }

    public void apply(GrammarFillInTheBlankQuestionRequest request, GrammarFillInTheBlankQuestion question) {
        question.setQuestion(request.question());
    }

    public void apply(GrammarFillInTheBlankAnswerRequest request, GrammarFillInTheBlankAnswer answer) {
        answer.setAnswer(request.answer());
        answer.setExplain(request.explain());
    }

    public void apply(GrammarChoiceOneQuestionRequest request, GrammarChoiceOneQuestion question) {
        question.setQuestion(request.question());
        question.setExplain(request.explain());
    }

    public void apply(GrammarChoiceOneOptionRequest request, GrammarChoiceOneOption option) {
        option.setOption(request.option());
        option.setCorrect(Boolean.TRUE.equals(request.correct()));
    }

    public void apply(GrammarErrorIdentificationRequest request, GrammarErrorIdentification record) {
        record.setErrorSentence(request.errorSentence());
        record.setErrorWord(request.errorWord());
        record.setCorrectWord(request.correctWord());
        record.setExplain(request.explain());
    }

    public void apply(GrammarSentenceTransformationRequest request, GrammarSentenceTransformation record) {
        record.setOriginalSentence(request.originalSentence());
        record.setBeginningWord(request.beginningWord() == null || request.beginningWord().isBlank()
                ? null : request.beginningWord());
        record.setExampleCorrectSentence(request.exampleCorrectSentence());
        record.setExplain(request.explain());
    }
}
