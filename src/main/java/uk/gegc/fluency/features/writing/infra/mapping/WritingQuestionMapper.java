package uk.gegc.fluency.features.writing.infra.mapping;

import org.springframework.stereotype.Component;
import uk.gegc.fluency.features.writing.api.dto.CreateWritingQuestionRequest;
import uk.gegc.fluency.features.writing.api.dto.WritingEssayDto;
import uk.gegc.fluency.features.writing.api.dto.WritingEssayRequest;
import uk.gegc.fluency.features.writing.api.dto.WritingQuestionDetail;
import uk.gegc.fluency.features.writing.api.dto.WritingSentenceCompletionDto;
import uk.gegc.fluency.features.writing.api.dto.WritingSentenceCompletionRequest;
import uk.gegc.fluency.features.writing.domain.model.WritingEssay;
import uk.gegc.fluency.features.writing.domain.model.WritingQuestion;
import uk.gegc.fluency.features.writing.domain.model.WritingSentenceCompletion;

import java.util.ArrayList;
import java.util.List;

@Component
public class WritingQuestionMapper {

    public WritingQuestion toEntity(CreateWritingQuestionRequest request) {
        WritingQuestion question = new WritingQuestion();
        question.setType(request.type());
        question.setTopic(new ArrayList<>(request.topic()));
        question.setInstruction(request.instruction());
        question.setImageUrls(request.imageUrls() == null ? new ArrayList<>() : new ArrayList<>(request.imageUrls()));
        question.setMaxTime(request.maxTime());
        return question;
    }

    /**
     * @param sentenceCompletions null unless the question is a sentence completion
     * @param essays              null unless the question is an essay
     */
    public WritingQuestionDetail toDetail(WritingQuestion question,
                                          List<WritingSentenceCompletion> sentenceCompletions,
                                          List<WritingEssay> essays) {
        return new WritingQuestionDetail(
                question.getId(),
                question.getType(),
                List.copyOf(question.getTopic()),
                question.getInstruction(),
                List.copyOf(question.getImageUrls()),
                question.getMaxTime(),
                question.getVersion(),
                question.getCreatedAt(),
                question.getUpdatedAt(),
                sentenceCompletions == null ? null : sentenceCompletions.stream().map(this::toDto).toList(),
                essays == null ? null : essays.stream().map(this::toDto).toList()
        );
    }

    public WritingSentenceCompletionDto toDto(WritingSentenceCompletion completion) {
        return new WritingSentenceCompletionDto(
                completion.getId(),
                completion.getExampleSentence(),
                completion.getGivenPartSentence(),
                completion.getPosition(),
                List.copyOf(completion.getRequiredWords()),
                completion.getExplain(),
                completion.getMinWords(),
                completion.getMaxWords()
        );
    }

    public WritingEssayDto toDto(WritingEssay essay) {
        return new WritingEssayDto(
                essay.getId(),
                essay.getEssayType(),
                List.copyOf(essay.getRequiredPoints()),
                essay.getMinWords(),
                essay.getMaxWords(),
                essay.getSampleEssay(),
                essay.getExplain()
        );
    }

    public void apply(WritingSentenceCompletionRequest request, WritingSentenceCompletion completion) {
        completion.setExampleSentence(request.exampleSentence());
        completion.setGivenPartSentence(request.givenPartSentence());
        completion.setPosition(request.position());
        completion.setRequiredWords(new ArrayList<>(request.requiredWords()));
        completion.setExplain(request.explain());
        completion.setMinWords(request.minWords());
        completion.setMaxWords(request.maxWords());
    }

    public void apply(WritingEssayRequest request, WritingEssay essay) {
        essay.setEssayType(request.essayType());
        essay.setRequiredPoints(new ArrayList<>(request.requiredPoints()));
        essay.setMinWords(request.minWords());
        essay.setMaxWords(request.maxWords());
        essay.setSampleEssay(request.sampleEssay());
        essay.setExplain(request.explain());
    }
}
