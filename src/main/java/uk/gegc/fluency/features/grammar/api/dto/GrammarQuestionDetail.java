package uk.gegc.fluency.features.grammar.api.dto;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import io.swagger.v3.oas.annotations.media.Schema;
import lombok.Builder;
import uk.gegc.fluency.features.grammar.domain.model.GrammarQuestionType;
import uk.gegc.fluency.features.sync.application.ContentDetail;

import java.time.Instant;
import java.util.List;
import java.util.UUID;

/**
 * A grammar question with the sub-records of its type. Slots belonging to other types stay null.
 * A single-record slot is also null while its type has no record yet.
 */
@Schema(name = "GrammarQuestionDetail", description = "Grammar question with its type-specific parts")
@JsonInclude(JsonInclude.Include.NON_NULL)
@Builder(toBuilder = true)
public record GrammarQuestionDetail(
        UUID id,
        GrammarQuestionType type,
        List<String> topic,
        String instruction,
        @JsonProperty("image_urls") List<String> imageUrls,
        @JsonProperty("max_time") int maxTime,
        int version,
        @JsonProperty("created_at") Instant createdAt,
        @JsonProperty("updated_at") Instant updatedAt,
        @JsonProperty("fill_in_the_blank_question") GrammarFillInTheBlankQuestionDto fillInTheBlankQuestion,
        @JsonProperty("fill_in_the_blank_answers") List<GrammarFillInTheBlankAnswerDto> fillInTheBlankAnswers,
        @JsonProperty("choice_one_question") GrammarChoiceOneQuestionDto choiceOneQuestion,
        @JsonProperty("choice_one_options") List<GrammarChoiceOneOptionDto> choiceOneOptions,
        @JsonProperty("error_identification") GrammarErrorIdentificationDto errorIdentification,
        @JsonProperty("sentence_transformation") GrammarSentenceTransformationDto sentenceTransformation
) implements ContentDetail {
}
