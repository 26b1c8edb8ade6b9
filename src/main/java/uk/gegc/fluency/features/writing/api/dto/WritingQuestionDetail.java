package uk.gegc.fluency.features.writing.api.dto;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import io.swagger.v3.oas.annotations.media.Schema;
import uk.gegc.fluency.features.sync.application.ContentDetail;
import uk.gegc.fluency.features.writing.domain.model.WritingQuestionType;

import java.time.Instant;
import java.util.List;
import java.util.UUID;

/**
 * A writing question with the sub-records of its type. The slot of the other type is null and left out of JSON.
 */
@Schema(name = "WritingQuestionDetail", description = "Writing question with its type-specific parts")
@JsonInclude(JsonInclude.Include.NON_NULL)
public record WritingQuestionDetail(
        UUID id,
        WritingQuestionType type,
        List<String> topic,
        String instruction,
        @JsonProperty("image_urls") List<String> imageUrls,
        @JsonProperty("max_time") int maxTime,
        int version,
        @JsonProperty("created_at") Instant createdAt,
        @JsonProperty("updated_at") Instant updatedAt,
        @JsonProperty("sentence_completion") List<WritingSentenceCompletionDto> sentenceCompletion,
        List<WritingEssayDto> essay
) implements ContentDetail {
}
