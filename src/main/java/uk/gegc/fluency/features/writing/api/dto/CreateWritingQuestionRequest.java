package uk.gegc.fluency.features.writing.api.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import io.swagger.v3.oas.annotations.media.Schema;
import jakarta.validation.constraints.Max;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotEmpty;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Size;
import uk.gegc.fluency.features.writing.domain.model.WritingQuestionType;

import java.util.List;

@Schema(name = "CreateWritingQuestionRequest", description = "Payload for creating a writing question")
public record CreateWritingQuestionRequest(
        @Schema(description = "Question type", example = "ESSAY")
        @NotNull(message = "type is required")
        WritingQuestionType type,

        @Schema(description = "Topics", example = "[\"environment\"]")
        @NotEmpty(message = "at least one topic is required")
        List<@NotBlank @Size(max = 100) String> topic,

        @Schema(description = "Instruction shown to the learner", example = "Write an essay about recycling")
        @NotBlank(message = "instruction is required")
        @Size(max = 1000, message = "instruction must be at most 1000 characters")
        String instruction,

        @Schema(description = "Illustrations")
        @JsonProperty("image_urls")
        @Size(max = 10, message = "at most 10 image urls are allowed")
        List<String> imageUrls,

        @Schema(description = "Time limit in seconds", example = "600")
        @JsonProperty("max_time")
        @Min(value = 30, message = "max_time must be at least 30 seconds")
        @Max(value = 3600, message = "max_time must be at most 3600 seconds")
        int maxTime
) {
}
