package uk.gegc.fluency.features.writing.api.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import io.swagger.v3.oas.annotations.media.Schema;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotEmpty;
import jakarta.validation.constraints.Size;

import java.util.List;

@Schema(name = "WritingEssayRequest", description = "Content of an essay task")
public record WritingEssayRequest(
        @JsonProperty("essay_type")
        @NotBlank(message = "essay_type is required")
        @Size(max = 100, message = "essay_type must be at most 100 characters")
        String essayType,

        @JsonProperty("required_points")
        @NotEmpty(message = "at least one required point is needed")
        List<@NotBlank String> requiredPoints,

        @JsonProperty("min_words")
        @Min(value = 1, message = "min_words must be at least 1")
        int minWords,

        @JsonProperty("max_words")
        @Min(value = 1, message = "max_words must be at least 1")
        int maxWords,

        @JsonProperty("sample_essay")
        @NotBlank(message = "sample_essay is required")
        String sampleEssay,

        @NotBlank(message = "explain is required")
        String explain
) {
}
