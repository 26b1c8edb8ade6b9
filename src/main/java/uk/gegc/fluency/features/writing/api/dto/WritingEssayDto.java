package uk.gegc.fluency.features.writing.api.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import io.swagger.v3.oas.annotations.media.Schema;

import java.util.List;
import java.util.UUID;

@Schema(name = "WritingEssay", description = "Essay task with its marking guidance")
public record WritingEssayDto(
        UUID id,
        @JsonProperty("essay_type") String essayType,
        @JsonProperty("required_points") List<String> requiredPoints,
        @JsonProperty("min_words") int minWords,
        @JsonProperty("max_words") int maxWords,
        @JsonProperty("sample_essay") String sampleEssay,
        String explain
) {
}
