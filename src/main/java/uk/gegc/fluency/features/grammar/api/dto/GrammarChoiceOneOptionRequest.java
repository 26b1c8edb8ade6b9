package uk.gegc.fluency.features.grammar.api.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import io.swagger.v3.oas.annotations.media.Schema;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Size;

@Schema(name = "GrammarChoiceOneOptionRequest", description = "One option of a single-choice question")
public record GrammarChoiceOneOptionRequest(
        @JsonProperty("options")
        @NotBlank(message = "options is required")
        @Size(max = 500, message = "options must be at most 500 characters")
        String option,

        @JsonProperty("is_correct")
        @NotNull(message = "is_correct is required")
        Boolean correct
) {
}
