package uk.gegc.fluency.features.sync.api.dto;

import io.swagger.v3.oas.annotations.media.Schema;
import jakarta.validation.Valid;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Size;

import java.util.List;

@Schema(name = "DeltaSyncRequest", description = "Items the client holds locally, with their versions")
public record DeltaSyncRequest(
        @NotNull(message = "questions is required")
        @Size(max = 500, message = "at most 500 questions per request")
        List<@Valid @NotNull VersionCheck> questions
) {
}
