package uk.gegc.fluency.features.sync.api.dto;

import io.swagger.v3.oas.annotations.media.Schema;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Size;

import java.util.List;
import java.util.UUID;

@Schema(name = "IdListRequest", description = "Ids of the items to load")
public record IdListRequest(
        @NotNull(message = "ids is required")
        @Size(max = 500, message = "at most 500 ids per request")
        List<@NotNull UUID> ids
) {
}
