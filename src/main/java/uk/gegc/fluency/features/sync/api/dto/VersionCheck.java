package uk.gegc.fluency.features.sync.api.dto;

import io.swagger.v3.oas.annotations.media.Schema;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.PositiveOrZero;

import java.util.UUID;

@Schema(name = "VersionCheck", description = "An item id and the version the client already holds")
public record VersionCheck(
        @Schema(description = "Item id", example = "3fa85f64-5717-4562-b3fc-2c963f66afa6")
        @NotNull(message = "id is required")
        UUID id,

        @Schema(description = "Version held by the client", example = "3")
        @PositiveOrZero(message = "version must not be negative")
        int version
) {
}
