package uk.gegc.fluency.features.sync.api.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import io.swagger.v3.oas.annotations.media.Schema;

import java.util.List;

@Schema(name = "ContentSearchResult", description = "One page of search results with the total match count")
public record ContentSearchResult<D>(
        @Schema(description = "Questions on this page, read from the store at their current version")
        List<D> questions,

        @Schema(description = "Number of indexed questions matching the filters", example = "42")
        long total,

        @Schema(description = "1-based page number", example = "1")
        int page,

        @Schema(description = "Page size", example = "10")
        @JsonProperty("page_size")
        int pageSize
) {
}
