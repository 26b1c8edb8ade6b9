package uk.gegc.fluency.shared.search;

import jakarta.validation.constraints.NotNull;
import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;
import org.springframework.validation.annotation.Validated;

@Data
@Validated
@Component
@ConfigurationProperties(prefix = "fluency.search")
public class SearchProperties {

    @NotNull
    private SearchIndexGateway.SearchType type = SearchIndexGateway.SearchType.MEMORY;

    /**
     * Classpath location holding one {@code <index>.json} definition per index.
     */
    @NotNull
    private String definitionLocation = "search";
}
