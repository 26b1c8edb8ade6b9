package uk.gegc.fluency.shared.search;

import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;
import org.springframework.data.annotation.Id;

/**
 * Id-only read model for search hits. Content comes from the relational store, not from the index.
 */
@Getter
@Setter
@NoArgsConstructor
public class SearchDocumentRef {

    @Id
    private String id;
}
