package uk.gegc.fluency.shared.search;

import java.util.List;

/**
 * One page of matching document ids together with the total number of matches.
 */
public record SearchPage(long total, List<String> documentIds) {

    public static SearchPage empty() {
        return new SearchPage(0, List.of());
    }
}
