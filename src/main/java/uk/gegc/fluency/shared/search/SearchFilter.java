package uk.gegc.fluency.shared.search;

import java.util.List;

/**
 * Exact-match filters over the fields every content document carries. A null or empty filter matches all.
 *
 * @param type   type discriminator, e.g. {@code ESSAY}
 * @param topics matches documents tagged with any of these topics, case-insensitively
 * @param status completion status wire value
 */
public record SearchFilter(String type, List<String> topics, String status) {

    public SearchFilter {
        topics = topics == null ? List.of() : List.copyOf(topics);
    }
}
