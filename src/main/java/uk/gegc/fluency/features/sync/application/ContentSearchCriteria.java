package uk.gegc.fluency.features.sync.application;

import uk.gegc.fluency.features.sync.domain.model.CompletionStatus;
import uk.gegc.fluency.shared.exception.ValidationException;
import uk.gegc.fluency.shared.search.SearchFilter;

import java.util.Arrays;
import java.util.List;

/**
 * Normalized search request. A page below 1 becomes 1 and a page size outside 1..100 becomes 10.
 */
public record ContentSearchCriteria(String type, List<String> topics, CompletionStatus status, int page, int pageSize) {

    public static final int DEFAULT_PAGE_SIZE = 10;
    public static final int MAX_PAGE_SIZE = 100;

    /**
     * @param topicList comma-separated topics, any of which may match
     * @param status    {@code complete} or {@code uncomplete}, or null for both
     * @throws ValidationException on an unknown status
     */
    public static ContentSearchCriteria of(String type, String topicList, String status, int page, int pageSize) {
        List<String> topics = topicList == null ? List.of() : Arrays.stream(topicList.split(","))
                .map(String::trim)
                .filter(topic -> !topic.isEmpty())
                .toList();
        CompletionStatus completionStatus = null;
        if (status != null && !status.isBlank()) {
            try {
                completionStatus = CompletionStatus.fromValue(status.trim());
            } catch (IllegalArgumentException e) {
                throw new ValidationException("status must be complete or uncomplete");
            }
        }
        return new ContentSearchCriteria(type, topics, completionStatus,
                Math.max(page, 1),
                pageSize < 1 || pageSize > MAX_PAGE_SIZE ? DEFAULT_PAGE_SIZE : pageSize);
    }

    public SearchFilter toFilter() {
        return new SearchFilter(type, topics, status == null ? null : status.value());
    }
}
