package uk.gegc.fluency.features.sync.domain.repository;

import jakarta.persistence.criteria.Predicate;
import org.springframework.data.jpa.domain.Specification;
import uk.gegc.fluency.features.sync.domain.model.ContentItem;

import java.util.List;
import java.util.Map;
import java.util.UUID;

public final class ContentItemSpecifications {

    private ContentItemSpecifications() {
    }

    /**
     * Matches items whose stored version is greater than the version the caller already holds:
     * {@code (id = ? AND version > ?) OR (id = ? AND version > ?) ...}.
     * An empty map matches nothing.
     */
    public static <E extends ContentItem> Specification<E> newerThan(Map<UUID, Integer> knownVersions) {
        return (root, query, cb) -> {
            if (knownVersions == null || knownVersions.isEmpty()) {
                return cb.disjunction();
            }
            List<Predicate> predicates = knownVersions.entrySet().stream()
                    .map(entry -> cb.and(
                            cb.equal(root.get("id"), entry.getKey()),
                            cb.greaterThan(root.<Integer>get("version"), entry.getValue())))
                    .toList();
            return cb.or(predicates.toArray(new Predicate[0]));
        };
    }

    public static <E extends ContentItem> Specification<E> idIn(List<UUID> ids) {
        return (root, query, cb) -> ids == null || ids.isEmpty()
                ? cb.disjunction()
                : root.get("id").in(ids);
    }
}
