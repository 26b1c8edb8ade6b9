package uk.gegc.fluency.features.sync.application;

import lombok.extern.slf4j.Slf4j;
import org.springframework.data.domain.Sort;
import org.springframework.data.jpa.repository.JpaSpecificationExecutor;
import uk.gegc.fluency.features.sync.api.dto.VersionCheck;
import uk.gegc.fluency.features.sync.domain.model.ContentItem;
import uk.gegc.fluency.features.sync.domain.repository.ContentItemSpecifications;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.UUID;

/**
 * Answers "which of these items changed since the version I hold".
 * <p>
 * The relational version column is authoritative: one batched query selects every item whose stored
 * version is greater than the client's, newest first. The cache is only consulted for the detail at
 * that current version, so stale cache keys can neither hide nor resurrect an update.
 */
@Slf4j
public class DeltaSyncResolver<E extends ContentItem, D extends ContentDetail> {

    private static final Sort NEWEST_FIRST = Sort.by(Sort.Direction.DESC, "createdAt");

    private final JpaSpecificationExecutor<E> repository;
    private final DetailAssembler<E, D> assembler;
    private final CompletionEvaluator<D> evaluator;
    private final DetailCacheSynchronizer<D> cacheSynchronizer;

    public DeltaSyncResolver(JpaSpecificationExecutor<E> repository,
                             DetailAssembler<E, D> assembler,
                             CompletionEvaluator<D> evaluator,
                             DetailCacheSynchronizer<D> cacheSynchronizer) {
        this.repository = repository;
        this.assembler = assembler;
        this.evaluator = evaluator;
        this.cacheSynchronizer = cacheSynchronizer;
    }

    public List<D> resolve(List<VersionCheck> checks) {
        if (checks == null || checks.isEmpty()) {
            return List.of();
        }
        Map<UUID, Integer> knownVersions = knownVersions(checks);
        List<E> newer = repository.findAll(ContentItemSpecifications.newerThan(knownVersions), NEWEST_FIRST);
        log.debug("Delta sync: {} of {} items are newer than the client's copy", newer.size(), knownVersions.size());
        return newer.stream().map(this::readThrough).toList();
    }

    /**
     * Later pairs for the same id replace earlier ones.
     */
    static Map<UUID, Integer> knownVersions(List<VersionCheck> checks) {
        Map<UUID, Integer> knownVersions = new LinkedHashMap<>();
        for (VersionCheck check : checks) {
            knownVersions.put(check.id(), check.version());
        }
        return knownVersions;
    }

    /**
     * Returns the detail at the item's current version from the cache, or assembles and caches it.
     */
    public D readThrough(E item) {
        Optional<D> cached = cacheSynchronizer.fetch(item.getId(), item.getVersion());
        if (cached.isPresent()) {
            return cached.get();
        }
        D detail = assembler.assemble(item);
        cacheSynchronizer.fill(detail, evaluator.evaluate(detail));
        return detail;
    }

    /**
     * Read-through lookup of several items in the order of {@code ids}. Unknown ids are skipped.
     */
    public List<D> readThrough(List<UUID> ids) {
        if (ids == null || ids.isEmpty()) {
            return List.of();
        }
        Map<UUID, E> byId = new LinkedHashMap<>();
        for (E item : repository.findAll(ContentItemSpecifications.idIn(ids))) {
            byId.put(item.getId(), item);
        }
        return ids.stream()
                .distinct()
                .map(byId::get)
                .filter(Objects::nonNull)
                .map(this::readThrough)
                .toList();
    }
}
