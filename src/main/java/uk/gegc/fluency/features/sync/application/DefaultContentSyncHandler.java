package uk.gegc.fluency.features.sync.application;

import lombok.extern.slf4j.Slf4j;
import uk.gegc.fluency.features.sync.domain.model.CompletionStatus;
import uk.gegc.fluency.features.sync.domain.model.ContentItem;
import uk.gegc.fluency.features.sync.domain.model.ContentKind;
import uk.gegc.fluency.shared.exception.ResourceNotFoundException;

import java.util.UUID;

/**
 * Assemble, evaluate, cache, index. The cache step never fails the pipeline; the index step does.
 * <p>
 * Tasks for one item may run concurrently on the relay threads. An upsert therefore re-checks that the
 * item still exists after writing, so projections never outlive a committed delete.
 */
@Slf4j
public class DefaultContentSyncHandler<E extends ContentItem, D extends ContentDetail> implements ContentSyncHandler {

    private final ContentKind kind;
    private final DetailAssembler<E, D> assembler;
    private final CompletionEvaluator<D> evaluator;
    private final DetailCacheSynchronizer<D> cacheSynchronizer;
    private final DetailSearchSynchronizer<D> searchSynchronizer;

    public DefaultContentSyncHandler(ContentKind kind,
                                     DetailAssembler<E, D> assembler,
                                     CompletionEvaluator<D> evaluator,
                                     DetailCacheSynchronizer<D> cacheSynchronizer,
                                     DetailSearchSynchronizer<D> searchSynchronizer) {
        this.kind = kind;
        this.assembler = assembler;
        this.evaluator = evaluator;
        this.cacheSynchronizer = cacheSynchronizer;
        this.searchSynchronizer = searchSynchronizer;
    }

    @Override
    public ContentKind kind() {
        return kind;
    }

    @Override
    public void upsert(UUID itemId) {
        D detail;
        try {
            detail = assembler.assemble(itemId);
        } catch (ResourceNotFoundException e) {
            log.info("{} {} was deleted before it could be synced, removing projections", kind, itemId);
            remove(itemId);
            return;
        }
        CompletionStatus status = evaluator.evaluate(detail);
        cacheSynchronizer.sync(detail, status);
        searchSynchronizer.upsert(detail, status);

        // a REMOVE for the same item may have run between the read and the writes above
        if (!assembler.exists(itemId)) {
            log.info("{} {} was deleted while it was being synced, removing projections", kind, itemId);
            remove(itemId);
        }
    }

    @Override
    public void remove(UUID itemId) {
        cacheSynchronizer.evict(itemId);
        searchSynchronizer.remove(itemId);
    }
}
