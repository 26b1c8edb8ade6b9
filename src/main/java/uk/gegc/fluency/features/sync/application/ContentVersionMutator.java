package uk.gegc.fluency.features.sync.application;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;
import uk.gegc.fluency.features.sync.domain.model.ContentItem;

import java.time.Clock;
import java.time.Instant;

/**
 * Applies a validated single-field update to an item and advances its version.
 * <p>
 * On success exactly one field changes, {@code version} grows by one and {@code updatedAt} is set
 * from the clock. On a validation failure the item is left untouched. Saving the item is up to the caller.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class ContentVersionMutator {

    private final Clock clock;

    public <E extends ContentItem> E apply(E item, FieldUpdate<? super E> update) {
        update.validate();
        update.applyTo(item);
        item.setVersion(item.getVersion() + 1);
        item.setUpdatedAt(Instant.now(clock));
        log.debug("Updated {} of item {} to version {}", update.field(), item.getId(), item.getVersion());
        return item;
    }
}
