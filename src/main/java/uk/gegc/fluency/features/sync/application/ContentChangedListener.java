package uk.gegc.fluency.features.sync.application;

import lombok.RequiredArgsConstructor;
import org.springframework.scheduling.annotation.Async;
import org.springframework.stereotype.Component;
import org.springframework.transaction.event.TransactionPhase;
import org.springframework.transaction.event.TransactionalEventListener;
import uk.gegc.fluency.features.sync.domain.event.ContentChangedEvent;

@Component
@RequiredArgsConstructor
public class ContentChangedListener {

    private final ContentSyncRelay relay;

    @Async("syncTaskExecutor")
    @TransactionalEventListener(phase = TransactionPhase.AFTER_COMMIT)
    public void onContentChanged(ContentChangedEvent event) {
        relay.process(event.getTaskId());
    }
}
