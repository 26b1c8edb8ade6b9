package uk.gegc.fluency.features.sync.domain.event;

import org.springframework.context.ApplicationEvent;

import java.util.UUID;

/**
 * Published when a content sync task has been written to the outbox. Listeners only act on it
 * after the surrounding transaction commits.
 */
public class ContentChangedEvent extends ApplicationEvent {

    private final UUID taskId;

    public ContentChangedEvent(Object source, UUID taskId) {
        super(source);
        this.taskId = taskId;
    }

    public UUID getTaskId() {
        return taskId;
    }
}
