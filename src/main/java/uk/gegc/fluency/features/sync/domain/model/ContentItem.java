package uk.gegc.fluency.features.sync.domain.model;

import jakarta.persistence.Column;
import jakarta.persistence.Convert;
import jakarta.persistence.GeneratedValue;
import jakarta.persistence.GenerationType;
import jakarta.persistence.Id;
import jakarta.persistence.MappedSuperclass;
import jakarta.persistence.PrePersist;
import lombok.Getter;
import lombok.Setter;
import uk.gegc.fluency.shared.persistence.StringListConverter;

import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.UUID;

/**
 * Columns shared by every versioned content item.
 * <p>
 * {@code version} starts at 1 and only moves through
 * {@link uk.gegc.fluency.features.sync.application.ContentVersionMutator}. Sub-record edits leave it untouched.
 */
@Getter
@Setter
@MappedSuperclass
public abstract class ContentItem {

    @Id
    @GeneratedValue(strategy = GenerationType.UUID)
    @Column(name = "id", updatable = false, nullable = false)
    private UUID id;

    @Convert(converter = StringListConverter.class)
    @Column(name = "topic", nullable = false, columnDefinition = "TEXT")
    private List<String> topic = new ArrayList<>();

    @Column(name = "instruction", nullable = false, length = 1000)
    private String instruction;

    @Convert(converter = StringListConverter.class)
    @Column(name = "image_urls", nullable = false, columnDefinition = "TEXT")
    private List<String> imageUrls = new ArrayList<>();

    @Column(name = "max_time", nullable = false)
    private int maxTime;

    @Column(name = "version", nullable = false)
    private int version;

    @Column(name = "created_at", nullable = false, updatable = false)
    private Instant createdAt;

    @Column(name = "updated_at", nullable = false)
    private Instant updatedAt;

    /**
     * Name of the item's type discriminator, used in logs and error messages.
     */
    public abstract String getTypeName();

    /**
     * Timestamps are not defaulted here; the services set them from the injected clock.
     */
    @PrePersist
    protected void onCreate() {
        if (version < 1) {
            version = 1;
        }
        if (createdAt == null || updatedAt == null) {
            throw new IllegalStateException("Timestamps of " + getClass().getSimpleName() + " must be set before saving");
        }
    }
}
