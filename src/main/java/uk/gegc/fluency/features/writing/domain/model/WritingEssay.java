package uk.gegc.fluency.features.writing.domain.model;

import jakarta.persistence.Column;
import jakarta.persistence.Convert;
import jakarta.persistence.Entity;
import jakarta.persistence.FetchType;
import jakarta.persistence.GeneratedValue;
import jakarta.persistence.GenerationType;
import jakarta.persistence.Id;
import jakarta.persistence.JoinColumn;
import jakarta.persistence.ManyToOne;
import jakarta.persistence.PrePersist;
import jakarta.persistence.Table;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;
import org.hibernate.annotations.OnDelete;
import org.hibernate.annotations.OnDeleteAction;
import uk.gegc.fluency.shared.persistence.StringListConverter;

import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.UUID;

@Entity
@Table(name = "writing_essays")
@Getter
@Setter
@NoArgsConstructor
public class WritingEssay {

    @Id
    @GeneratedValue(strategy = GenerationType.UUID)
    @Column(name = "id", updatable = false, nullable = false)
    private UUID id;

    @ManyToOne(fetch = FetchType.LAZY, optional = false)
    @JoinColumn(name = "writing_question_id", nullable = false, updatable = false)
    @OnDelete(action = OnDeleteAction.CASCADE)
    private WritingQuestion writingQuestion;

    @Column(name = "essay_type", nullable = false, length = 100)
    private String essayType;

    @Convert(converter = StringListConverter.class)
    @Column(name = "required_points", nullable = false, columnDefinition = "TEXT")
    private List<String> requiredPoints = new ArrayList<>();

    @Column(name = "min_words", nullable = false)
    private int minWords;

    @Column(name = "max_words", nullable = false)
    private int maxWords;

    @Column(name = "sample_essay", nullable = false, columnDefinition = "TEXT")
    private String sampleEssay;

    @Column(name = "explanation", nullable = false, columnDefinition = "TEXT")
    private String explain;

    @Column(name = "created_at", nullable = false, updatable = false)
    private Instant createdAt;

    @PrePersist
    protected void onCreate() {
        if (createdAt == null) {
            createdAt = Instant.now();
        }
    }
}
