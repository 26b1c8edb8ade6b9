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
@Table(name = "writing_sentence_completions")
@Getter
@Setter
@NoArgsConstructor
public class WritingSentenceCompletion {

    @Id
    @GeneratedValue(strategy = GenerationType.UUID)
    @Column(name = "id", updatable = false, nullable = false)
    private UUID id;

    @ManyToOne(fetch = FetchType.LAZY, optional = false)
    @JoinColumn(name = "writing_question_id", nullable = false, updatable = false)
    @OnDelete(action = OnDeleteAction.CASCADE)
    private WritingQuestion writingQuestion;

    @Column(name = "example_sentence", nullable = false, columnDefinition = "TEXT")
    private String exampleSentence;

    @Column(name = "given_part_sentence", nullable = false, columnDefinition = "TEXT")
    private String givenPartSentence;

    /**
     * Where the given part sits in the sentence: {@code start} or {@code end}.
     */
    @Column(name = "sentence_position", nullable = false, length = 8)
    private String position;

    @Convert(converter = StringListConverter.class)
    @Column(name = "required_words", nullable = false, columnDefinition = "TEXT")
    private List<String> requiredWords = new ArrayList<>();

    @Column(name = "explanation", nullable = false, columnDefinition = "TEXT")
    private String explain;

    @Column(name = "min_words", nullable = false)
    private int minWords;

    @Column(name = "max_words", nullable = false)
    private int maxWords;

    @Column(name = "created_at", nullable = false, updatable = false)
    private Instant createdAt;

    @PrePersist
    protected void onCreate() {
        if (createdAt == null) {
            createdAt = Instant.now();
        }
    }
}
