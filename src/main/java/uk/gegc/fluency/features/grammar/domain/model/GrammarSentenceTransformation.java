package uk.gegc.fluency.features.grammar.domain.model;

import jakarta.persistence.Column;
import jakarta.persistence.Entity;
import jakarta.persistence.FetchType;
import jakarta.persistence.GeneratedValue;
import jakarta.persistence.GenerationType;
import jakarta.persistence.Id;
import jakarta.persistence.JoinColumn;
import jakarta.persistence.ManyToOne;
import jakarta.persistence.PrePersist;
import jakarta.persistence.Table;
import jakarta.persistence.UniqueConstraint;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;
import org.hibernate.annotations.OnDelete;
import org.hibernate.annotations.OnDeleteAction;

import java.time.Instant;
import java.util.UUID;

@Entity
@Table(name = "grammar_sentence_transformations", uniqueConstraints = @UniqueConstraint(name = "uk_grammar_sentence_transformation_parent", columnNames = "grammar_question_id"))
@Getter
@Setter
@NoArgsConstructor
public class GrammarSentenceTransformation {

    @Id
    @GeneratedValue(strategy = GenerationType.UUID)
    @Column(name = "id", updatable = false, nullable = false)
    private UUID id;

    @ManyToOne(fetch = FetchType.LAZY, optional = false)
    @JoinColumn(name = "grammar_question_id", nullable = false, updatable = false)
    @OnDelete(action = OnDeleteAction.CASCADE)
    private GrammarQuestion grammarQuestion;

    @Column(name = "original_sentence", nullable = false, columnDefinition = "TEXT")
    private String originalSentence;

    @Column(name = "beginning_word", length = 255)
    private String beginningWord;

    @Column(name = "example_correct_sentence", nullable = false, columnDefinition = "TEXT")
    private String exampleCorrectSentence;

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
