package uk.gegc.fluency.features.grammar.domain.model;

import jakarta.persistence.Column;
import jakarta.persistence.Entity;
import jakarta.persistence.EnumType;
import jakarta.persistence.Enumerated;
import jakarta.persistence.Index;
import jakarta.persistence.Table;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;
import uk.gegc.fluency.features.sync.domain.model.ContentItem;

@Entity
@Table(name = "grammar_questions", indexes = {
        @Index(name = "idx_grammar_questions_created_at", columnList = "created_at")
})
@Getter
@Setter
@NoArgsConstructor
public class GrammarQuestion extends ContentItem {

    @Enumerated(EnumType.STRING)
    @Column(name = "type", nullable = false, length = 32)
    private GrammarQuestionType type;

    @Override
    public String getTypeName() {
        return type == null ? null : type.name();
    }
}
