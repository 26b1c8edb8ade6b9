package uk.gegc.fluency.features.writing.domain.model;

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
@Table(name = "writing_questions", indexes = {
        @Index(name = "idx_writing_questions_created_at", columnList = "created_at")
})
@Getter
@Setter
@NoArgsConstructor
public class WritingQuestion extends ContentItem {

    @Enumerated(EnumType.STRING)
    @Column(name = "type", nullable = false, length = 32)
    private WritingQuestionType type;

    @Override
    public String getTypeName() {
        return type == null ? null : type.name();
    }
}
