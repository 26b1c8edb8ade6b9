package uk.gegc.fluency.features.writing.infra.sync;

import org.springframework.stereotype.Component;
import uk.gegc.fluency.features.sync.application.CompletionEvaluator;
import uk.gegc.fluency.features.writing.api.dto.WritingQuestionDetail;

import java.util.List;

/**
 * A writing question is complete once it has at least one sub-record of its own type.
 */
@Component
public class WritingQuestionCompletionEvaluator implements CompletionEvaluator<WritingQuestionDetail> {

    @Override
    public boolean isComplete(WritingQuestionDetail detail) {
        if (detail == null || detail.type() == null) {
            return false;
        }
        return switch (detail.type()) {
            case SENTENCE_COMPLETION -> hasAny(detail.sentenceCompletion());
            case ESSAY -> hasAny(detail.essay());
        };
    }

    private static boolean hasAny(List<?> records) {
        return records != null && !records.isEmpty();
    }
}
