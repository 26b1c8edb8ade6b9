package uk.gegc.fluency.features.grammar.infra.sync;

import org.springframework.stereotype.Component;
import uk.gegc.fluency.features.grammar.api.dto.GrammarChoiceOneOptionDto;
import uk.gegc.fluency.features.grammar.api.dto.GrammarQuestionDetail;
import uk.gegc.fluency.features.sync.application.CompletionEvaluator;

import java.util.List;

/**
 * Completeness rules per grammar type:
 * <ul>
 *     <li>fill in the blank: the sentence and at least one answer</li>
 *     <li>choice one: the stem, at least two options, at least one correct and one incorrect</li>
 *     <li>error identification and sentence transformation: the single record exists</li>
 * </ul>
 */
@Component
public class GrammarQuestionCompletionEvaluator implements CompletionEvaluator<GrammarQuestionDetail> {

    static final int MIN_CHOICE_OPTIONS = 2;

    @Override
    public boolean isComplete(GrammarQuestionDetail detail) {
        if (detail == null || detail.type() == null) {
            return false;
        }
        return switch (detail.type()) {
            case FILL_IN_THE_BLANK -> detail.fillInTheBlankQuestion() != null
                    && detail.fillInTheBlankAnswers() != null
                    && !detail.fillInTheBlankAnswers().isEmpty();
            case CHOICE_ONE -> detail.choiceOneQuestion() != null && hasValidOptions(detail.choiceOneOptions());
            case ERROR_IDENTIFICATION -> detail.errorIdentification() != null;
            case SENTENCE_TRANSFORMATION -> detail.sentenceTransformation() != null;
        };
    }

    private static boolean hasValidOptions(List<GrammarChoiceOneOptionDto> options) {
        if (options == null || options.size() < MIN_CHOICE_OPTIONS) {
            return false;
        }
        boolean anyCorrect = options.stream().anyMatch(GrammarChoiceOneOptionDto::correct);
        boolean anyIncorrect = options.stream().anyMatch(o -> !o.correct());
        return anyCorrect && anyIncorrect;
    }
}
