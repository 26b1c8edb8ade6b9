package uk.gegc.fluency.testsupport;

import uk.gegc.fluency.features.writing.api.dto.WritingEssayDto;
import uk.gegc.fluency.features.writing.api.dto.WritingQuestionDetail;
import uk.gegc.fluency.features.writing.api.dto.WritingSentenceCompletionDto;
import uk.gegc.fluency.features.writing.domain.model.WritingQuestionType;

import java.time.Instant;
import java.util.List;
import java.util.UUID;

/**
 * Detail fixtures for writing questions.
 */
public final class WritingDetails {

    public static final Instant CREATED_AT = Instant.parse("2025-01-01T10:00:00Z");

    private WritingDetails() {
    }

    public static WritingQuestionDetail sentenceCompletion(UUID id, int version,
                                                           List<WritingSentenceCompletionDto> completions) {
        return new WritingQuestionDetail(id, WritingQuestionType.SENTENCE_COMPLETION, List.of("daily life"),
                "Complete the sentence", List.of(), 300, version, CREATED_AT, CREATED_AT, completions, null);
    }

    public static WritingQuestionDetail essay(UUID id, int version, List<WritingEssayDto> essays) {
        return new WritingQuestionDetail(id, WritingQuestionType.ESSAY, List.of("environment"),
                "Write an essay", List.of("https://cdn.example.com/e.png"), 1200, version,
                CREATED_AT, CREATED_AT, null, essays);
    }

    public static WritingSentenceCompletionDto completion() {
        return new WritingSentenceCompletionDto(UUID.randomUUID(), "I go to school by bus.", "I go to school",
                "start", List.of("bus"), "Use a means of transport", 3, 8);
    }

    public static WritingEssayDto essayRecord() {
        return new WritingEssayDto(UUID.randomUUID(), "opinion", List.of("introduction", "conclusion"),
                150, 250, "Recycling matters because...", "State a clear opinion");
    }
}
