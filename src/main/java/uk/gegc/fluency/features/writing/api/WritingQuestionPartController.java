package uk.gegc.fluency.features.writing.api;

import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.tags.Tag;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.DeleteMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.PutMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;
import uk.gegc.fluency.features.writing.api.dto.WritingEssayDto;
import uk.gegc.fluency.features.writing.api.dto.WritingEssayRequest;
import uk.gegc.fluency.features.writing.api.dto.WritingSentenceCompletionDto;
import uk.gegc.fluency.features.writing.api.dto.WritingSentenceCompletionRequest;
import uk.gegc.fluency.features.writing.application.WritingQuestionPartService;

import java.util.UUID;

@RestController
@RequestMapping("/api/v1/writing-questions")
@RequiredArgsConstructor
@Tag(name = "Writing Question Parts", description = "Sentence completions and essays of writing questions")
public class WritingQuestionPartController {

    private final WritingQuestionPartService partService;

    @Operation(summary = "Add a sentence completion")
    @PostMapping("/{questionId}/sentence-completions")
    public ResponseEntity<WritingSentenceCompletionDto> addSentenceCompletion(
            @PathVariable UUID questionId,
            @Valid @RequestBody WritingSentenceCompletionRequest request) {
        return ResponseEntity.status(HttpStatus.CREATED).body(partService.addSentenceCompletion(questionId, request));
    }

    @Operation(summary = "Replace a sentence completion")
    @PutMapping("/sentence-completions/{completionId}")
    public ResponseEntity<WritingSentenceCompletionDto> updateSentenceCompletion(
            @PathVariable UUID completionId,
            @Valid @RequestBody WritingSentenceCompletionRequest request) {
        return ResponseEntity.ok(partService.updateSentenceCompletion(completionId, request));
    }

    @Operation(summary = "Delete a sentence completion")
    @DeleteMapping("/sentence-completions/{completionId}")
    public ResponseEntity<Void> deleteSentenceCompletion(@PathVariable UUID completionId) {
        partService.deleteSentenceCompletion(completionId);
        return ResponseEntity.noContent().build();
    }

    @Operation(summary = "Add an essay")
    @PostMapping("/{questionId}/essays")
    public ResponseEntity<WritingEssayDto> addEssay(@PathVariable UUID questionId,
                                                    @Valid @RequestBody WritingEssayRequest request) {
        return ResponseEntity.status(HttpStatus.CREATED).body(partService.addEssay(questionId, request));
    }

    @Operation(summary = "Replace an essay")
    @PutMapping("/essays/{essayId}")
    public ResponseEntity<WritingEssayDto> updateEssay(@PathVariable UUID essayId,
                                                       @Valid @RequestBody WritingEssayRequest request) {
        return ResponseEntity.ok(partService.updateEssay(essayId, request));
    }

    @Operation(summary = "Delete an essay")
    @DeleteMapping("/essays/{essayId}")
    public ResponseEntity<Void> deleteEssay(@PathVariable UUID essayId) {
        partService.deleteEssay(essayId);
        return ResponseEntity.noContent().build();
    }
}
