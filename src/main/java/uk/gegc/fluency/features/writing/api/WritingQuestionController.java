package uk.gegc.fluency.features.writing.api;

import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.media.Content;
import io.swagger.v3.oas.annotations.media.Schema;
import io.swagger.v3.oas.annotations.responses.ApiResponse;
import io.swagger.v3.oas.annotations.responses.ApiResponses;
import io.swagger.v3.oas.annotations.tags.Tag;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import org.springframework.http.HttpStatus;
import org.springframework.http.ProblemDetail;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.DeleteMapping;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PatchMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;
import uk.gegc.fluency.features.sync.api.dto.ContentSearchResult;
import uk.gegc.fluency.features.sync.api.dto.DeltaSyncRequest;
import uk.gegc.fluency.features.sync.api.dto.IdListRequest;
import uk.gegc.fluency.features.sync.application.ContentSearchCriteria;
import uk.gegc.fluency.features.writing.api.dto.CreateWritingQuestionRequest;
import uk.gegc.fluency.features.writing.api.dto.WritingQuestionDetail;
import uk.gegc.fluency.features.writing.api.dto.WritingQuestionFieldUpdate;
import uk.gegc.fluency.features.writing.application.WritingQuestionService;
import uk.gegc.fluency.features.writing.domain.model.WritingQuestionType;

import java.util.List;
import java.util.Map;
import java.util.UUID;

@RestController
@RequestMapping("/api/v1/writing-questions")
@RequiredArgsConstructor
@Tag(name = "Writing Questions", description = "Writing questions with cache and search synchronization")
public class WritingQuestionController {

    private final WritingQuestionService questionService;

    @Operation(summary = "Create a writing question", description = "Creates the question at version 1.")
    @ApiResponses({
            @ApiResponse(responseCode = "201", description = "Question created",
                    content = @Content(schema = @Schema(implementation = WritingQuestionDetail.class))),
            @ApiResponse(responseCode = "400", description = "Validation error",
                    content = @Content(schema = @Schema(implementation = ProblemDetail.class)))
    })
    @PostMapping
    public ResponseEntity<WritingQuestionDetail> createQuestion(@Valid @RequestBody CreateWritingQuestionRequest request) {
        return ResponseEntity.status(HttpStatus.CREATED).body(questionService.createQuestion(request));
    }

    @Operation(summary = "Get a writing question", description = "Returns the question with its type-specific parts.")
    @ApiResponses({
            @ApiResponse(responseCode = "200", description = "Question returned"),
            @ApiResponse(responseCode = "404", description = "Question not found",
                    content = @Content(schema = @Schema(implementation = ProblemDetail.class)))
    })
    @GetMapping("/{id}")
    public ResponseEntity<WritingQuestionDetail> getQuestion(@PathVariable UUID id) {
        return ResponseEntity.ok(questionService.getQuestion(id));
    }

    @Operation(summary = "Get several writing questions", description = "Unknown ids are skipped.")
    @PostMapping("/list")
    public ResponseEntity<List<WritingQuestionDetail>> getQuestions(@Valid @RequestBody IdListRequest request) {
        return ResponseEntity.ok(questionService.getQuestions(request.ids()));
    }

    @Operation(summary = "Search writing questions",
            description = "Filters the search index by type, topic and completion status. Topics are comma-separated "
                    + "and any of them may match. page starts at 1; page_size outside 1..100 falls back to 10.")
    @ApiResponses({
            @ApiResponse(responseCode = "200", description = "Page of matching questions"),
            @ApiResponse(responseCode = "400", description = "Unknown type or status",
                    content = @Content(schema = @Schema(implementation = ProblemDetail.class)))
    })
    @GetMapping("/search")
    public ResponseEntity<ContentSearchResult<WritingQuestionDetail>> searchQuestions(
            @RequestParam(required = false) WritingQuestionType type,
            @RequestParam(required = false) String topic,
            @RequestParam(required = false) String status,
            @RequestParam(defaultValue = "1") int page,
            @RequestParam(name = "page_size", defaultValue = "10") int pageSize) {
        ContentSearchCriteria criteria = ContentSearchCriteria.of(type == null ? null : type.name(), topic, status,
                page, pageSize);
        return ResponseEntity.ok(questionService.searchQuestions(criteria));
    }

    @Operation(summary = "Update one field", description = "Changes topic, instruction, image_urls or max_time and bumps the version.")
    @ApiResponses({
            @ApiResponse(responseCode = "200", description = "Question updated"),
            @ApiResponse(responseCode = "400", description = "Invalid field or value",
                    content = @Content(schema = @Schema(implementation = ProblemDetail.class))),
            @ApiResponse(responseCode = "404", description = "Question not found",
                    content = @Content(schema = @Schema(implementation = ProblemDetail.class)))
    })
    @PatchMapping("/{id}")
    public ResponseEntity<WritingQuestionDetail> updateField(@PathVariable UUID id,
                                                             @RequestBody WritingQuestionFieldUpdate update) {
        return ResponseEntity.ok(questionService.updateField(id, update));
    }

    @Operation(summary = "Delete a writing question", description = "Deletes the question and all of its parts.")
    @ApiResponses({
            @ApiResponse(responseCode = "204", description = "Question deleted"),
            @ApiResponse(responseCode = "404", description = "Question not found",
                    content = @Content(schema = @Schema(implementation = ProblemDetail.class)))
    })
    @DeleteMapping("/{id}")
    public ResponseEntity<Void> deleteQuestion(@PathVariable UUID id) {
        questionService.deleteQuestion(id);
        return ResponseEntity.noContent().build();
    }

    @Operation(summary = "Delta sync", description = "Returns the questions that changed since the versions the client holds.")
    @PostMapping("/sync")
    public ResponseEntity<List<WritingQuestionDetail>> getNewUpdates(@Valid @RequestBody DeltaSyncRequest request) {
        return ResponseEntity.ok(questionService.getNewUpdates(request.questions()));
    }

    @Operation(summary = "Purge all writing questions", description = "Deletes every question, its cache entries and its search index.")
    @DeleteMapping
    public ResponseEntity<Void> deleteAllQuestions() {
        questionService.deleteAllQuestions();
        return ResponseEntity.noContent().build();
    }

    @Operation(summary = "Create the search index")
    @PostMapping("/index")
    public ResponseEntity<Map<String, Boolean>> createSearchIndex() {
        return ResponseEntity.ok(Map.of("created", questionService.createSearchIndex()));
    }

    @Operation(summary = "Drop the search index")
    @DeleteMapping("/index")
    public ResponseEntity<Map<String, Boolean>> dropSearchIndex() {
        return ResponseEntity.ok(Map.of("dropped", questionService.dropSearchIndex()));
    }
}
