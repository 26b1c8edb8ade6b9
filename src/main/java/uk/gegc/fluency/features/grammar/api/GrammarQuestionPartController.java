package uk.gegc.fluency.features.grammar.api;

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
import uk.gegc.fluency.features.grammar.api.dto.GrammarChoiceOneOptionDto;
import uk.gegc.fluency.features.grammar.api.dto.GrammarChoiceOneOptionRequest;
import uk.gegc.fluency.features.grammar.api.dto.GrammarChoiceOneQuestionDto;
import uk.gegc.fluency.features.grammar.api.dto.GrammarChoiceOneQuestionRequest;
import uk.gegc.fluency.features.grammar.api.dto.GrammarErrorIdentificationDto;
import uk.gegc.fluency.features.grammar.api.dto.GrammarErrorIdentificationRequest;
import uk.gegc.fluency.features.grammar.api.dto.GrammarFillInTheBlankAnswerDto;
import uk.gegc.fluency.features.grammar.api.dto.GrammarFillInTheBlankAnswerRequest;
import uk.gegc.fluency.features.grammar.api.dto.GrammarFillInTheBlankQuestionDto;
import uk.gegc.fluency.features.grammar.api.dto.GrammarFillInTheBlankQuestionRequest;
import uk.gegc.fluency.features.grammar.api.dto.GrammarSentenceTransformationDto;
import uk.gegc.fluency.features.grammar.api.dto.GrammarSentenceTransformationRequest;
import uk.gegc.fluency.features.grammar.application.GrammarQuestionPartService;

import java.util.UUID;

@RestController
@RequestMapping("/api/v1/grammar-questions")
@RequiredArgsConstructor
@Tag(name = "Grammar Question Parts", description = "Type-specific parts of grammar questions")
public class GrammarQuestionPartController {

    private final GrammarQuestionPartService partService;

    @Operation(summary = "Set the fill-in-the-blank sentence")
    @PutMapping("/{questionId}/fill-in-the-blank-question")
    public ResponseEntity<GrammarFillInTheBlankQuestionDto> putFillInTheBlankQuestion(
            @PathVariable UUID questionId,
            @Valid @RequestBody GrammarFillInTheBlankQuestionRequest request) {
        return ResponseEntity.ok(partService.putFillInTheBlankQuestion(questionId, request));
    }

    @Operation(summary = "Delete the fill-in-the-blank sentence and its answers")
    @DeleteMapping("/{questionId}/fill-in-the-blank-question")
    public ResponseEntity<Void> deleteFillInTheBlankQuestion(@PathVariable UUID questionId) {
        partService.deleteFillInTheBlankQuestion(questionId);
        return ResponseEntity.noContent().build();
    }

    @Operation(summary = "Add an accepted answer")
    @PostMapping("/{questionId}/fill-in-the-blank-answers")
    public ResponseEntity<GrammarFillInTheBlankAnswerDto> addFillInTheBlankAnswer(
            @PathVariable UUID questionId,
            @Valid @RequestBody GrammarFillInTheBlankAnswerRequest request) {
        return ResponseEntity.status(HttpStatus.CREATED).body(partService.addFillInTheBlankAnswer(questionId, request));
    }

    @Operation(summary = "Replace an accepted answer")
    @PutMapping("/fill-in-the-blank-answers/{answerId}")
    public ResponseEntity<GrammarFillInTheBlankAnswerDto> updateFillInTheBlankAnswer(
            @PathVariable UUID answerId,
            @Valid @RequestBody GrammarFillInTheBlankAnswerRequest request) {
        return ResponseEntity.ok(partService.updateFillInTheBlankAnswer(answerId, request));
    }

    @Operation(summary = "Delete an accepted answer")
    @DeleteMapping("/fill-in-the-blank-answers/{answerId}")
    public ResponseEntity<Void> deleteFillInTheBlankAnswer(@PathVariable UUID answerId) {
        partService.deleteFillInTheBlankAnswer(answerId);
        return ResponseEntity.noContent().build();
    }

    @Operation(summary = "Set the choice-one stem")
    @PutMapping("/{questionId}/choice-one-question")
    public ResponseEntity<GrammarChoiceOneQuestionDto> putChoiceOneQuestion(
            @PathVariable UUID questionId,
            @Valid @RequestBody GrammarChoiceOneQuestionRequest request) {
        return ResponseEntity.ok(partService.putChoiceOneQuestion(questionId, request));
    }

    @Operation(summary = "Delete the choice-one stem and its options")
    @DeleteMapping("/{questionId}/choice-one-question")
    public ResponseEntity<Void> deleteChoiceOneQuestion(@PathVariable UUID questionId) {
        partService.deleteChoiceOneQuestion(questionId);
        return ResponseEntity.noContent().build();
    }

    @Operation(summary = "Add an option")
    @PostMapping("/{questionId}/choice-one-options")
    public ResponseEntity<GrammarChoiceOneOptionDto> addChoiceOneOption(
            @PathVariable UUID questionId,
            @Valid @RequestBody GrammarChoiceOneOptionRequest request) {
        return ResponseEntity.status(HttpStatus.CREATED).body(partService.addChoiceOneOption(questionId, request));
    }

    @Operation(summary = "Replace an option")
    @PutMapping("/choice-one-options/{optionId}")
    public ResponseEntity<GrammarChoiceOneOptionDto> updateChoiceOneOption(
            @PathVariable UUID optionId,
            @Valid @RequestBody GrammarChoiceOneOptionRequest request) {
        return ResponseEntity.ok(partService.updateChoiceOneOption(optionId, request));
    }

    @Operation(summary = "Delete an option")
    @DeleteMapping("/choice-one-options/{optionId}")
    public ResponseEntity<Void> deleteChoiceOneOption(@PathVariable UUID optionId) {
        partService.deleteChoiceOneOption(optionId);
        return ResponseEntity.noContent().build();
    }

    @Operation(summary = "Set the error identification")
    @PutMapping("/{questionId}/error-identification")
    public ResponseEntity<GrammarErrorIdentificationDto> putErrorIdentification(
            @PathVariable UUID questionId,
            @Valid @RequestBody GrammarErrorIdentificationRequest request) {
        return ResponseEntity.ok(partService.putErrorIdentification(questionId, request));
    }

    @Operation(summary = "Delete the error identification")
    @DeleteMapping("/{questionId}/error-identification")
    public ResponseEntity<Void> deleteErrorIdentification(@PathVariable UUID questionId) {
        partService.deleteErrorIdentification(questionId);
        return ResponseEntity.noContent().build();
    }

    @Operation(summary = "Set the sentence transformation")
    @PutMapping("/{questionId}/sentence-transformation")
    public ResponseEntity<GrammarSentenceTransformationDto> putSentenceTransformation(
            @PathVariable UUID questionId,
            @Valid @RequestBody GrammarSentenceTransformationRequest request) {
        return ResponseEntity.ok(partService.putSentenceTransformation(questionId, request));
    }

    @Operation(summary = "Delete the sentence transformation")
    @DeleteMapping("/{questionId}/sentence-transformation")
    public ResponseEntity<Void> deleteSentenceTransformation(@PathVariable UUID questionId) {
        partService.deleteSentenceTransformation(questionId);
        return ResponseEntity.noContent().build();
    }
}
