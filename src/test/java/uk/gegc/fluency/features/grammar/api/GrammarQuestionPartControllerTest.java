package uk.gegc.fluency.features.grammar.api;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.web.servlet.AutoConfigureMockMvc;
import org.springframework.boot.test.autoconfigure.web.servlet.WebMvcTest;
import org.springframework.http.MediaType;
import org.springframework.test.context.bean.override.mockito.MockitoBean;
import org.springframework.test.web.servlet.MockMvc;
import uk.gegc.fluency.features.grammar.api.dto.GrammarChoiceOneOptionDto;
import uk.gegc.fluency.features.grammar.api.dto.GrammarChoiceOneOptionRequest;
import uk.gegc.fluency.features.grammar.api.dto.GrammarSentenceTransformationDto;
import uk.gegc.fluency.features.grammar.api.dto.GrammarSentenceTransformationRequest;
import uk.gegc.fluency.features.grammar.application.GrammarQuestionPartService;
import uk.gegc.fluency.features.grammar.application.GrammarQuestionService;
import uk.gegc.fluency.shared.exception.ValidationException;

import java.util.UUID;

import static org.hamcrest.Matchers.endsWith;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.mockito.Mockito.when;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.delete;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.patch;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.post;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.put;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

@WebMvcTest({GrammarQuestionPartController.class, GrammarQuestionController.class})
@AutoConfigureMockMvc(addFilters = false)
@DisplayName("GrammarQuestionPartController")
class GrammarQuestionPartControllerTest {

    private static final String BASE = "/api/v1/grammar-questions";

    @Autowired
    private MockMvc mockMvc;

    @MockitoBean
    private GrammarQuestionPartService partService;

    @MockitoBean
    private GrammarQuestionService questionService;

    @Test
    @DisplayName("POST option uses the options and is_correct wire names")
    void addOption() throws Exception {
        UUID questionId = UUID.randomUUID();
        UUID optionId = UUID.randomUUID();
        when(partService.addChoiceOneOption(eq(questionId), any(GrammarChoiceOneOptionRequest.class)))
                .thenReturn(new GrammarChoiceOneOptionDto(optionId, "went", true));

        mockMvc.perform(post(BASE + "/{questionId}/choice-one-options", questionId)
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"options\":\"went\",\"is_correct\":true}"))
                .andExpect(status().isCreated())
                .andExpect(jsonPath("$.id").value(optionId.toString()))
                .andExpect(jsonPath("$.options").value("went"))
                .andExpect(jsonPath("$.is_correct").value(true));

        verify(partService).addChoiceOneOption(questionId, new GrammarChoiceOneOptionRequest("went", true));
    }

    @Test
    @DisplayName("POST option without is_correct is a validation error")
    void addOptionMissingFlag() throws Exception {
        mockMvc.perform(post(BASE + "/{questionId}/choice-one-options", UUID.randomUUID())
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"options\":\"went\"}"))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.fieldErrors[0].field").value("correct"));

        verifyNoInteractions(partService);
    }

    @Test
    @DisplayName("PUT sentence transformation leaves out an absent beginning word")
    void putSentenceTransformation() throws Exception {
        UUID questionId = UUID.randomUUID();
        when(partService.putSentenceTransformation(eq(questionId), any(GrammarSentenceTransformationRequest.class)))
                .thenReturn(new GrammarSentenceTransformationDto(UUID.randomUUID(), "It is too cold to swim.", null,
                        "It is not warm enough to swim.", "enough"));

        mockMvc.perform(put(BASE + "/{questionId}/sentence-transformation", questionId)
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("""
                                {"original_sentence":"It is too cold to swim.",
                                 "example_correct_sentence":"It is not warm enough to swim.","explain":"enough"}
                                """))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.original_sentence").value("It is too cold to swim."))
                .andExpect(jsonPath("$.beginning_word").doesNotExist());
    }

    @Test
    @DisplayName("a sub-record of the wrong type is a validation error")
    void wrongType() throws Exception {
        UUID questionId = UUID.randomUUID();
        when(partService.putSentenceTransformation(eq(questionId), any(GrammarSentenceTransformationRequest.class)))
                .thenThrow(new ValidationException("Grammar question " + questionId
                        + " is of type CHOICE_ONE, expected SENTENCE_TRANSFORMATION"));

        mockMvc.perform(put(BASE + "/{questionId}/sentence-transformation", questionId)
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("""
                                {"original_sentence":"a","example_correct_sentence":"b","explain":"c"}
                                """))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.type", endsWith("/validation-failed")));
    }

    @Test
    @DisplayName("DELETE answer returns 204")
    void deleteAnswer() throws Exception {
        UUID answerId = UUID.randomUUID();

        mockMvc.perform(delete(BASE + "/fill-in-the-blank-answers/{answerId}", answerId))
                .andExpect(status().isNoContent());

        verify(partService).deleteFillInTheBlankAnswer(answerId);
    }

    @Test
    @DisplayName("PATCH of an unknown grammar field is an invalid field")
    void patchUnknownField() throws Exception {
        mockMvc.perform(patch(BASE + "/{id}", UUID.randomUUID())
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"field\":\"version\",\"value\":9}"))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.field").value("version"));

        verifyNoInteractions(questionService);
    }
}
