package uk.gegc.fluency.features.writing.api;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.web.servlet.AutoConfigureMockMvc;
import org.springframework.boot.test.autoconfigure.web.servlet.WebMvcTest;
import org.springframework.http.MediaType;
import org.springframework.test.context.bean.override.mockito.MockitoBean;
import org.springframework.test.web.servlet.MockMvc;
import uk.gegc.fluency.features.sync.api.dto.ContentSearchResult;
import uk.gegc.fluency.features.sync.api.dto.VersionCheck;
import uk.gegc.fluency.features.sync.application.ContentSearchCriteria;
import uk.gegc.fluency.features.writing.api.dto.CreateWritingQuestionRequest;
import uk.gegc.fluency.features.writing.api.dto.WritingQuestionDetail;
import uk.gegc.fluency.features.writing.api.dto.WritingQuestionFieldUpdate;
import uk.gegc.fluency.features.writing.application.WritingQuestionService;
import uk.gegc.fluency.shared.exception.ResourceNotFoundException;
import uk.gegc.fluency.shared.exception.ValidationException;
import uk.gegc.fluency.testsupport.WritingDetails;

import java.util.List;
import java.util.UUID;
import java.util.stream.Collectors;
import java.util.stream.IntStream;

import static org.hamcrest.Matchers.endsWith;
import static org.hamcrest.Matchers.hasSize;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyList;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.mockito.Mockito.when;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.delete;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.patch;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.post;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

@WebMvcTest(WritingQuestionController.class)
@AutoConfigureMockMvc(addFilters = false)
@DisplayName("WritingQuestionController")
class WritingQuestionControllerTest {

    private static final String BASE = "/api/v1/writing-questions";

    @Autowired
    private MockMvc mockMvc;

    @MockitoBean
    private WritingQuestionService questionService;

    @Test
    @DisplayName("POST creates a question and returns 201 with snake_case fields")
    void createQuestion() throws Exception {
        UUID id = UUID.randomUUID();
        when(questionService.createQuestion(any(CreateWritingQuestionRequest.class)))
                .thenReturn(WritingDetails.sentenceCompletion(id, 1, List.of()));

        mockMvc.perform(post(BASE)
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("""
                                {"type":"SENTENCE_COMPLETION","topic":["daily life"],
                                 "instruction":"Complete the sentence","image_urls":[],"max_time":300}
                                """))
                .andExpect(status().isCreated())
                .andExpect(jsonPath("$.id").value(id.toString()))
                .andExpect(jsonPath("$.version").value(1))
                .andExpect(jsonPath("$.max_time").value(300))
                .andExpect(jsonPath("$.sentence_completion", hasSize(0)))
                .andExpect(jsonPath("$.essay").doesNotExist());
    }

    @Test
    @DisplayName("POST with a blank instruction is a validation error")
    void createQuestionInvalid() throws Exception {
        mockMvc.perform(post(BASE)
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("""
                                {"type":"ESSAY","topic":["x"],"instruction":" ","max_time":300}
                                """))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.type", endsWith("/validation-failed")))
                .andExpect(jsonPath("$.fieldErrors[0].field").value("instruction"));

        verifyNoInteractions(questionService);
    }

    @Test
    @DisplayName("GET of an unknown id is 404")
    void getQuestionNotFound() throws Exception {
        UUID id = UUID.randomUUID();
        when(questionService.getQuestion(id)).thenThrow(new ResourceNotFoundException("Writing question " + id + " not found"));

        mockMvc.perform(get(BASE + "/{id}", id))
                .andExpect(status().isNotFound())
                .andExpect(jsonPath("$.type", endsWith("/resource-not-found")));
    }

    @Test
    @DisplayName("GET with a malformed id is a type mismatch")
    void getQuestionBadId() throws Exception {
        mockMvc.perform(get(BASE + "/not-a-uuid"))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.parameter").value("id"));
    }

    @Test
    @DisplayName("PATCH routes the field update to the service")
    void updateField() throws Exception {
        UUID id = UUID.randomUUID();
        WritingQuestionDetail updated = WritingDetails.essay(id, 2, List.of());
        when(questionService.updateField(eq(id), any(WritingQuestionFieldUpdate.class))).thenReturn(updated);

        mockMvc.perform(patch(BASE + "/{id}", id)
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"field\":\"max_time\",\"value\":900}"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.version").value(2));

        verify(questionService).updateField(id, new WritingQuestionFieldUpdate.MaxTime(900));
    }

    @Test
    @DisplayName("PATCH of a field that cannot be updated is an invalid field")
    void updateUnknownField() throws Exception {
        mockMvc.perform(patch(BASE + "/{id}", UUID.randomUUID())
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"field\":\"type\",\"value\":\"ESSAY\"}"))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.type", endsWith("/invalid-field")))
                .andExpect(jsonPath("$.field").value("type"));

        verifyNoInteractions(questionService);
    }

    @Test
    @DisplayName("PATCH without a field name is an invalid field")
    void updateMissingField() throws Exception {
        mockMvc.perform(patch(BASE + "/{id}", UUID.randomUUID())
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"value\":\"x\"}"))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.type", endsWith("/invalid-field")))
                .andExpect(jsonPath("$.detail").value("Field name is required"));
    }

    @Test
    @DisplayName("PATCH with a rejected value is a validation error")
    void updateInvalidValue() throws Exception {
        UUID id = UUID.randomUUID();
        when(questionService.updateField(eq(id), any(WritingQuestionFieldUpdate.class)))
                .thenThrow(new ValidationException("max_time must be between 30 and 3600 seconds"));

        mockMvc.perform(patch(BASE + "/{id}", id)
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"field\":\"max_time\",\"value\":5}"))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.type", endsWith("/validation-failed")))
                .andExpect(jsonPath("$.detail").value("max_time must be between 30 and 3600 seconds"));
    }

    @Test
    @DisplayName("DELETE returns 204")
    void deleteQuestion() throws Exception {
        UUID id = UUID.randomUUID();

        mockMvc.perform(delete(BASE + "/{id}", id))
                .andExpect(status().isNoContent());

        verify(questionService).deleteQuestion(id);
    }

    @Test
    @DisplayName("POST /sync returns only what changed")
    void deltaSync() throws Exception {
        UUID stale = UUID.randomUUID();
        UUID current = UUID.randomUUID();
        List<VersionCheck> checks = List.of(new VersionCheck(stale, 1), new VersionCheck(current, 4));
        when(questionService.getNewUpdates(checks)).thenReturn(List.of(WritingDetails.essay(stale, 2, List.of())));

        mockMvc.perform(post(BASE + "/sync")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"questions\":[{\"id\":\"" + stale + "\",\"version\":1},"
                                + "{\"id\":\"" + current + "\",\"version\":4}]}"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$", hasSize(1)))
                .andExpect(jsonPath("$[0].id").value(stale.toString()))
                .andExpect(jsonPath("$[0].version").value(2));
    }

    @Test
    @DisplayName("POST /sync without the questions list is a validation error")
    void deltaSyncMissingList() throws Exception {
        mockMvc.perform(post(BASE + "/sync")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{}"))
                .andExpect(status().isBadRequest());

        verifyNoInteractions(questionService);
    }

    @Test
    @DisplayName("POST /sync accepts exactly 500 questions")
    void deltaSyncAtLimit() throws Exception {
        String questions = IntStream.range(0, 500)
                .mapToObj(i -> "{\"id\":\"" + UUID.randomUUID() + "\",\"version\":1}")
                .collect(Collectors.joining(",", "[", "]"));
        when(questionService.getNewUpdates(anyList())).thenReturn(List.of());

        mockMvc.perform(post(BASE + "/sync")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"questions\":" + questions + "}"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$", hasSize(0)));
    }

    @Test
    @DisplayName("GET /search without filters uses the first page of ten")
    void searchDefaults() throws Exception {
        when(questionService.searchQuestions(any(ContentSearchCriteria.class)))
                .thenReturn(new ContentSearchResult<>(List.of(), 0, 1, 10));

        mockMvc.perform(get(BASE + "/search"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.questions", hasSize(0)))
                .andExpect(jsonPath("$.total").value(0));

        verify(questionService).searchQuestions(new ContentSearchCriteria(null, List.of(), null, 1, 10));
    }

    @Test
    @DisplayName("GET /search with an unknown status is a validation error")
    void searchUnknownStatus() throws Exception {
        mockMvc.perform(get(BASE + "/search").param("status", "done"))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.type", endsWith("/validation-failed")))
                .andExpect(jsonPath("$.detail").value("status must be complete or uncomplete"));

        verifyNoInteractions(questionService);
    }

    @Test
    @DisplayName("POST /index reports whether the index was created")
    void createIndex() throws Exception {
        when(questionService.createSearchIndex()).thenReturn(true);

        mockMvc.perform(post(BASE + "/index"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.created").value(true));
    }
}
