package uk.gegc.fluency.features.grammar.infra.sync;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;
import uk.gegc.fluency.features.grammar.api.dto.GrammarQuestionDetail;
import uk.gegc.fluency.features.sync.application.SearchDocumentMapper;
import uk.gegc.fluency.features.sync.domain.model.CompletionStatus;
import uk.gegc.fluency.shared.exception.SearchSyncException;

import java.util.LinkedHashMap;
import java.util.Map;

@Component
@RequiredArgsConstructor
public class GrammarQuestionSearchDocumentMapper implements SearchDocumentMapper<GrammarQuestionDetail> {

    private final ObjectMapper objectMapper;

    @Override
    public Map<String, Object> toDocument(GrammarQuestionDetail detail, CompletionStatus status) {
        Map<String, Object> document = new LinkedHashMap<>();
        document.put("id", detail.id().toString());
        document.put("type", detail.type() == null ? null : detail.type().name());
        document.put("topic", detail.topic());
        document.put("instruction", detail.instruction());
        document.put("image_urls", detail.imageUrls());
        document.put("max_time", detail.maxTime());
        document.put("status", status.value());
        document.put("version", detail.version());
        putSlot(document, "fill_in_the_blank_question", detail.fillInTheBlankQuestion());
        putSlot(document, "fill_in_the_blank_answers", detail.fillInTheBlankAnswers());
        putSlot(document, "choice_one_question", detail.choiceOneQuestion());
        putSlot(document, "choice_one_options", detail.choiceOneOptions());
        putSlot(document, "error_identification", detail.errorIdentification());
        putSlot(document, "sentence_transformation", detail.sentenceTransformation());
        return document;
    }

    private void putSlot(Map<String, Object> document, String name, Object slot) {
        if (slot == null) {
            return;
        }
        try {
            document.put(name, objectMapper.writeValueAsString(slot));
        } catch (JsonProcessingException e) {
            throw new SearchSyncException("Failed to serialize " + name + " for indexing", e);
        }
    }
}
