package uk.gegc.fluency.features.writing.infra.sync;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;
import uk.gegc.fluency.features.sync.application.SearchDocumentMapper;
import uk.gegc.fluency.features.sync.domain.model.CompletionStatus;
import uk.gegc.fluency.features.writing.api.dto.WritingQuestionDetail;
import uk.gegc.fluency.shared.exception.SearchSyncException;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Sub-record slots are stored as JSON text so the index can match on their content without mapping every field.
 */
@Component
@RequiredArgsConstructor
public class WritingQuestionSearchDocumentMapper implements SearchDocumentMapper<WritingQuestionDetail> {

    private final ObjectMapper objectMapper;

    @Override
    public Map<String, Object> toDocument(WritingQuestionDetail detail, CompletionStatus status) {
        Map<String, Object> document = new LinkedHashMap<>();
        document.put("id", detail.id().toString());
        document.put("type", detail.type() == null ? null : detail.type().name());
        document.put("topic", detail.topic());
        document.put("instruction", detail.instruction());
        document.put("image_urls", detail.imageUrls());
        document.put("max_time", detail.maxTime());
        document.put("status", status.value());
        document.put("version", detail.version());
        putSlot(document, "sentence_completion", detail.sentenceCompletion());
        putSlot(document, "essay", detail.essay());
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
