package uk.gegc.fluency.features.writing.api.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.annotation.JsonSubTypes;
import com.fasterxml.jackson.annotation.JsonTypeInfo;
import io.swagger.v3.oas.annotations.media.Schema;
import uk.gegc.fluency.features.sync.application.ContentItemConstraints;
import uk.gegc.fluency.features.sync.application.FieldUpdate;
import uk.gegc.fluency.features.writing.domain.model.WritingQuestion;
import uk.gegc.fluency.shared.exception.ValidationException;

import java.util.ArrayList;
import java.util.List;

/**
 * Fields of a writing question that can be changed one at a time.
 * Wire form: {@code {"field": "<name>", "value": ...}}.
 */
@Schema(name = "WritingQuestionFieldUpdate",
        description = "Single-field update; field is one of topic, instruction, image_urls, max_time")
@JsonTypeInfo(use = JsonTypeInfo.Id.NAME, include = JsonTypeInfo.As.PROPERTY, property = "field")
@JsonSubTypes({
        @JsonSubTypes.Type(value = WritingQuestionFieldUpdate.Topic.class, name = "topic"),
        @JsonSubTypes.Type(value = WritingQuestionFieldUpdate.Instruction.class, name = "instruction"),
        @JsonSubTypes.Type(value = WritingQuestionFieldUpdate.ImageUrls.class, name = "image_urls"),
        @JsonSubTypes.Type(value = WritingQuestionFieldUpdate.MaxTime.class, name = "max_time")
})
public sealed interface WritingQuestionFieldUpdate extends FieldUpdate<WritingQuestion> {

    record Topic(@JsonProperty("value") List<String> value) implements WritingQuestionFieldUpdate {
        @Override
        public String field() {
            return "topic";
        }

        @Override
        public void validate() {
            ContentItemConstraints.validateTopics(value);
        }

        @Override
        public void applyTo(WritingQuestion item) {
            item.setTopic(new ArrayList<>(value));
        }
    }

    record Instruction(@JsonProperty("value") String value) implements WritingQuestionFieldUpdate {
        @Override
        public String field() {
            return "instruction";
        }

        @Override
        public void validate() {
            ContentItemConstraints.validateInstruction(value);
        }

        @Override
        public void applyTo(WritingQuestion item) {
            item.setInstruction(value);
        }
    }

    record ImageUrls(@JsonProperty("value") List<String> value) implements WritingQuestionFieldUpdate {
        @Override
        public String field() {
            return "image_urls";
        }

        @Override
        public void validate() {
            ContentItemConstraints.validateImageUrls(value);
        }

        @Override
        public void applyTo(WritingQuestion item) {
            item.setImageUrls(new ArrayList<>(value));
        }
    }

    record MaxTime(@JsonProperty("value") Integer value) implements WritingQuestionFieldUpdate {
        @Override
        public String field() {
            return "max_time";
        }

        @Override
        public void validate() {
            if (value == null) {
                throw new ValidationException("max_time value is required");
            }
            ContentItemConstraints.validateMaxTime(value);
        }

        @Override
        public void applyTo(WritingQuestion item) {
            item.setMaxTime(value);
        }
    }
}
