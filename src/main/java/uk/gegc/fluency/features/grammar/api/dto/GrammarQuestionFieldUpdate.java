package uk.gegc.fluency.features.grammar.api.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.annotation.JsonSubTypes;
import com.fasterxml.jackson.annotation.JsonTypeInfo;
import io.swagger.v3.oas.annotations.media.Schema;
import uk.gegc.fluency.features.grammar.domain.model.GrammarQuestion;
import uk.gegc.fluency.features.sync.application.ContentItemConstraints;
import uk.gegc.fluency.features.sync.application.FieldUpdate;
import uk.gegc.fluency.shared.exception.ValidationException;

import java.util.ArrayList;
import java.util.List;

/**
 * Fields of a grammar question that can be changed one at a time.
 * Wire form: {@code {"field": "<name>", "value": ...}}.
 */
@Schema(name = "GrammarQuestionFieldUpdate",
        description = "Single-field update; field is one of topic, instruction, image_urls, max_time")
@JsonTypeInfo(use = JsonTypeInfo.Id.NAME, include = JsonTypeInfo.As.PROPERTY, property = "field")
@JsonSubTypes({
        @JsonSubTypes.Type(value = GrammarQuestionFieldUpdate.Topic.class, name = "topic"),
        @JsonSubTypes.Type(value = GrammarQuestionFieldUpdate.Instruction.class, name = "instruction"),
        @JsonSubTypes.Type(value = GrammarQuestionFieldUpdate.ImageUrls.class, name = "image_urls"),
        @JsonSubTypes.Type(value = GrammarQuestionFieldUpdate.MaxTime.class, name = "max_time")
})
public sealed interface GrammarQuestionFieldUpdate extends FieldUpdate<GrammarQuestion> {

    record Topic(@JsonProperty("value") List<String> value) implements GrammarQuestionFieldUpdate {
        @Override
        public String field() {
            return "topic";
        }

        @Override
        public void validate() {
            ContentItemConstraints.validateTopics(value);
        }

        @Override
        public void applyTo(GrammarQuestion item) {
            item.setTopic(new ArrayList<>(value));
        }
    }

    record Instruction(@JsonProperty("value") String value) implements GrammarQuestionFieldUpdate {
        @Override
        public String field() {
            return "instruction";
        }

        @Override
        public void validate() {
            ContentItemConstraints.validateInstruction(value);
        }

        @Override
        public void applyTo(GrammarQuestion item) {
            item.setInstruction(value);
        }
    }

    record ImageUrls(@JsonProperty("value") List<String> value) implements GrammarQuestionFieldUpdate {
        @Override
        public String field() {
            return "image_urls";
        }

        @Override
        public void validate() {
            ContentItemConstraints.validateImageUrls(value);
        }

        @Override
        public void applyTo(GrammarQuestion item) {
            item.setImageUrls(new ArrayList<>(value));
        }
    }

    record MaxTime(@JsonProperty("value") Integer value) implements GrammarQuestionFieldUpdate {
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
        public void applyTo(GrammarQuestion item) {
            item.setMaxTime(value);
        }
    }
}
