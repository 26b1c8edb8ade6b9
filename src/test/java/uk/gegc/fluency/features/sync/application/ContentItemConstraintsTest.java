package uk.gegc.fluency.features.sync.application;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.ValueSource;
import uk.gegc.fluency.shared.exception.ValidationException;

import java.util.Arrays;
import java.util.Collections;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThatCode;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

@DisplayName("ContentItemConstraints")
class ContentItemConstraintsTest {

    @Test
    @DisplayName("topics must be present, non-blank and short")
    void validateTopics() {
        assertThatCode(() -> ContentItemConstraints.validateTopics(List.of("grammar", "tenses")))
                .doesNotThrowAnyException();
        assertThatThrownBy(() -> ContentItemConstraints.validateTopics(List.of()))
                .isInstanceOf(ValidationException.class);
        assertThatThrownBy(() -> ContentItemConstraints.validateTopics(null))
                .isInstanceOf(ValidationException.class);
        assertThatThrownBy(() -> ContentItemConstraints.validateTopics(List.of(" ")))
                .isInstanceOf(ValidationException.class);
        assertThatThrownBy(() -> ContentItemConstraints.validateTopics(List.of("x".repeat(101))))
                .isInstanceOf(ValidationException.class);
    }

    @Test
    @DisplayName("instruction is limited to 1000 characters")
    void validateInstruction() {
        assertThatCode(() -> ContentItemConstraints.validateInstruction("x".repeat(1000)))
                .doesNotThrowAnyException();
        assertThatThrownBy(() -> ContentItemConstraints.validateInstruction("x".repeat(1001)))
                .isInstanceOf(ValidationException.class);
    }

    @Test
    @DisplayName("image urls need a scheme and a host and are capped at ten")
    void validateImageUrls() {
        assertThatCode(() -> ContentItemConstraints.validateImageUrls(List.of()))
                .doesNotThrowAnyException();
        assertThatCode(() -> ContentItemConstraints.validateImageUrls(List.of("https://cdn.example.com/a.png")))
                .doesNotThrowAnyException();
        assertThatThrownBy(() -> ContentItemConstraints.validateImageUrls(List.of("not a url")))
                .isInstanceOf(ValidationException.class);
        assertThatThrownBy(() -> ContentItemConstraints.validateImageUrls(List.of("/relative/path.png")))
                .isInstanceOf(ValidationException.class);
        assertThatThrownBy(() -> ContentItemConstraints.validateImageUrls(Arrays.asList("https://a.example.com/x.png", null)))
                .isInstanceOf(ValidationException.class);
        assertThatThrownBy(() -> ContentItemConstraints.validateImageUrls(
                Collections.nCopies(11, "https://cdn.example.com/a.png")))
                .isInstanceOf(ValidationException.class);
    }

    @ParameterizedTest
    @ValueSource(ints = {30, 600, 3600})
    @DisplayName("max_time inside [30, 3600] is accepted")
    void validateMaxTime_accepted(int value) {
        assertThatCode(() -> ContentItemConstraints.validateMaxTime(value)).doesNotThrowAnyException();
    }

    @ParameterizedTest
    @ValueSource(ints = {-1, 0, 29, 3601})
    @DisplayName("max_time outside [30, 3600] is rejected")
    void validateMaxTime_rejected(int value) {
        assertThatThrownBy(() -> ContentItemConstraints.validateMaxTime(value))
                .isInstanceOf(ValidationException.class);
    }
}
