package uk.gegc.fluency.features.sync.application;

import uk.gegc.fluency.shared.exception.ValidationException;

import java.net.URI;
import java.net.URISyntaxException;
import java.util.List;

/**
 * Value rules shared by every content item field, applied both on create and on field update.
 */
public final class ContentItemConstraints {

    public static final int MAX_TOPIC_LENGTH = 100;
    public static final int MAX_INSTRUCTION_LENGTH = 1000;
    public static final int MAX_IMAGE_URLS = 10;
    public static final int MIN_MAX_TIME = 30;
    public static final int MAX_MAX_TIME = 3600;

    private ContentItemConstraints() {
    }

    public static void validateTopics(List<String> topics) {
        if (topics == null || topics.isEmpty()) {
            throw new ValidationException("topic must contain at least one entry");
        }
        for (String topic : topics) {
            if (topic == null || topic.isBlank()) {
                throw new ValidationException("topic entries must not be blank");
            }
            if (topic.length() > MAX_TOPIC_LENGTH) {
                throw new ValidationException("topic entries must be at most " + MAX_TOPIC_LENGTH + " characters");
            }
        }
    }

    public static void validateInstruction(String instruction) {
        if (instruction == null || instruction.isBlank()) {
            throw new ValidationException("instruction must not be blank");
        }
        if (instruction.length() > MAX_INSTRUCTION_LENGTH) {
            throw new ValidationException("instruction must be at most " + MAX_INSTRUCTION_LENGTH + " characters");
        }
    }

    public static void validateImageUrls(List<String> imageUrls) {
        if (imageUrls == null) {
            throw new ValidationException("image_urls must not be null");
        }
        if (imageUrls.size() > MAX_IMAGE_URLS) {
            throw new ValidationException("at most " + MAX_IMAGE_URLS + " image urls are allowed");
        }
        for (String url : imageUrls) {
            if (!isAbsoluteUrl(url)) {
                throw new ValidationException("invalid image url: " + url);
            }
        }
    }

    public static void validateMaxTime(int maxTime) {
        if (maxTime < MIN_MAX_TIME || maxTime > MAX_MAX_TIME) {
            throw new ValidationException("max_time must be between " + MIN_MAX_TIME + " and " + MAX_MAX_TIME + " seconds");
        }
    }

    private static boolean isAbsoluteUrl(String url) {
        if (url == null || url.isBlank()) {
            return false;
        }
        try {
            URI uri = new URI(url.trim());
            return uri.getScheme() != null && uri.getHost() != null;
        } catch (URISyntaxException e) {
            return false;
        }
    }
}
