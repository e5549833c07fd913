package com.instagrab.common.util;

import com.instagrab.common.model.MediaMetadata;
import com.instagrab.common.model.MediaType;

import java.time.Instant;
import java.time.ZoneOffset;
import java.time.format.DateTimeFormatter;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Renders download filenames from a template with named placeholders:
 * {username} {shortcode} {postId} {num} {extension} {timestamp} {date} {type}.
 * Every occurrence is replaced; a missing value renders as "unknown".
 */
public final class FilenameTemplate {
    public static final String DEFAULT_TEMPLATE = "{username}_{shortcode}_{num}.{extension}";
    public static final String UNKNOWN = "unknown";

    private static final int MAX_USERNAME_LENGTH = 200;
    private static final DateTimeFormatter DATE_FORMAT = DateTimeFormatter.ofPattern("yyyyMMdd").withZone(ZoneOffset.UTC);

    private final String template;

    public FilenameTemplate(String template) {
        this.template = (template == null || template.isBlank()) ? DEFAULT_TEMPLATE : template;
    }

    public static FilenameTemplate defaultTemplate() {
        return new FilenameTemplate(DEFAULT_TEMPLATE);
    }

    public String getTemplate() {
        return template;
    }

    public String render(MediaMetadata metadata, String extension, MediaType type) {
        Map<String, String> values = new LinkedHashMap<>();
        values.put("username", orUnknown(sanitize(metadata.username())));
        values.put("shortcode", orUnknown(metadata.shortcode()));
        values.put("postId", orUnknown(metadata.postId()));
        values.put("num", String.valueOf(metadata.carouselIndex() != null ? metadata.carouselIndex() : 1));
        values.put("extension", orUnknown(extension));
        values.put("timestamp", metadata.timestamp() != null ? String.valueOf(metadata.timestamp()) : UNKNOWN);
        values.put("date", formatDate(metadata.timestamp()));
        values.put("type", type != null ? type.label() : UNKNOWN);

        String result = template;
        for (Map.Entry<String, String> e : values.entrySet()) {
            result = result.replace("{" + e.getKey() + "}", e.getValue());
        }
        return result;
    }

    /** yyyyMMdd in UTC for an epoch-seconds timestamp, "unknown" when absent. */
    public static String formatDate(Long epochSeconds) {
        if (epochSeconds == null) return UNKNOWN;
        return DATE_FORMAT.format(Instant.ofEpochSecond(epochSeconds));
    }

    /**
     * Makes a string safe as a filename component: reserved and control characters and whitespace
     * become '_', runs of '_' collapse, leading/trailing '_' are dropped, length is capped.
     */
    public static String sanitize(String name) {
        if (name == null) return null;
        String cleaned = name
                .replaceAll("[<>:\"/\\\\|?*\\x00-\\x1F]", "_")
                .replaceAll("\\s+", "_")
                .replaceAll("_+", "_")
                .replaceAll("^_|_$", "");
        if (cleaned.length() > MAX_USERNAME_LENGTH) {
            cleaned = cleaned.substring(0, MAX_USERNAME_LENGTH);
        }
        return cleaned;
    }

    private static String orUnknown(String value) {
        return (value == null || value.isEmpty()) ? UNKNOWN : value;
    }
}
