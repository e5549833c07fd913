package com.instagrab.core.client.model;

/**
 * Entry of a user's highlight tray.
 */
public record HighlightRef(String id, String title) {
    public static final String PREFIX = "highlight:";

    /** Numeric highlight id without the "highlight:" prefix. */
    public String numericId() {
        return id != null && id.startsWith(PREFIX) ? id.substring(PREFIX.length()) : id;
    }
}
