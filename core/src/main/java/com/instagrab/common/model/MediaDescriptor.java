package com.instagrab.common.model;

/**
 * Normalized, immutable description of one downloadable file.
 * Produced once by the normalizer (or the DOM scraper) and only read afterwards.
 */
public record MediaDescriptor(
        String url,
        MediaType type,
        String filename,
        String extension,
        MediaMetadata metadata
) {
    public boolean isVideo() {
        return type == MediaType.VIDEO;
    }

    public boolean isImage() {
        return type == MediaType.IMAGE;
    }
}
