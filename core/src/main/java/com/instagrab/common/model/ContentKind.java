package com.instagrab.common.model;

/**
 * Where a media item came from on the provider side.
 */
public enum ContentKind {
    POST,
    REEL,
    STORY,
    HIGHLIGHT;

    /** Stories and highlights carry either a video or an image, never both. */
    public boolean isEphemeral() {
        return this == STORY || this == HIGHLIGHT;
    }
}
