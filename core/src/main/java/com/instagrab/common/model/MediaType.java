package com.instagrab.common.model;

/**
 * Asset kind of a downloadable file.
 */
public enum MediaType {
    IMAGE("image"),
    VIDEO("video");

    private final String label;

    MediaType(String label) {
        this.label = label;
    }

    /** Lowercase label used in filename templates ({type}). */
    public String label() {
        return label;
    }
}
