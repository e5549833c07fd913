package com.instagrab.core.client.model;

/**
 * A downloadable rendition with declared pixel dimensions.
 */
public interface SizedAsset {
    String url();

    int width();

    int height();

    default long resolution() {
        return (long) width() * (long) height();
    }
}
