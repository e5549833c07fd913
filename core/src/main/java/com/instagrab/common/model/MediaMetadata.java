package com.instagrab.common.model;

/**
 * Provider-independent metadata for one media item.
 * carouselIndex is non-null exactly when carousel is true (1-based, source order).
 */
public record MediaMetadata(
        String postId,
        String shortcode,
        String username,
        Long timestamp,       // epoch seconds, may be null
        String caption,       // may be null
        int width,
        int height,
        boolean carousel,
        Integer carouselIndex,
        ContentKind contentKind,
        Long likes,           // may be null
        Long comments         // may be null
) {
    public MediaMetadata {
        if (carousel && carouselIndex == null) {
            throw new IllegalArgumentException("carouselIndex is required for carousel items");
        }
        if (!carousel && carouselIndex != null) {
            throw new IllegalArgumentException("carouselIndex is only allowed for carousel items");
        }
        if (carouselIndex != null && carouselIndex < 1) {
            throw new IllegalArgumentException("carouselIndex is 1-based: " + carouselIndex);
        }
    }

    public MediaMetadata withDimensions(int newWidth, int newHeight) {
        return new MediaMetadata(postId, shortcode, username, timestamp, caption, newWidth, newHeight,
                carousel, carouselIndex, contentKind, likes, comments);
    }
}
