package com.instagrab.core.client.model;

import com.google.gson.annotations.SerializedName;

import java.util.List;

/**
 * Provider-native media record as returned by the private REST API.
 * The same shape is used for top-level posts, carousel children and story/highlight items;
 * fields not present on a given level are simply null.
 */
public record RawPost(
        String pk,
        String id,
        String code,
        @SerializedName("media_type") int mediaType,
        @SerializedName("taken_at") Long takenAt,
        @SerializedName("original_width") int originalWidth,
        @SerializedName("original_height") int originalHeight,
        @SerializedName("image_versions2") ImageVersions imageVersions,
        @SerializedName("video_versions") List<VideoVersion> videoVersions,
        IgUser user,
        Caption caption,
        @SerializedName("like_count") Long likeCount,
        @SerializedName("comment_count") Long commentCount,
        @SerializedName("carousel_media") List<RawPost> carouselMedia,
        @SerializedName("product_type") String productType
) {
    public static final String PRODUCT_CLIPS = "clips";

    public record ImageVersions(List<ImageCandidate> candidates) {
    }

    public record Caption(String text) {
    }

    public List<ImageCandidate> imageCandidates() {
        return imageVersions != null && imageVersions.candidates() != null ? imageVersions.candidates() : List.of();
    }

    public List<VideoVersion> videos() {
        return videoVersions != null ? videoVersions : List.of();
    }

    /** Primary key used for de-duplication; falls back to the composite id. */
    public String key() {
        return pk != null ? pk : id;
    }
}
