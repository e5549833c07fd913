package com.instagrab.test;

import com.google.gson.Gson;
import com.instagrab.api.ExtractorOptions;
import com.instagrab.common.model.ContentKind;
import com.instagrab.common.model.MediaDescriptor;
import com.instagrab.common.model.MediaMetadata;
import com.instagrab.common.model.MediaType;
import com.instagrab.core.client.model.IgUser;
import com.instagrab.core.client.model.ImageCandidate;
import com.instagrab.core.client.model.RawPost;
import com.instagrab.core.client.model.StoryReel;
import com.instagrab.core.client.model.VideoVersion;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Builders for provider records and their JSON envelopes.
 */
public final class Fixtures {
    private static final Gson GSON = new Gson();

    public static final Map<String, String> COOKIES = Map.of(
            "sessionid", "sess-123",
            "csrftoken", "csrf-abc",
            "ds_user_id", "42");

    private Fixtures() {
    }

    public static ImageCandidate image(String url, int width, int height) {
        return new ImageCandidate(url, width, height);
    }

    public static VideoVersion video(String url, int width, int height) {
        return new VideoVersion(url, width, height, 101);
    }

    public static IgUser user(String pk, String username, boolean isPrivate) {
        return new IgUser(pk, username, username + " Full", isPrivate);
    }

    public static RawPost post(String pk, String code, IgUser owner, List<ImageCandidate> images, List<VideoVersion> videos) {
        return new RawPost(pk, pk + "_" + (owner != null ? owner.pk() : "0"), code, videos.isEmpty() ? 1 : 2,
                1700000000L, 1080, 1350, new RawPost.ImageVersions(images), videos.isEmpty() ? null : videos,
                owner, new RawPost.Caption("caption of " + code), 10L, 2L, null, null);
    }

    public static RawPost photo(String pk, String code, IgUser owner) {
        return post(pk, code, owner, List.of(image("https://cdn.example.com/" + pk + ".jpg", 1080, 1350)), List.of());
    }

    public static RawPost reel(String pk, String code, IgUser owner) {
        RawPost base = post(pk, code, owner,
                List.of(image("https://cdn.example.com/" + pk + "_cover.jpg", 640, 1136)),
                List.of(video("https://cdn.example.com/" + pk + ".mp4", 720, 1280)));
        return new RawPost(base.pk(), base.id(), base.code(), base.mediaType(), base.takenAt(), base.originalWidth(),
                base.originalHeight(), base.imageVersions(), base.videoVersions(), base.user(), base.caption(),
                base.likeCount(), base.commentCount(), null, RawPost.PRODUCT_CLIPS);
    }

    public static RawPost child(String pk, List<ImageCandidate> images, List<VideoVersion> videos) {
        return new RawPost(pk, pk, null, videos.isEmpty() ? 1 : 2, null, 1080, 1080,
                new RawPost.ImageVersions(images), videos.isEmpty() ? null : videos,
                null, null, null, null, null, null);
    }

    public static RawPost carousel(String pk, String code, IgUser owner, List<RawPost> children) {
        return new RawPost(pk, pk + "_" + owner.pk(), code, 8, 1700000000L, 1080, 1080, null, null,
                owner, null, 5L, 1L, children, null);
    }

    public static RawPost storyItem(String pk, String ownerPk, List<ImageCandidate> images, List<VideoVersion> videos) {
        return new RawPost(pk, pk + "_" + ownerPk, null, videos.isEmpty() ? 1 : 2, 1700000500L, 1080, 1920,
                new RawPost.ImageVersions(images), videos.isEmpty() ? null : videos,
                null, null, null, null, null, null);
    }

    // ========== JSON ENVELOPES ==========

    public static String json(Object value) {
        return GSON.toJson(value);
    }

    public static String profileJson(IgUser user) {
        return json(Map.of("data", Map.of("user", user)));
    }

    public static String mediaInfoJson(RawPost post) {
        return json(Map.of("items", List.of(post)));
    }

    public static String feedJson(List<RawPost> items, boolean more, String cursor) {
        Map<String, Object> page = new LinkedHashMap<>();
        page.put("items", items);
        page.put("more_available", more);
        if (cursor != null) page.put("next_max_id", cursor);
        return json(page);
    }

    public static String savedJson(List<RawPost> items, boolean more, String cursor) {
        Map<String, Object> page = new LinkedHashMap<>();
        page.put("items", items.stream().map(p -> Map.of("media", p)).toList());
        page.put("more_available", more);
        if (cursor != null) page.put("next_max_id", cursor);
        return json(page);
    }

    public static String reelsJson(StoryReel... reels) {
        Map<String, Object> byId = new LinkedHashMap<>();
        for (StoryReel reel : reels) byId.put(reel.id(), reel);
        return json(Map.of("reels", byId));
    }

    // ========== DESCRIPTORS ==========

    public static ExtractorOptions allMedia() {
        return ExtractorOptions.defaults();
    }

    public static MediaDescriptor descriptor(String url, MediaType type, String filename) {
        MediaMetadata metadata = new MediaMetadata("1", "abc", "tester", 1700000000L, null, 100, 100,
                false, null, ContentKind.POST, null, null);
        return new MediaDescriptor(url, type, filename, type == MediaType.VIDEO ? "mp4" : "jpg", metadata);
    }
}
