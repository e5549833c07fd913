package com.instagrab.core.extract;

import com.google.gson.Gson;
import com.instagrab.api.CredentialProvider;
import com.instagrab.api.ExtractorOptions;
import com.instagrab.common.auth.SessionManager;
import com.instagrab.common.model.ContentKind;
import com.instagrab.common.model.MediaDescriptor;
import com.instagrab.core.client.InstagramClient;
import com.instagrab.core.client.PrivateAccountException;
import com.instagrab.core.client.RateLimitedException;
import com.instagrab.core.client.model.HighlightRef;
import com.instagrab.core.client.model.IgUser;
import com.instagrab.core.client.model.RawPost;
import com.instagrab.core.client.model.StoryReel;
import com.instagrab.core.media.MediaNormalizer;
import com.instagrab.core.pagination.DelayWindow;
import com.instagrab.test.FakeTransport;
import com.instagrab.test.Fixtures;
import com.instagrab.test.TestBase;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.Iterator;
import java.util.List;
import java.util.Map;
import java.util.stream.Stream;

import static com.instagrab.test.Fixtures.*;
import static org.junit.jupiter.api.Assertions.*;

class ExtractorsTest extends TestBase {
    private static final String WEB = "https://www.instagram.com";
    private static final DelayWindow PACE = new DelayWindow(3000, 6000);

    private final IgUser natgeo = user("42", "natgeo", false);
    private FakeTransport transport;
    private List<Long> sleeps;
    private ExtractorRegistry registry;

    @BeforeEach
    void setUp() {
        transport = new FakeTransport();
        sleeps = new ArrayList<>();
        InstagramClient client = new InstagramClient(new SessionManager(CredentialProvider.of(Fixtures.COOKIES)),
                transport, new Gson(), "https://api.test");
        registry = ExtractorRegistry.createDefault(client, new MediaNormalizer(), PACE, PACE, sleeps::add);
    }

    private List<MediaDescriptor> extract(String url, ExtractorOptions options) {
        try (Stream<MediaDescriptor> stream = registry.extract(url, options)) {
            return stream.toList();
        }
    }

    private void publicProfile() {
        transport.respond("web_profile_info", 200, profileJson(natgeo));
    }

    // ========== POSTS ==========

    @Test
    void testSinglePost() {
        transport.respond("/v1/media/", 200, mediaInfoJson(carousel("3001", "Cabc", natgeo, List.of(
                child("c1", List.of(image("https://cdn/1.jpg", 640, 640)), List.of()),
                child("c2", List.of(image("https://cdn/2.jpg", 640, 640)), List.of())))));

        List<MediaDescriptor> result = extract(WEB + "/p/Cabc/", allMedia());

        assertEquals(2, result.size());
        assertEquals(1, transport.getRequests().size());
        assertTrue(sleeps.isEmpty(), "A single post is never paced");
    }

    // ========== USER FEEDS ==========

    @Test
    void testPrivateAccountFailsFast() {
        transport.respond("web_profile_info", 200, profileJson(user("7", "secret", true)));

        PrivateAccountException e = assertThrows(PrivateAccountException.class, () -> extract(WEB + "/secret/", allMedia()));

        assertEquals("secret", e.getUsername());
        assertEquals(1, transport.getRequests().size(), "No listing request after detecting a private account");
    }

    @Test
    void testUserFeedWalksPagesWithPacing() {
        publicProfile();
        transport.respond("/v1/feed/user/42/", 200, feedJson(List.of(photo("1", "A1", natgeo), photo("2", "A2", natgeo)), true, "c1"));
        transport.respond("/v1/feed/user/42/", 200, feedJson(List.of(photo("3", "A3", natgeo)), false, null));

        List<MediaDescriptor> result = extract(WEB + "/natgeo/", allMedia());

        assertEquals(List.of("A1", "A2", "A3"), result.stream().map(d -> d.metadata().shortcode()).toList());
        assertEquals(2, transport.count("/v1/feed/user/42/"));
        assertTrue(transport.last().url().contains("max_id=c1"));
        assertEquals(1, sleeps.size(), "One pause between two pages");
        assertTrue(sleeps.get(0) >= 3000 && sleeps.get(0) <= 6000);
    }

    @Test
    void testCapStopsFurtherPages() {
        publicProfile();
        transport.respond("/v1/feed/user/42/", 200, feedJson(List.of(photo("1", "A1", natgeo), photo("2", "A2", natgeo)), true, "c1"));

        List<MediaDescriptor> result = extract(WEB + "/natgeo/", allMedia().withMaxItems(2));

        assertEquals(2, result.size());
        assertEquals(1, transport.count("/v1/feed/user/42/"), "Cap reached on the first page");
        assertTrue(sleeps.isEmpty());
    }

    @Test
    void testEarlyStopFetchesNothingMore() {
        publicProfile();
        transport.respond("/v1/feed/user/42/", 200, feedJson(List.of(photo("1", "A1", natgeo)), true, "c1"));

        Iterator<MediaDescriptor> it = registry.extract(WEB + "/natgeo/", allMedia()).iterator();
        it.next();

        assertEquals(1, transport.count("/v1/feed/user/42/"), "Second page is fetched only on demand");
    }

    @Test
    void testErrorMidListingAbortsExtraction() {
        publicProfile();
        transport.respond("/v1/feed/user/42/", 200, feedJson(List.of(photo("1", "A1", natgeo)), true, "c1"));
        transport.respond("/v1/feed/user/42/", 429, "{\"message\":\"Please wait\"}");

        assertThrows(RateLimitedException.class, () -> extract(WEB + "/natgeo/", allMedia()));
    }

    @Test
    void testReelsTabUsesClips() {
        publicProfile();
        transport.respond("/v1/clips/user/", 200, json(Map.of(
                "items", List.of(Map.of("media", reel("9", "R9", natgeo))),
                "paging_info", Map.of("more_available", false))));

        List<MediaDescriptor> result = extract(WEB + "/natgeo/reels/", new ExtractorOptions(true, false, null, 0));

        assertEquals(1, result.size());
        assertTrue(result.get(0).isVideo());
        assertEquals(ContentKind.REEL, result.get(0).metadata().contentKind());
    }

    @Test
    void testTaggedTab() {
        publicProfile();
        transport.respond("/v1/usertags/42/feed/", 200, feedJson(List.of(photo("5", "T5", user("8", "friend", false))), false, null));

        List<MediaDescriptor> result = extract(WEB + "/natgeo/tagged/", allMedia());

        assertEquals("friend", result.get(0).metadata().username(), "Tagged posts keep their own author");
    }

    // ========== STORIES & HIGHLIGHTS ==========

    private StoryReel storyReel() {
        return new StoryReel("42", natgeo, List.of(
                storyItem("9001", "42", List.of(image("https://cdn/9001.jpg", 1080, 1920)), List.of(video("https://cdn/9001.mp4", 720, 1280))),
                storyItem("9002", "42", List.of(image("https://cdn/9002.jpg", 1080, 1920)), List.of())));
    }

    @Test
    void testStories() {
        publicProfile();
        transport.respond("reels_media", 200, reelsJson(storyReel()));

        List<MediaDescriptor> result = extract(WEB + "/stories/natgeo/", allMedia());

        assertEquals(2, result.size());
        assertTrue(result.get(0).isVideo());
        assertTrue(result.get(1).isImage());
        assertTrue(result.stream().allMatch(d -> d.metadata().contentKind() == ContentKind.STORY));
    }

    @Test
    void testSingleStory() {
        publicProfile();
        transport.respond("reels_media", 200, reelsJson(storyReel()));

        List<MediaDescriptor> result = extract(WEB + "/stories/natgeo/9002/", allMedia());

        assertEquals(1, result.size());
        assertEquals("https://cdn/9002.jpg", result.get(0).url());
    }

    @Test
    void testNoActiveStories() {
        publicProfile();
        transport.respond("reels_media", 200, "{\"reels\":{}}");
        assertTrue(extract(WEB + "/stories/natgeo/", allMedia()).isEmpty());
    }

    private void highlightTray() {
        publicProfile();
        transport.respond("highlights_tray", 200, json(Map.of("tray", List.of(
                new HighlightRef("highlight:111", "Trip"), new HighlightRef("highlight:222", "Food")))));
        transport.respond("highlight%3A111", 200, reelsJson(new StoryReel("highlight:111", natgeo, List.of(
                storyItem("1", "42", List.of(image("https://cdn/h1a.jpg", 10, 10)), List.of()),
                storyItem("2", "42", List.of(image("https://cdn/h1b.jpg", 10, 10)), List.of())))));
        transport.respond("highlight%3A222", 200, reelsJson(new StoryReel("highlight:222", natgeo, List.of(
                storyItem("3", "42", List.of(image("https://cdn/h2.jpg", 10, 10)), List.of())))));
    }

    @Test
    void testAllHighlightsInTrayOrder() {
        highlightTray();

        List<MediaDescriptor> result = extract(WEB + "/natgeo/highlights/", allMedia());

        assertEquals(List.of("https://cdn/h1a.jpg", "https://cdn/h1b.jpg", "https://cdn/h2.jpg"),
                result.stream().map(MediaDescriptor::url).toList());
        assertTrue(result.stream().allMatch(d -> d.metadata().contentKind() == ContentKind.HIGHLIGHT));
        assertEquals(1, sleeps.size(), "Reels after the first one are paced");
    }

    @Test
    void testHighlightsCapSkipsRemainingReels() {
        highlightTray();

        List<MediaDescriptor> result = extract(WEB + "/natgeo/highlights/", allMedia().withMaxItems(2));

        assertEquals(2, result.size());
        assertEquals(0, transport.count("highlight%3A222"));
    }

    @Test
    void testSingleHighlightNeedsNoProfile() {
        highlightTray();

        List<MediaDescriptor> result = extract(WEB + "/stories/highlights/222/", allMedia());

        assertEquals(1, result.size());
        assertEquals(0, transport.count("web_profile_info"));
    }

    // ========== SAVED ==========

    @Test
    void testSavedPostsDeduplicateAcrossPages() {
        RawPost one = photo("1", "S1", natgeo);
        transport.respond("/v1/feed/saved/posts/", 200, savedJson(List.of(one, photo("2", "S2", natgeo)), true, "s1"));
        transport.respond("/v1/feed/saved/posts/", 200, savedJson(List.of(one, photo("3", "S3", natgeo)), false, null));

        List<MediaDescriptor> result = extract(WEB + "/natgeo/saved/", allMedia());

        assertEquals(List.of("S1", "S2", "S3"), result.stream().map(d -> d.metadata().shortcode()).toList());
        assertEquals(0, transport.count("web_profile_info"), "Saved posts belong to the session user");
    }

    @Test
    void testSavedCollection() {
        transport.respond("/v1/feed/collection/17890/posts/", 200, savedJson(List.of(photo("1", "S1", natgeo)), false, null));

        List<MediaDescriptor> result = extract(WEB + "/natgeo/saved/trips/17890/", allMedia());

        assertEquals(1, result.size());
    }

    @Test
    void testExtractorRejectsForeignUrl() {
        PostExtractor post = (PostExtractor) registry.find(WEB + "/p/Cabc/");
        assertThrows(UnsupportedUrlException.class, () -> post.extract(WEB + "/natgeo/", allMedia()));
    }
}
