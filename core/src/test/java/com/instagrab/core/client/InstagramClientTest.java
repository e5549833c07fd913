package com.instagrab.core.client;

import com.google.gson.Gson;
import com.instagrab.common.auth.SessionManager;
import com.instagrab.common.util.Shortcodes;
import com.instagrab.core.client.model.IgUser;
import com.instagrab.core.client.model.RawPost;
import com.instagrab.core.client.model.StoryReel;
import com.instagrab.core.pagination.Page;
import com.instagrab.test.FakeTransport;
import com.instagrab.test.Fixtures;
import com.instagrab.test.TestBase;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.io.IOException;
import java.util.List;
import java.util.Map;
import java.util.concurrent.atomic.AtomicInteger;

import static com.instagrab.test.Fixtures.*;
import static org.junit.jupiter.api.Assertions.*;

class InstagramClientTest extends TestBase {
    private static final String BASE = "https://api.test";

    private FakeTransport transport;
    private AtomicInteger credentialLoads;
    private InstagramClient client;

    @BeforeEach
    void setUp() {
        transport = new FakeTransport();
        credentialLoads = new AtomicInteger();
        SessionManager sessionManager = new SessionManager(() -> {
            credentialLoads.incrementAndGet();
            return Fixtures.COOKIES;
        });
        client = new InstagramClient(sessionManager, transport, new Gson(), BASE + "/");
    }

    @Test
    void testRequestsCarryBrowserHeaders() {
        transport.respond("web_profile_info", 200, profileJson(user("42", "natgeo", false)));

        IgUser user = client.getUserByName("natgeo");

        assertEquals("42", user.pk());
        ApiRequest request = transport.last();
        assertEquals("GET", request.method());
        assertEquals(BASE + "/v1/users/web_profile_info/?username=natgeo", request.url());
        assertEquals("csrf-abc", request.headers().get("X-CSRFToken"));
        assertEquals(InstagramClient.APP_ID, request.headers().get("X-IG-App-ID"));
        assertEquals("0", request.headers().get("X-IG-WWW-Claim"));
        assertEquals("XMLHttpRequest", request.headers().get("X-Requested-With"));
        assertTrue(request.headers().get("Cookie").contains("sessionid=sess-123"));
        assertFalse(request.hasBody());
    }

    @Test
    void testClaimTokenIsEchoedOnNextRequest() {
        transport.respond("web_profile_info",
                new ApiResponse(200, Map.of("X-IG-Set-WWW-Claim", "hmac.AR1"), profileJson(user("42", "natgeo", false))));
        transport.respond("/info/", 200, json(Map.of("user", user("42", "natgeo", false))));

        client.getUserByName("natgeo");
        client.getUserById("42");

        assertEquals("hmac.AR1", transport.last().headers().get("X-IG-WWW-Claim"));
    }

    @Test
    void testUnknownUserIsNotFound() {
        transport.respond("web_profile_info", 200, "{\"data\":{\"user\":null}}");
        assertThrows(NotFoundException.class, () -> client.getUserByName("ghost"));
    }

    @Test
    void testMediaByShortcodeUsesNumericId() {
        RawPost post = photo("3001", "Cabc", user("42", "natgeo", false));
        transport.respond("/v1/media/", 200, mediaInfoJson(post));

        RawPost result = client.getMediaByShortcode("Cabc");

        assertEquals("3001", result.pk());
        assertTrue(transport.last().url().contains("/v1/media/" + Shortcodes.toMediaId("Cabc") + "/info/"));
    }

    @Test
    void testEmptyMediaInfoIsNotFound() {
        transport.respond("/v1/media/", 200, "{\"items\":[]}");
        assertThrows(NotFoundException.class, () -> client.getMediaById("1"));
    }

    @Test
    void testFeedPagePassesCursorVerbatim() {
        IgUser owner = user("42", "natgeo", false);
        transport.respond("/v1/feed/user/42/", 200, feedJson(List.of(photo("1", "A1", owner)), true, "QVFE=="));

        Page<RawPost> page = client.getUserFeed("42", "cur/sor==");

        assertEquals(1, page.items().size());
        assertTrue(page.hasNext());
        assertEquals("QVFE==", page.nextCursor());
        assertTrue(transport.last().url().contains("max_id=cur%2Fsor%3D%3D"));
    }

    @Test
    void testClipsUseFormPost() {
        IgUser owner = user("42", "natgeo", false);
        String body = json(Map.of(
                "items", List.of(Map.of("media", reel("7", "R7", owner))),
                "paging_info", Map.of("more_available", false)));
        transport.respond("/v1/clips/user/", 200, body);

        Page<RawPost> page = client.getUserClips("42", null);

        assertEquals(List.of("7"), page.items().stream().map(RawPost::pk).toList());
        assertFalse(page.hasNext());
        ApiRequest request = transport.last();
        assertEquals("POST", request.method());
        assertEquals("application/x-www-form-urlencoded", request.headers().get("Content-Type"));
        assertTrue(request.body().contains("target_user_id=42"));
        assertFalse(request.body().contains("max_id"), "First page carries no cursor");
    }

    @Test
    void testSavedItemsAreUnwrapped() {
        IgUser owner = user("42", "natgeo", false);
        transport.respond("/v1/feed/saved/posts/", 200, savedJson(List.of(photo("1", "A1", owner), photo("2", "A2", owner)), false, null));

        Page<RawPost> page = client.getSavedPosts(null);

        assertEquals(List.of("1", "2"), page.items().stream().map(RawPost::pk).toList());
        assertFalse(page.hasNext());
    }

    @Test
    void testReelsAreReturnedInRequestOrder() {
        IgUser a = user("1", "alpha", false);
        IgUser b = user("2", "beta", false);
        transport.respond("reels_media", 200, reelsJson(new StoryReel("1", a, List.of()), new StoryReel("2", b, List.of())));

        List<StoryReel> reels = client.getReelsMedia(List.of("2", "1", "3"));

        assertEquals(List.of("2", "1"), reels.stream().map(StoryReel::id).toList());
        assertTrue(transport.last().url().contains("reel_ids=2&reel_ids=1&reel_ids=3"));
    }

    @Test
    void testMissingHighlightIsNotFound() {
        transport.respond("reels_media", 200, "{\"reels\":{}}");
        assertThrows(NotFoundException.class, () -> client.getHighlightReel("17900"));
        assertTrue(transport.last().url().contains("reel_ids=highlight%3A17900"));
    }

    @Test
    void testAuthenticationFailureDropsSession() {
        transport.respond("web_profile_info", 401, "{\"message\":\"login_required\"}");

        assertThrows(AuthenticationFailedException.class, () -> client.getUserByName("natgeo"));
        assertThrows(AuthenticationFailedException.class, () -> client.getUserByName("natgeo"));

        assertEquals(2, credentialLoads.get(), "Session must be rebuilt after an authentication failure");
    }

    @Test
    void testLoginRedirectIsAuthenticationFailure() {
        transport.respond("web_profile_info",
                new ApiResponse(302, Map.of("Location", "https://www.instagram.com/accounts/login/?next=/api"), ""));
        assertThrows(AuthenticationFailedException.class, () -> client.getUserByName("natgeo"));
    }

    @Test
    void testChallengeRedirect() {
        transport.respond("web_profile_info",
                new ApiResponse(302, Map.of("Location", "https://www.instagram.com/challenge/action/"), ""));
        assertThrows(ChallengeRequiredException.class, () -> client.getUserByName("natgeo"));
    }

    @Test
    void testRateLimit() {
        transport.respond("web_profile_info", 429, "{\"message\":\"Please wait a few minutes\"}");
        RateLimitedException e = assertThrows(RateLimitedException.class, () -> client.getUserByName("natgeo"));
        assertTrue(e.isRetryable());
        assertEquals(1, credentialLoads.get(), "Rate limiting keeps the session");
    }

    @Test
    void testTransportFailureIsNetworkError() {
        transport.fail("web_profile_info", new IOException("Connection reset"));
        NetworkException e = assertThrows(NetworkException.class, () -> client.getUserByName("natgeo"));
        assertEquals(ErrorKind.NETWORK, e.getKind());
    }

    @Test
    void testMalformedBodyIsGenericError() {
        transport.respond("web_profile_info", 200, "<html>not json</html>");
        InstagramApiException e = assertThrows(InstagramApiException.class, () -> client.getUserByName("natgeo"));
        assertEquals(ErrorKind.GENERIC, e.getKind());
    }

    @Test
    void testNoCredentialsFailsBeforeAnyRequest() {
        InstagramClient anonymous = new InstagramClient(new SessionManager(() -> Map.of()), transport, new Gson(), BASE);
        assertThrows(AuthenticationFailedException.class, () -> anonymous.getUserByName("natgeo"));
        assertTrue(transport.getRequests().isEmpty());
    }
}
