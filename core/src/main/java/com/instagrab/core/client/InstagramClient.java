package com.instagrab.core.client;

import com.google.gson.Gson;
import com.google.gson.JsonParseException;
import com.instagrab.common.auth.SessionContext;
import com.instagrab.common.auth.SessionManager;
import com.instagrab.common.util.HttpUtils;
import com.instagrab.common.util.Shortcodes;
import com.instagrab.core.client.model.HighlightRef;
import com.instagrab.core.client.model.IgUser;
import com.instagrab.core.client.model.RawPost;
import com.instagrab.core.client.model.StoryReel;
import com.instagrab.core.pagination.Page;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * Authenticated client for the web app's private REST API.
 * <p>
 * Every call replays the session's cookies, CSRF token and claim token. A refreshed claim token in
 * a response replaces the session context. Non-2xx responses are mapped through {@link ApiErrors};
 * an authentication failure drops the session before the exception leaves the client.
 */
public class InstagramClient {
    private static final Logger logger = LoggerFactory.getLogger(InstagramClient.class);

    public static final String BASE_URL = "https://www.instagram.com/api";
    public static final String WEB_ORIGIN = "https://www.instagram.com";
    static final String APP_ID = "936619743392459";
    static final String ASBD_ID = "129477";
    static final String CLAIM_HEADER = "x-ig-set-www-claim";

    private static final int FEED_PAGE_SIZE = 30;
    private static final int SAVED_PAGE_SIZE = 50;

    private final SessionManager sessionManager;
    private final HttpTransport transport;
    private final Gson gson;
    private final String baseUrl;

    public InstagramClient(SessionManager sessionManager) {
        this(sessionManager, new UrlConnectionTransport(), new Gson());
    }

    public InstagramClient(SessionManager sessionManager, HttpTransport transport, Gson gson) {
        this(sessionManager, transport, gson, BASE_URL);
    }

    public InstagramClient(SessionManager sessionManager, HttpTransport transport, Gson gson, String baseUrl) {
        this.sessionManager = Objects.requireNonNull(sessionManager, "sessionManager");
        this.transport = Objects.requireNonNull(transport, "transport");
        this.gson = Objects.requireNonNull(gson, "gson");
        this.baseUrl = baseUrl.endsWith("/") ? baseUrl.substring(0, baseUrl.length() - 1) : baseUrl;
    }

    // ========== USERS ==========

    public IgUser getUserByName(String username) {
        ApiResponses.WebProfileInfo info = get("/v1/users/web_profile_info/", query("username", username),
                ApiResponses.WebProfileInfo.class);
        if (info.data() == null || info.data().user() == null) {
            throw new NotFoundException("", "User @" + username + " not found");
        }
        return info.data().user();
    }

    public IgUser getUserById(String userId) {
        ApiResponses.UserInfo info = get("/v1/users/" + userId + "/info/", Map.of(), ApiResponses.UserInfo.class);
        if (info.user() == null) {
            throw new NotFoundException("", "User " + userId + " not found");
        }
        return info.user();
    }

    // ========== MEDIA ==========

    public RawPost getMediaByShortcode(String shortcode) {
        return getMediaById(Shortcodes.toMediaId(shortcode));
    }

    public RawPost getMediaById(String mediaId) {
        ApiResponses.MediaInfo info = get("/v1/media/" + mediaId + "/info/", Map.of(), ApiResponses.MediaInfo.class);
        if (info.items() == null || info.items().isEmpty()) {
            throw new NotFoundException("", "Media " + mediaId + " not found");
        }
        return info.items().get(0);
    }

    // ========== FEEDS ==========

    public Page<RawPost> getUserFeed(String userId, String cursor) {
        ApiResponses.Feed feed = get("/v1/feed/user/" + userId + "/",
                pageQuery(FEED_PAGE_SIZE, cursor), ApiResponses.Feed.class);
        return new Page<>(feed.items(), feed.moreAvailable(), feed.nextMaxId());
    }

    public Page<RawPost> getUserClips(String userId, String cursor) {
        Map<String, Object> form = new LinkedHashMap<>();
        form.put("target_user_id", userId);
        form.put("page_size", FEED_PAGE_SIZE);
        form.put("include_feed_video", "true");
        if (cursor != null) form.put("max_id", cursor);

        ApiResponses.Clips clips = post("/v1/clips/user/", form, ApiResponses.Clips.class);
        List<RawPost> items = new ArrayList<>();
        if (clips.items() != null) {
            for (ApiResponses.Clips.ClipItem item : clips.items()) {
                if (item != null && item.media() != null) items.add(item.media());
            }
        }
        ApiResponses.Clips.PagingInfo paging = clips.pagingInfo();
        return paging == null
                ? Page.last(items)
                : new Page<>(items, paging.moreAvailable(), paging.maxId());
    }

    public Page<RawPost> getUserTagged(String userId, String cursor) {
        ApiResponses.Feed feed = get("/v1/usertags/" + userId + "/feed/",
                pageQuery(FEED_PAGE_SIZE, cursor), ApiResponses.Feed.class);
        return new Page<>(feed.items(), feed.moreAvailable(), feed.nextMaxId());
    }

    // ========== STORIES & HIGHLIGHTS ==========

    /**
     * Fetches the given reels (user ids for stories, "highlight:{id}" for highlights), in request order.
     * Ids the provider returns nothing for are left out.
     */
    public List<StoryReel> getReelsMedia(List<String> reelIds) {
        ApiResponses.ReelsMedia response = get("/v1/feed/reels_media/", query("reel_ids", List.copyOf(reelIds)),
                ApiResponses.ReelsMedia.class);

        List<StoryReel> reels = new ArrayList<>();
        if (response.reels() != null && !response.reels().isEmpty()) {
            for (String id : reelIds) {
                StoryReel reel = response.reels().get(id);
                if (reel != null) reels.add(reel);
            }
        } else if (response.reelsMedia() != null) {
            reels.addAll(response.reelsMedia());
        }
        return reels;
    }

    public List<HighlightRef> getHighlightsTray(String userId) {
        ApiResponses.HighlightsTray tray = get("/v1/highlights/" + userId + "/highlights_tray/", Map.of(),
                ApiResponses.HighlightsTray.class);
        return tray.tray() != null ? tray.tray() : List.of();
    }

    /**
     * @param highlightId numeric id, with or without the "highlight:" prefix
     */
    public StoryReel getHighlightReel(String highlightId) {
        String reelId = highlightId.startsWith(HighlightRef.PREFIX) ? highlightId : HighlightRef.PREFIX + highlightId;
        List<StoryReel> reels = getReelsMedia(List.of(reelId));
        if (reels.isEmpty()) {
            throw new NotFoundException("", "Highlight " + highlightId + " not found");
        }
        return reels.get(0);
    }

    // ========== SAVED ==========

    public Page<RawPost> getSavedPosts(String cursor) {
        return savedPage("/v1/feed/saved/posts/", cursor);
    }

    public Page<RawPost> getSavedCollection(String collectionId, String cursor) {
        return savedPage("/v1/feed/collection/" + collectionId + "/posts/", cursor);
    }

    private Page<RawPost> savedPage(String path, String cursor) {
        ApiResponses.Saved saved = get(path, pageQuery(SAVED_PAGE_SIZE, cursor), ApiResponses.Saved.class);
        List<RawPost> items = new ArrayList<>();
        if (saved.items() != null) {
            for (ApiResponses.Saved.SavedItem item : saved.items()) {
                if (item != null && item.media() != null) items.add(item.media());
            }
        }
        return new Page<>(items, saved.moreAvailable(), saved.nextMaxId());
    }

    // ========== TRANSPORT ==========

    private <T> T get(String path, Map<String, ?> query, Class<T> type) {
        String url = baseUrl + path + (query.isEmpty() ? "" : "?" + HttpUtils.encodeForm(query));
        return send("GET", url, null, type);
    }

    private <T> T post(String path, Map<String, ?> form, Class<T> type) {
        return send("POST", baseUrl + path, HttpUtils.encodeForm(form), type);
    }

    private <T> T send(String method, String url, String body, Class<T> type) {
        SessionContext session = sessionManager.current();
        ApiRequest request = new ApiRequest(method, url, headersFor(session, body != null), body);

        ApiResponse response;
        try {
            response = transport.execute(request);
        } catch (IOException e) {
            logger.warn("🌐 {} {} failed: {}", method, url, e.getMessage());
            throw new NetworkException(url, e);
        }

        String claim = response.header(CLAIM_HEADER);
        if (claim != null && !claim.isEmpty()) {
            sessionManager.updateClaim(claim);
        }

        if (!response.isSuccess()) {
            throw fail(url, response);
        }

        try {
            T parsed = gson.fromJson(response.body(), type);
            if (parsed == null) {
                throw new InstagramApiException(response.status(), response.body(), "Empty response from " + url);
            }
            return parsed;
        } catch (JsonParseException e) {
            throw new InstagramApiException(response.status(), response.body(),
                    "Malformed response from " + url + ": " + e.getMessage());
        }
    }

    private InstagramApiException fail(String url, ApiResponse response) {
        InstagramApiException error;
        if (response.isRedirect()) {
            String location = response.header("location");
            if (location != null && location.contains("/accounts/login")) {
                error = ApiErrors.classify(401, response.body());
            } else if (location != null && location.contains("/challenge")) {
                error = ApiErrors.classify(403, "challenge_required");
            } else {
                error = ApiErrors.classify(response.status(), response.body());
            }
        } else {
            error = ApiErrors.classify(response.status(), response.body());
        }

        if (error instanceof AuthenticationFailedException) {
            sessionManager.invalidate();
        }
        logger.debug("{} -> HTTP {} ({})", url, response.status(), error.getKind());
        return error;
    }

    private static Map<String, String> headersFor(SessionContext session, boolean form) {
        Map<String, String> headers = new LinkedHashMap<>();
        headers.put("Accept", "*/*");
        headers.put("Accept-Language", "en-US,en;q=0.9");
        headers.put("X-CSRFToken", session.csrfToken());
        headers.put("X-IG-App-ID", APP_ID);
        headers.put("X-ASBD-ID", ASBD_ID);
        headers.put("X-IG-WWW-Claim", session.wwwClaim());
        headers.put("X-Requested-With", "XMLHttpRequest");
        headers.put("Sec-Fetch-Dest", "empty");
        headers.put("Sec-Fetch-Mode", "cors");
        headers.put("Sec-Fetch-Site", "same-origin");
        headers.put("Referer", WEB_ORIGIN + "/");
        headers.put("User-Agent", HttpUtils.DEFAULT_USER_AGENT);
        headers.put("Cookie", session.cookieHeader());
        if (form) {
            headers.put("Content-Type", "application/x-www-form-urlencoded");
        }
        return headers;
    }

    private static Map<String, Object> query(String key, Object value) {
        Map<String, Object> query = new LinkedHashMap<>();
        query.put(key, value);
        return query;
    }

    private static Map<String, Object> pageQuery(int count, String cursor) {
        Map<String, Object> query = query("count", count);
        if (cursor != null) query.put("max_id", cursor);
        return query;
    }
}
