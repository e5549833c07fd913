package com.instagrab.core.dom;

import com.google.gson.Gson;
import com.google.gson.JsonArray;
import com.google.gson.JsonElement;
import com.google.gson.JsonObject;
import com.google.gson.JsonParseException;
import com.google.gson.JsonParser;
import com.instagrab.api.ExtractorOptions;
import com.instagrab.common.model.ContentKind;
import com.instagrab.common.model.MediaDescriptor;
import com.instagrab.common.model.MediaMetadata;
import com.instagrab.common.model.MediaType;
import com.instagrab.common.util.FilenameTemplate;
import com.instagrab.common.util.HttpUtils;
import com.instagrab.core.client.model.ImageCandidate;
import com.instagrab.core.client.model.RawPost;
import com.instagrab.core.extract.InstagramUrl;
import com.instagrab.core.extract.InvalidUrlException;
import com.instagrab.core.extract.PostExtractor;
import com.instagrab.core.media.BestAssetSelector;
import com.instagrab.core.media.MediaNormalizer;
import org.jsoup.Jsoup;
import org.jsoup.internal.StringUtil;
import org.jsoup.nodes.Document;
import org.jsoup.nodes.Element;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Fallback extraction from an already rendered page, used when the API is not reachable.
 * <p>
 * The embedded server-side JSON is tried first. Only when it yields nothing are the page's
 * {@code img} and {@code video} elements scanned directly. Results are unique by URL, first wins.
 */
public class DomScraper {
    private static final Logger logger = LoggerFactory.getLogger(DomScraper.class);

    private static final List<String> POST_KEYS = List.of("shortcode_media", "xdt_shortcode_media");
    private static final List<String> EDGE_KEYS = List.of(
            "edge_owner_to_timeline_media", "edge_user_to_photos_of_you", "edge_saved_media");
    private static final String SHARED_DATA_MARKER = "window._sharedData";

    private final MediaNormalizer normalizer;
    private final Gson gson;
    private final Clock clock;

    public DomScraper(MediaNormalizer normalizer, Gson gson, Clock clock) {
        this.normalizer = normalizer;
        this.gson = gson;
        this.clock = clock;
    }

    public List<MediaDescriptor> scrape(String html, String pageUrl, ExtractorOptions options) {
        Document document = Jsoup.parse(html != null ? html : "", pageUrl != null ? pageUrl : "");
        PageInfo page = PageInfo.of(pageUrl, clock.instant().getEpochSecond());

        List<MediaDescriptor> found = fromEmbeddedJson(document, page, options);
        if (found.isEmpty()) {
            found = fromElements(document, page, options);
            logger.debug("No embedded data on {}, element scan found {} item(s)", pageUrl, found.size());
        }

        Map<String, MediaDescriptor> unique = new LinkedHashMap<>();
        for (MediaDescriptor d : found) unique.putIfAbsent(d.url(), d);

        List<MediaDescriptor> result = new ArrayList<>(unique.values());
        if (options.isCapped() && result.size() > options.maxItems()) {
            result = new ArrayList<>(result.subList(0, options.maxItems()));
        }
        logger.info("📄 Scraped {} item(s) from {}", result.size(), pageUrl);
        return result;
    }

    // ========== EMBEDDED JSON ==========

    private List<MediaDescriptor> fromEmbeddedJson(Document document, PageInfo page, ExtractorOptions options) {
        List<MediaDescriptor> result = new ArrayList<>();
        for (JsonElement root : embeddedPayloads(document)) {
            for (String key : POST_KEYS) {
                findObject(root, key).ifPresent(node -> result.addAll(decodeNode(node, page, options)));
            }
            for (String key : EDGE_KEYS) {
                findObject(root, key).ifPresent(edgeList -> {
                    for (JsonObject node : edgeNodes(edgeList)) {
                        result.addAll(decodeNode(node, page, options));
                    }
                });
            }
        }
        return result;
    }

    private List<JsonElement> embeddedPayloads(Document document) {
        List<JsonElement> payloads = new ArrayList<>();

        Element nextData = document.getElementById("__NEXT_DATA__");
        if (nextData != null) parse(nextData.data()).ifPresent(payloads::add);

        for (Element script : document.select("script[type=application/json]")) {
            if ("__NEXT_DATA__".equals(script.id())) continue;
            parse(script.data()).ifPresent(payloads::add);
        }

        for (Element script : document.select("script")) {
            String text = script.data();
            int marker = text.indexOf(SHARED_DATA_MARKER);
            if (marker < 0) continue;
            int start = text.indexOf('{', marker);
            int end = text.lastIndexOf('}');
            if (start >= 0 && end > start) parse(text.substring(start, end + 1)).ifPresent(payloads::add);
        }
        return payloads;
    }

    private static Optional<JsonElement> parse(String json) {
        if (json == null || json.isBlank()) return Optional.empty();
        try {
            return Optional.of(JsonParser.parseString(json));
        } catch (JsonParseException e) {
            logger.debug("Skipping unparseable script block: {}", e.getMessage());
            return Optional.empty();
        }
    }

    /** Depth-first search for the first object stored under {@code key}. */
    static Optional<JsonObject> findObject(JsonElement element, String key) {
        if (element == null || element.isJsonNull() || element.isJsonPrimitive()) return Optional.empty();

        if (element.isJsonArray()) {
            for (JsonElement child : element.getAsJsonArray()) {
                Optional<JsonObject> found = findObject(child, key);
                if (found.isPresent()) return found;
            }
            return Optional.empty();
        }

        JsonObject object = element.getAsJsonObject();
        JsonElement direct = object.get(key);
        if (direct != null && direct.isJsonObject()) return Optional.of(direct.getAsJsonObject());

        for (Map.Entry<String, JsonElement> entry : object.entrySet()) {
            Optional<JsonObject> found = findObject(entry.getValue(), key);
            if (found.isPresent()) return found;
        }
        return Optional.empty();
    }

    private static List<JsonObject> edgeNodes(JsonObject edgeList) {
        List<JsonObject> nodes = new ArrayList<>();
        JsonElement edges = edgeList.get("edges");
        if (edges == null || !edges.isJsonArray()) return nodes;
        for (JsonElement edge : edges.getAsJsonArray()) {
            if (!edge.isJsonObject()) continue;
            JsonElement node = edge.getAsJsonObject().get("node");
            if (node != null && node.isJsonObject()) nodes.add(node.getAsJsonObject());
        }
        return nodes;
    }

    private List<MediaDescriptor> decodeNode(JsonObject node, PageInfo page, ExtractorOptions options) {
        // Newer pages embed the REST shape instead of the GraphQL one
        if (node.has("image_versions2") || node.has("carousel_media") || node.has("video_versions")) {
            try {
                RawPost post = gson.fromJson(node, RawPost.class);
                return normalizer.normalizePost(post, options);
            } catch (JsonParseException e) {
                logger.debug("Unexpected media shape on {}: {}", page.url(), e.getMessage());
                return List.of();
            }
        }

        String username = node.has("owner") ? string(node.getAsJsonObject("owner"), "username") : null;
        if (username == null) username = page.username();
        String shortcode = string(node, "shortcode");
        if (shortcode == null) shortcode = page.shortcode();

        List<JsonObject> children = edgeNodes(objectOrEmpty(node, "edge_sidecar_to_children"));
        if (children.isEmpty()) children = List.of(node);
        boolean carousel = children.size() > 1;

        Long timestamp = longOrNull(node, "taken_at_timestamp");
        MediaContext context = new MediaContext(
                string(node, "id"),
                shortcode,
                username,
                timestamp != null ? timestamp : page.timestamp(),
                captionOf(node),
                longOrNull(objectOrEmpty(node, "edge_media_preview_like"), "count"),
                longOrNull(objectOrEmpty(node, "edge_media_to_comment"), "count"));

        FilenameTemplate template = options.template();
        List<MediaDescriptor> result = new ArrayList<>();
        for (int i = 0; i < children.size(); i++) {
            result.addAll(decodeSingle(children.get(i), context, carousel ? i + 1 : null, options, template));
        }
        return result;
    }

    private List<MediaDescriptor> decodeSingle(JsonObject node, MediaContext context, Integer carouselIndex,
                                               ExtractorOptions options, FilenameTemplate template) {
        JsonObject dimensions = objectOrEmpty(node, "dimensions");
        MediaMetadata metadata = new MediaMetadata(
                context.postId(), context.shortcode(), context.username(), context.timestamp(), context.caption(),
                intOrZero(dimensions, "width"), intOrZero(dimensions, "height"),
                carouselIndex != null, carouselIndex, ContentKind.POST, context.likes(), context.comments());

        List<MediaDescriptor> result = new ArrayList<>();
        String videoUrl = string(node, "video_url");
        if (options.includeVideos() && isTrue(node, "is_video") && videoUrl != null) {
            result.add(new MediaDescriptor(videoUrl, MediaType.VIDEO,
                    template.render(metadata, MediaNormalizer.VIDEO_EXTENSION, MediaType.VIDEO),
                    MediaNormalizer.VIDEO_EXTENSION, metadata));
        }

        if (options.includeImages()) {
            bestDisplayImage(node).ifPresent(image -> {
                String extension = HttpUtils.extensionFromUrl(image.url(), MediaNormalizer.DEFAULT_IMAGE_EXTENSION);
                MediaMetadata sized = image.width() > 0 ? metadata.withDimensions(image.width(), image.height()) : metadata;
                result.add(new MediaDescriptor(image.url(), MediaType.IMAGE,
                        template.render(sized, extension, MediaType.IMAGE), extension, sized));
            });
        }
        return result;
    }

    private static Optional<ImageCandidate> bestDisplayImage(JsonObject node) {
        List<ImageCandidate> candidates = new ArrayList<>();
        JsonElement resources = node.get("display_resources");
        if (resources != null && resources.isJsonArray()) {
            for (JsonElement r : resources.getAsJsonArray()) {
                if (!r.isJsonObject()) continue;
                JsonObject res = r.getAsJsonObject();
                String src = string(res, "src");
                if (src != null) {
                    candidates.add(new ImageCandidate(src, intOrZero(res, "config_width"), intOrZero(res, "config_height")));
                }
            }
        }
        Optional<ImageCandidate> best = BestAssetSelector.best(candidates);
        if (best.isPresent()) return best;

        String displayUrl = string(node, "display_url");
        return displayUrl != null ? Optional.of(new ImageCandidate(displayUrl, 0, 0)) : Optional.empty();
    }

    // ========== RENDERED ELEMENTS ==========

    private List<MediaDescriptor> fromElements(Document document, PageInfo page, ExtractorOptions options) {
        List<String> images = new ArrayList<>();
        List<String> videos = new ArrayList<>();

        if (options.includeImages()) {
            for (Element img : document.select("img")) {
                String url = bestImageSource(img);
                if (isHttp(url) && !images.contains(url)) images.add(url);
            }
        }
        if (options.includeVideos()) {
            for (Element video : document.select("video")) {
                String src = video.attr("src");
                if (src.isEmpty()) {
                    Element source = video.selectFirst("source[src]");
                    src = source != null ? source.attr("src") : "";
                }
                if (isHttp(src) && !videos.contains(src)) videos.add(src);
            }
        }

        int total = images.size() + videos.size();
        FilenameTemplate template = options.template();
        List<MediaDescriptor> result = new ArrayList<>();
        int index = 0;
        for (String url : images) {
            index++;
            String extension = HttpUtils.extensionFromUrl(url, MediaNormalizer.DEFAULT_IMAGE_EXTENSION);
            result.add(elementDescriptor(url, MediaType.IMAGE, extension, page, total, index, template));
        }
        for (String url : videos) {
            index++;
            result.add(elementDescriptor(url, MediaType.VIDEO, MediaNormalizer.VIDEO_EXTENSION, page, total, index, template));
        }
        return result;
    }

    private static MediaDescriptor elementDescriptor(String url, MediaType type, String extension, PageInfo page,
                                                     int total, int index, FilenameTemplate template) {
        // Several elements on one page are numbered so their filenames do not collide
        boolean numbered = total > 1;
        MediaMetadata metadata = new MediaMetadata(null, page.shortcode(), page.username(), page.timestamp(), null,
                0, 0, numbered, numbered ? index : null, ContentKind.POST, null, null);
        return new MediaDescriptor(url, type, template.render(metadata, extension, type), extension, metadata);
    }

    /**
     * Widest declared {@code srcset} candidate, else {@code src}. Relative URLs are resolved
     * against the page URL.
     */
    static String bestImageSource(Element img) {
        String srcset = img.attr("srcset");
        if (!srcset.isBlank()) {
            String bestUrl = null;
            int bestWidth = -1;
            for (String part : srcset.split(",")) {
                String[] tokens = part.trim().split("\\s+");
                if (tokens.length == 0 || tokens[0].isEmpty()) continue;
                int width = 0;
                if (tokens.length > 1 && tokens[1].endsWith("w")) {
                    try {
                        width = Integer.parseInt(tokens[1].substring(0, tokens[1].length() - 1));
                    } catch (NumberFormatException e) {
                        width = 0;
                    }
                }
                String candidate = StringUtil.resolve(img.baseUri(), tokens[0]);
                if (!isHttp(candidate)) continue;
                if (width > bestWidth) {
                    bestWidth = width;
                    bestUrl = candidate;
                }
            }
            if (bestUrl != null) return bestUrl;
        }
        String src = img.absUrl("src");
        return src.isEmpty() ? img.attr("src") : src;
    }

    private static boolean isHttp(String url) {
        return url != null && (url.startsWith("http://") || url.startsWith("https://"));
    }

    // ========== JSON HELPERS ==========

    private static String captionOf(JsonObject node) {
        JsonElement edges = objectOrEmpty(node, "edge_media_to_caption").get("edges");
        if (edges == null || !edges.isJsonArray()) return null;
        JsonArray array = edges.getAsJsonArray();
        if (array.isEmpty() || !array.get(0).isJsonObject()) return null;
        return string(objectOrEmpty(array.get(0).getAsJsonObject(), "node"), "text");
    }

    private static JsonObject objectOrEmpty(JsonObject object, String key) {
        JsonElement value = object.get(key);
        return value != null && value.isJsonObject() ? value.getAsJsonObject() : new JsonObject();
    }

    private static String string(JsonObject object, String key) {
        JsonElement value = object.get(key);
        return value != null && value.isJsonPrimitive() ? value.getAsString() : null;
    }

    private static Long longOrNull(JsonObject object, String key) {
        JsonElement value = object.get(key);
        if (value == null || !value.isJsonPrimitive() || !value.getAsJsonPrimitive().isNumber()) return null;
        return value.getAsLong();
    }

    private static int intOrZero(JsonObject object, String key) {
        Long value = longOrNull(object, key);
        return value != null ? value.intValue() : 0;
    }

    private static boolean isTrue(JsonObject object, String key) {
        JsonElement value = object.get(key);
        return value != null && value.isJsonPrimitive() && value.getAsJsonPrimitive().isBoolean() && value.getAsBoolean();
    }

    private record MediaContext(String postId, String shortcode, String username, Long timestamp, String caption,
                                Long likes, Long comments) {
    }

    /** What the page URL tells us about its content. */
    record PageInfo(String url, String shortcode, String username, long timestamp) {

        static PageInfo of(String pageUrl, long now) {
            InstagramUrl parsed;
            try {
                parsed = InstagramUrl.parse(pageUrl);
            } catch (InvalidUrlException e) {
                return new PageInfo(pageUrl, null, null, now);
            }

            String shortcode = PostExtractor.shortcodeOf(parsed);
            String username = null;
            if (parsed.segmentIs(0, "stories")) {
                username = InstagramUrl.isUsername(parsed.segment(1)) ? parsed.segment(1) : null;
            } else if (InstagramUrl.isUsername(parsed.segment(0))) {
                username = parsed.segment(0);
            }
            return new PageInfo(pageUrl, shortcode, username, now);
        }
    }
}
