package com.instagrab.core.extract;

import java.net.URI;
import java.util.Arrays;
import java.util.List;
import java.util.Locale;
import java.util.Set;
import java.util.regex.Pattern;

/**
 * Parsed Instagram page URL reduced to its non-empty path segments.
 */
public record InstagramUrl(String url, List<String> segments) {
    private static final Pattern USERNAME = Pattern.compile("[A-Za-z0-9._]{1,30}");
    private static final Pattern SHORTCODE = Pattern.compile("[A-Za-z0-9_-]+");
    private static final Pattern NUMERIC = Pattern.compile("\\d+");

    /** First path segments that are site sections, never usernames. */
    static final Set<String> RESERVED_PATHS = Set.of(
            "p", "reel", "reels", "tv", "stories", "explore", "accounts", "direct", "about", "legal",
            "developer", "developers", "web", "api", "graphql", "saved", "challenge", "emails", "session",
            "privacy", "terms", "press", "blog", "help", "lite", "nametag", "locations", "topics", "oauth");

    public InstagramUrl {
        segments = List.copyOf(segments);
    }

    /**
     * @throws InvalidUrlException if the URL is blank, malformed or not on instagram.com
     */
    public static InstagramUrl parse(String url) {
        if (url == null || url.isBlank()) throw new InvalidUrlException(String.valueOf(url));
        String trimmed = url.trim();
        String withScheme = trimmed.contains("://") ? trimmed : "https://" + trimmed;

        URI uri;
        try {
            uri = URI.create(withScheme);
        } catch (IllegalArgumentException e) {
            throw new InvalidUrlException(url);
        }

        String scheme = uri.getScheme() != null ? uri.getScheme().toLowerCase(Locale.ROOT) : "";
        if (!scheme.equals("http") && !scheme.equals("https")) throw new InvalidUrlException(url);
        if (!isInstagramHost(uri.getHost())) throw new InvalidUrlException(url);

        String path = uri.getPath() != null ? uri.getPath() : "";
        List<String> segments = Arrays.stream(path.split("/")).filter(s -> !s.isEmpty()).toList();
        return new InstagramUrl(trimmed, segments);
    }

    public static boolean isInstagram(String url) {
        try {
            parse(url);
            return true;
        } catch (InvalidUrlException e) {
            return false;
        }
    }

    static boolean isInstagramHost(String host) {
        if (host == null) return false;
        String h = host.toLowerCase(Locale.ROOT);
        return h.equals("instagram.com") || h.endsWith(".instagram.com");
    }

    public int size() {
        return segments.size();
    }

    public String segment(int index) {
        return index < segments.size() ? segments.get(index) : null;
    }

    public boolean segmentIs(int index, String value) {
        String s = segment(index);
        return s != null && s.equalsIgnoreCase(value);
    }

    public static boolean isUsername(String value) {
        return value != null && USERNAME.matcher(value).matches()
                && !RESERVED_PATHS.contains(value.toLowerCase(Locale.ROOT));
    }

    public static boolean isShortcode(String value) {
        return value != null && SHORTCODE.matcher(value).matches();
    }

    public static boolean isNumeric(String value) {
        return value != null && NUMERIC.matcher(value).matches();
    }
}
