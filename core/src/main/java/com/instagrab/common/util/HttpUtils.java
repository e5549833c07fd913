package com.instagrab.common.util;

import java.io.BufferedReader;
import java.io.IOException;
import java.io.InputStream;
import java.io.InputStreamReader;
import java.net.HttpURLConnection;
import java.net.URI;
import java.net.URLEncoder;
import java.nio.charset.StandardCharsets;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.StringJoiner;
import java.util.regex.Matcher;
import java.util.regex.Pattern;
import java.util.zip.GZIPInputStream;

public class HttpUtils {
    public static final String DEFAULT_USER_AGENT = "Mozilla/5.0 (Windows NT 10.0; Win64; x64) AppleWebKit/537.36 (KHTML, like Gecko) Chrome/122.0.0.0 Safari/537.36";
    private static final Pattern EXTENSION_PATTERN = Pattern.compile("\\.([a-z0-9]+)$", Pattern.CASE_INSENSITIVE);

    private HttpUtils() {
    }

    /**
     * Encodes key/value pairs as application/x-www-form-urlencoded (also usable as a query string).
     * A value of type List is written as a repeated parameter.
     */
    public static String encodeForm(Map<String, ?> params) {
        StringJoiner joiner = new StringJoiner("&");
        for (Map.Entry<String, ?> e : params.entrySet()) {
            Object value = e.getValue();
            if (value == null) continue;
            if (value instanceof List<?> list) {
                for (Object v : list) joiner.add(encodePair(e.getKey(), String.valueOf(v)));
            } else {
                joiner.add(encodePair(e.getKey(), String.valueOf(value)));
            }
        }
        return joiner.toString();
    }

    private static String encodePair(String key, String value) {
        return URLEncoder.encode(key, StandardCharsets.UTF_8) + "=" + URLEncoder.encode(value, StandardCharsets.UTF_8);
    }

    /**
     * Reads the response body of an opened connection, from the error stream for 4xx/5xx.
     * Returns an empty string when the server sent no body.
     */
    public static String readBody(HttpURLConnection conn) throws IOException {
        int code = conn.getResponseCode();
        InputStream in = (code >= 400) ? conn.getErrorStream() : conn.getInputStream();
        if (in == null) return "";

        if ("gzip".equalsIgnoreCase(conn.getContentEncoding())) {
            in = new GZIPInputStream(in);
        }

        StringBuilder result = new StringBuilder();
        try (BufferedReader reader = new BufferedReader(new InputStreamReader(in, StandardCharsets.UTF_8))) {
            char[] buffer = new char[8192];
            int count;
            while ((count = reader.read(buffer)) != -1) result.append(buffer, 0, count);
        }
        return result.toString();
    }

    /**
     * Lowercase extension of the URL path (query ignored), or the fallback if there is none.
     */
    public static String extensionFromUrl(String url, String fallback) {
        String path = pathOf(url);
        if (path == null) return fallback;
        Matcher m = EXTENSION_PATTERN.matcher(path);
        return m.find() ? m.group(1).toLowerCase(Locale.ROOT) : fallback;
    }

    private static String pathOf(String url) {
        if (url == null) return null;
        try {
            return URI.create(url.trim()).getPath();
        } catch (IllegalArgumentException e) {
            return null;
        }
    }
}
