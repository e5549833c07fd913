package com.instagrab.common.auth;

import com.instagrab.api.CredentialProvider;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Reads provider cookies from a Netscape-format cookies.txt (as exported by browser extensions or yt-dlp).
 * Only cookies of the instagram.com domain are returned. The file is re-read on every call so a
 * refreshed export is picked up after the session is invalidated.
 */
public class CookieFileCredentialProvider implements CredentialProvider {
    private static final Logger logger = LoggerFactory.getLogger(CookieFileCredentialProvider.class);
    private static final String DOMAIN = "instagram.com";
    private static final String HTTP_ONLY_PREFIX = "#HttpOnly_";

    private final Path cookieFile;

    public CookieFileCredentialProvider(Path cookieFile) {
        this.cookieFile = cookieFile;
    }

    public Path getCookieFile() {
        return cookieFile;
    }

    @Override
    public Map<String, String> loadCookies() throws IOException {
        if (cookieFile == null || !Files.exists(cookieFile)) {
            logger.debug("No cookie file at {}", cookieFile);
            return Map.of();
        }
        return parse(Files.readAllLines(cookieFile, StandardCharsets.UTF_8));
    }

    static Map<String, String> parse(List<String> lines) {
        Map<String, String> cookies = new LinkedHashMap<>();
        for (String raw : lines) {
            String line = raw.strip();
            if (line.startsWith(HTTP_ONLY_PREFIX)) {
                line = line.substring(HTTP_ONLY_PREFIX.length());
            } else if (line.isEmpty() || line.startsWith("#")) {
                continue;
            }

            String[] parts = line.split("\t");
            if (parts.length < 7) continue;

            String domain = parts[0].startsWith(".") ? parts[0].substring(1) : parts[0];
            if (!domain.equals(DOMAIN) && !domain.endsWith("." + DOMAIN)) continue;

            cookies.put(parts[5], parts[6]);
        }
        return cookies;
    }
}
