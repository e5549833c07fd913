package com.instagrab.core.extract;

import com.instagrab.api.ExtractorOptions;
import com.instagrab.common.model.MediaDescriptor;
import com.instagrab.core.client.InstagramClient;
import com.instagrab.core.media.MediaNormalizer;
import com.instagrab.core.pagination.DelayWindow;
import com.instagrab.core.pagination.Sleeper;

import java.util.Locale;
import java.util.Set;
import java.util.stream.Stream;

/**
 * Single post, reel or IGTV video: /p/{code}, /reel/{code}, /reels/{code}, /tv/{code},
 * optionally prefixed with the owner's username.
 */
public class PostExtractor extends AbstractInstagramExtractor {
    public static final int SPECIFICITY = 100;
    private static final Set<String> POST_SECTIONS = Set.of("p", "reel", "reels", "tv");

    public PostExtractor(InstagramClient client, MediaNormalizer normalizer) {
        super(client, normalizer, DelayWindow.NONE, Sleeper.SYSTEM);
    }

    @Override
    public String getName() {
        return "Post";
    }

    @Override
    public int specificity() {
        return SPECIFICITY;
    }

    @Override
    protected boolean matches(InstagramUrl url) {
        return shortcodeOf(url) != null;
    }

    @Override
    protected Stream<MediaDescriptor> descriptors(InstagramUrl url, ExtractorOptions options) {
        String shortcode = shortcodeOf(url);
        return normalizer.normalizePost(client.getMediaByShortcode(shortcode), options).stream();
    }

    /** Shortcode of a post URL, or null if the URL is not a post URL. */
    public static String shortcodeOf(InstagramUrl url) {
        if (url.size() >= 2 && isSection(url.segment(0)) && InstagramUrl.isShortcode(url.segment(1))) {
            return url.segment(1);
        }
        if (url.size() >= 3 && InstagramUrl.isUsername(url.segment(0)) && isSection(url.segment(1))
                && InstagramUrl.isShortcode(url.segment(2))) {
            return url.segment(2);
        }
        return null;
    }

    private static boolean isSection(String segment) {
        return segment != null && POST_SECTIONS.contains(segment.toLowerCase(Locale.ROOT));
    }
}
