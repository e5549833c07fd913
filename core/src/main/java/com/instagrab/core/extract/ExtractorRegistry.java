package com.instagrab.core.extract;

import com.instagrab.api.ExtractorOptions;
import com.instagrab.api.MediaExtractor;
import com.instagrab.common.model.MediaDescriptor;
import com.instagrab.core.client.InstagramClient;
import com.instagrab.core.media.MediaNormalizer;
import com.instagrab.core.pagination.DelayWindow;
import com.instagrab.core.pagination.Sleeper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Optional;
import java.util.stream.Stream;

/**
 * Picks the extraction strategy for a URL.
 * <p>
 * Strategies are ordered by descending {@link MediaExtractor#specificity()}; strategies with equal
 * specificity keep their registration order. The first match wins. A URL nobody accepts is always
 * reported, never silently ignored.
 */
public class ExtractorRegistry {
    private static final Logger logger = LoggerFactory.getLogger(ExtractorRegistry.class);

    private final List<MediaExtractor> extractors;

    public ExtractorRegistry(List<? extends MediaExtractor> extractors) {
        List<MediaExtractor> sorted = new ArrayList<>(extractors);
        // List.sort is stable
        sorted.sort(Comparator.comparingInt(MediaExtractor::specificity).reversed());
        this.extractors = List.copyOf(sorted);
        logger.debug("Registered extractors: {}", this.extractors);
    }

    public static ExtractorRegistry createDefault(InstagramClient client, MediaNormalizer normalizer,
                                                  DelayWindow profileDelay, DelayWindow savedDelay, Sleeper sleeper) {
        return new ExtractorRegistry(List.of(
                new PostExtractor(client, normalizer),
                new HighlightsExtractor(client, normalizer, profileDelay, sleeper),
                new StoriesExtractor(client, normalizer),
                new SavedCollectionExtractor(client, normalizer, savedDelay, sleeper),
                new UserFeedExtractor(UserFeedExtractor.Feed.REELS, client, normalizer, profileDelay, sleeper),
                new UserFeedExtractor(UserFeedExtractor.Feed.TAGGED, client, normalizer, profileDelay, sleeper),
                new SavedPostsExtractor(client, normalizer, savedDelay, sleeper),
                new UserFeedExtractor(UserFeedExtractor.Feed.POSTS, client, normalizer, profileDelay, sleeper)));
    }

    /**
     * @throws InvalidUrlException          if the URL is not an Instagram URL
     * @throws NoMatchingExtractorException if no strategy accepts it
     */
    public MediaExtractor find(String url) {
        if (!InstagramUrl.isInstagram(url)) {
            throw new InvalidUrlException(url);
        }
        for (MediaExtractor extractor : extractors) {
            if (extractor.matches(url)) {
                logger.debug("{} -> {}", url, extractor.getName());
                return extractor;
            }
        }
        throw new NoMatchingExtractorException(url);
    }

    public Stream<MediaDescriptor> extract(String url, ExtractorOptions options) {
        return find(url).extract(url, options);
    }

    public boolean canExtract(String url) {
        return contentType(url).isPresent();
    }

    /** Name of the strategy that would handle the URL, if any. */
    public Optional<String> contentType(String url) {
        if (!InstagramUrl.isInstagram(url)) return Optional.empty();
        return extractors.stream()
                .filter(e -> e.matches(url))
                .map(MediaExtractor::getName)
                .findFirst();
    }

    public List<MediaExtractor> getExtractors() {
        return extractors;
    }
}
