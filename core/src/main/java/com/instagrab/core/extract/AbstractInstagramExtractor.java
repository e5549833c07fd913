package com.instagrab.core.extract;

import com.instagrab.api.ExtractorOptions;
import com.instagrab.api.MediaExtractor;
import com.instagrab.common.model.MediaDescriptor;
import com.instagrab.core.client.InstagramClient;
import com.instagrab.core.client.PrivateAccountException;
import com.instagrab.core.client.model.IgUser;
import com.instagrab.core.client.model.RawPost;
import com.instagrab.core.media.MediaNormalizer;
import com.instagrab.core.pagination.DelayWindow;
import com.instagrab.core.pagination.PageFetcher;
import com.instagrab.core.pagination.Paginator;
import com.instagrab.core.pagination.Sleeper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Objects;
import java.util.Spliterator;
import java.util.stream.Stream;
import java.util.stream.StreamSupport;

/**
 * Shared plumbing for API-backed strategies: URL parsing, lazy stream construction, user resolution
 * and paginated post listings.
 */
public abstract class AbstractInstagramExtractor implements MediaExtractor {
    protected final Logger logger = LoggerFactory.getLogger(getClass());

    protected final InstagramClient client;
    protected final MediaNormalizer normalizer;
    protected final DelayWindow delay;
    protected final Sleeper sleeper;

    protected AbstractInstagramExtractor(InstagramClient client, MediaNormalizer normalizer, DelayWindow delay, Sleeper sleeper) {
        this.client = Objects.requireNonNull(client, "client");
        this.normalizer = Objects.requireNonNull(normalizer, "normalizer");
        this.delay = Objects.requireNonNull(delay, "delay");
        this.sleeper = Objects.requireNonNull(sleeper, "sleeper");
    }

    @Override
    public final boolean matches(String url) {
        return InstagramUrl.isInstagram(url) && matches(InstagramUrl.parse(url));
    }

    protected abstract boolean matches(InstagramUrl url);

    /**
     * Builds the descriptor stream. Called only once the returned stream is consumed.
     */
    protected abstract Stream<MediaDescriptor> descriptors(InstagramUrl url, ExtractorOptions options);

    @Override
    public Stream<MediaDescriptor> extract(String url, ExtractorOptions options) {
        InstagramUrl parsed = InstagramUrl.parse(url);
        if (!matches(parsed)) {
            throw new UnsupportedUrlException(url, getName() + " cannot handle " + url);
        }

        Stream<MediaDescriptor> stream = StreamSupport.stream(() -> {
            logger.info("🔎 {} extraction started for {}", getName(), url);
            return descriptors(parsed, options).spliterator();
        }, Spliterator.ORDERED, false);
        return options.isCapped() ? stream.limit(options.maxItems()) : stream;
    }

    /**
     * Looks the user up and fails before any further call when the account is private.
     */
    protected IgUser resolvePublicUser(String username) {
        IgUser user = client.getUserByName(username);
        if (user.isPrivate()) {
            logger.warn("🔒 @{} is private, aborting", username);
            throw new PrivateAccountException(username);
        }
        logger.debug("Resolved @{} to {}", username, user.pk());
        return user;
    }

    protected Stream<MediaDescriptor> paginatedPosts(PageFetcher<RawPost> fetcher, ExtractorOptions options) {
        return Paginator.builder(fetcher)
                .delay(delay)
                .maxItems(options.maxItems())
                .dedupeBy(RawPost::key)
                .sleeper(sleeper)
                .build()
                .stream()
                .flatMap(post -> normalizer.normalizePost(post, options).stream());
    }

    @Override
    public String toString() {
        return getName() + "(" + specificity() + ")";
    }
}
