package com.instagrab.core.extract;

import com.instagrab.api.ExtractorOptions;
import com.instagrab.common.model.MediaDescriptor;
import com.instagrab.core.client.InstagramClient;
import com.instagrab.core.client.model.IgUser;
import com.instagrab.core.client.model.RawPost;
import com.instagrab.core.media.MediaNormalizer;
import com.instagrab.core.pagination.DelayWindow;
import com.instagrab.core.pagination.PageFetcher;
import com.instagrab.core.pagination.Sleeper;

import java.util.stream.Stream;

/**
 * A user's timeline, reels tab or tagged tab.
 */
public class UserFeedExtractor extends AbstractInstagramExtractor {

    public enum Feed {
        POSTS("UserPosts", null, 10),
        REELS("UserReels", "reels", 80),
        TAGGED("UserTagged", "tagged", 80);

        private final String extractorName;
        private final String tab;
        private final int specificity;

        Feed(String extractorName, String tab, int specificity) {
            this.extractorName = extractorName;
            this.tab = tab;
            this.specificity = specificity;
        }
    }

    private final Feed feed;

    public UserFeedExtractor(Feed feed, InstagramClient client, MediaNormalizer normalizer, DelayWindow delay, Sleeper sleeper) {
        super(client, normalizer, delay, sleeper);
        this.feed = feed;
    }

    public Feed getFeed() {
        return feed;
    }

    @Override
    public String getName() {
        return feed.extractorName;
    }

    @Override
    public int specificity() {
        return feed.specificity;
    }

    @Override
    protected boolean matches(InstagramUrl url) {
        if (!InstagramUrl.isUsername(url.segment(0))) return false;
        if (feed.tab == null) return url.size() == 1;
        return url.size() == 2 && url.segmentIs(1, feed.tab);
    }

    @Override
    protected Stream<MediaDescriptor> descriptors(InstagramUrl url, ExtractorOptions options) {
        IgUser user = resolvePublicUser(url.segment(0));
        return paginatedPosts(fetcherFor(user.pk()), options);
    }

    private PageFetcher<RawPost> fetcherFor(String userId) {
        switch (feed) {
            case REELS:
                return cursor -> client.getUserClips(userId, cursor);
            case TAGGED:
                return cursor -> client.getUserTagged(userId, cursor);
            default:
                return cursor -> client.getUserFeed(userId, cursor);
        }
    }
}
