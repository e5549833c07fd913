package com.instagrab.core.extract;

import com.instagrab.api.ExtractorOptions;
import com.instagrab.common.model.MediaDescriptor;
import com.instagrab.core.client.InstagramClient;
import com.instagrab.core.media.MediaNormalizer;
import com.instagrab.core.pagination.DelayWindow;
import com.instagrab.core.pagination.Sleeper;

import java.util.stream.Stream;

/**
 * The logged-in user's saved posts: /{username}/saved/ and /{username}/saved/all-posts/.
 */
public class SavedPostsExtractor extends AbstractInstagramExtractor {
    public static final int SPECIFICITY = 70;

    public SavedPostsExtractor(InstagramClient client, MediaNormalizer normalizer, DelayWindow delay, Sleeper sleeper) {
        super(client, normalizer, delay, sleeper);
    }

    @Override
    public String getName() {
        return "SavedPosts";
    }

    @Override
    public int specificity() {
        return SPECIFICITY;
    }

    @Override
    protected boolean matches(InstagramUrl url) {
        if (!InstagramUrl.isUsername(url.segment(0)) || !url.segmentIs(1, "saved")) return false;
        return url.size() == 2 || (url.size() == 3 && url.segmentIs(2, "all-posts"));
    }

    @Override
    protected Stream<MediaDescriptor> descriptors(InstagramUrl url, ExtractorOptions options) {
        return paginatedPosts(client::getSavedPosts, options);
    }
}
