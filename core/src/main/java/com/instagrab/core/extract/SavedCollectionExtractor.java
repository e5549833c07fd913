package com.instagrab.core.extract;

import com.instagrab.api.ExtractorOptions;
import com.instagrab.common.model.MediaDescriptor;
import com.instagrab.core.client.InstagramClient;
import com.instagrab.core.media.MediaNormalizer;
import com.instagrab.core.pagination.DelayWindow;
import com.instagrab.core.pagination.Sleeper;

import java.util.stream.Stream;

/**
 * One named saved collection: /{username}/saved/{collectionName}/{collectionId}/.
 */
public class SavedCollectionExtractor extends AbstractInstagramExtractor {
    public static final int SPECIFICITY = 85;

    public SavedCollectionExtractor(InstagramClient client, MediaNormalizer normalizer, DelayWindow delay, Sleeper sleeper) {
        super(client, normalizer, delay, sleeper);
    }

    @Override
    public String getName() {
        return "SavedCollection";
    }

    @Override
    public int specificity() {
        return SPECIFICITY;
    }

    @Override
    protected boolean matches(InstagramUrl url) {
        return url.size() == 4
                && InstagramUrl.isUsername(url.segment(0))
                && url.segmentIs(1, "saved")
                && InstagramUrl.isNumeric(url.segment(3));
    }

    @Override
    protected Stream<MediaDescriptor> descriptors(InstagramUrl url, ExtractorOptions options) {
        String collectionId = url.segment(3);
        logger.debug("Saved collection '{}' ({})", url.segment(2), collectionId);
        return paginatedPosts(cursor -> client.getSavedCollection(collectionId, cursor), options);
    }
}
