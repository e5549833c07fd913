package com.instagrab.core.extract;

import com.instagrab.api.ExtractorOptions;
import com.instagrab.common.model.ContentKind;
import com.instagrab.common.model.MediaDescriptor;
import com.instagrab.core.client.InstagramClient;
import com.instagrab.core.client.model.IgUser;
import com.instagrab.core.client.model.RawPost;
import com.instagrab.core.client.model.StoryReel;
import com.instagrab.core.media.MediaNormalizer;
import com.instagrab.core.pagination.DelayWindow;
import com.instagrab.core.pagination.Sleeper;

import java.util.List;
import java.util.stream.Stream;

/**
 * Current stories of a user: /stories/{username}/ or a single story /stories/{username}/{storyId}/.
 */
public class StoriesExtractor extends AbstractInstagramExtractor {
    public static final int SPECIFICITY = 90;

    public StoriesExtractor(InstagramClient client, MediaNormalizer normalizer) {
        super(client, normalizer, DelayWindow.NONE, Sleeper.SYSTEM);
    }

    @Override
    public String getName() {
        return "Stories";
    }

    @Override
    public int specificity() {
        return SPECIFICITY;
    }

    @Override
    protected boolean matches(InstagramUrl url) {
        if (!url.segmentIs(0, "stories") || url.size() < 2 || url.size() > 3) return false;
        if (url.segmentIs(1, "highlights")) return false;
        return InstagramUrl.isUsername(url.segment(1)) && (url.size() == 2 || InstagramUrl.isNumeric(url.segment(2)));
    }

    @Override
    protected Stream<MediaDescriptor> descriptors(InstagramUrl url, ExtractorOptions options) {
        IgUser user = resolvePublicUser(url.segment(1));
        String storyId = url.segment(2);

        List<StoryReel> reels = client.getReelsMedia(List.of(user.pk()));
        if (reels.isEmpty() || reels.get(0).itemsOrEmpty().isEmpty()) {
            logger.info("@{} has no active stories", user.username());
            return Stream.empty();
        }

        StoryReel reel = reels.get(0);
        IgUser owner = reel.user() != null ? reel.user() : user;
        return reel.itemsOrEmpty().stream()
                .filter(item -> storyId == null || isStory(item, storyId))
                .flatMap(item -> normalizer.normalizeStoryItem(item, owner, ContentKind.STORY, options).stream());
    }

    private static boolean isStory(RawPost item, String storyId) {
        if (storyId.equals(item.pk())) return true;
        return item.id() != null && (item.id().equals(storyId) || item.id().startsWith(storyId + "_"));
    }
}
