package com.instagrab.core.extract;

import com.instagrab.api.ExtractorOptions;
import com.instagrab.common.model.ContentKind;
import com.instagrab.common.model.MediaDescriptor;
import com.instagrab.core.client.InstagramClient;
import com.instagrab.core.client.model.HighlightRef;
import com.instagrab.core.client.model.IgUser;
import com.instagrab.core.client.model.StoryReel;
import com.instagrab.core.media.MediaNormalizer;
import com.instagrab.core.pagination.DelayWindow;
import com.instagrab.core.pagination.Page;
import com.instagrab.core.pagination.Paginator;
import com.instagrab.core.pagination.Sleeper;

import java.util.List;
import java.util.stream.Stream;

/**
 * Story highlights, either one reel (/stories/highlights/{id}/) or every highlight of a user
 * (/{username}/highlights/), fetched one reel at a time in tray order.
 */
public class HighlightsExtractor extends AbstractInstagramExtractor {
    public static final int SPECIFICITY = 95;

    public HighlightsExtractor(InstagramClient client, MediaNormalizer normalizer, DelayWindow delay, Sleeper sleeper) {
        super(client, normalizer, delay, sleeper);
    }

    @Override
    public String getName() {
        return "Highlights";
    }

    @Override
    public int specificity() {
        return SPECIFICITY;
    }

    @Override
    protected boolean matches(InstagramUrl url) {
        if (url.segmentIs(0, "stories") && url.segmentIs(1, "highlights")) {
            return url.size() >= 3 && InstagramUrl.isNumeric(url.segment(2));
        }
        return url.size() == 2 && InstagramUrl.isUsername(url.segment(0)) && url.segmentIs(1, "highlights");
    }

    @Override
    protected Stream<MediaDescriptor> descriptors(InstagramUrl url, ExtractorOptions options) {
        if (url.segmentIs(0, "stories")) {
            return highlight(url.segment(2), options).stream();
        }

        IgUser user = resolvePublicUser(url.segment(0));
        List<HighlightRef> tray = client.getHighlightsTray(user.pk());
        logger.info("@{} has {} highlight(s)", user.username(), tray.size());
        if (tray.isEmpty()) return Stream.empty();

        // Each tray entry is treated as a page so reels are paced like any other listing
        return Paginator.<MediaDescriptor>builder(cursor -> {
                    int index = cursor == null ? 0 : Integer.parseInt(cursor);
                    List<MediaDescriptor> items = highlight(tray.get(index).numericId(), options);
                    boolean more = index + 1 < tray.size();
                    return new Page<>(items, more, more ? String.valueOf(index + 1) : null);
                })
                .delay(delay)
                .maxItems(options.maxItems())
                .sleeper(sleeper)
                .build()
                .stream();
    }

    private List<MediaDescriptor> highlight(String highlightId, ExtractorOptions options) {
        StoryReel reel = client.getHighlightReel(highlightId);
        return reel.itemsOrEmpty().stream()
                .flatMap(item -> normalizer.normalizeStoryItem(item, reel.user(), ContentKind.HIGHLIGHT, options).stream())
                .toList();
    }
}
