package com.instagrab.core.media;

import com.instagrab.api.ExtractorOptions;
import com.instagrab.common.model.ContentKind;
import com.instagrab.common.model.MediaDescriptor;
import com.instagrab.common.model.MediaMetadata;
import com.instagrab.common.model.MediaType;
import com.instagrab.common.util.FilenameTemplate;
import com.instagrab.common.util.HttpUtils;
import com.instagrab.common.util.Shortcodes;
import com.instagrab.core.client.model.IgUser;
import com.instagrab.core.client.model.ImageCandidate;
import com.instagrab.core.client.model.RawPost;
import com.instagrab.core.client.model.SizedAsset;
import com.instagrab.core.client.model.VideoVersion;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

/**
 * Turns provider records into {@link MediaDescriptor}s.
 * <p>
 * Posts and reels may yield both a video and its cover image. Story and highlight items are
 * either/or: the image is dropped when the item has a video.
 */
public class MediaNormalizer {
    public static final String VIDEO_EXTENSION = "mp4";
    public static final String DEFAULT_IMAGE_EXTENSION = "jpg";

    /**
     * Normalizes a feed, reel, tagged or saved post, including every carousel child.
     */
    public List<MediaDescriptor> normalizePost(RawPost post, ExtractorOptions options) {
        ContentKind kind = RawPost.PRODUCT_CLIPS.equals(post.productType()) ? ContentKind.REEL : ContentKind.POST;
        List<RawPost> children = post.carouselMedia() != null && !post.carouselMedia().isEmpty()
                ? post.carouselMedia()
                : List.of(post);
        boolean carousel = children.size() > 1;

        FilenameTemplate template = options.template();
        String username = post.user() != null ? post.user().username() : null;
        String shortcode = shortcodeOf(post);

        List<MediaDescriptor> result = new ArrayList<>();
        for (int i = 0; i < children.size(); i++) {
            RawPost child = children.get(i);
            if (child == null) continue;
            MediaMetadata metadata = new MediaMetadata(
                    post.key(),
                    shortcode,
                    username,
                    post.takenAt(),
                    post.caption() != null ? post.caption().text() : null,
                    child.originalWidth(),
                    child.originalHeight(),
                    carousel,
                    carousel ? i + 1 : null,
                    kind,
                    post.likeCount(),
                    post.commentCount());
            emit(child, metadata, options, template, result);
        }
        return result;
    }

    /**
     * Normalizes one story or highlight item.
     *
     * @param owner reel owner, used when the item itself carries no user
     */
    public List<MediaDescriptor> normalizeStoryItem(RawPost item, IgUser owner, ContentKind kind, ExtractorOptions options) {
        IgUser user = item.user() != null ? item.user() : owner;
        MediaMetadata metadata = new MediaMetadata(
                item.key(),
                shortcodeOf(item),
                user != null ? user.username() : null,
                item.takenAt(),
                item.caption() != null ? item.caption().text() : null,
                item.originalWidth(),
                item.originalHeight(),
                false,
                null,
                kind,
                null,
                null);

        List<MediaDescriptor> result = new ArrayList<>();
        emit(item, metadata, options, options.template(), result);
        return result;
    }

    private void emit(RawPost item, MediaMetadata metadata, ExtractorOptions options,
                      FilenameTemplate template, List<MediaDescriptor> out) {
        Optional<VideoVersion> video = BestAssetSelector.best(item.videos());
        boolean eitherOr = metadata.contentKind().isEphemeral();

        if (options.includeVideos() && video.isPresent()) {
            out.add(describe(video.get(), MediaType.VIDEO, VIDEO_EXTENSION, metadata, template));
        }

        if (options.includeImages() && !(eitherOr && video.isPresent())) {
            Optional<ImageCandidate> image = BestAssetSelector.best(item.imageCandidates());
            image.ifPresent(candidate -> out.add(describe(candidate, MediaType.IMAGE,
                    HttpUtils.extensionFromUrl(candidate.url(), DEFAULT_IMAGE_EXTENSION), metadata, template)));
        }
    }

    private static MediaDescriptor describe(SizedAsset asset, MediaType type, String extension,
                                            MediaMetadata base, FilenameTemplate template) {
        MediaMetadata metadata = base.withDimensions(
                asset.width() > 0 ? asset.width() : base.width(),
                asset.height() > 0 ? asset.height() : base.height());
        return new MediaDescriptor(asset.url(), type, template.render(metadata, extension, type), extension, metadata);
    }

    private static String shortcodeOf(RawPost post) {
        if (post.code() != null && !post.code().isEmpty()) return post.code();
        String fromPk = Shortcodes.fromMediaIdOrNull(post.pk());
        return fromPk != null ? fromPk : Shortcodes.fromMediaIdOrNull(post.id());
    }
}
