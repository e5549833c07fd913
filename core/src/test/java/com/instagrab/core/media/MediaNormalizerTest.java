package com.instagrab.core.media;

import com.instagrab.api.ExtractorOptions;
import com.instagrab.common.model.ContentKind;
import com.instagrab.common.model.MediaDescriptor;
import com.instagrab.common.model.MediaType;
import com.instagrab.core.client.model.IgUser;
import com.instagrab.core.client.model.RawPost;
import com.instagrab.test.TestBase;
import org.junit.jupiter.api.Test;

import java.util.List;

import static com.instagrab.test.Fixtures.*;
import static org.junit.jupiter.api.Assertions.*;

class MediaNormalizerTest extends TestBase {
    private final MediaNormalizer normalizer = new MediaNormalizer();
    private final IgUser owner = user("42", "natgeo", false);

    @Test
    void testSinglePhoto() {
        RawPost post = post("3001", "Cabc", owner,
                List.of(image("https://cdn/s.jpg", 320, 400), image("https://cdn/l.webp", 1080, 1350)), List.of());

        List<MediaDescriptor> result = normalizer.normalizePost(post, allMedia());

        assertEquals(1, result.size());
        MediaDescriptor d = result.get(0);
        assertEquals("https://cdn/l.webp", d.url());
        assertEquals(MediaType.IMAGE, d.type());
        assertEquals("webp", d.extension());
        assertEquals("natgeo_Cabc_1.webp", d.filename());
        assertFalse(d.metadata().carousel());
        assertNull(d.metadata().carouselIndex());
        assertEquals(ContentKind.POST, d.metadata().contentKind());
        assertEquals(1080, d.metadata().width());
        assertEquals("caption of Cabc", d.metadata().caption());
        assertEquals(10L, d.metadata().likes());
    }

    @Test
    void testCarouselOfThreeImages() {
        RawPost carousel = carousel("3002", "Ccar", owner, List.of(
                child("c1", List.of(image("https://cdn/1.jpg", 640, 640)), List.of()),
                child("c2", List.of(image("https://cdn/2.jpg", 1080, 1080)), List.of()),
                child("c3", List.of(image("https://cdn/3.jpg", 750, 750)), List.of())));

        List<MediaDescriptor> result = normalizer.normalizePost(carousel, allMedia());

        assertEquals(3, result.size());
        assertTrue(result.stream().allMatch(MediaDescriptor::isImage));
        assertTrue(result.stream().allMatch(d -> d.metadata().carousel()));
        assertEquals(List.of(1, 2, 3), result.stream().map(d -> d.metadata().carouselIndex()).toList());
        assertEquals(List.of("natgeo_Ccar_1.jpg", "natgeo_Ccar_2.jpg", "natgeo_Ccar_3.jpg"),
                result.stream().map(MediaDescriptor::filename).toList());
        assertTrue(result.stream().allMatch(d -> "3002".equals(d.metadata().postId())),
                "Children share the parent's post id");
    }

    @Test
    void testSingleChildCarouselIsNotACarousel() {
        RawPost carousel = carousel("3003", "Cone", owner,
                List.of(child("c1", List.of(image("https://cdn/1.jpg", 640, 640)), List.of())));

        MediaDescriptor d = normalizer.normalizePost(carousel, allMedia()).get(0);

        assertFalse(d.metadata().carousel());
        assertNull(d.metadata().carouselIndex());
    }

    @Test
    void testPostVideoEmitsVideoAndCover() {
        List<MediaDescriptor> result = normalizer.normalizePost(reel("5001", "Rvid", owner), allMedia());

        assertEquals(List.of(MediaType.VIDEO, MediaType.IMAGE), result.stream().map(MediaDescriptor::type).toList());
        assertEquals("mp4", result.get(0).extension());
        assertEquals(ContentKind.REEL, result.get(0).metadata().contentKind());
        assertEquals(720, result.get(0).metadata().width(), "Dimensions follow the chosen asset");
    }

    @Test
    void testKindFilters() {
        RawPost mixed = carousel("3004", "Cmix", owner, List.of(
                child("c1", List.of(image("https://cdn/1.jpg", 640, 640)), List.of()),
                child("c2", List.of(image("https://cdn/2.jpg", 640, 640)), List.of(video("https://cdn/2.mp4", 640, 640)))));

        ExtractorOptions videosOnly = new ExtractorOptions(true, false, null, 0);
        ExtractorOptions imagesOnly = new ExtractorOptions(false, true, null, 0);
        ExtractorOptions nothing = new ExtractorOptions(false, false, null, 0);

        List<MediaDescriptor> videos = normalizer.normalizePost(mixed, videosOnly);
        assertEquals(1, videos.size());
        assertEquals(2, videos.get(0).metadata().carouselIndex());

        assertEquals(2, normalizer.normalizePost(mixed, imagesOnly).size());
        assertTrue(normalizer.normalizePost(mixed, nothing).isEmpty());
        assertEquals(3, normalizer.normalizePost(mixed, allMedia()).size(), "At most two descriptors per sub-item");
    }

    @Test
    void testStoryItemsAreEitherOr() {
        RawPost videoItem = storyItem("9001", "42",
                List.of(image("https://cdn/9001.jpg", 1080, 1920)), List.of(video("https://cdn/9001.mp4", 720, 1280)));
        RawPost imageItem = storyItem("9002", "42", List.of(image("https://cdn/9002.jpg", 1080, 1920)), List.of());

        List<MediaDescriptor> fromVideo = normalizer.normalizeStoryItem(videoItem, owner, ContentKind.STORY, allMedia());
        List<MediaDescriptor> fromImage = normalizer.normalizeStoryItem(imageItem, owner, ContentKind.STORY, allMedia());

        assertEquals(1, fromVideo.size());
        assertTrue(fromVideo.get(0).isVideo());
        assertEquals("natgeo", fromVideo.get(0).metadata().username(), "Owner fills in the missing item user");
        assertEquals(1, fromImage.size());
        assertTrue(fromImage.get(0).isImage());
    }

    @Test
    void testStoryVideoItemWithVideosDisabledYieldsNothing() {
        RawPost videoItem = storyItem("9001", "42",
                List.of(image("https://cdn/9001.jpg", 1080, 1920)), List.of(video("https://cdn/9001.mp4", 720, 1280)));

        List<MediaDescriptor> result = normalizer.normalizeStoryItem(videoItem, owner, ContentKind.HIGHLIGHT,
                new ExtractorOptions(false, true, null, 0));

        assertTrue(result.isEmpty());
    }

    @Test
    void testShortcodeDerivedWhenMissing() {
        RawPost item = storyItem("65", "42", List.of(image("https://cdn/x.jpg", 10, 10)), List.of());

        MediaDescriptor d = normalizer.normalizeStoryItem(item, owner, ContentKind.STORY, allMedia()).get(0);

        assertEquals("BB", d.metadata().shortcode());
    }

    @Test
    void testCustomTemplate() {
        ExtractorOptions options = new ExtractorOptions(true, true, "{postId}_{type}.{extension}", 0);
        MediaDescriptor d = normalizer.normalizePost(photo("3001", "Cabc", owner), options).get(0);
        assertEquals("3001_image.jpg", d.filename());
    }
}
