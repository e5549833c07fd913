package com.instagrab.common.util;

import com.instagrab.common.model.ContentKind;
import com.instagrab.common.model.MediaMetadata;
import com.instagrab.common.model.MediaType;
import com.instagrab.test.TestBase;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

class FilenameTemplateTest extends TestBase {

    private static MediaMetadata metadata(String username, String shortcode, Integer index) {
        return new MediaMetadata("3001", shortcode, username, 1700000000L, null, 1080, 1080,
                index != null, index, ContentKind.POST, null, null);
    }

    @Test
    void testDefaultTemplate() {
        String name = FilenameTemplate.defaultTemplate().render(metadata("natgeo", "Cabc123", null), "jpg", MediaType.IMAGE);
        assertEquals("natgeo_Cabc123_1.jpg", name);
    }

    @Test
    void testCarouselIndexIsRendered() {
        String name = FilenameTemplate.defaultTemplate().render(metadata("natgeo", "Cabc123", 3), "mp4", MediaType.VIDEO);
        assertEquals("natgeo_Cabc123_3.mp4", name);
    }

    @Test
    void testAllPlaceholders() {
        FilenameTemplate template = new FilenameTemplate("{date}-{timestamp}-{postId}-{type}-{shortcode}.{extension}");
        String name = template.render(metadata("natgeo", "Cabc", null), "jpg", MediaType.IMAGE);
        assertEquals("20231114-1700000000-3001-image-Cabc.jpg", name);
    }

    @Test
    void testEveryOccurrenceIsReplaced() {
        FilenameTemplate template = new FilenameTemplate("{shortcode}/{shortcode}.{extension}");
        assertEquals("X1/X1.jpg", template.render(metadata("u", "X1", null), "jpg", MediaType.IMAGE));
    }

    @Test
    void testMissingValuesRenderUnknown() {
        String name = FilenameTemplate.defaultTemplate().render(metadata(null, null, null), "jpg", MediaType.IMAGE);
        assertEquals("unknown_unknown_1.jpg", name);
        assertEquals("unknown", FilenameTemplate.formatDate(null));
    }

    @Test
    void testUsernameIsSanitized() {
        String name = FilenameTemplate.defaultTemplate().render(metadata("a b/c", "X", null), "jpg", MediaType.IMAGE);
        assertEquals("a_b_c_X_1.jpg", name);
    }

    @Test
    void testBlankTemplateFallsBackToDefault() {
        assertEquals(FilenameTemplate.DEFAULT_TEMPLATE, new FilenameTemplate("  ").getTemplate());
    }

    @Test
    void testSanitize() {
        assertEquals("hello_world", FilenameTemplate.sanitize("  hello:*world  "));
        assertEquals("a_b", FilenameTemplate.sanitize("a???b"));
        assertNull(FilenameTemplate.sanitize(null));
        assertEquals(200, FilenameTemplate.sanitize("x".repeat(500)).length());
    }
}
