package com.instagrab.api;

import com.instagrab.common.util.FilenameTemplate;

/**
 * Per-extraction switches.
 *
 * @param maxItems item cap, 0 for unlimited
 */
public record ExtractorOptions(
        boolean includeVideos,
        boolean includeImages,
        String filenameTemplate,
        int maxItems
) {
    public ExtractorOptions {
        if (maxItems < 0) throw new IllegalArgumentException("maxItems must be >= 0");
        if (filenameTemplate == null || filenameTemplate.isBlank()) filenameTemplate = FilenameTemplate.DEFAULT_TEMPLATE;
    }

    public static ExtractorOptions defaults() {
        return new ExtractorOptions(true, true, FilenameTemplate.DEFAULT_TEMPLATE, 0);
    }

    public ExtractorOptions withMaxItems(int cap) {
        return new ExtractorOptions(includeVideos, includeImages, filenameTemplate, cap);
    }

    public FilenameTemplate template() {
        return new FilenameTemplate(filenameTemplate);
    }

    public boolean isCapped() {
        return maxItems > 0;
    }
}
