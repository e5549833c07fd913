package com.instagrab.core.download;

import java.nio.file.Path;

/**
 * @param delayMs minimum pause between consecutive batch downloads
 */
public record DownloadOptions(
        Path directory,
        boolean includeVideos,
        boolean includeImages,
        boolean skipExisting,
        long delayMs
) {
    public static final long DEFAULT_DELAY_MS = 1000;

    public DownloadOptions {
        if (directory == null) directory = Path.of("downloads");
        if (delayMs < 0) throw new IllegalArgumentException("delayMs must be >= 0");
    }

    public static DownloadOptions into(Path directory) {
        return new DownloadOptions(directory, true, true, false, DEFAULT_DELAY_MS);
    }

    public DownloadOptions withDelay(long millis) {
        return new DownloadOptions(directory, includeVideos, includeImages, skipExisting, millis);
    }

    public DownloadOptions withSkipExisting(boolean skip) {
        return new DownloadOptions(directory, includeVideos, includeImages, skip, delayMs);
    }

    public DownloadOptions withKinds(boolean videos, boolean images) {
        return new DownloadOptions(directory, videos, images, skipExisting, delayMs);
    }
}
