package com.instagrab.core.download;

import java.nio.file.Path;

/**
 * Outcome of a single download. Failures are reported here instead of thrown.
 *
 * @param downloadId facility id, null when nothing was submitted
 */
public record DownloadResult(boolean success, Long downloadId, Path path, String error) {

    public static DownloadResult success(Long downloadId, Path path) {
        return new DownloadResult(true, downloadId, path, null);
    }

    public static DownloadResult failure(Long downloadId, Path path, String error) {
        return new DownloadResult(false, downloadId, path, error);
    }
}
