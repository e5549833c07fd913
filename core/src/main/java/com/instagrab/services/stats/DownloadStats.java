package com.instagrab.services.stats;

/**
 * Lifetime counters. Unlike the history list these are never trimmed.
 *
 * @param lastDownloadTime epoch milliseconds of the most recent attempt, null if there was none
 */
public record DownloadStats(long totalDownloads, long successfulDownloads, long failedDownloads, Long lastDownloadTime) {

    public static DownloadStats empty() {
        return new DownloadStats(0, 0, 0, null);
    }
}
