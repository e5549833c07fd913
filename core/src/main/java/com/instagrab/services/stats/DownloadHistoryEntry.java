package com.instagrab.services.stats;

/**
 * @param timestamp epoch milliseconds
 * @param error     null for successful downloads
 */
public record DownloadHistoryEntry(String id, String url, String filename, long timestamp, boolean success, String error) {
}
