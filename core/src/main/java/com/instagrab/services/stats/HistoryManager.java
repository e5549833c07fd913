package com.instagrab.services.stats;

import com.instagrab.services.database.DatabaseService;
import org.jdbi.v3.core.JdbiException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.util.List;
import java.util.UUID;

/**
 * HistoryManager - Records every download attempt and keeps the newest {@code limit} entries.
 * Lifetime counters are kept separately and survive trimming.
 */
public class HistoryManager {
    private static final Logger logger = LoggerFactory.getLogger(HistoryManager.class);
    public static final int DEFAULT_LIMIT = 1000;

    private final DatabaseService databaseService;
    private final int limit;
    private final Clock clock;

    public HistoryManager(DatabaseService databaseService, int limit) {
        this(databaseService, limit, Clock.systemUTC());
    }

    public HistoryManager(DatabaseService databaseService, int limit, Clock clock) {
        if (limit < 1) throw new IllegalArgumentException("History limit must be positive");
        this.databaseService = databaseService;
        this.limit = limit;
        this.clock = clock;
        logger.debug("HistoryManager initialized (limit {})", limit);
    }

    /**
     * Records one attempt. A storage failure is logged and does not affect the download outcome.
     */
    public DownloadHistoryEntry record(String url, String filename, boolean success, String error) {
        DownloadHistoryEntry entry = new DownloadHistoryEntry(
                UUID.randomUUID().toString(), url, filename, clock.millis(), success, success ? null : error);
        try {
            databaseService.insertHistory(entry);
            int removed = databaseService.trimHistory(limit);
            if (removed > 0) logger.debug("Trimmed {} old history entries", removed);
        } catch (JdbiException e) {
            logger.warn("⚠️ Could not record history for {}: {}", filename, e.getMessage());
        }
        return entry;
    }

    /** Newest first, at most {@code max} entries. */
    public List<DownloadHistoryEntry> getHistory(int max) {
        return databaseService.recentHistory(Math.min(max, limit));
    }

    public List<DownloadHistoryEntry> getHistory() {
        return getHistory(limit);
    }

    public DownloadStats getStats() {
        return databaseService.loadStats();
    }

    public boolean isDownloaded(String url) {
        if (url == null || url.isEmpty()) return false;
        return databaseService.hasSucceeded(url);
    }

    public void clear() {
        databaseService.clearHistory();
        logger.info("History cleared");
    }

    public int getLimit() {
        return limit;
    }
}
