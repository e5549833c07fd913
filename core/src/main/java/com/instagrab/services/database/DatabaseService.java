package com.instagrab.services.database;

import com.instagrab.services.stats.DownloadHistoryEntry;
import com.instagrab.services.stats.DownloadStats;
import org.jdbi.v3.core.Jdbi;
import org.jdbi.v3.core.JdbiException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.File;
import java.util.List;

/**
 * DatabaseService - H2 embedded database for the download history and lifetime counters.
 */
public class DatabaseService {
    private static final Logger logger = LoggerFactory.getLogger(DatabaseService.class);
    private final Jdbi jdbi;
    private final String jdbcUrl;

    private DatabaseService(String jdbcUrl) {
        this.jdbcUrl = jdbcUrl;
        this.jdbi = Jdbi.create(jdbcUrl);
        initializeSchema();
        logger.info("🗄️ Database initialized: {}", jdbcUrl);
    }

    /**
     * File-backed database, e.g. {@code data/instagrab} (H2 appends {@code .mv.db}).
     */
    public static DatabaseService open(String dbPath) {
        File parent = new File(dbPath).getAbsoluteFile().getParentFile();
        if (parent != null) parent.mkdirs();

        // ./ prefix is required by H2 2.x for relative paths
        String location = new File(dbPath).isAbsolute() ? dbPath : "./" + dbPath;
        return new DatabaseService("jdbc:h2:" + location +
                ";DB_CLOSE_DELAY=-1" +
                ";DATABASE_TO_UPPER=FALSE" +
                ";AUTO_SERVER=TRUE");
    }

    /** Private in-memory database, gone once {@link #shutdown()} is called. */
    public static DatabaseService inMemory(String name) {
        return new DatabaseService("jdbc:h2:mem:" + name + ";DB_CLOSE_DELAY=-1;DATABASE_TO_UPPER=FALSE");
    }

    private void initializeSchema() {
        jdbi.useHandle(handle -> {
            handle.execute("""
                        CREATE TABLE IF NOT EXISTS download_history (
                            seq BIGINT AUTO_INCREMENT PRIMARY KEY,
                            id VARCHAR(64) NOT NULL,
                            url VARCHAR(4096),
                            filename VARCHAR(1024),
                            recorded_at BIGINT NOT NULL,
                            success BOOLEAN NOT NULL,
                            error VARCHAR(4096)
                        )
                    """);
            handle.execute("CREATE INDEX IF NOT EXISTS idx_history_url ON download_history(url)");

            handle.execute("""
                        CREATE TABLE IF NOT EXISTS download_stats (
                            id INT PRIMARY KEY,
                            total BIGINT NOT NULL,
                            successful BIGINT NOT NULL,
                            failed BIGINT NOT NULL,
                            last_download_time BIGINT
                        )
                    """);
            Integer rows = handle.createQuery("SELECT COUNT(*) FROM download_stats WHERE id = 1")
                    .mapTo(Integer.class)
                    .one();
            if (rows == 0) {
                handle.execute("INSERT INTO download_stats (id, total, successful, failed) VALUES (1, 0, 0, 0)");
            }
        });
        logger.debug("✅ Database schema initialized");
    }

    /**
     * Stores an entry and bumps the counters in one transaction.
     */
    public void insertHistory(DownloadHistoryEntry entry) {
        jdbi.useTransaction(handle -> {
            handle.createUpdate("""
                        INSERT INTO download_history (id, url, filename, recorded_at, success, error)
                        VALUES (?, ?, ?, ?, ?, ?)
                    """)
                    .bind(0, entry.id())
                    .bind(1, entry.url())
                    .bind(2, entry.filename())
                    .bind(3, entry.timestamp())
                    .bind(4, entry.success())
                    .bind(5, entry.error())
                    .execute();

            handle.createUpdate("""
                        UPDATE download_stats
                        SET total = total + 1,
                            successful = successful + ?,
                            failed = failed + ?,
                            last_download_time = ?
                        WHERE id = 1
                    """)
                    .bind(0, entry.success() ? 1 : 0)
                    .bind(1, entry.success() ? 0 : 1)
                    .bind(2, entry.timestamp())
                    .execute();
        });
    }

    /**
     * Deletes everything but the newest {@code keep} entries.
     *
     * @return number of rows removed
     */
    public int trimHistory(int keep) {
        return jdbi.withHandle(handle -> {
            List<Long> cutoff = handle.createQuery("SELECT seq FROM download_history ORDER BY seq DESC LIMIT 1 OFFSET ?")
                    .bind(0, keep)
                    .mapTo(Long.class)
                    .list();
            if (cutoff.isEmpty()) return 0;
            return handle.createUpdate("DELETE FROM download_history WHERE seq <= ?")
                    .bind(0, cutoff.get(0))
                    .execute();
        });
    }

    /** Newest first. */
    public List<DownloadHistoryEntry> recentHistory(int limit) {
        return jdbi.withHandle(handle -> handle.createQuery("""
                            SELECT id, url, filename, recorded_at, success, error
                            FROM download_history
                            ORDER BY seq DESC
                            LIMIT ?
                        """)
                .bind(0, limit)
                .map((rs, ctx) -> new DownloadHistoryEntry(
                        rs.getString("id"),
                        rs.getString("url"),
                        rs.getString("filename"),
                        rs.getLong("recorded_at"),
                        rs.getBoolean("success"),
                        rs.getString("error")))
                .list());
    }

    public int countHistory() {
        return jdbi.withHandle(handle -> handle.createQuery("SELECT COUNT(*) FROM download_history")
                .mapTo(Integer.class)
                .one());
    }

    public boolean hasSucceeded(String url) {
        return jdbi.withHandle(handle -> {
            Integer count = handle.createQuery("SELECT COUNT(*) FROM download_history WHERE url = ? AND success = TRUE")
                    .bind(0, url)
                    .mapTo(Integer.class)
                    .one();
            return count > 0;
        });
    }

    public DownloadStats loadStats() {
        return jdbi.withHandle(handle -> handle.createQuery(
                        "SELECT total, successful, failed, last_download_time FROM download_stats WHERE id = 1")
                .map((rs, ctx) -> {
                    long last = rs.getLong("last_download_time");
                    boolean never = rs.wasNull();
                    return new DownloadStats(
                            rs.getLong("total"),
                            rs.getLong("successful"),
                            rs.getLong("failed"),
                            never ? null : last);
                })
                .findOne()
                .orElse(DownloadStats.empty()));
    }

    /** Drops the history list and resets the counters. */
    public void clearHistory() {
        jdbi.useTransaction(handle -> {
            handle.execute("DELETE FROM download_history");
            handle.execute("UPDATE download_stats SET total = 0, successful = 0, failed = 0, last_download_time = NULL WHERE id = 1");
        });
    }

    public void shutdown() {
        try {
            jdbi.useHandle(handle -> handle.execute("SHUTDOWN"));
        } catch (JdbiException e) {
            logger.warn("Error shutting down database: {}", e.getMessage());
        }
        logger.info("✅ Database shutdown complete ({})", jdbcUrl);
    }
}
