package com.instagrab.services.database;

import com.instagrab.services.stats.DownloadHistoryEntry;
import com.instagrab.test.TestBase;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Files;
import java.nio.file.Path;

import static org.junit.jupiter.api.Assertions.*;

class DatabaseServiceTest extends TestBase {

    @Test
    void testHistorySurvivesReopen(@TempDir Path dir) {
        String dbPath = dir.resolve("data").resolve("instagrab").toAbsolutePath().toString();

        DatabaseService first = DatabaseService.open(dbPath);
        first.insertHistory(new DownloadHistoryEntry("id-1", "https://cdn/a.jpg", "a.jpg", 1000L, true, null));
        first.shutdown();

        assertTrue(Files.exists(dir.resolve("data").resolve("instagrab.mv.db")), "Database file should be created");

        DatabaseService second = DatabaseService.open(dbPath);
        try {
            assertEquals(1, second.countHistory());
            assertEquals(1, second.loadStats().totalDownloads());
            assertEquals(1000L, second.loadStats().lastDownloadTime());
        } finally {
            second.shutdown();
        }
    }

    @Test
    void testTrimKeepsNewest() {
        DatabaseService db = DatabaseService.inMemory("trim-test");
        try {
            for (int i = 0; i < 4; i++) {
                db.insertHistory(new DownloadHistoryEntry("id-" + i, "u" + i, "f" + i, i, true, null));
            }
            assertEquals(0, db.trimHistory(10));
            assertEquals(2, db.trimHistory(2));
            assertEquals("f3", db.recentHistory(10).get(0).filename());
            assertEquals(2, db.countHistory());
        } finally {
            db.shutdown();
        }
    }
}
