package com.instagrab.core.config;

import com.instagrab.api.ExtractorOptions;
import com.instagrab.common.util.FilenameTemplate;
import com.instagrab.core.download.DownloadOptions;
import com.instagrab.core.pagination.DelayWindow;

import java.nio.file.Path;

/**
 * Contents of config.json. Fields are public so Gson can map them directly; missing keys keep
 * the defaults below.
 */
public class Configuration {
    // --- General ---
    public boolean debugMode = false;
    public String downloadPath = "downloads";
    public String filenameTemplate = FilenameTemplate.DEFAULT_TEMPLATE;

    // --- Media selection ---
    public boolean includeVideos = true;
    public boolean includeImages = true;
    public boolean skipExisting = true;

    // --- Pacing (milliseconds) ---
    public long profileDelayMinMs = 3000;
    public long profileDelayMaxMs = 6000;
    public long savedDelayMinMs = 1500;
    public long savedDelayMaxMs = 3000;
    public long downloadDelayMs = DownloadOptions.DEFAULT_DELAY_MS;
    public int downloadThreads = 2;

    // --- Storage ---
    public int historyLimit = 1000;
    public String cookiesFile = "cookies.txt";
    public String databasePath = "data/instagrab";

    public DelayWindow profileDelay() {
        return new DelayWindow(profileDelayMinMs, profileDelayMaxMs);
    }

    public DelayWindow savedDelay() {
        return new DelayWindow(savedDelayMinMs, savedDelayMaxMs);
    }

    public ExtractorOptions extractorOptions() {
        return new ExtractorOptions(includeVideos, includeImages, filenameTemplate, 0);
    }

    public DownloadOptions downloadOptions() {
        return new DownloadOptions(Path.of(downloadPath), includeVideos, includeImages, skipExisting, downloadDelayMs);
    }
}
