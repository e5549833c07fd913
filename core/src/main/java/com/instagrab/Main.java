package com.instagrab;

import com.instagrab.api.ExtractorOptions;
import com.instagrab.common.auth.AuthStatus;
import com.instagrab.common.auth.CookieFileCredentialProvider;
import com.instagrab.common.model.MediaDescriptor;
import com.instagrab.core.Kernel;
import com.instagrab.core.client.InstagramApiException;
import com.instagrab.core.config.ConfigManager;
import com.instagrab.core.config.ConfigValidator;
import com.instagrab.core.config.Configuration;
import com.instagrab.core.download.BatchProgress;
import com.instagrab.core.extract.UnsupportedUrlException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;

public class Main {
    private static final Logger logger = LoggerFactory.getLogger(Main.class);

    static final int EXIT_OK = 0;
    static final int EXIT_FAILURES = 1;
    static final int EXIT_USAGE = 2;

    public static void main(String[] args) {
        System.exit(run(args));
    }

    static int run(String[] args) {
        CommandParser.Request request;
        try {
            request = CommandParser.parse(args);
        } catch (IllegalArgumentException e) {
            System.err.println(e.getMessage());
            return EXIT_USAGE;
        }

        logger.info("🚀 Starting InstaGrab for {}", request.url());
        ConfigManager configManager = new ConfigManager(request.configFile());
        Configuration config = applyOverrides(configManager.getConfig(), request);

        try {
            new ConfigValidator().validateAndReport(config);
        } catch (IllegalStateException e) {
            logger.error(e.getMessage());
            return EXIT_USAGE;
        }

        ExtractorOptions options = config.extractorOptions().withMaxItems(request.maxItems());
        try (Kernel kernel = Kernel.builder(config, new CookieFileCredentialProvider(Path.of(config.cookiesFile))).build()) {
            List<MediaDescriptor> items;
            if (request.htmlFile() != null) {
                String html = Files.readString(request.htmlFile(), StandardCharsets.UTF_8);
                items = kernel.scrapePage(html, request.url(), options);
            } else {
                AuthStatus auth = kernel.getAuthStatus();
                if (!auth.loggedIn()) {
                    logger.warn("🔑 No session in {} - API requests will be rejected", config.cookiesFile);
                }
                items = kernel.extractAll(request.url(), options);
            }

            logger.info("🔎 Found {} item(s)", items.size());
            if (request.listOnly()) {
                for (MediaDescriptor item : items) {
                    System.out.println(item.type().label() + "\t" + item.filename() + "\t" + item.url());
                }
                return EXIT_OK;
            }

            BatchProgress result = kernel.downloadBatch(items, config.downloadOptions(), progress -> {
                if (progress.currentFile() != null) {
                    logger.info("⬇️ [{}/{}] {}", progress.completed() + progress.errors().size(), progress.total(), progress.currentFile());
                }
            });

            for (BatchProgress.BatchError error : result.errors()) {
                logger.error("❌ {}: {}", error.filename(), error.error());
            }
            logger.info("🏁 Done: {} of {} downloaded to {}", result.completed(), result.total(), config.downloadPath);
            return result.errors().isEmpty() ? EXIT_OK : EXIT_FAILURES;
        } catch (UnsupportedUrlException e) {
            logger.error(e.getMessage());
            return EXIT_USAGE;
        } catch (InstagramApiException e) {
            logger.error("❌ {} ({})", e.getUserMessage(), e.getMessage());
            return EXIT_FAILURES;
        } catch (IOException e) {
            logger.error("❌ Could not read {}: {}", request.htmlFile(), e.getMessage());
            return EXIT_FAILURES;
        }
    }

    static Configuration applyOverrides(Configuration config, CommandParser.Request request) {
        if (request.directory() != null) config.downloadPath = request.directory().toString();
        if (request.template() != null) config.filenameTemplate = request.template();
        if (request.cookiesFile() != null) config.cookiesFile = request.cookiesFile().toString();
        if (request.includeVideos() != null) config.includeVideos = request.includeVideos();
        if (request.includeImages() != null) config.includeImages = request.includeImages();
        return config;
    }
}
