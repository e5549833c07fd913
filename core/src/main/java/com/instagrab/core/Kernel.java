package com.instagrab.core;

import com.google.gson.Gson;
import com.instagrab.api.CredentialProvider;
import com.instagrab.api.DownloadFacility;
import com.instagrab.api.ExtractorOptions;
import com.instagrab.api.ProgressListener;
import com.instagrab.common.auth.AuthStatus;
import com.instagrab.common.auth.SessionManager;
import com.instagrab.common.model.MediaDescriptor;
import com.instagrab.core.client.AuthenticationFailedException;
import com.instagrab.core.client.HttpTransport;
import com.instagrab.core.client.InstagramClient;
import com.instagrab.core.client.UrlConnectionTransport;
import com.instagrab.core.config.Configuration;
import com.instagrab.core.dom.DomScraper;
import com.instagrab.core.download.BatchProgress;
import com.instagrab.core.download.DownloadManager;
import com.instagrab.core.download.DownloadOptions;
import com.instagrab.core.download.DownloadQueue;
import com.instagrab.core.download.DownloadResult;
import com.instagrab.core.download.HttpDownloadFacility;
import com.instagrab.core.extract.ExtractorRegistry;
import com.instagrab.core.media.MediaNormalizer;
import com.instagrab.core.pagination.Sleeper;
import com.instagrab.services.database.DatabaseService;
import com.instagrab.services.stats.HistoryManager;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.util.List;
import java.util.Objects;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.stream.Stream;

/**
 * Composition root and the boundary a shell (CLI, UI) talks to.
 * <p>
 * One kernel corresponds to one configured session. Extraction is pull-based; downloads run on the
 * caller's thread unless {@link #downloadBatchAsync} is used.
 */
public class Kernel implements AutoCloseable {
    private static final Logger logger = LoggerFactory.getLogger(Kernel.class);

    private final Configuration configuration;
    private final DatabaseService databaseService;
    private final HistoryManager historyManager;
    private final SessionManager sessionManager;
    private final InstagramClient client;
    private final ExtractorRegistry registry;
    private final DomScraper domScraper;
    private final DownloadFacility downloadFacility;
    private final DownloadManager downloadManager;
    private final DownloadQueue downloadQueue;
    private final ExecutorService batchExecutor;

    private Kernel(Builder builder) {
        this.configuration = builder.configuration;
        this.sessionManager = new SessionManager(builder.credentialProvider);

        this.databaseService = builder.databaseService != null
                ? builder.databaseService
                : DatabaseService.open(configuration.databasePath);
        this.historyManager = new HistoryManager(databaseService, configuration.historyLimit, builder.clock);

        Gson gson = new Gson();
        HttpTransport transport = builder.transport != null ? builder.transport : new UrlConnectionTransport();
        this.client = new InstagramClient(sessionManager, transport, gson);

        MediaNormalizer normalizer = new MediaNormalizer();
        this.registry = ExtractorRegistry.createDefault(client, normalizer,
                configuration.profileDelay(), configuration.savedDelay(), builder.sleeper);
        this.domScraper = new DomScraper(normalizer, gson, builder.clock);

        this.downloadFacility = builder.downloadFacility != null
                ? builder.downloadFacility
                : new HttpDownloadFacility(configuration.downloadThreads, this::sessionCookieHeader);
        this.downloadManager = new DownloadManager(downloadFacility, historyManager, builder.sleeper);
        this.downloadQueue = new DownloadQueue(downloadManager);

        this.batchExecutor = Executors.newSingleThreadExecutor(r -> {
            Thread t = new Thread(r, "BatchWorker");
            t.setDaemon(true);
            return t;
        });
        logger.info("⚛️ Kernel ready ({} extractors)", registry.getExtractors().size());
    }

    public static Builder builder(Configuration configuration, CredentialProvider credentialProvider) {
        return new Builder(configuration, credentialProvider);
    }

    // ========== EXTRACTION ==========

    /**
     * Lazy descriptor stream for a URL. Nothing is requested until the stream is consumed.
     */
    public Stream<MediaDescriptor> extract(String url, ExtractorOptions options) {
        return registry.extract(url, options);
    }

    public List<MediaDescriptor> extractAll(String url, ExtractorOptions options) {
        try (Stream<MediaDescriptor> stream = extract(url, options)) {
            return stream.toList();
        }
    }

    /**
     * Fallback for when the API refuses us: extracts from a page the shell already rendered.
     */
    public List<MediaDescriptor> scrapePage(String html, String pageUrl, ExtractorOptions options) {
        return domScraper.scrape(html, pageUrl, options);
    }

    public boolean canExtract(String url) {
        return registry.canExtract(url);
    }

    // ========== DOWNLOADS ==========

    public DownloadResult download(MediaDescriptor descriptor, DownloadOptions options) {
        return downloadManager.download(descriptor, options);
    }

    public BatchProgress downloadBatch(List<MediaDescriptor> items, DownloadOptions options, ProgressListener listener) {
        return downloadManager.downloadBatch(items, options, listener);
    }

    /**
     * Runs the batch on the kernel's batch thread. Batches submitted while another is running wait
     * for it, keeping a single download flow per session.
     */
    public CompletableFuture<BatchProgress> downloadBatchAsync(List<MediaDescriptor> items, DownloadOptions options,
                                                               ProgressListener listener) {
        List<MediaDescriptor> snapshot = List.copyOf(items);
        return CompletableFuture.supplyAsync(() -> downloadManager.downloadBatch(snapshot, options, listener), batchExecutor);
    }

    public int cancelAll() {
        return downloadManager.cancelAll();
    }

    // ========== SESSION ==========

    public AuthStatus getAuthStatus() {
        return sessionManager.getAuthStatus();
    }

    public void onCredentialsChanged() {
        sessionManager.onCredentialsChanged();
    }

    private String sessionCookieHeader() {
        try {
            return sessionManager.current().cookieHeader();
        } catch (AuthenticationFailedException e) {
            logger.debug("Downloading without session cookies: {}", e.getMessage());
            return null;
        }
    }

    // ========== GETTERS ==========

    public Configuration getConfiguration() {
        return configuration;
    }

    public HistoryManager getHistoryManager() {
        return historyManager;
    }

    public DownloadQueue getDownloadQueue() {
        return downloadQueue;
    }

    public ExtractorRegistry getRegistry() {
        return registry;
    }

    public InstagramClient getClient() {
        return client;
    }

    @Override
    public void close() {
        downloadQueue.pause();
        batchExecutor.shutdownNow();
        if (downloadFacility instanceof AutoCloseable closeable) {
            try {
                closeable.close();
            } catch (Exception e) {
                logger.warn("Error closing download facility: {}", e.getMessage());
            }
        }
        databaseService.shutdown();
        logger.info("Kernel stopped.");
    }

    public static final class Builder {
        private final Configuration configuration;
        private final CredentialProvider credentialProvider;
        private HttpTransport transport;
        private DownloadFacility downloadFacility;
        private DatabaseService databaseService;
        private Sleeper sleeper = Sleeper.SYSTEM;
        private Clock clock = Clock.systemUTC();

        private Builder(Configuration configuration, CredentialProvider credentialProvider) {
            this.configuration = Objects.requireNonNull(configuration, "configuration");
            this.credentialProvider = Objects.requireNonNull(credentialProvider, "credentialProvider");
        }

        public Builder transport(HttpTransport transport) {
            this.transport = transport;
            return this;
        }

        public Builder downloadFacility(DownloadFacility downloadFacility) {
            this.downloadFacility = downloadFacility;
            return this;
        }

        public Builder databaseService(DatabaseService databaseService) {
            this.databaseService = databaseService;
            return this;
        }

        public Builder sleeper(Sleeper sleeper) {
            this.sleeper = Objects.requireNonNull(sleeper, "sleeper");
            return this;
        }

        public Builder clock(Clock clock) {
            this.clock = Objects.requireNonNull(clock, "clock");
            return this;
        }

        public Kernel build() {
            return new Kernel(this);
        }
    }
}
