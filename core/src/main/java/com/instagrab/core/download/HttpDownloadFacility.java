package com.instagrab.core.download;

import com.instagrab.api.DownloadFacility;
import com.instagrab.common.util.HttpUtils;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.InputStream;
import java.io.OutputStream;
import java.net.HttpURLConnection;
import java.net.URI;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.util.Locale;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.CancellationException;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.atomic.AtomicLong;
import java.util.function.Supplier;
import java.util.stream.Collectors;

/**
 * Streams files over {@link HttpURLConnection} on a small worker pool. Data is written to a
 * {@code .part} file next to the target and moved into place once complete, so a cancelled or
 * failed transfer never leaves a truncated file under the final name.
 */
public class HttpDownloadFacility implements DownloadFacility, AutoCloseable {
    private static final Logger logger = LoggerFactory.getLogger(HttpDownloadFacility.class);
    private static final String PART_SUFFIX = ".part";

    private final ExecutorService executor;
    private final Supplier<String> cookieHeader;
    private final Map<Long, Future<Path>> downloads = new ConcurrentHashMap<>();
    private final AtomicLong ids = new AtomicLong();
    private final int connectTimeoutMs;
    private final int readTimeoutMs;

    /**
     * @param cookieHeader session cookies for provider-hosted URLs, may return null
     */
    public HttpDownloadFacility(int threads, Supplier<String> cookieHeader) {
        this(threads, cookieHeader, 15_000, 30_000);
    }

    public HttpDownloadFacility(int threads, Supplier<String> cookieHeader, int connectTimeoutMs, int readTimeoutMs) {
        AtomicInteger counter = new AtomicInteger();
        this.executor = Executors.newFixedThreadPool(threads, r -> {
            Thread t = new Thread(r, "download-" + counter.incrementAndGet());
            t.setDaemon(true);
            return t;
        });
        this.cookieHeader = cookieHeader != null ? cookieHeader : () -> null;
        this.connectTimeoutMs = connectTimeoutMs;
        this.readTimeoutMs = readTimeoutMs;
    }

    @Override
    public long submit(String url, Path target) throws DownloadFailedException {
        if (url == null || !(url.startsWith("http://") || url.startsWith("https://"))) {
            throw new DownloadFailedException("Unsupported URL: " + url);
        }
        long id = ids.incrementAndGet();
        try {
            downloads.put(id, executor.submit(() -> transfer(url, target)));
        } catch (RuntimeException e) {
            throw new DownloadFailedException("Could not schedule download of " + url, e);
        }
        logger.debug("Submitted #{} {}", id, url);
        return id;
    }

    @Override
    public Path await(long downloadId) throws DownloadFailedException, DownloadInterruptedException {
        Future<Path> future = downloads.get(downloadId);
        if (future == null) throw new DownloadFailedException("Unknown download #" + downloadId);
        try {
            return future.get();
        } catch (CancellationException e) {
            throw new DownloadInterruptedException("Download #" + downloadId + " was cancelled");
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new DownloadInterruptedException("Interrupted while waiting for download #" + downloadId, e);
        } catch (ExecutionException e) {
            Throwable cause = e.getCause();
            if (cause instanceof DownloadInterruptedException di) throw di;
            if (cause instanceof DownloadFailedException df) throw df;
            throw new DownloadFailedException(cause.getMessage() != null ? cause.getMessage() : cause.toString(), cause);
        } finally {
            if (future.isDone()) downloads.remove(downloadId);
        }
    }

    @Override
    public boolean cancel(long downloadId) {
        Future<Path> future = downloads.get(downloadId);
        if (future == null || future.isDone()) return false;
        boolean cancelled = future.cancel(true);
        if (cancelled) logger.info("Cancelled download #{}", downloadId);
        return cancelled;
    }

    @Override
    public Set<Long> inProgress() {
        return downloads.entrySet().stream()
                .filter(e -> !e.getValue().isDone())
                .map(Map.Entry::getKey)
                .collect(Collectors.toUnmodifiableSet());
    }

    @Override
    public void close() {
        executor.shutdownNow();
    }

    private Path transfer(String url, Path target) throws IOException {
        Path parent = target.toAbsolutePath().getParent();
        if (parent != null) Files.createDirectories(parent);
        Path part = target.resolveSibling(target.getFileName() + PART_SUFFIX);

        HttpURLConnection conn = (HttpURLConnection) URI.create(url).toURL().openConnection();
        try {
            conn.setRequestMethod("GET");
            conn.setConnectTimeout(connectTimeoutMs);
            conn.setReadTimeout(readTimeoutMs);
            conn.setRequestProperty("User-Agent", HttpUtils.DEFAULT_USER_AGENT);
            conn.setRequestProperty("Referer", "https://www.instagram.com/");
            String cookies = isProviderHost(conn.getURL().getHost()) ? cookieHeader.get() : null;
            if (cookies != null && !cookies.isEmpty()) conn.setRequestProperty("Cookie", cookies);

            int code = conn.getResponseCode();
            if (code != HttpURLConnection.HTTP_OK) {
                throw new DownloadFailedException("HTTP " + code + " for " + url);
            }

            try (InputStream in = conn.getInputStream();
                 OutputStream out = Files.newOutputStream(part)) {
                byte[] buffer = new byte[8192];
                int count;
                while ((count = in.read(buffer)) != -1) {
                    if (Thread.currentThread().isInterrupted()) {
                        throw new DownloadInterruptedException("Download of " + target.getFileName() + " cancelled");
                    }
                    out.write(buffer, 0, count);
                }
            }
            return commit(part, target);
        } catch (IOException e) {
            Files.deleteIfExists(part);
            throw e;
        } finally {
            conn.disconnect();
        }
    }

    /**
     * Moves a finished part file into place unless the download was cancelled after the last read.
     */
    static Path commit(Path part, Path target) throws IOException {
        if (Thread.currentThread().isInterrupted()) {
            throw new DownloadInterruptedException("Download of " + target.getFileName() + " cancelled");
        }
        Files.move(part, target, StandardCopyOption.REPLACE_EXISTING);
        return target;
    }

    static boolean isProviderHost(String host) {
        if (host == null) return false;
        String h = host.toLowerCase(Locale.ROOT);
        return h.equals("instagram.com") || h.endsWith(".instagram.com")
                || h.endsWith(".cdninstagram.com") || h.endsWith(".fbcdn.net");
    }
}
