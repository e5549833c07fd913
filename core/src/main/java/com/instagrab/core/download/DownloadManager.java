package com.instagrab.core.download;

import com.instagrab.api.DownloadFacility;
import com.instagrab.api.ProgressListener;
import com.instagrab.common.model.MediaDescriptor;
import com.instagrab.core.pagination.Sleeper;
import com.instagrab.services.stats.HistoryManager;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.InvalidPathException;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * Materializes descriptors on disk through a {@link DownloadFacility}.
 * <p>
 * Single downloads never throw for transfer problems: the outcome is returned as a
 * {@link DownloadResult} and written to the history either way. Batches run strictly one item at a
 * time with a fixed pause in between and keep going past failed items.
 */
public class DownloadManager {
    private static final Logger logger = LoggerFactory.getLogger(DownloadManager.class);

    private final DownloadFacility facility;
    private final HistoryManager historyManager;
    private final Sleeper sleeper;

    public DownloadManager(DownloadFacility facility, HistoryManager historyManager) {
        this(facility, historyManager, Sleeper.SYSTEM);
    }

    public DownloadManager(DownloadFacility facility, HistoryManager historyManager, Sleeper sleeper) {
        this.facility = Objects.requireNonNull(facility, "facility");
        this.historyManager = Objects.requireNonNull(historyManager, "historyManager");
        this.sleeper = Objects.requireNonNull(sleeper, "sleeper");
    }

    public DownloadResult download(MediaDescriptor descriptor, DownloadOptions options) {
        Path target;
        try {
            target = resolveTarget(options.directory(), descriptor.filename());
        } catch (DownloadFailedException e) {
            logger.error("❌ {}", e.getMessage());
            historyManager.record(descriptor.url(), descriptor.filename(), false, e.getMessage());
            return DownloadResult.failure(null, null, e.getMessage());
        }

        DownloadTask task = new DownloadTask(descriptor, target);
        DownloadResult result = execute(task, options);
        historyManager.record(descriptor.url(), descriptor.filename(), result.success(), result.error());
        return result;
    }

    private DownloadResult execute(DownloadTask task, DownloadOptions options) {
        Path target = task.getTarget();
        if (options.skipExisting() && existsNonEmpty(target)) {
            task.markCompleted();
            logger.info("⏭️ Already on disk: {}", target.getFileName());
            return DownloadResult.success(null, target);
        }

        Long id = null;
        try {
            id = facility.submit(task.getDescriptor().url(), target);
            task.markDownloading(id);
            Path written = facility.await(id);
            task.markCompleted();
            logger.info("✅ Downloaded {}", written.getFileName());
            return DownloadResult.success(id, written);
        } catch (DownloadFailedException | DownloadInterruptedException e) {
            task.markFailed(e.getMessage());
            logger.error("❌ Download failed: {} | URL: {} | {}", target.getFileName(), task.getDescriptor().url(), e.getMessage());
            return DownloadResult.failure(id, target, e.getMessage());
        }
    }

    /**
     * Downloads the items that pass the kind filter, in order.
     *
     * @return the final progress; {@code completed} counts successes only
     */
    public BatchProgress downloadBatch(List<MediaDescriptor> items, DownloadOptions options, ProgressListener listener) {
        ProgressListener progress = listener != null ? listener : ProgressListener.NONE;
        List<MediaDescriptor> selected = items.stream()
                .filter(d -> d.isVideo() ? options.includeVideos() : options.includeImages())
                .toList();

        int total = selected.size();
        int completed = 0;
        List<BatchProgress.BatchError> errors = new ArrayList<>();
        logger.info("📦 Batch of {} item(s) ({} filtered out)", total, items.size() - total);

        for (int i = 0; i < total; i++) {
            MediaDescriptor item = selected.get(i);

            if (i > 0 && options.delayMs() > 0) {
                try {
                    sleeper.sleep(options.delayMs());
                } catch (InterruptedException e) {
                    Thread.currentThread().interrupt();
                    logger.warn("Batch interrupted after {} of {} item(s)", i, total);
                    break;
                }
            }

            progress.onProgress(new BatchProgress(completed, total, item.filename(), errors));

            DownloadResult result = download(item, options);
            if (result.success()) {
                completed++;
            } else {
                errors.add(new BatchProgress.BatchError(item.filename(), result.error()));
            }

            progress.onProgress(new BatchProgress(completed, total, item.filename(), errors));
        }

        logger.info("📦 Batch finished: {}/{} succeeded, {} failed", completed, total, errors.size());
        return new BatchProgress(completed, total, null, errors);
    }

    /**
     * Cancels downloads already handed to the facility. Items of a running batch that were not
     * submitted yet are not affected.
     *
     * @return number of downloads cancelled
     */
    public int cancelAll() {
        int cancelled = 0;
        for (Long id : facility.inProgress()) {
            if (facility.cancel(id)) cancelled++;
        }
        if (cancelled > 0) logger.warn("🛑 Cancelled {} download(s)", cancelled);
        return cancelled;
    }

    /**
     * Resolves a (possibly nested) templated filename under the download directory.
     */
    static Path resolveTarget(Path directory, String filename) throws DownloadFailedException {
        if (filename == null || filename.isBlank()) {
            throw new DownloadFailedException("Empty filename");
        }
        Path base = directory.toAbsolutePath().normalize();
        Path target;
        try {
            target = base.resolve(filename).normalize();
        } catch (InvalidPathException e) {
            throw new DownloadFailedException("Invalid filename: " + filename, e);
        }
        if (!target.startsWith(base) || target.equals(base)) {
            throw new DownloadFailedException("Filename escapes the download directory: " + filename);
        }
        return target;
    }

    private static boolean existsNonEmpty(Path file) {
        try {
            return Files.isRegularFile(file) && Files.size(file) > 0;
        } catch (IOException e) {
            logger.debug("Could not stat {}: {}", file, e.getMessage());
            return false;
        }
    }
}
