package com.instagrab.core.download;

import com.instagrab.common.model.MediaDescriptor;

import java.nio.file.Path;
import java.time.Instant;

/**
 * One descriptor on its way to disk.
 */
public class DownloadTask {
    private final MediaDescriptor descriptor;
    private final Path target;
    private final Instant createdAt;

    private DownloadStatus status = DownloadStatus.PENDING;
    private Long downloadId;
    private Instant startedAt;
    private Instant finishedAt;
    private String error;

    public DownloadTask(MediaDescriptor descriptor, Path target) {
        this.descriptor = descriptor;
        this.target = target;
        this.createdAt = Instant.now();
    }

    public synchronized void markDownloading(long id) {
        transition(DownloadStatus.DOWNLOADING);
        this.downloadId = id;
        this.startedAt = Instant.now();
    }

    public synchronized void markCompleted() {
        transition(DownloadStatus.COMPLETED);
        this.finishedAt = Instant.now();
    }

    public synchronized void markFailed(String error) {
        transition(DownloadStatus.FAILED);
        this.error = error;
        this.finishedAt = Instant.now();
    }

    private void transition(DownloadStatus next) {
        if (!status.canTransitionTo(next)) {
            throw new IllegalStateException("Illegal status change " + status + " -> " + next + " for " + target);
        }
        status = next;
    }

    public MediaDescriptor getDescriptor() {
        return descriptor;
    }

    public Path getTarget() {
        return target;
    }

    public synchronized DownloadStatus getStatus() {
        return status;
    }

    public synchronized Long getDownloadId() {
        return downloadId;
    }

    public Instant getCreatedAt() {
        return createdAt;
    }

    public synchronized Instant getStartedAt() {
        return startedAt;
    }

    public synchronized Instant getFinishedAt() {
        return finishedAt;
    }

    public synchronized String getError() {
        return error;
    }
}
