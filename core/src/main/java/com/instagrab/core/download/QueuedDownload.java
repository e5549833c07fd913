package com.instagrab.core.download;

import com.instagrab.common.model.MediaDescriptor;

import java.util.UUID;

/**
 * Entry of the {@link DownloadQueue}.
 */
public class QueuedDownload {
    private final String id;
    private final MediaDescriptor descriptor;
    private final DownloadOptions options;
    private final long addedAt;

    private volatile DownloadStatus status = DownloadStatus.PENDING;
    private volatile Long completedAt;
    private volatile String error;

    QueuedDownload(MediaDescriptor descriptor, DownloadOptions options) {
        this.id = UUID.randomUUID().toString();
        this.descriptor = descriptor;
        this.options = options;
        this.addedAt = System.currentTimeMillis();
    }

    void setStatus(DownloadStatus status) {
        this.status = status;
    }

    void finish(boolean success, String error) {
        this.status = success ? DownloadStatus.COMPLETED : DownloadStatus.FAILED;
        this.error = error;
        this.completedAt = System.currentTimeMillis();
    }

    public String getId() {
        return id;
    }

    public MediaDescriptor getDescriptor() {
        return descriptor;
    }

    public DownloadOptions getOptions() {
        return options;
    }

    public long getAddedAt() {
        return addedAt;
    }

    public DownloadStatus getStatus() {
        return status;
    }

    public Long getCompletedAt() {
        return completedAt;
    }

    public String getError() {
        return error;
    }
}
