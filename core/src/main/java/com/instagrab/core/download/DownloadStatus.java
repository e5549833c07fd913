package com.instagrab.core.download;

public enum DownloadStatus {
    PENDING,
    DOWNLOADING,
    COMPLETED,
    FAILED;

    public boolean isTerminal() {
        return this == COMPLETED || this == FAILED;
    }

    /** Status only ever moves forward, and never out of a terminal state. */
    public boolean canTransitionTo(DownloadStatus next) {
        return !isTerminal() && next.ordinal() > ordinal();
    }
}
