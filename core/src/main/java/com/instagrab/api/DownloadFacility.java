package com.instagrab.api;

import com.instagrab.core.download.DownloadFailedException;
import com.instagrab.core.download.DownloadInterruptedException;

import java.nio.file.Path;
import java.util.Set;

/**
 * Underlying transfer mechanism. Downloads run asynchronously once submitted and are identified by
 * the id {@link #submit} returns.
 */
public interface DownloadFacility {

    /**
     * Starts transferring {@code url} into {@code target}.
     *
     * @throws DownloadFailedException if the download could not be started
     */
    long submit(String url, Path target) throws DownloadFailedException;

    /**
     * Blocks until the download reaches a terminal state.
     *
     * @return the written file
     * @throws DownloadFailedException      if the transfer failed
     * @throws DownloadInterruptedException if it was cancelled or the waiting thread was interrupted
     */
    Path await(long downloadId) throws DownloadFailedException, DownloadInterruptedException;

    /**
     * @return false if the id is unknown or already finished
     */
    boolean cancel(long downloadId);

    /** Ids of submitted downloads that have not finished yet. */
    Set<Long> inProgress();
}
