package com.instagrab.api;

import com.instagrab.core.download.BatchProgress;

/**
 * Receives batch progress before and after each item.
 */
@FunctionalInterface
public interface ProgressListener {
    ProgressListener NONE = progress -> {
    };

    void onProgress(BatchProgress progress);
}
