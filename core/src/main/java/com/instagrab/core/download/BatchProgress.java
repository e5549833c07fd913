package com.instagrab.core.download;

import java.util.List;

/**
 * Snapshot of a running batch.
 *
 * @param currentFile filename being worked on, null once the batch is done
 * @param errors      failures so far, in batch order
 */
public record BatchProgress(int completed, int total, String currentFile, List<BatchError> errors) {

    public BatchProgress {
        errors = List.copyOf(errors);
    }

    public record BatchError(String filename, String error) {
    }

    public boolean isDone() {
        return completed + errors.size() >= total;
    }
}
