package com.instagrab.core.download;

import java.io.IOException;

/**
 * The download was cancelled, or the thread waiting for it was interrupted.
 */
public class DownloadInterruptedException extends IOException {
    public DownloadInterruptedException(String message) {
        super(message);
    }

    public DownloadInterruptedException(String message, Throwable cause) {
        super(message, cause);
    }
}
