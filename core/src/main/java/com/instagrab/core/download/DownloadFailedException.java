package com.instagrab.core.download;

import java.io.IOException;

public class DownloadFailedException extends IOException {
    public DownloadFailedException(String message) {
        super(message);
    }

    public DownloadFailedException(String message, Throwable cause) {
        super(message, cause);
    }
}
