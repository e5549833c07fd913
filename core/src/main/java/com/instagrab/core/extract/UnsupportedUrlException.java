package com.instagrab.core.extract;

/**
 * A URL no extraction strategy can handle.
 */
public class UnsupportedUrlException extends RuntimeException {
    private final String url;

    public UnsupportedUrlException(String url, String message) {
        super(message);
        this.url = url;
    }

    public String getUrl() {
        return url;
    }
}
