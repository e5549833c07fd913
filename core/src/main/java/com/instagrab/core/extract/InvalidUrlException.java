package com.instagrab.core.extract;

/**
 * Not an Instagram URL at all, or not parseable.
 */
public class InvalidUrlException extends UnsupportedUrlException {
    public InvalidUrlException(String url) {
        super(url, "Not a valid Instagram URL: " + url);
    }
}
