package com.instagrab.core.extract;

/**
 * An Instagram URL whose page type is not supported (explore, direct, hashtag and the like).
 */
public class NoMatchingExtractorException extends UnsupportedUrlException {
    public NoMatchingExtractorException(String url) {
        super(url, "No extractor supports this URL: " + url);
    }
}
