package com.instagrab.api;

import com.instagrab.common.model.MediaDescriptor;

import java.util.stream.Stream;

/**
 * Strategy for one family of URLs.
 * <p>
 * {@link #extract} returns a lazy, finite, single-use stream: provider calls happen only as the
 * stream is consumed, and a consumer that stops early causes no further requests. Provider errors
 * surface as unchecked exceptions from the terminal operation.
 */
public interface MediaExtractor {

    String getName();

    /** Higher values are tried first when several strategies accept the same URL. */
    int specificity();

    boolean matches(String url);

    Stream<MediaDescriptor> extract(String url, ExtractorOptions options);
}
