package com.instagrab.core.pagination;

@FunctionalInterface
public interface PageFetcher<T> {

    /**
     * @param cursor null for the first page
     */
    Page<T> fetch(String cursor);
}
