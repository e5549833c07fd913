package com.instagrab.core.pagination;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Collections;
import java.util.HashSet;
import java.util.Iterator;
import java.util.NoSuchElementException;
import java.util.Objects;
import java.util.Set;
import java.util.Spliterator;
import java.util.Spliterators;
import java.util.function.Function;
import java.util.stream.Stream;
import java.util.stream.StreamSupport;

/**
 * Lazy iterator over a cursor-paginated listing.
 * <p>
 * Pages are fetched on demand, one at a time, with a randomized delay between consecutive fetches.
 * Iteration stops when the provider reports no more pages, when the item cap is reached (without
 * fetching another page), or when the thread is interrupted while waiting. Fetch errors propagate
 * to the caller of {@link #hasNext()} and end the sequence.
 * <p>
 * Single use: not restartable and not thread-safe.
 */
public class Paginator<T> implements Iterator<T> {
    private static final Logger logger = LoggerFactory.getLogger(Paginator.class);

    private final PageFetcher<T> fetcher;
    private final DelayWindow delay;
    private final int maxItems;
    private final Function<T, String> keyFunction;
    private final Sleeper sleeper;
    private final Set<String> seenKeys = new HashSet<>();

    private Iterator<T> buffer = Collections.emptyIterator();
    private String cursor;
    private boolean morePages = true;
    private int pagesFetched;
    private int produced;
    private boolean finished;
    private T lookahead;

    private Paginator(Builder<T> builder) {
        this.fetcher = builder.fetcher;
        this.delay = builder.delay;
        this.maxItems = builder.maxItems;
        this.keyFunction = builder.keyFunction;
        this.sleeper = builder.sleeper;
    }

    public static <T> Builder<T> builder(PageFetcher<T> fetcher) {
        return new Builder<>(fetcher);
    }

    @Override
    public boolean hasNext() {
        if (lookahead != null) return true;
        if (finished) return false;
        try {
            lookahead = advance();
        } catch (RuntimeException e) {
            finished = true;
            throw e;
        }
        if (lookahead == null) finished = true;
        return lookahead != null;
    }

    @Override
    public T next() {
        if (!hasNext()) throw new NoSuchElementException();
        T item = lookahead;
        lookahead = null;
        produced++;
        return item;
    }

    public Stream<T> stream() {
        return StreamSupport.stream(
                Spliterators.spliteratorUnknownSize(this, Spliterator.ORDERED | Spliterator.NONNULL), false);
    }

    public int getPagesFetched() {
        return pagesFetched;
    }

    private T advance() {
        while (true) {
            if (maxItems > 0 && produced >= maxItems) {
                logger.debug("Item cap {} reached after {} page(s)", maxItems, pagesFetched);
                return null;
            }

            while (buffer.hasNext()) {
                T item = buffer.next();
                if (item == null) continue;
                if (keyFunction != null) {
                    String key = keyFunction.apply(item);
                    if (key != null && !seenKeys.add(key)) continue;
                }
                return item;
            }

            if (!morePages) return null;

            if (pagesFetched > 0 && !pause()) {
                return null;
            }

            Page<T> page = fetcher.fetch(cursor);
            pagesFetched++;
            buffer = page.items().iterator();
            morePages = page.hasNext();
            cursor = page.nextCursor();
            logger.debug("Fetched page {} ({} items, more={})", pagesFetched, page.items().size(), morePages);
        }
    }

    private boolean pause() {
        long millis = delay.pick();
        if (millis <= 0) return true;
        try {
            sleeper.sleep(millis);
            return true;
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            logger.info("Pagination interrupted after {} page(s)", pagesFetched);
            return false;
        }
    }

    public static final class Builder<T> {
        private final PageFetcher<T> fetcher;
        private DelayWindow delay = DelayWindow.NONE;
        private int maxItems;
        private Function<T, String> keyFunction;
        private Sleeper sleeper = Sleeper.SYSTEM;

        private Builder(PageFetcher<T> fetcher) {
            this.fetcher = Objects.requireNonNull(fetcher, "fetcher");
        }

        public Builder<T> delay(DelayWindow delay) {
            this.delay = Objects.requireNonNull(delay, "delay");
            return this;
        }

        /** 0 means unlimited. */
        public Builder<T> maxItems(int maxItems) {
            if (maxItems < 0) throw new IllegalArgumentException("maxItems must be >= 0");
            this.maxItems = maxItems;
            return this;
        }

        public Builder<T> dedupeBy(Function<T, String> keyFunction) {
            this.keyFunction = keyFunction;
            return this;
        }

        public Builder<T> sleeper(Sleeper sleeper) {
            this.sleeper = Objects.requireNonNull(sleeper, "sleeper");
            return this;
        }

        public Paginator<T> build() {
            return new Paginator<>(this);
        }
    }
}
