package com.instagrab.core.pagination;

import java.util.concurrent.ThreadLocalRandom;

/**
 * Inclusive range a randomized inter-page delay is drawn from.
 */
public record DelayWindow(long minMs, long maxMs) {
    public static final DelayWindow NONE = new DelayWindow(0, 0);
    public static final DelayWindow PROFILE = new DelayWindow(3000, 6000);
    public static final DelayWindow SAVED = new DelayWindow(1500, 3000);

    public DelayWindow {
        if (minMs < 0 || maxMs < minMs) {
            throw new IllegalArgumentException("Invalid delay window [" + minMs + ", " + maxMs + "]");
        }
    }

    public long pick() {
        if (minMs == maxMs) return minMs;
        return ThreadLocalRandom.current().nextLong(minMs, maxMs + 1);
    }
}
