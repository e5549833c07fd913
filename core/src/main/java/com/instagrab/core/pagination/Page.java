package com.instagrab.core.pagination;

import java.util.List;

/**
 * One page of a cursor-paginated listing. The cursor is opaque and only ever handed back to the fetcher.
 */
public record Page<T>(List<T> items, boolean moreAvailable, String nextCursor) {

    public Page {
        items = items != null ? items : List.of();
    }

    public static <T> Page<T> last(List<T> items) {
        return new Page<>(items, false, null);
    }

    public boolean hasNext() {
        return moreAvailable && nextCursor != null && !nextCursor.isEmpty();
    }
}
