package com.product.resolution.api;

import java.util.Objects;

/**
 * Pagination request: offset, limit and the golden-record ordering to page through.
 */
public record PageRequest(int offset, int limit, GoldenRecordSort sort) {

    private static final int MAX_LIMIT = 10_000;

    public PageRequest {
        if (offset < 0) {
            throw new IllegalArgumentException("offset must be >= 0");
        }
        if (limit <= 0 || limit > MAX_LIMIT) {
            throw new IllegalArgumentException("limit must be > 0 and <= " + MAX_LIMIT);
        }
        sort = Objects.requireNonNullElse(sort, GoldenRecordSort.byId());
    }

    /**
     * Creates a page request from page number and size, ordered by golden-record id.
     * Page numbering starts at 0.
     */
    public static PageRequest of(int page, int size) {
        return of(page, size, GoldenRecordSort.byId());
    }

    public static PageRequest of(int page, int size, GoldenRecordSort sort) {
        if (page < 0) {
            throw new IllegalArgumentException("page must be >= 0");
        }
        if (size > 0 && (long) page * size > Integer.MAX_VALUE) {
            throw new IllegalArgumentException("page " + page + " is out of range for size " + size);
        }
        return new PageRequest(page * size, size, sort);
    }

    public static PageRequest first(int size) {
        return of(0, size);
    }

    /**
     * Returns the page number (derived from offset and limit).
     */
    public int pageNumber() {
        return offset / limit;
    }
}
