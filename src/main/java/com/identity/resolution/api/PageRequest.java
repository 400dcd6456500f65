package com.identity.resolution.api;

/**
 * Pagination request specifying offset and limit.
 */
public record PageRequest(int offset, int limit) {

    private static final int MAX_LIMIT = 10_000;

    public PageRequest {
        if (offset < 0) {
            throw new IllegalArgumentException("offset must be >= 0");
        }
        if (limit <= 0 || limit > MAX_LIMIT) {
            throw new IllegalArgumentException("limit must be > 0 and <= " + MAX_LIMIT);
        }
    }

    /**
     * Creates a page request from page number and size. Page numbering starts at 0.
     */
    public static PageRequest of(int page, int size) {
        if (page < 0) {
            throw new IllegalArgumentException("page must be >= 0");
        }
        return new PageRequest(page * size, size);
    }

    public static PageRequest first(int size) {
        return of(0, size);
    }

    public int pageNumber() {
        return offset / limit;
    }
}
