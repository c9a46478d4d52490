package com.regulatory.conflict.api;

/**
 * Offset-based page request. Results are ordered by their timestamp (detection time for
 * conflicts, application time for records, opening time for cases) in the given direction.
 */
public record PageRequest(int offset, int limit, SortDirection direction) {

    public enum SortDirection {
        OLDEST_FIRST, NEWEST_FIRST
    }

    private static final int MAX_LIMIT = 1_000;

    public PageRequest {
        if (offset < 0) {
            throw new IllegalArgumentException("offset must be >= 0");
        }
        if (limit <= 0 || limit > MAX_LIMIT) {
            throw new IllegalArgumentException("limit must be > 0 and <= " + MAX_LIMIT);
        }
        if (direction == null) {
            direction = SortDirection.OLDEST_FIRST;
        }
    }

    /**
     * Page numbering starts at 0.
     */
    public static PageRequest of(int page, int size) {
        return of(page, size, SortDirection.OLDEST_FIRST);
    }

    public static PageRequest of(int page, int size, SortDirection direction) {
        if (page < 0) {
            throw new IllegalArgumentException("page must be >= 0");
        }
        return new PageRequest(page * size, size, direction);
    }

    public static PageRequest first(int size) {
        return of(0, size);
    }

    public int pageNumber() {
        return offset / limit;
    }

    public PageRequest next() {
        return new PageRequest(offset + limit, limit, direction);
    }
}
