package com.regulatory.conflict.api;

import java.util.List;
import java.util.function.Function;

/**
 * One page of a query result.
 *
 * @param content       elements on this page
 * @param totalElements number of matching elements across all pages
 * @param pageNumber    0-based page number
 * @param pageSize      requested page size
 */
public record Page<T>(List<T> content, long totalElements, int pageNumber, int pageSize) {

    public Page {
        content = content != null ? List.copyOf(content) : List.of();
        if (totalElements < 0) {
            throw new IllegalArgumentException("totalElements must be >= 0");
        }
    }

    /**
     * Cuts the page described by {@code request} out of an already filtered and ordered list.
     */
    static <T> Page<T> slice(List<T> ordered, PageRequest request) {
        int from = Math.min(request.offset(), ordered.size());
        int to = Math.min(from + request.limit(), ordered.size());
        return new Page<>(ordered.subList(from, to), ordered.size(), request.pageNumber(), request.limit());
    }

    public boolean hasNext() {
        return (long) (pageNumber + 1) * pageSize < totalElements;
    }

    public boolean hasPrevious() {
        return pageNumber > 0;
    }

    public int totalPages() {
        return pageSize == 0 ? 0 : (int) Math.ceil((double) totalElements / pageSize);
    }

    public <R> Page<R> map(Function<? super T, ? extends R> mapper) {
        List<R> mapped = content.stream().<R>map(mapper).toList();
        return new Page<>(mapped, totalElements, pageNumber, pageSize);
    }
}
