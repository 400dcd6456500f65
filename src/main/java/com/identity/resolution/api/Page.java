package com.identity.resolution.api;

import java.util.List;

/**
 * One window over an ordered result list, such as the pending review queue.
 *
 * @param content       the content of this page (defensive copy)
 * @param totalElements total number of elements across all pages
 * @param pageNumber    the current page number (0-based)
 * @param pageSize      the requested page size
 * @param <T>           the element type
 */
public record Page<T>(List<T> content, long totalElements, int pageNumber, int pageSize) {

    public Page {
        content = content != null ? List.copyOf(content) : List.of();
        if (totalElements < 0) {
            throw new IllegalArgumentException("totalElements must be >= 0");
        }
    }

    public boolean hasNext() {
        return (long) (pageNumber + 1) * pageSize < totalElements;
    }

    public int totalPages() {
        return pageSize == 0 ? 0 : (int) Math.ceil((double) totalElements / pageSize);
    }

    public int numberOfElements() {
        return content.size();
    }

    /**
     * Cuts the requested window out of an already ordered list.
     */
    public static <T> Page<T> slice(List<T> ordered, PageRequest request) {
        int total = ordered.size();
        int fromIndex = Math.min(request.offset(), total);
        int toIndex = (int) Math.min((long) request.offset() + request.limit(), total);
        return new Page<>(ordered.subList(fromIndex, toIndex), total, request.pageNumber(), request.limit());
    }

    public static <T> Page<T> empty(PageRequest request) {
        return new Page<>(List.of(), 0, request.pageNumber(), request.limit());
    }
}
