package com.product.resolution.api;

import java.util.List;
import java.util.function.Function;

/**
 * A page of results from a paginated query.
 *
 * @param content       the content of this page (defensive copy)
 * @param totalElements total number of matching elements across all pages
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

    /**
     * Cuts the page described by {@code request} out of an already filtered and sorted list.
     */
    public static <T> Page<T> slice(List<T> all, PageRequest request) {
        int from = (int) Math.min(request.offset(), all.size());
        int to = (int) Math.min((long) request.offset() + request.limit(), all.size());
        return new Page<>(all.subList(from, to), all.size(), request.pageNumber(), request.limit());
    }

    public static <T> Page<T> empty(PageRequest request) {
        return new Page<>(List.of(), 0, request.pageNumber(), request.limit());
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

    public int numberOfElements() {
        return content.size();
    }

    public boolean hasContent() {
        return !content.isEmpty();
    }

    /**
     * Returns a page with the same paging data and mapped content.
     */
    public <R> Page<R> map(Function<? super T, ? extends R> mapper) {
        return new Page<>(content.stream().<R>map(mapper).toList(), totalElements, pageNumber, pageSize);
    }
}
