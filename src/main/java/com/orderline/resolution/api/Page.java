package com.orderline.resolution.api;

import java.util.List;

/**
 * One page of a paginated listing.
 *
 * @param content       the items on this page
 * @param totalElements number of items across all pages
 * @param pageNumber    0-based page number
 * @param pageSize      requested page size
 * @param <T>           the item type
 */
public record Page<T>(List<T> content, long totalElements, int pageNumber, int pageSize) {

    public Page {
        content = content != null ? List.copyOf(content) : List.of();
        if (totalElements < 0) {
            throw new IllegalArgumentException("totalElements must be >= 0");
        }
    }

    /**
     * Cuts one page out of an already ordered list.
     */
    public static <T> Page<T> slice(List<T> all, PageRequest request) {
        int total = all.size();
        int from = Math.min(request.offset(), total);
        int to = Math.min(request.offset() + request.limit(), total);
        return new Page<>(all.subList(from, to), total, request.pageNumber(), request.limit());
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
}
