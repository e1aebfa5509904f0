package com.rideshare.reputation.model;

import java.util.List;

public record PagedResponse<T>(List<T> data, long total, int page, int pageSize, int totalPages) {

    /**
     * Slices an already sorted list. Pages past the end come back empty.
     */
    public static <T> PagedResponse<T> of(List<T> sorted, int page, int pageSize) {
        int total = sorted.size();
        int totalPages = (int) Math.ceil((double) total / pageSize);
        long offset = (long) (page - 1) * pageSize;
        List<T> data = offset >= total
                ? List.of()
                : List.copyOf(sorted.subList((int) offset, (int) Math.min(total, offset + pageSize)));
        return new PagedResponse<>(data, total, page, pageSize, totalPages);
    }
}
