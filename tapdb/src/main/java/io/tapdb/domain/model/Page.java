package io.tapdb.domain.model;

import java.util.List;

/**
 * One page of a listing. Pages are 1-based.
 */
public record Page<T>(List<T> items, int page, int pageSize, long total) {

    public int totalPages() {
        return pageSize <= 0 ? 0 : (int) ((total + pageSize - 1) / pageSize);
    }

    public boolean hasNext() {
        return page < totalPages();
    }
}
