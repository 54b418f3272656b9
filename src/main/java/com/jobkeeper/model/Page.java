package com.jobkeeper.model;

import java.util.Collections;
import java.util.List;

/**
 * One page of a list query.
 */
public class Page<T> {
    private final List<T> items;
    private final long totalCount;
    private final int pageIndex;
    private final int pageSize;

    public Page(List<T> items, long totalCount, int pageIndex, int pageSize) {
        this.items = items;
        this.totalCount = totalCount;
        this.pageIndex = pageIndex;
        this.pageSize = pageSize;
    }

    public static <T> Page<T> empty(PageQuery q) {
        return new Page<>(Collections.emptyList(), 0, q.getPageIndex(), q.getPageSize());
    }

    public List<T> getItems() { return items; }
    public long getTotalCount() { return totalCount; }
    public int getPageIndex() { return pageIndex; }
    public int getPageSize() { return pageSize; }

    public int getTotalPages() {
        if (pageSize <= 0) {
            return 0;
        }
        return (int) ((totalCount + pageSize - 1) / pageSize);
    }
}
