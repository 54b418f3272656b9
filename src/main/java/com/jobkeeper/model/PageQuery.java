package com.jobkeeper.model;

/**
 * Paging and sorting shared by every list query. Page index is 1-based.
 */
public abstract class PageQuery {
    private int pageIndex = 1;
    private int pageSize;
    private String sortBy;
    private String sortOrder;

    protected PageQuery(int defaultPageSize) {
        this.pageSize = defaultPageSize;
    }

    public int getPageIndex() { return pageIndex; }
    public void setPageIndex(int pageIndex) { this.pageIndex = pageIndex; }

    public int getPageSize() { return pageSize; }
    public void setPageSize(int pageSize) { this.pageSize = pageSize; }

    public String getSortBy() { return sortBy; }
    public void setSortBy(String sortBy) { this.sortBy = sortBy; }

    public String getSortOrder() { return sortOrder; }
    public void setSortOrder(String sortOrder) { this.sortOrder = sortOrder; }

    /** True only for an explicit {@code asc}; every other value sorts descending. */
    public boolean isAscending() {
        return "asc".equalsIgnoreCase(sortOrder);
    }

    /** Sets sort key and direction in one call. */
    public void sort(String by, String order) {
        this.sortBy = by;
        this.sortOrder = order;
    }
}
