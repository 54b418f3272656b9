package com.jobkeeper.model;

/** Execution outcomes within one hour. */
public class TrendPoint {
    private final String time;
    private final long successCount;
    private final long failedCount;
    private final long totalCount;

    public TrendPoint(String time, long successCount, long failedCount, long totalCount) {
        this.time = time;
        this.successCount = successCount;
        this.failedCount = failedCount;
        this.totalCount = totalCount;
    }

    /** Hour label formatted as {@code yyyy-MM-dd HH:00}. */
    public String getTime() { return time; }
    public long getSuccessCount() { return successCount; }
    public long getFailedCount() { return failedCount; }
    public long getTotalCount() { return totalCount; }
}
