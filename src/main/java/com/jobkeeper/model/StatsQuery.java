package com.jobkeeper.model;

import java.time.LocalDateTime;

public class StatsQuery {
    private TimeRange timeRange = TimeRange.LAST_7_DAYS;
    private LocalDateTime startTime;
    private LocalDateTime endTime;

    public StatsQuery() {
    }

    public StatsQuery(TimeRange timeRange) {
        this.timeRange = timeRange;
    }

    public static StatsQuery custom(LocalDateTime start, LocalDateTime end) {
        StatsQuery q = new StatsQuery(TimeRange.CUSTOM);
        q.setStartTime(start);
        q.setEndTime(end);
        return q;
    }

    /** Start and end of the window as of {@code now}. */
    public LocalDateTime[] window(LocalDateTime now) {
        TimeRange range = timeRange == null ? TimeRange.LAST_7_DAYS : timeRange;
        return range.resolve(now, startTime, endTime);
    }

    public TimeRange getTimeRange() { return timeRange; }
    public void setTimeRange(TimeRange timeRange) { this.timeRange = timeRange; }

    public LocalDateTime getStartTime() { return startTime; }
    public void setStartTime(LocalDateTime startTime) { this.startTime = startTime; }

    public LocalDateTime getEndTime() { return endTime; }
    public void setEndTime(LocalDateTime endTime) { this.endTime = endTime; }
}
