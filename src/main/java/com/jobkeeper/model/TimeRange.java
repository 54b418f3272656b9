package com.jobkeeper.model;

import java.time.DayOfWeek;
import java.time.LocalDate;
import java.time.LocalDateTime;
import java.time.temporal.TemporalAdjusters;

/**
 * Named windows used by the statistics queries.
 */
public enum TimeRange {
    TODAY,
    YESTERDAY,
    THIS_WEEK,
    THIS_MONTH,
    LAST_7_DAYS,
    LAST_30_DAYS,
    CUSTOM;

    /**
     * Resolves the window relative to {@code now}. Returns {start, end}.
     * CUSTOM without both bounds falls back to the last seven days.
     */
    public LocalDateTime[] resolve(LocalDateTime now, LocalDateTime customStart, LocalDateTime customEnd) {
        LocalDate today = now.toLocalDate();
        switch (this) {
            case TODAY:
                return new LocalDateTime[] {today.atStartOfDay(), now};
            case YESTERDAY:
                return new LocalDateTime[] {today.minusDays(1).atStartOfDay(), today.atStartOfDay().minusNanos(1_000_000)};
            case THIS_WEEK:
                LocalDate sunday = today.with(TemporalAdjusters.previousOrSame(DayOfWeek.SUNDAY));
                return new LocalDateTime[] {sunday.atStartOfDay(), now};
            case THIS_MONTH:
                return new LocalDateTime[] {today.withDayOfMonth(1).atStartOfDay(), now};
            case LAST_30_DAYS:
                return new LocalDateTime[] {now.minusDays(30), now};
            case CUSTOM:
                if (customStart != null && customEnd != null) {
                    return new LocalDateTime[] {customStart, customEnd};
                }
                return new LocalDateTime[] {now.minusDays(7), now};
            case LAST_7_DAYS:
            default:
                return new LocalDateTime[] {now.minusDays(7), now};
        }
    }
}
