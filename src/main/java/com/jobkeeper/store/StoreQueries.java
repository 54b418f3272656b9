package com.jobkeeper.store;

import com.jobkeeper.model.DistributionEntry;
import com.jobkeeper.model.ExecutionLogEntry;
import com.jobkeeper.model.JobDefinition;
import com.jobkeeper.model.JobKind;
import com.jobkeeper.model.JobQuery;
import com.jobkeeper.model.JobStats;
import com.jobkeeper.model.JobStatus;
import com.jobkeeper.model.LogQuery;
import com.jobkeeper.model.LogStatus;
import com.jobkeeper.model.NotificationQuery;
import com.jobkeeper.model.NotificationRecord;
import com.jobkeeper.model.Page;
import com.jobkeeper.model.PageQuery;
import com.jobkeeper.model.TrendPoint;

import java.time.LocalDateTime;
import java.time.format.DateTimeFormatter;
import java.time.temporal.ChronoUnit;
import java.util.ArrayList;
import java.util.Collection;
import java.util.Comparator;
import java.util.EnumMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.TreeMap;
import java.util.function.Function;
import java.util.stream.Collectors;

/**
 * Filter, sort, page and aggregation rules shared by all {@link JobStore}
 * backends. Enums sort by name so that SQL and in-memory ordering agree.
 */
public final class StoreQueries {
    public static final DateTimeFormatter HOUR_LABEL = DateTimeFormatter.ofPattern("yyyy-MM-dd HH:00");

    /** Upper bounds (exclusive, in seconds) of the duration buckets; the last bucket is open. */
    static final double[] DURATION_BOUNDS = {1, 5, 10, 30, 60, 300};
    static final String[] DURATION_LABELS = {"< 1s", "1-5s", "5-10s", "10-30s", "30s-1m", "1-5m", ">= 5m"};

    private StoreQueries() {}

    // ---- matching ----

    static boolean containsIgnoreCase(String value, String needle) {
        if (needle == null || needle.isEmpty()) {
            return true;
        }
        return value != null && value.toLowerCase(Locale.ROOT).contains(needle.toLowerCase(Locale.ROOT));
    }

    public static boolean matches(JobDefinition job, JobQuery q) {
        return containsIgnoreCase(job.getJobName(), q.getJobName())
                && containsIgnoreCase(job.getJobGroup(), q.getJobGroup())
                && (q.getStatus() == null || q.getStatus() == job.getStatus())
                && (q.getEnabled() == null || q.getEnabled() == job.isEnabled());
    }

    public static boolean matches(ExecutionLogEntry log, LogQuery q) {
        return containsIgnoreCase(log.getJobName(), q.getJobName())
                && containsIgnoreCase(log.getJobGroup(), q.getJobGroup())
                && (q.getStatus() == null || q.getStatus() == log.getStatus())
                && inRange(log.getStartTime(), q.getStartTime(), q.getEndTime());
    }

    public static boolean matches(NotificationRecord n, NotificationQuery q) {
        return (q.getStatus() == null || q.getStatus() == n.getStatus())
                && containsIgnoreCase(n.getTriggeredBy(), q.getTriggeredBy())
                && inRange(n.getCreateTime(), q.getStartTime(), q.getEndTime());
    }

    static boolean inRange(LocalDateTime t, LocalDateTime from, LocalDateTime to) {
        if (from == null && to == null) {
            return true;
        }
        if (t == null) {
            return false;
        }
        return (from == null || !t.isBefore(from)) && (to == null || !t.isAfter(to));
    }

    // ---- sorting ----

    static <T, U extends Comparable<? super U>> Comparator<T> by(Function<T, U> key, boolean ascending) {
        Comparator<T> c = Comparator.comparing(key, Comparator.nullsFirst(Comparator.<U>naturalOrder()));
        return ascending ? c : c.reversed();
    }

    static String enumName(Enum<?> e) {
        return e == null ? null : e.name();
    }

    public static Comparator<JobDefinition> jobOrder(PageQuery q) {
        boolean asc = q.isAscending();
        String key = q.getSortBy() == null ? "" : q.getSortBy().toLowerCase(Locale.ROOT);
        switch (key) {
            case "jobname": return by(JobDefinition::getJobName, asc);
            case "jobgroup": return by(JobDefinition::getJobGroup, asc);
            case "status": return by(j -> enumName(j.getStatus()), asc);
            case "enabled":
            case "isenabled": return by(JobDefinition::isEnabled, asc);
            case "createtime": return by(JobDefinition::getCreateTime, asc);
            case "updatetime": return by(JobDefinition::getUpdateTime, asc);
            case "previousruntime": return by(JobDefinition::getPreviousRunTime, asc);
            case "nextruntime": return by(JobDefinition::getNextRunTime, asc);
            default: return by(JobDefinition::getCreateTime, false);
        }
    }

    public static Comparator<ExecutionLogEntry> logOrder(PageQuery q) {
        boolean asc = q.isAscending();
        String key = q.getSortBy() == null ? "" : q.getSortBy().toLowerCase(Locale.ROOT);
        switch (key) {
            case "jobname": return by(ExecutionLogEntry::getJobName, asc);
            case "jobgroup": return by(ExecutionLogEntry::getJobGroup, asc);
            case "status": return by(l -> enumName(l.getStatus()), asc);
            case "createtime": return by(ExecutionLogEntry::getCreateTime, asc);
            case "starttime": return by(ExecutionLogEntry::getStartTime, asc);
            case "endtime": return by(ExecutionLogEntry::getEndTime, asc);
            case "duration": return by(ExecutionLogEntry::getDurationMillis, asc);
            default: return by(ExecutionLogEntry::getCreateTime, false);
        }
    }

    public static Comparator<NotificationRecord> notificationOrder(PageQuery q) {
        boolean asc = q.isAscending();
        String key = q.getSortBy() == null ? "" : q.getSortBy().toLowerCase(Locale.ROOT);
        switch (key) {
            case "title": return by(NotificationRecord::getTitle, asc);
            case "status": return by(n -> enumName(n.getStatus()), asc);
            case "createtime": return by(NotificationRecord::getCreateTime, asc);
            case "sendtime": return by(NotificationRecord::getSendTime, asc);
            default: return by(NotificationRecord::getCreateTime, false);
        }
    }

    // ---- paging ----

    /** Slices an already filtered and sorted list. */
    public static <T> Page<T> page(List<T> sorted, PageQuery q) {
        int size = Math.max(q.getPageSize(), 0);
        long skip = (long) Math.max(q.getPageIndex() - 1, 0) * size;
        List<T> items = sorted.stream().skip(skip).limit(size).collect(Collectors.toList());
        return new Page<>(items, sorted.size(), q.getPageIndex(), q.getPageSize());
    }

    public static Page<JobDefinition> queryJobs(Collection<JobDefinition> jobs, JobQuery q) {
        List<JobDefinition> list = jobs.stream().filter(j -> matches(j, q))
                .sorted(jobOrder(q)).collect(Collectors.toList());
        return page(list, q);
    }

    public static Page<ExecutionLogEntry> queryLogs(Collection<ExecutionLogEntry> logs, LogQuery q) {
        List<ExecutionLogEntry> list = logs.stream().filter(l -> matches(l, q))
                .sorted(logOrder(q)).collect(Collectors.toList());
        return page(list, q);
    }

    public static Page<NotificationRecord> queryNotifications(Collection<NotificationRecord> records, NotificationQuery q) {
        List<NotificationRecord> list = records.stream().filter(n -> matches(n, q))
                .sorted(notificationOrder(q)).collect(Collectors.toList());
        return page(list, q);
    }

    // ---- statistics ----

    static double percentage(long count, long total) {
        if (total <= 0) {
            return 0;
        }
        return Math.round(count * 10000.0 / total) / 100.0;
    }

    /** Keeps the log rows whose start time falls inside {@code [from, to]}. */
    public static List<ExecutionLogEntry> inWindow(Collection<ExecutionLogEntry> logs, LocalDateTime[] window) {
        return logs.stream()
                .filter(l -> l.getStartTime() != null && inRange(l.getStartTime(), window[0], window[1]))
                .collect(Collectors.toList());
    }

    public static JobStats jobStats(Collection<JobDefinition> jobs, Collection<ExecutionLogEntry> windowLogs) {
        JobStats s = new JobStats();
        s.setTotalJobs(jobs.size());
        s.setEnabledJobs((int) jobs.stream().filter(JobDefinition::isEnabled).count());
        s.setDisabledJobs(s.getTotalJobs() - s.getEnabledJobs());
        s.setPausedCount((int) jobs.stream().filter(j -> j.getStatus() == JobStatus.PAUSED).count());
        s.setBlockedCount((int) jobs.stream().filter(j -> j.getStatus() == JobStatus.BLOCKED).count());
        s.setExecutingJobs((int) windowLogs.stream().filter(l -> l.getStatus() == LogStatus.RUNNING).count());
        s.setSuccessCount((int) windowLogs.stream().filter(l -> l.getStatus() == LogStatus.SUCCESS).count());
        s.setFailedCount((int) windowLogs.stream().filter(l -> l.getStatus() == LogStatus.FAILED).count());
        return s;
    }

    public static List<DistributionEntry> statusDistribution(Collection<JobDefinition> jobs) {
        Map<JobStatus, Long> counts = new EnumMap<>(JobStatus.class);
        for (JobDefinition j : jobs) {
            if (j.getStatus() != null) {
                counts.merge(j.getStatus(), 1L, Long::sum);
            }
        }
        List<DistributionEntry> out = new ArrayList<>();
        counts.forEach((k, v) -> out.add(new DistributionEntry(k.name(), v, percentage(v, jobs.size()))));
        return out;
    }

    public static List<DistributionEntry> typeDistribution(Collection<JobDefinition> jobs) {
        Map<JobKind, Long> counts = new EnumMap<>(JobKind.class);
        for (JobDefinition j : jobs) {
            if (j.getJobKind() != null) {
                counts.merge(j.getJobKind(), 1L, Long::sum);
            }
        }
        List<DistributionEntry> out = new ArrayList<>();
        counts.forEach((k, v) -> out.add(new DistributionEntry(k.name(), v, percentage(v, jobs.size()))));
        return out;
    }

    /** Hourly success/failure counts in ascending time order. */
    public static List<TrendPoint> trend(Collection<ExecutionLogEntry> windowLogs) {
        Map<LocalDateTime, List<ExecutionLogEntry>> byHour = new TreeMap<>();
        for (ExecutionLogEntry l : windowLogs) {
            byHour.computeIfAbsent(l.getStartTime().truncatedTo(ChronoUnit.HOURS), k -> new ArrayList<>()).add(l);
        }
        List<TrendPoint> out = new ArrayList<>();
        byHour.forEach((hour, rows) -> out.add(new TrendPoint(
                HOUR_LABEL.format(hour),
                rows.stream().filter(l -> l.getStatus() == LogStatus.SUCCESS).count(),
                rows.stream().filter(l -> l.getStatus() == LogStatus.FAILED).count(),
                rows.size())));
        return out;
    }

    /** Duration histogram over finished rows. Every bucket is reported, empty ones with zero. */
    public static List<DistributionEntry> durationHistogram(Collection<ExecutionLogEntry> windowLogs) {
        long[] counts = new long[DURATION_LABELS.length];
        long total = 0;
        for (ExecutionLogEntry l : windowLogs) {
            if (l.getStatus() == LogStatus.RUNNING || l.getDurationMillis() == null) {
                continue;
            }
            counts[bucketOf(l.getDurationMillis())]++;
            total++;
        }
        List<DistributionEntry> out = new ArrayList<>();
        for (int i = 0; i < counts.length; i++) {
            out.add(new DistributionEntry(DURATION_LABELS[i], counts[i], percentage(counts[i], total)));
        }
        return out;
    }

    static int bucketOf(long durationMillis) {
        double seconds = durationMillis / 1000.0;
        for (int i = 0; i < DURATION_BOUNDS.length; i++) {
            if (seconds < DURATION_BOUNDS[i]) {
                return i;
            }
        }
        return DURATION_BOUNDS.length;
    }
}
