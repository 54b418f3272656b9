package com.jobkeeper.store;

import com.jobkeeper.model.DistributionEntry;
import com.jobkeeper.model.ExecutionLogEntry;
import com.jobkeeper.model.JobDefinition;
import com.jobkeeper.model.JobQuery;
import com.jobkeeper.model.JobStats;
import com.jobkeeper.model.JobStatus;
import com.jobkeeper.model.LogQuery;
import com.jobkeeper.model.NotificationQuery;
import com.jobkeeper.model.NotificationRecord;
import com.jobkeeper.model.Page;
import com.jobkeeper.model.Setting;
import com.jobkeeper.model.StatsQuery;
import com.jobkeeper.model.TrendPoint;

import java.time.LocalDateTime;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.stream.Collectors;

/**
 * Simple in-memory JobStore used by default. Nothing survives a restart.
 */
public class InMemoryJobStore implements JobStore {
    private final List<JobDefinition> jobs = new ArrayList<>();
    private final List<ExecutionLogEntry> logs = new ArrayList<>();
    private final Map<String, Setting> settings = new LinkedHashMap<>();
    private final List<NotificationRecord> notifications = new ArrayList<>();

    @Override
    public boolean initialize() {
        return true;
    }

    @Override
    public boolean isInitialized() {
        return true;
    }

    @Override
    public synchronized boolean addJob(JobDefinition job) {
        if (find(job.getJobName(), job.getJobGroup()) != null) {
            return false;
        }
        jobs.add(job.copy());
        return true;
    }

    @Override
    public synchronized boolean updateJob(JobDefinition job) {
        for (int i = 0; i < jobs.size(); i++) {
            if (jobs.get(i).sameIdentity(job.getJobName(), job.getJobGroup())) {
                jobs.set(i, job.copy());
                return true;
            }
        }
        return false;
    }

    @Override
    public synchronized boolean deleteJob(String jobName, String jobGroup) {
        return jobs.removeIf(j -> j.sameIdentity(jobName, jobGroup));
    }

    @Override
    public synchronized JobDefinition getJob(String jobName, String jobGroup) {
        JobDefinition j = find(jobName, jobGroup);
        return j == null ? null : j.copy();
    }

    private JobDefinition find(String jobName, String jobGroup) {
        for (JobDefinition j : jobs) {
            if (j.sameIdentity(jobName, jobGroup)) {
                return j;
            }
        }
        return null;
    }

    @Override
    public synchronized Page<JobDefinition> getJobs(JobQuery query) {
        return StoreQueries.queryJobs(getAllJobs(), query);
    }

    @Override
    public synchronized List<JobDefinition> getAllJobs() {
        return jobs.stream().map(JobDefinition::copy).collect(Collectors.toList());
    }

    @Override
    public synchronized boolean updateJobStatus(String jobName, String jobGroup, JobStatus status) {
        JobDefinition j = find(jobName, jobGroup);
        if (j == null) {
            return false;
        }
        j.setStatus(status);
        j.setUpdateTime(LocalDateTime.now());
        return true;
    }

    @Override
    public synchronized boolean addExecutionLog(ExecutionLogEntry entry) {
        logs.add(entry);
        return true;
    }

    @Override
    public synchronized Page<ExecutionLogEntry> getExecutionLogs(LogQuery query) {
        return StoreQueries.queryLogs(logs, query);
    }

    @Override
    public synchronized int clearExpiredLogs(int retentionDays) {
        LocalDateTime cutoff = LocalDateTime.now().minusDays(retentionDays);
        int before = logs.size();
        logs.removeIf(l -> l.getCreateTime() != null && l.getCreateTime().isBefore(cutoff));
        return before - logs.size();
    }

    @Override
    public synchronized boolean clearLogs(LogQuery filter) {
        if (filter == null || filter.isEmptyFilter()) {
            logs.clear();
        } else {
            logs.removeIf(l -> StoreQueries.matches(l, filter));
        }
        return true;
    }

    @Override
    public synchronized JobStats getJobStats(StatsQuery query) {
        return StoreQueries.jobStats(jobs, StoreQueries.inWindow(logs, query.window(LocalDateTime.now())));
    }

    @Override
    public synchronized List<DistributionEntry> getJobStatusDistribution() {
        return StoreQueries.statusDistribution(jobs);
    }

    @Override
    public synchronized List<DistributionEntry> getJobTypeDistribution() {
        return StoreQueries.typeDistribution(jobs);
    }

    @Override
    public synchronized List<TrendPoint> getExecutionTrend(StatsQuery query) {
        return StoreQueries.trend(StoreQueries.inWindow(logs, query.window(LocalDateTime.now())));
    }

    @Override
    public synchronized List<DistributionEntry> getExecutionTimeDistribution(StatsQuery query) {
        return StoreQueries.durationHistogram(StoreQueries.inWindow(logs, query.window(LocalDateTime.now())));
    }

    @Override
    public synchronized boolean saveSetting(Setting setting) {
        LocalDateTime now = LocalDateTime.now();
        Setting existing = settings.get(setting.getKey());
        setting.setCreateTime(existing != null ? existing.getCreateTime() : now);
        setting.setUpdateTime(now);
        settings.put(setting.getKey(), setting);
        return true;
    }

    @Override
    public synchronized Setting getSetting(String key) {
        return settings.get(key);
    }

    @Override
    public synchronized List<Setting> getAllSettings() {
        return new ArrayList<>(settings.values());
    }

    @Override
    public synchronized boolean addNotification(NotificationRecord record) {
        notifications.add(record);
        return true;
    }

    @Override
    public synchronized boolean updateNotification(NotificationRecord record) {
        for (int i = 0; i < notifications.size(); i++) {
            if (notifications.get(i).getNotificationId().equals(record.getNotificationId())) {
                notifications.set(i, record);
                return true;
            }
        }
        return false;
    }

    @Override
    public synchronized NotificationRecord getNotification(String notificationId) {
        for (NotificationRecord n : notifications) {
            if (n.getNotificationId().equals(notificationId)) {
                return n;
            }
        }
        return null;
    }

    @Override
    public synchronized Page<NotificationRecord> getNotifications(NotificationQuery query) {
        return StoreQueries.queryNotifications(notifications, query);
    }

    @Override
    public synchronized boolean deleteNotification(String notificationId) {
        return notifications.removeIf(n -> n.getNotificationId().equals(notificationId));
    }

    @Override
    public synchronized boolean clearNotifications(NotificationQuery filter) {
        if (filter == null || filter.isEmptyFilter()) {
            notifications.clear();
        } else {
            notifications.removeIf(n -> StoreQueries.matches(n, filter));
        }
        return true;
    }
}
