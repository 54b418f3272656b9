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

import java.util.List;

/**
 * Durable storage for job definitions, execution logs, settings and
 * notification records.
 * <p>
 * Implementations never throw: I/O and serialization failures are logged and
 * reported as {@code false}, {@code null}, {@code 0} or an empty result.
 * Filtering, sorting and paging follow {@link StoreQueries} in every backend.
 */
public interface JobStore {

    /** Creates the backing files or tables when missing. */
    boolean initialize();

    boolean isInitialized();

    /** Inserts a new definition. Fails when the identity already exists. */
    boolean addJob(JobDefinition job);

    /** Overwrites the mutable fields of an existing definition. */
    boolean updateJob(JobDefinition job);

    boolean deleteJob(String jobName, String jobGroup);

    /** Returns the definition or {@code null} when missing or unreadable. */
    JobDefinition getJob(String jobName, String jobGroup);

    Page<JobDefinition> getJobs(JobQuery query);

    List<JobDefinition> getAllJobs();

    boolean updateJobStatus(String jobName, String jobGroup, JobStatus status);

    boolean addExecutionLog(ExecutionLogEntry entry);

    Page<ExecutionLogEntry> getExecutionLogs(LogQuery query);

    /** Deletes log rows created more than {@code retentionDays} ago and returns how many went. */
    int clearExpiredLogs(int retentionDays);

    /** Deletes the log rows matching {@code filter}; an empty filter deletes all of them. */
    boolean clearLogs(LogQuery filter);

    JobStats getJobStats(StatsQuery query);

    List<DistributionEntry> getJobStatusDistribution();

    List<DistributionEntry> getJobTypeDistribution();

    List<TrendPoint> getExecutionTrend(StatsQuery query);

    List<DistributionEntry> getExecutionTimeDistribution(StatsQuery query);

    /** Inserts or replaces the setting with the same key. */
    boolean saveSetting(Setting setting);

    Setting getSetting(String key);

    List<Setting> getAllSettings();

    boolean addNotification(NotificationRecord record);

    boolean updateNotification(NotificationRecord record);

    NotificationRecord getNotification(String notificationId);

    Page<NotificationRecord> getNotifications(NotificationQuery query);

    boolean deleteNotification(String notificationId);

    /** Deletes the records matching {@code filter}; an empty filter deletes all of them. */
    boolean clearNotifications(NotificationQuery filter);
}
