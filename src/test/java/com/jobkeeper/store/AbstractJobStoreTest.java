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
import com.jobkeeper.model.NotificationStatus;
import com.jobkeeper.model.Page;
import com.jobkeeper.model.Setting;
import com.jobkeeper.model.StatsQuery;
import com.jobkeeper.model.TrendPoint;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.time.LocalDateTime;
import java.time.temporal.ChronoUnit;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Behaviour every {@link JobStore} backend must share.
 */
public abstract class AbstractJobStoreTest {
    protected JobStore store;
    protected final LocalDateTime now = LocalDateTime.now().truncatedTo(ChronoUnit.MILLIS);

    protected abstract JobStore createStore() throws Exception;

    @BeforeEach
    public void setUp() throws Exception {
        store = createStore();
        assertTrue(store.initialize());
        assertTrue(store.isInitialized());
    }

    protected JobDefinition job(String name, String group) {
        JobDefinition j = new JobDefinition(name, group);
        j.setTriggerName(name + "_Trigger");
        j.setTriggerGroup(group);
        j.setTarget("com.example.Job");
        j.setCreateTime(now);
        j.setUpdateTime(now);
        return j;
    }

    protected ExecutionLogEntry logRow(String name, LogStatus status, long durationMillis, LocalDateTime start) {
        ExecutionLogEntry e = new ExecutionLogEntry(name, JobDefinition.DEFAULT_GROUP);
        e.setStatus(status);
        e.setStartTime(start);
        e.setEndTime(start.plusNanos(durationMillis * 1_000_000));
        e.setDurationMillis(durationMillis);
        e.setCreateTime(start);
        return e;
    }

    @Test
    public void testAddGetUpdateDelete() {
        JobDefinition j = job("report", "billing");
        j.setJobData("{\"region\":\"eu\"}");
        j.setStartTime(now.plusHours(1));
        assertTrue(store.addJob(j));
        assertFalse(store.addJob(job("report", "billing")));

        JobDefinition loaded = store.getJob("report", "billing");
        assertNotNull(loaded);
        assertEquals("report_Trigger", loaded.getTriggerName());
        assertEquals("{\"region\":\"eu\"}", loaded.getJobData());
        assertEquals(now.plusHours(1), loaded.getStartTime());
        assertEquals(JobStatus.NORMAL, loaded.getStatus());
        assertTrue(loaded.isEnabled());

        loaded.setCronExpression("0 0 3 * * ?");
        loaded.setNextRunTime(now.plusDays(1));
        assertTrue(store.updateJob(loaded));
        JobDefinition updated = store.getJob("report", "billing");
        assertEquals("0 0 3 * * ?", updated.getCronExpression());
        assertEquals(now.plusDays(1), updated.getNextRunTime());

        assertFalse(store.updateJob(job("missing", "billing")));
        assertTrue(store.deleteJob("report", "billing"));
        assertNull(store.getJob("report", "billing"));
        assertFalse(store.deleteJob("report", "billing"));
    }

    @Test
    public void testReturnedJobsAreDetached() {
        store.addJob(job("a", "g"));
        JobDefinition loaded = store.getJob("a", "g");
        loaded.setStatus(JobStatus.PAUSED);
        assertEquals(JobStatus.NORMAL, store.getJob("a", "g").getStatus());
    }

    @Test
    public void testUpdateJobStatus() {
        store.addJob(job("a", "g"));
        assertTrue(store.updateJobStatus("a", "g", JobStatus.PAUSED));
        assertEquals(JobStatus.PAUSED, store.getJob("a", "g").getStatus());
        assertFalse(store.updateJobStatus("b", "g", JobStatus.PAUSED));
    }

    @Test
    public void testJobQueryFiltersSortsAndPages() {
        for (int i = 0; i < 5; i++) {
            JobDefinition j = job("Nightly-" + i, "ops");
            j.setCreateTime(now.minusMinutes(i));
            store.addJob(j);
        }
        JobDefinition other = job("cleanup", "misc");
        other.setEnabled(false);
        store.addJob(other);

        JobQuery q = new JobQuery();
        q.setJobName("nightly");
        q.setPageSize(2);
        Page<JobDefinition> page = store.getJobs(q);
        assertEquals(5, page.getTotalCount());
        assertEquals(3, page.getTotalPages());
        assertEquals(2, page.getItems().size());
        // newest first by default
        assertEquals("Nightly-0", page.getItems().get(0).getJobName());

        q.setPageIndex(3);
        assertEquals(List.of("Nightly-4"), names(store.getJobs(q)));

        JobQuery byName = new JobQuery();
        byName.sort("jobName", "asc");
        assertEquals("Nightly-0", store.getJobs(byName).getItems().get(0).getJobName());

        JobQuery disabled = new JobQuery();
        disabled.setEnabled(false);
        assertEquals(List.of("cleanup"), names(store.getJobs(disabled)));

        JobQuery group = new JobQuery();
        group.setJobGroup("OPS");
        assertEquals(5, store.getJobs(group).getTotalCount());

        assertEquals(6, store.getAllJobs().size());
    }

    private static List<String> names(Page<JobDefinition> page) {
        return page.getItems().stream().map(JobDefinition::getJobName).collect(java.util.stream.Collectors.toList());
    }

    @Test
    public void testExecutionLogsQueryAndClear() {
        store.addExecutionLog(logRow("alpha", LogStatus.SUCCESS, 100, now.minusHours(2)));
        store.addExecutionLog(logRow("alpha", LogStatus.FAILED, 200, now.minusHours(1)));
        store.addExecutionLog(logRow("beta", LogStatus.SUCCESS, 300, now));

        LogQuery all = new LogQuery();
        Page<ExecutionLogEntry> page = store.getExecutionLogs(all);
        assertEquals(3, page.getTotalCount());
        assertEquals("beta", page.getItems().get(0).getJobName());

        LogQuery failed = new LogQuery();
        failed.setStatus(LogStatus.FAILED);
        assertEquals(1, store.getExecutionLogs(failed).getTotalCount());

        LogQuery window = new LogQuery();
        window.setStartTime(now.minusHours(1));
        window.setEndTime(now);
        assertEquals(2, store.getExecutionLogs(window).getTotalCount());

        LogQuery alpha = new LogQuery();
        alpha.setJobName("alp");
        assertTrue(store.clearLogs(alpha));
        assertEquals(1, store.getExecutionLogs(all).getTotalCount());

        assertTrue(store.clearLogs(new LogQuery()));
        assertEquals(0, store.getExecutionLogs(all).getTotalCount());
    }

    @Test
    public void testLogRowKeepsFailureDetails() {
        ExecutionLogEntry e = logRow("alpha", LogStatus.FAILED, 5, now);
        e.setException("java.lang.IllegalStateException");
        e.setErrorMessage("boom");
        e.setErrorStackTrace("java.lang.IllegalStateException: boom\n\tat x");
        e.setJobData("{\"k\":\"v\"}");
        store.addExecutionLog(e);

        ExecutionLogEntry loaded = store.getExecutionLogs(new LogQuery()).getItems().get(0);
        assertEquals(e.getLogId(), loaded.getLogId());
        assertEquals(LogStatus.FAILED, loaded.getStatus());
        assertEquals(Long.valueOf(5), loaded.getDurationMillis());
        assertEquals("boom", loaded.getErrorMessage());
        assertEquals("{\"k\":\"v\"}", loaded.getJobData());
        assertTrue(loaded.getErrorStackTrace().startsWith("java.lang.IllegalStateException"));
    }

    @Test
    public void testClearExpiredLogs() {
        store.addExecutionLog(logRow("old", LogStatus.SUCCESS, 1, now.minusDays(10)));
        store.addExecutionLog(logRow("new", LogStatus.SUCCESS, 1, now.minusDays(1)));
        assertEquals(1, store.clearExpiredLogs(7));
        Page<ExecutionLogEntry> left = store.getExecutionLogs(new LogQuery());
        assertEquals(1, left.getTotalCount());
        assertEquals("new", left.getItems().get(0).getJobName());
    }

    @Test
    public void testStatistics() {
        JobDefinition paused = job("p", "g");
        paused.setStatus(JobStatus.PAUSED);
        JobDefinition http = job("h", "g");
        http.setJobKind(JobKind.HTTP);
        http.setEnabled(false);
        store.addJob(job("n", "g"));
        store.addJob(paused);
        store.addJob(http);

        LocalDateTime hour = now.minusHours(1).truncatedTo(ChronoUnit.HOURS);
        store.addExecutionLog(logRow("n", LogStatus.SUCCESS, 500, hour.plusMinutes(1)));
        store.addExecutionLog(logRow("n", LogStatus.SUCCESS, 2_000, hour.plusMinutes(2)));
        store.addExecutionLog(logRow("n", LogStatus.FAILED, 400_000, hour.plusMinutes(3)));
        store.addExecutionLog(logRow("n", LogStatus.SUCCESS, 1, now.minusDays(30)));

        StatsQuery last7 = new StatsQuery();
        JobStats stats = store.getJobStats(last7);
        assertEquals(3, stats.getTotalJobs());
        assertEquals(2, stats.getEnabledJobs());
        assertEquals(1, stats.getDisabledJobs());
        assertEquals(1, stats.getPausedCount());
        assertEquals(2, stats.getSuccessCount());
        assertEquals(1, stats.getFailedCount());

        List<DistributionEntry> status = store.getJobStatusDistribution();
        DistributionEntry normal = status.stream().filter(d -> d.getLabel().equals("NORMAL")).findFirst().orElseThrow();
        assertEquals(2, normal.getCount());
        assertEquals(66.67, normal.getPercentage(), 0.001);

        List<DistributionEntry> types = store.getJobTypeDistribution();
        assertEquals(2, types.size());

        List<TrendPoint> trend = store.getExecutionTrend(last7);
        assertEquals(1, trend.size());
        assertEquals(2, trend.get(0).getSuccessCount());
        assertEquals(1, trend.get(0).getFailedCount());

        List<DistributionEntry> durations = store.getExecutionTimeDistribution(last7);
        assertEquals(7, durations.size());
        assertEquals(1, durations.get(0).getCount());
        assertEquals(1, durations.get(1).getCount());
        assertEquals(1, durations.get(6).getCount());
        assertEquals(0, durations.get(3).getCount());
    }

    @Test
    public void testSettingsUpsertKeepsCreateTime() throws Exception {
        assertNull(store.getSetting("k"));
        assertTrue(store.saveSetting(new Setting("k", "one")));
        LocalDateTime created = store.getSetting("k").getCreateTime();
        assertNotNull(created);

        Thread.sleep(20);
        assertTrue(store.saveSetting(new Setting("k", "two")));
        Setting loaded = store.getSetting("k");
        assertEquals("two", loaded.getValue());
        assertEquals(created, loaded.getCreateTime());
        assertEquals(1, store.getAllSettings().size());
    }

    @Test
    public void testNotifications() {
        NotificationRecord r = new NotificationRecord("title", "body", "job-failure");
        r.setCreateTime(now);
        assertTrue(store.addNotification(r));
        assertEquals(NotificationStatus.PENDING, store.getNotification(r.getNotificationId()).getStatus());

        r.setStatus(NotificationStatus.SENT);
        r.setSendTime(now.plusSeconds(1));
        r.setDurationMillis(12L);
        assertTrue(store.updateNotification(r));
        NotificationRecord loaded = store.getNotification(r.getNotificationId());
        assertEquals(NotificationStatus.SENT, loaded.getStatus());
        assertEquals(Long.valueOf(12), loaded.getDurationMillis());

        NotificationRecord other = new NotificationRecord("t2", "b2", "test");
        other.setCreateTime(now.minusMinutes(5));
        store.addNotification(other);

        NotificationQuery sent = new NotificationQuery();
        sent.setStatus(NotificationStatus.SENT);
        assertEquals(1, store.getNotifications(sent).getTotalCount());

        NotificationQuery byTrigger = new NotificationQuery();
        byTrigger.setTriggeredBy("test");
        assertTrue(store.clearNotifications(byTrigger));
        assertEquals(1, store.getNotifications(new NotificationQuery()).getTotalCount());

        assertTrue(store.deleteNotification(r.getNotificationId()));
        assertNull(store.getNotification(r.getNotificationId()));
        assertFalse(store.deleteNotification(r.getNotificationId()));
    }
}
