package com.jobkeeper.core;

import com.jobkeeper.core.OperationResult.ErrorCode;
import com.jobkeeper.model.DistributionEntry;
import com.jobkeeper.model.ExecutionLogEntry;
import com.jobkeeper.model.JobDefinition;
import com.jobkeeper.model.JobKind;
import com.jobkeeper.model.JobQuery;
import com.jobkeeper.model.JobStats;
import com.jobkeeper.model.JobStatus;
import com.jobkeeper.model.LogQuery;
import com.jobkeeper.model.Page;
import com.jobkeeper.model.StatsQuery;
import com.jobkeeper.model.TrendPoint;
import com.jobkeeper.store.JobStore;
import org.quartz.CronExpression;
import org.quartz.JobDataMap;
import org.quartz.JobDetail;
import org.quartz.JobKey;
import org.quartz.SchedulerException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.net.URI;
import java.net.URISyntaxException;
import java.text.ParseException;
import java.time.LocalDateTime;
import java.time.temporal.ChronoUnit;
import java.util.ArrayList;
import java.util.Date;
import java.util.List;
import java.util.Map;
import java.util.TimeZone;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.locks.ReentrantLock;
import java.util.function.Supplier;

/**
 * Keeps the job store and the scheduling engine in agreement. The store is the
 * source of truth; every engine action is derived from the stored definition.
 * Mutations of one job identity are serialized by a per-identity lock.
 */
public class JobOrchestrator {
    private static final Logger log = LoggerFactory.getLogger(JobOrchestrator.class);

    private final JobStore store;
    private final SchedulingEngine engine;
    private final JobClassRegistry registry;
    private final JobDetailFactory factory;
    private final StartupReconciler reconciler;
    private final Map<JobKey, ReentrantLock> locks = new ConcurrentHashMap<>();

    public JobOrchestrator(JobStore store, SchedulingEngine engine, JobClassRegistry registry, JobDetailFactory factory) {
        this.store = store;
        this.engine = engine;
        this.registry = registry;
        this.factory = factory;
        this.reconciler = new StartupReconciler(store, engine, this);
    }

    public JobStore getStore() {
        return store;
    }

    public SchedulingEngine getEngine() {
        return engine;
    }

    public JobDetailFactory getFactory() {
        return factory;
    }

    public StartupReconciler getReconciler() {
        return reconciler;
    }

    /**
     * Runs {@code action} while holding the lock of {@code key}. The lock entry
     * is dropped once the job is gone from the store and nobody else holds or
     * waits on it.
     */
    <T> T withLock(JobKey key, Supplier<T> action) {
        ReentrantLock lock = acquire(key);
        boolean gone = true;
        try {
            T result = action.get();
            gone = store.getJob(key.getName(), key.getGroup()) == null;
            return result;
        } finally {
            lock.unlock();
            if (gone) {
                locks.computeIfPresent(key, (k, l) -> l != lock || l.isLocked() || l.hasQueuedThreads() ? l : null);
            }
        }
    }

    /** Locks the current entry of {@code key}, retrying when the entry was replaced meanwhile. */
    private ReentrantLock acquire(JobKey key) {
        while (true) {
            ReentrantLock lock = locks.computeIfAbsent(key, k -> new ReentrantLock());
            lock.lock();
            if (locks.get(key) == lock) {
                return lock;
            }
            lock.unlock();
        }
    }

    int lockCount() {
        return locks.size();
    }

    private LocalDateTime now() {
        return LocalDateTime.now(factory.getZone()).truncatedTo(ChronoUnit.MILLIS);
    }

    // ---- validation ----

    /** Fills identity-derived defaults in place. */
    static void applyDefaults(JobDefinition def) {
        if (def.getJobGroup() == null || def.getJobGroup().isBlank()) {
            def.setJobGroup(JobDefinition.DEFAULT_GROUP);
        }
        if (def.getTriggerName() == null || def.getTriggerName().isBlank()) {
            def.setTriggerName(def.getJobName() + "_Trigger");
        }
        if (def.getTriggerGroup() == null || def.getTriggerGroup().isBlank()) {
            def.setTriggerGroup(def.getJobGroup());
        }
        if (def.getJobKind() == null) {
            def.setJobKind(JobKind.CLASS);
        }
        if (def.getJobKind() == JobKind.HTTP) {
            if (def.getHttpMethod() == null || def.getHttpMethod().isBlank()) {
                def.setHttpMethod(JobDefinition.DEFAULT_HTTP_METHOD);
            }
            if (def.getHttpTimeoutSeconds() <= 0) {
                def.setHttpTimeoutSeconds(JobDefinition.DEFAULT_HTTP_TIMEOUT_SECONDS);
            }
        }
    }

    /** Returns a description of the first problem found, or {@code null} when the definition is valid. */
    String validate(JobDefinition def) {
        if (def.getJobName() == null || def.getJobName().isBlank()) {
            return "Job name is required";
        }
        String cronError = cronError(def.getCronExpression(), def.getStartTime(), def.getEndTime());
        if (cronError != null) {
            return cronError;
        }
        if (def.getJobKind() == JobKind.HTTP) {
            if (!isHttpUrl(def.getTarget())) {
                return "URL must be an absolute http or https address: " + def.getTarget();
            }
            try {
                Json.readFlatMap(def.getHttpHeaders());
            } catch (IllegalArgumentException e) {
                return "Headers must be a JSON object: " + e.getMessage();
            }
        } else if (!registry.contains(def.getTarget())) {
            return "Job class is not registered: " + def.getTarget();
        }
        try {
            for (String key : Json.readFlatMap(def.getJobData()).keySet()) {
                if (key.startsWith(JobDataKeys.PREFIX)) {
                    return "Job data key " + key + " is reserved";
                }
            }
        } catch (IllegalArgumentException e) {
            return "Job data must be a JSON object: " + e.getMessage();
        }
        return null;
    }

    private String cronError(String cron, LocalDateTime start, LocalDateTime end) {
        if (cron == null || !CronExpression.isValidExpression(cron)) {
            return "Invalid cron expression: " + cron;
        }
        try {
            CronExpression expr = new CronExpression(cron);
            expr.setTimeZone(TimeZone.getTimeZone(factory.getZone()));
            Date from = new Date();
            Date startDate = factory.toDate(start);
            if (startDate != null && startDate.after(from)) {
                from = startDate;
            }
            Date next = expr.getNextValidTimeAfter(from);
            if (next == null) {
                return "Cron expression never fires: " + cron;
            }
            Date endDate = factory.toDate(end);
            if (endDate != null && next.after(endDate)) {
                return "Cron expression never fires before the end time: " + cron;
            }
            return null;
        } catch (ParseException e) {
            return "Invalid cron expression: " + e.getMessage();
        }
    }

    static boolean isHttpUrl(String url) {
        if (url == null || url.isBlank()) {
            return false;
        }
        try {
            URI uri = new URI(url);
            String scheme = uri.getScheme();
            return uri.isAbsolute() && uri.getHost() != null
                    && ("http".equalsIgnoreCase(scheme) || "https".equalsIgnoreCase(scheme));
        } catch (URISyntaxException e) {
            return false;
        }
    }

    // ---- engine helpers ----

    /**
     * Registers the job and its cron trigger, replacing any existing registration,
     * then copies the engine's fire times into {@code def}. Does not write the store.
     */
    void scheduleInEngine(JobDefinition def) throws SchedulerException {
        JobDetail detail = factory.buildJob(def);
        engine.schedule(detail, factory.buildTrigger(def, detail), true);
        if (def.getStatus() == JobStatus.PAUSED) {
            engine.pause(detail.getKey());
        }
        copyLiveTimes(def);
        log.info("Scheduled {} with cron {}", def.getIdentity(), def.getCronExpression());
    }

    /**
     * Overlays the engine's fire times on {@code def}. Returns false when the
     * engine has no trigger for the job.
     */
    private boolean copyLiveTimes(JobDefinition def) throws SchedulerException {
        List<TriggerTimes> triggers = engine.triggersOf(JobDetailFactory.jobKey(def));
        if (triggers.isEmpty()) {
            return false;
        }
        TriggerTimes t = triggers.get(0);
        for (TriggerTimes candidate : triggers) {
            if (candidate.getKey().equals(JobDetailFactory.triggerKey(def))) {
                t = candidate;
            }
        }
        def.setNextRunTime(def.getStatus() == JobStatus.PAUSED || t.isPaused() ? null : factory.toLocal(t.getNextFireTime()));
        if (t.getPreviousFireTime() != null) {
            def.setPreviousRunTime(factory.toLocal(t.getPreviousFireTime()));
        }
        return true;
    }

    private void overlayLive(JobDefinition def) {
        try {
            if (engine.exists(JobDetailFactory.jobKey(def))) {
                copyLiveTimes(def);
            }
        } catch (SchedulerException e) {
            log.debug("Cannot read live trigger state of {}", def.getIdentity(), e);
        }
    }

    private void bestEffort(String action, JobKey key, EngineCall call) {
        try {
            call.run();
        } catch (SchedulerException e) {
            log.warn("Engine {} of {} failed: {}", action, key, e.getMessage());
        }
    }

    private interface EngineCall {
        void run() throws SchedulerException;
    }

    // ---- job mutations ----

    /** Validates, persists and, when enabled, schedules a new job. */
    public OperationResult<JobDefinition> addJob(JobDefinition request) {
        JobDefinition def = request.copy();
        applyDefaults(def);
        String error = validate(def);
        if (error != null) {
            log.warn("Rejected job {}: {}", def.getIdentity(), error);
            return OperationResult.fail(ErrorCode.VALIDATION, error);
        }
        JobKey key = JobDetailFactory.jobKey(def);
        return withLock(key, () -> {
            if (store.getJob(def.getJobName(), def.getJobGroup()) != null) {
                return OperationResult.fail(ErrorCode.DUPLICATE, "Job " + def.getIdentity() + " already exists");
            }
            LocalDateTime now = now();
            def.setStatus(JobStatus.NORMAL);
            def.setCreateTime(now);
            def.setUpdateTime(now);
            def.setNextRunTime(null);
            def.setPreviousRunTime(null);
            if (!store.addJob(def)) {
                return OperationResult.fail(ErrorCode.STORE, "Failed to save job " + def.getIdentity());
            }
            if (!def.isEnabled()) {
                log.info("Added disabled job {}", def.getIdentity());
                return OperationResult.ok("Job added", def);
            }
            try {
                scheduleInEngine(def);
            } catch (SchedulerException e) {
                log.error("Job {} saved but could not be scheduled", def.getIdentity(), e);
                return OperationResult.ok("Job saved; scheduling failed and will be retried at next start: "
                        + e.getMessage(), def);
            }
            if (!store.updateJob(def)) {
                return OperationResult.fail(ErrorCode.STORE, "Failed to save run times of " + def.getIdentity());
            }
            return OperationResult.ok("Job added", def);
        });
    }

    /**
     * Replaces a job definition. The engine registration is torn down first and
     * rebuilt from the stored result so old and new triggers never coexist.
     */
    public OperationResult<JobDefinition> updateJob(JobDefinition request) {
        JobDefinition def = request.copy();
        applyDefaults(def);
        String error = validate(def);
        if (error != null) {
            log.warn("Rejected update of {}: {}", def.getIdentity(), error);
            return OperationResult.fail(ErrorCode.VALIDATION, error);
        }
        JobKey key = JobDetailFactory.jobKey(def);
        return withLock(key, () -> {
            JobDefinition existing = store.getJob(def.getJobName(), def.getJobGroup());
            if (existing == null) {
                return OperationResult.fail(ErrorCode.NOT_FOUND, "Job " + def.getIdentity() + " not found");
            }
            bestEffort("pause", key, () -> engine.pause(key));
            bestEffort("unschedule", key, () -> engine.unschedule(JobDetailFactory.triggerKey(existing)));
            bestEffort("delete", key, () -> engine.delete(key));

            def.setStatus(existing.getStatus() == null ? JobStatus.NORMAL : existing.getStatus());
            def.setCreateTime(existing.getCreateTime());
            def.setCreateBy(existing.getCreateBy());
            def.setPreviousRunTime(existing.getPreviousRunTime());
            def.setNextRunTime(null);
            def.setUpdateTime(now());
            if (!store.updateJob(def)) {
                return OperationResult.fail(ErrorCode.STORE, "Failed to save job " + def.getIdentity());
            }
            if (!def.isEnabled()) {
                return OperationResult.ok("Job updated", def);
            }
            try {
                scheduleInEngine(def);
            } catch (SchedulerException e) {
                log.error("Job {} updated but could not be rescheduled", def.getIdentity(), e);
                return OperationResult.ok("Job updated; rescheduling failed: " + e.getMessage(), def);
            }
            if (!store.updateJob(def)) {
                return OperationResult.fail(ErrorCode.STORE, "Failed to save run times of " + def.getIdentity());
            }
            return OperationResult.ok("Job updated", def);
        });
    }

    /** Removes the job from the engine (best effort) and from the store. */
    public OperationResult<Void> deleteJob(String jobName, String jobGroup) {
        JobKey key = JobKey.jobKey(jobName, jobGroup);
        return withLock(key, () -> {
            try {
                if (!engine.delete(key)) {
                    log.warn("Job {} was not registered in the engine", key);
                }
            } catch (SchedulerException e) {
                log.warn("Engine delete of {} failed: {}", key, e.getMessage());
            }
            if (!store.deleteJob(jobName, jobGroup) && store.getJob(jobName, jobGroup) != null) {
                return OperationResult.fail(ErrorCode.STORE, "Failed to delete job " + key);
            }
            log.info("Deleted job {}", key);
            return OperationResult.ok("Job deleted", null);
        });
    }

    /** Deletes each identity in turn and reports how many were removed. */
    public OperationResult<Integer> batchDeleteJobs(List<JobKey> keys) {
        int deleted = 0;
        List<String> failed = new ArrayList<>();
        for (JobKey k : keys) {
            if (deleteJob(k.getName(), k.getGroup()).isSuccess()) {
                deleted++;
            } else {
                failed.add(k.toString());
            }
        }
        if (!failed.isEmpty()) {
            return OperationResult.fail(ErrorCode.STORE, "Failed to delete " + String.join(", ", failed));
        }
        return OperationResult.ok("Deleted " + deleted + " jobs", deleted);
    }

    /** Marks the job paused in the store, then pauses its triggers. */
    public OperationResult<Void> pauseJob(String jobName, String jobGroup) {
        JobKey key = JobKey.jobKey(jobName, jobGroup);
        return withLock(key, () -> {
            JobDefinition def = store.getJob(jobName, jobGroup);
            if (def == null) {
                return OperationResult.fail(ErrorCode.NOT_FOUND, "Job " + key + " not found");
            }
            def.setStatus(JobStatus.PAUSED);
            def.setNextRunTime(null);
            def.setUpdateTime(now());
            if (!store.updateJob(def)) {
                return OperationResult.fail(ErrorCode.STORE, "Failed to pause job " + key);
            }
            bestEffort("pause", key, () -> engine.pause(key));
            log.info("Paused job {}", key);
            return OperationResult.ok("Job paused", null);
        });
    }

    /**
     * Resumes a job, rescheduling it from the stored definition when the engine
     * has forgotten it or holds no trigger for it.
     */
    public OperationResult<JobDefinition> resumeJob(String jobName, String jobGroup) {
        JobKey key = JobKey.jobKey(jobName, jobGroup);
        return withLock(key, () -> {
            JobDefinition def = store.getJob(jobName, jobGroup);
            if (def == null) {
                return OperationResult.fail(ErrorCode.NOT_FOUND, "Job " + key + " not found");
            }
            def.setStatus(JobStatus.NORMAL);
            def.setUpdateTime(now());
            if (def.isEnabled()) {
                try {
                    if (engine.exists(key)) {
                        engine.resume(key);
                        if (engine.triggersOf(key).isEmpty()) {
                            log.info("Job {} had no triggers after resume, rescheduling", key);
                            scheduleInEngine(def);
                        }
                    } else {
                        scheduleInEngine(def);
                    }
                    copyLiveTimes(def);
                } catch (SchedulerException e) {
                    log.error("Failed to resume {}", key, e);
                    return OperationResult.fail(ErrorCode.ENGINE, "Failed to resume job " + key + ": " + e.getMessage());
                }
            }
            if (!store.updateJob(def)) {
                return OperationResult.fail(ErrorCode.STORE, "Failed to save job " + key);
            }
            log.info("Resumed job {}", key);
            return OperationResult.ok("Job resumed", def);
        });
    }

    /**
     * Fires the job once, now. The firing carries the manual flag so that it
     * runs even while the job is paused; the stored status is left untouched.
     */
    public OperationResult<Void> triggerJob(String jobName, String jobGroup) {
        JobKey key = JobKey.jobKey(jobName, jobGroup);
        return withLock(key, () -> {
            JobDefinition def = store.getJob(jobName, jobGroup);
            if (def == null) {
                return OperationResult.fail(ErrorCode.NOT_FOUND, "Job " + key + " not found");
            }
            try {
                if (!engine.exists(key)) {
                    engine.addDurable(factory.buildJob(def));
                }
                JobDataMap data = factory.jobData(def);
                data.put(JobDataKeys.MANUAL, "true");
                engine.triggerNow(key, data);
            } catch (SchedulerException e) {
                log.error("Failed to trigger {}", key, e);
                return OperationResult.fail(ErrorCode.ENGINE, "Failed to trigger job " + key + ": " + e.getMessage());
            }
            log.info("Triggered job {} manually", key);
            return OperationResult.ok("Job triggered", null);
        });
    }

    /**
     * Records a completed firing: the fire time becomes the previous run time and
     * the next run time is re-read from the job's live cron trigger.
     */
    public OperationResult<Void> updateExecutionTimes(String jobName, String jobGroup, Date firedAt) {
        JobKey key = JobKey.jobKey(jobName, jobGroup);
        return withLock(key, () -> {
            JobDefinition def = store.getJob(jobName, jobGroup);
            if (def == null) {
                return OperationResult.fail(ErrorCode.NOT_FOUND, "Job " + key + " not found");
            }
            try {
                if (!copyLiveTimes(def)) {
                    def.setNextRunTime(null);
                }
            } catch (SchedulerException e) {
                log.debug("Cannot read next fire time of {}", key, e);
            }
            if (firedAt != null) {
                def.setPreviousRunTime(factory.toLocal(firedAt));
            }
            if (!store.updateJob(def)) {
                return OperationResult.fail(ErrorCode.STORE, "Failed to save run times of " + key);
            }
            return OperationResult.ok(null);
        });
    }

    /** Replays the scheduling step for a stored job unless the engine already has a trigger for it. */
    boolean registerIfMissing(JobDefinition stored) {
        JobKey key = JobDetailFactory.jobKey(stored);
        return withLock(key, () -> {
            JobDefinition def = store.getJob(stored.getJobName(), stored.getJobGroup());
            if (def == null || !def.isEnabled() || def.getStatus() == JobStatus.PAUSED) {
                return false;
            }
            try {
                if (!engine.triggersOf(key).isEmpty()) {
                    return false;
                }
                scheduleInEngine(def);
            } catch (SchedulerException e) {
                log.error("Failed to register {} with the engine", key, e);
                return false;
            }
            if (!store.updateJob(def)) {
                log.warn("Registered {} but could not save its run times", key);
            }
            return true;
        });
    }

    // ---- queries ----

    public OperationResult<Page<JobDefinition>> getJobs(JobQuery query) {
        Page<JobDefinition> page = store.getJobs(query);
        for (JobDefinition def : page.getItems()) {
            overlayLive(def);
        }
        return OperationResult.ok(page);
    }

    public OperationResult<JobDefinition> getJobDetail(String jobName, String jobGroup) {
        JobDefinition def = store.getJob(jobName, jobGroup);
        if (def == null) {
            return OperationResult.fail(ErrorCode.NOT_FOUND, "Job " + jobGroup + "." + jobName + " not found");
        }
        overlayLive(def);
        return OperationResult.ok(def);
    }

    public OperationResult<Page<ExecutionLogEntry>> getJobLogs(LogQuery query) {
        return OperationResult.ok(store.getExecutionLogs(query));
    }

    public OperationResult<Void> clearJobLogs(LogQuery filter) {
        return store.clearLogs(filter)
                ? OperationResult.ok("Logs cleared", null)
                : OperationResult.fail(ErrorCode.STORE, "Failed to clear logs");
    }

    public OperationResult<Integer> clearExpiredLogs(int retentionDays) {
        return OperationResult.ok(store.clearExpiredLogs(retentionDays));
    }

    public OperationResult<JobStats> getJobStats(StatsQuery query) {
        return OperationResult.ok(store.getJobStats(query));
    }

    public OperationResult<List<DistributionEntry>> getJobStatusDistribution() {
        return OperationResult.ok(store.getJobStatusDistribution());
    }

    public OperationResult<List<DistributionEntry>> getJobTypeDistribution() {
        return OperationResult.ok(store.getJobTypeDistribution());
    }

    public OperationResult<List<TrendPoint>> getExecutionTrend(StatsQuery query) {
        return OperationResult.ok(store.getExecutionTrend(query));
    }

    public OperationResult<List<DistributionEntry>> getExecutionTimeDistribution(StatsQuery query) {
        return OperationResult.ok(store.getExecutionTimeDistribution(query));
    }

    public OperationResult<Boolean> validateCronExpression(String cron) {
        String error = cronError(cron, null, null);
        return error == null ? OperationResult.ok(Boolean.TRUE) : OperationResult.fail(ErrorCode.VALIDATION, error);
    }

    /** The next {@code count} fire times of {@code cron} in display time. */
    public OperationResult<List<LocalDateTime>> nextRunTimes(String cron, int count) {
        String error = cronError(cron, null, null);
        if (error != null) {
            return OperationResult.fail(ErrorCode.VALIDATION, error);
        }
        List<LocalDateTime> times = new ArrayList<>();
        try {
            CronExpression expr = new CronExpression(cron);
            expr.setTimeZone(TimeZone.getTimeZone(factory.getZone()));
            Date next = new Date();
            for (int i = 0; i < count; i++) {
                next = expr.getNextValidTimeAfter(next);
                if (next == null) {
                    break;
                }
                times.add(factory.toLocal(next));
            }
        } catch (ParseException e) {
            return OperationResult.fail(ErrorCode.VALIDATION, "Invalid cron expression: " + e.getMessage());
        }
        return OperationResult.ok(times);
    }

    public OperationResult<List<String>> jobClassNames() {
        return OperationResult.ok(registry.names());
    }

    // ---- scheduler control ----

    public OperationResult<EngineStatus> schedulerStatus() {
        try {
            return OperationResult.ok(engine.status());
        } catch (SchedulerException e) {
            return OperationResult.fail(ErrorCode.ENGINE, "Cannot read scheduler status: " + e.getMessage());
        }
    }

    /** Starts the engine and registers every runnable stored job with it. */
    public OperationResult<Integer> startScheduler() {
        try {
            engine.start();
        } catch (SchedulerException e) {
            log.error("Failed to start scheduler", e);
            return OperationResult.fail(ErrorCode.ENGINE, "Failed to start scheduler: " + e.getMessage());
        }
        int registered = reconciler.run();
        return OperationResult.ok("Scheduler started", registered);
    }

    public OperationResult<Void> shutdownScheduler() {
        try {
            engine.shutdown();
            return OperationResult.ok("Scheduler shut down", null);
        } catch (SchedulerException e) {
            log.error("Failed to shut down scheduler", e);
            return OperationResult.fail(ErrorCode.ENGINE, "Failed to shut down scheduler: " + e.getMessage());
        }
    }

    /** Removes every job from the engine and the store. */
    public OperationResult<Integer> clearAllJobs() {
        try {
            engine.clear();
        } catch (SchedulerException e) {
            log.warn("Engine clear failed: {}", e.getMessage());
        }
        int deleted = 0;
        for (JobDefinition def : store.getAllJobs()) {
            if (!withLock(JobDetailFactory.jobKey(def), () -> store.deleteJob(def.getJobName(), def.getJobGroup()))) {
                return OperationResult.fail(ErrorCode.STORE, "Failed to delete job " + def.getIdentity());
            }
            deleted++;
        }
        log.info("Cleared {} jobs", deleted);
        return OperationResult.ok("Cleared " + deleted + " jobs", deleted);
    }
}
