package com.jobkeeper.core;

import com.jobkeeper.model.ExecutionLogEntry;
import com.jobkeeper.model.JobDefinition;
import com.jobkeeper.model.JobStatus;
import com.jobkeeper.model.LogStatus;
import org.quartz.JobDataMap;
import org.quartz.JobExecutionContext;
import org.quartz.JobExecutionException;
import org.quartz.JobKey;
import org.quartz.JobListener;
import org.quartz.Trigger;
import org.quartz.Trigger.CompletedExecutionInstruction;
import org.quartz.TriggerListener;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.PrintWriter;
import java.io.StringWriter;
import java.util.Date;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.TreeMap;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.CopyOnWriteArrayList;

/**
 * Guards every firing and records its outcome.
 * <p>
 * Before a firing the stored status is consulted: scheduled firings of a
 * paused job are vetoed, manual firings always run. After a firing one
 * execution log row is written, the job's run times are refreshed and the
 * registered {@link JobResultListener}s are told.
 */
public class ExecutionListener implements TriggerListener, JobListener {
    private static final Logger log = LoggerFactory.getLogger(ExecutionListener.class);
    static final String NAME = "jobkeeper-execution";
    private static final int MAX_STACK_TRACE = 8000;

    private final JobOrchestrator orchestrator;
    private final List<JobResultListener> resultListeners = new CopyOnWriteArrayList<>();
    private final Set<String> pausedVetoes = ConcurrentHashMap.newKeySet();

    public ExecutionListener(JobOrchestrator orchestrator) {
        this.orchestrator = orchestrator;
    }

    public void addResultListener(JobResultListener listener) {
        resultListeners.add(listener);
    }

    @Override
    public String getName() {
        return NAME;
    }

    static boolean isManual(JobExecutionContext context) {
        Object flag = context.getMergedJobDataMap().get(JobDataKeys.MANUAL);
        return flag != null && Boolean.parseBoolean(flag.toString());
    }

    // ---- TriggerListener ----

    @Override
    public void triggerFired(Trigger trigger, JobExecutionContext context) {
    }

    @Override
    public boolean vetoJobExecution(Trigger trigger, JobExecutionContext context) {
        if (isManual(context)) {
            return false;
        }
        JobKey key = trigger.getJobKey();
        JobDefinition def = orchestrator.getStore().getJob(key.getName(), key.getGroup());
        if (def != null && def.getStatus() == JobStatus.PAUSED) {
            pausedVetoes.add(context.getFireInstanceId());
            Metrics.getInstance().recordVetoed();
            log.warn("Skipping scheduled firing of paused job {}", key);
            return true;
        }
        return false;
    }

    @Override
    public void triggerMisfired(Trigger trigger) {
        log.warn("Trigger {} of job {} misfired", trigger.getKey(), trigger.getJobKey());
    }

    @Override
    public void triggerComplete(Trigger trigger, JobExecutionContext context,
                                CompletedExecutionInstruction triggerInstructionCode) {
    }

    // ---- JobListener ----

    @Override
    public void jobToBeExecuted(JobExecutionContext context) {
        log.debug("Running {} (fire {})", context.getJobDetail().getKey(), context.getFireInstanceId());
    }

    @Override
    public void jobExecutionVetoed(JobExecutionContext context) {
        if (pausedVetoes.remove(context.getFireInstanceId())) {
            return;
        }
        JobKey key = context.getJobDetail().getKey();
        ExecutionLogEntry entry = newEntry(context);
        entry.setStatus(LogStatus.FAILED);
        entry.setEndTime(entry.getStartTime());
        entry.setMessage("Execution vetoed");
        entry.setErrorMessage("Execution vetoed by another listener");
        writeLog(entry);
        Metrics.getInstance().recordFailure();
        notifyListeners(new JobOutcome(key.getName(), key.getGroup(), false, isManual(context), null,
                entry.getErrorMessage()));
    }

    @Override
    public void jobWasExecuted(JobExecutionContext context, JobExecutionException jobException) {
        JobKey key = context.getJobDetail().getKey();
        JobDetailFactory factory = orchestrator.getFactory();
        Date fired = context.getFireTime();
        long now = System.currentTimeMillis();
        long duration = fired == null ? context.getJobRunTime() : Math.max(0, now - fired.getTime());

        ExecutionLogEntry entry = newEntry(context);
        entry.setEndTime(factory.toLocal(new Date(now)));
        entry.setDurationMillis(duration);
        boolean success = jobException == null;
        if (success) {
            entry.setStatus(LogStatus.SUCCESS);
            entry.setMessage("Job executed successfully");
            if (context.getResult() != null) {
                entry.setResult(context.getResult().toString());
            }
        } else {
            Throwable cause = jobException.getCause() != null ? jobException.getCause() : jobException;
            entry.setStatus(LogStatus.FAILED);
            entry.setMessage("Job execution failed");
            entry.setException(cause.getClass().getName());
            entry.setErrorMessage(errorMessage(jobException, cause));
            entry.setErrorStackTrace(stackTrace(jobException));
        }
        writeLog(entry);

        OperationResult<Void> times = orchestrator.updateExecutionTimes(key.getName(), key.getGroup(), fired);
        if (!times.isSuccess()) {
            log.warn("Could not refresh run times of {}: {}", key, times.getMessage());
        }

        Metrics metrics = Metrics.getInstance();
        if (success) {
            metrics.recordSuccess();
        } else {
            metrics.recordFailure();
        }
        metrics.recordDuration(duration);

        notifyListeners(new JobOutcome(key.getName(), key.getGroup(), success, isManual(context), duration,
                entry.getErrorMessage()));
    }

    private ExecutionLogEntry newEntry(JobExecutionContext context) {
        JobKey key = context.getJobDetail().getKey();
        JobDetailFactory factory = orchestrator.getFactory();
        ExecutionLogEntry entry = new ExecutionLogEntry(key.getName(), key.getGroup());
        if (context.getTrigger() != null) {
            entry.setTriggerName(context.getTrigger().getKey().getName());
            entry.setTriggerGroup(context.getTrigger().getKey().getGroup());
        }
        Date fired = context.getFireTime() == null ? new Date() : context.getFireTime();
        entry.setStartTime(factory.toLocal(fired));
        entry.setCreateTime(factory.toLocal(new Date()));
        entry.setJobData(snapshot(context.getMergedJobDataMap()));
        return entry;
    }

    /** The wrapper's own message, or the cause's when the wrapper only repeats it. */
    static String errorMessage(JobExecutionException e, Throwable cause) {
        String msg = e.getMessage();
        if (cause != e && (msg == null || msg.equals(cause.toString()))) {
            msg = cause.getMessage();
        }
        return msg == null ? cause.toString() : msg;
    }

    private static String snapshot(JobDataMap data) {
        Map<String, String> copy = new TreeMap<>();
        for (Map.Entry<String, Object> e : data.entrySet()) {
            copy.put(e.getKey(), e.getValue() == null ? null : e.getValue().toString());
        }
        try {
            return Json.write(copy);
        } catch (IllegalArgumentException e) {
            log.debug("Cannot serialize job data", e);
            return null;
        }
    }

    private void writeLog(ExecutionLogEntry entry) {
        if (!orchestrator.getStore().addExecutionLog(entry)) {
            log.error("Failed to write execution log for {}.{}", entry.getJobGroup(), entry.getJobName());
        }
    }

    private void notifyListeners(JobOutcome outcome) {
        for (JobResultListener l : resultListeners) {
            try {
                l.jobFinished(outcome);
            } catch (RuntimeException e) {
                log.warn("Result listener {} failed for {}", l.getClass().getSimpleName(), outcome.getIdentity(), e);
            }
        }
    }

    private static String stackTrace(Throwable t) {
        StringWriter sw = new StringWriter();
        t.printStackTrace(new PrintWriter(sw));
        String s = sw.toString();
        return s.length() > MAX_STACK_TRACE ? s.substring(0, MAX_STACK_TRACE) : s;
    }
}
