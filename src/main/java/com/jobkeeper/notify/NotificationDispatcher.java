package com.jobkeeper.notify;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.jobkeeper.core.JobOutcome;
import com.jobkeeper.core.JobResultListener;
import com.jobkeeper.core.Json;
import com.jobkeeper.model.NotificationQuery;
import com.jobkeeper.model.NotificationRecord;
import com.jobkeeper.model.NotificationStatus;
import com.jobkeeper.model.Page;
import com.jobkeeper.model.Setting;
import com.jobkeeper.store.JobStore;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.LocalDateTime;
import java.time.ZoneId;
import java.time.format.DateTimeFormatter;
import java.time.temporal.ChronoUnit;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.concurrent.Executor;
import java.util.concurrent.RejectedExecutionException;

/**
 * Turns job results and scheduler errors into notifications according to the
 * stored {@link NotificationPolicy}. Every attempt is recorded; nothing is retried.
 */
public class NotificationDispatcher implements JobResultListener {
    private static final Logger log = LoggerFactory.getLogger(NotificationDispatcher.class);
    private static final DateTimeFormatter TIME = DateTimeFormatter.ofPattern("yyyy-MM-dd HH:mm:ss");

    public static final String TRIGGER_JOB_SUCCESS = "job-success";
    public static final String TRIGGER_JOB_FAILURE = "job-failure";
    public static final String TRIGGER_SCHEDULER_ERROR = "scheduler-error";
    public static final String TRIGGER_TEST = "test";

    private final JobStore store;
    private final NotificationChannel channel;
    private final Executor executor;
    private final ZoneId zone;

    public NotificationDispatcher(JobStore store, NotificationChannel channel, Executor executor, ZoneId zone) {
        this.store = store;
        this.channel = channel;
        this.executor = executor;
        this.zone = zone;
    }

    @Override
    public void jobFinished(JobOutcome outcome) {
        notifyJobResult(outcome.getJobName(), outcome.getJobGroup(), outcome.isSuccess(),
                outcome.isSuccess() ? "Job completed" : "Job failed", outcome.getDurationMillis(),
                outcome.getErrorMessage());
    }

    public void notifyJobResult(String jobName, String jobGroup, boolean success, String message,
                                Long durationMillis, String errorText) {
        NotificationPolicy policy = getPolicy();
        if (!policy.isEnabled() || (success ? !policy.isNotifyOnSuccess() : !policy.isNotifyOnFailure())) {
            return;
        }
        Map<String, String> fields = new LinkedHashMap<>();
        fields.put("Job", jobGroup + "." + jobName);
        fields.put("Result", success ? "SUCCESS" : "FAILED");
        fields.put("Message", message);
        fields.put("Duration", durationMillis == null ? "-" : durationMillis + " ms");
        fields.put("Time", now().format(TIME));
        if (!success && errorText != null) {
            fields.put("Error", errorText);
        }
        String title = (success ? "Job succeeded: " : "Job failed: ") + jobGroup + "." + jobName;
        dispatch(title, render(policy.getFormat(), title, fields), policy.getFormat(),
                success ? TRIGGER_JOB_SUCCESS : TRIGGER_JOB_FAILURE);
    }

    public void notifySchedulerError(String message, Throwable cause) {
        NotificationPolicy policy = getPolicy();
        if (!policy.isEnabled() || !policy.isNotifyOnSchedulerError()) {
            return;
        }
        Map<String, String> fields = new LinkedHashMap<>();
        fields.put("Message", message);
        fields.put("Time", now().format(TIME));
        if (cause != null) {
            fields.put("Error", cause.toString());
        }
        String title = "Scheduler error";
        dispatch(title, render(policy.getFormat(), title, fields), policy.getFormat(), TRIGGER_SCHEDULER_ERROR);
    }

    /** Sends a test message regardless of the policy's event switches; waits for the result. */
    public NotificationRecord sendTest() {
        NotificationPolicy policy = getPolicy();
        Map<String, String> fields = new LinkedHashMap<>();
        fields.put("Message", "This is a test notification");
        fields.put("Time", now().format(TIME));
        String title = "Test notification";
        NotificationRecord record = new NotificationRecord(title, render(policy.getFormat(), title, fields), TRIGGER_TEST);
        record.setCreateTime(now());
        if (!store.addNotification(record)) {
            log.warn("Could not record test notification");
        }
        deliver(record, policy.getFormat());
        return record;
    }

    private void dispatch(String title, String content, String format, String triggeredBy) {
        NotificationRecord record = new NotificationRecord(title, content, triggeredBy);
        record.setCreateTime(now());
        if (!store.addNotification(record)) {
            log.warn("Could not record notification '{}'", title);
        }
        try {
            executor.execute(() -> deliver(record, format));
        } catch (RejectedExecutionException e) {
            record.setStatus(NotificationStatus.FAILED);
            record.setErrorMessage("Dispatcher is shut down");
            store.updateNotification(record);
            log.warn("Dropped notification '{}': dispatcher is shut down", title);
        }
    }

    private void deliver(NotificationRecord record, String format) {
        long start = System.currentTimeMillis();
        boolean sent;
        String error = null;
        try {
            sent = channel.send(record.getTitle(), record.getContent(), format);
            if (!sent) {
                error = "Channel rejected the notification";
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            sent = false;
            error = "Interrupted";
        } catch (Exception e) {
            sent = false;
            error = e.getMessage() == null ? e.toString() : e.getMessage();
        }
        record.setStatus(sent ? NotificationStatus.SENT : NotificationStatus.FAILED);
        record.setErrorMessage(error);
        record.setSendTime(now());
        record.setDurationMillis(System.currentTimeMillis() - start);
        if (!store.updateNotification(record)) {
            log.warn("Could not update notification {}", record.getNotificationId());
        }
        if (sent) {
            log.debug("Sent notification '{}'", record.getTitle());
        } else {
            log.warn("Notification '{}' failed: {}", record.getTitle(), error);
        }
    }

    static String render(String format, String title, Map<String, String> fields) {
        StringBuilder sb = new StringBuilder();
        switch (format) {
            case NotificationPolicy.FORMAT_HTML:
                sb.append("<h3>").append(escapeHtml(title)).append("</h3>\n<table>\n");
                fields.forEach((k, v) -> sb.append("<tr><td><b>").append(escapeHtml(k)).append("</b></td><td>")
                        .append(escapeHtml(v)).append("</td></tr>\n"));
                sb.append("</table>");
                break;
            case NotificationPolicy.FORMAT_MARKDOWN:
                sb.append("### ").append(title).append("\n\n");
                fields.forEach((k, v) -> sb.append("- **").append(k).append("**: ").append(v).append('\n'));
                break;
            default:
                sb.append(title).append('\n');
                fields.forEach((k, v) -> sb.append(k).append(": ").append(v).append('\n'));
        }
        return sb.toString();
    }

    private static String escapeHtml(String s) {
        if (s == null) {
            return "";
        }
        return s.replace("&", "&amp;").replace("<", "&lt;").replace(">", "&gt;").replace("\"", "&quot;");
    }

    private LocalDateTime now() {
        return LocalDateTime.now(zone).truncatedTo(ChronoUnit.MILLIS);
    }

    // ---- policy and record management ----

    /** The stored policy, or a disabled default when none is stored or it cannot be read. */
    public NotificationPolicy getPolicy() {
        Setting s = store.getSetting(NotificationPolicy.SETTING_KEY);
        if (s == null || s.getValue() == null || s.getValue().isBlank()) {
            return new NotificationPolicy();
        }
        try {
            return Json.mapper().readValue(s.getValue(), NotificationPolicy.class);
        } catch (JsonProcessingException e) {
            log.warn("Ignoring unreadable notification policy: {}", e.getOriginalMessage());
            return new NotificationPolicy();
        }
    }

    public boolean savePolicy(NotificationPolicy policy) {
        Setting s = new Setting(NotificationPolicy.SETTING_KEY, Json.write(policy));
        s.setDescription("Notification policy");
        s.setUpdateTime(now());
        return store.saveSetting(s);
    }

    public Page<NotificationRecord> getNotifications(NotificationQuery query) {
        return store.getNotifications(query);
    }

    public NotificationRecord getNotification(String notificationId) {
        return store.getNotification(notificationId);
    }

    public boolean deleteNotification(String notificationId) {
        return store.deleteNotification(notificationId);
    }

    public boolean clearNotifications(NotificationQuery filter) {
        return store.clearNotifications(filter);
    }
}
