package com.jobkeeper.core;

import com.jobkeeper.jobs.ClassInvocationJob;
import com.jobkeeper.jobs.HttpCallJob;
import com.jobkeeper.model.JobDefinition;
import com.jobkeeper.model.JobKind;
import org.quartz.CronScheduleBuilder;
import org.quartz.JobBuilder;
import org.quartz.JobDataMap;
import org.quartz.JobDetail;
import org.quartz.JobKey;
import org.quartz.Trigger;
import org.quartz.TriggerBuilder;
import org.quartz.TriggerKey;

import java.time.Instant;
import java.time.LocalDateTime;
import java.time.ZoneId;
import java.util.Date;
import java.util.Map;
import java.util.TimeZone;

/**
 * Builds Quartz job details and cron triggers from job definitions and
 * converts between engine instants and local display times.
 */
public class JobDetailFactory {
    private final ZoneId zone;

    public JobDetailFactory(ZoneId zone) {
        this.zone = zone;
    }

    public ZoneId getZone() {
        return zone;
    }

    public static JobKey jobKey(JobDefinition def) {
        return JobKey.jobKey(def.getJobName(), def.getJobGroup());
    }

    public static TriggerKey triggerKey(JobDefinition def) {
        return TriggerKey.triggerKey(def.getTriggerName(), def.getTriggerGroup());
    }

    /** Job data as the job sees it: the user's entries plus the reserved execution keys. */
    public JobDataMap jobData(JobDefinition def) {
        JobDataMap map = new JobDataMap();
        for (Map.Entry<String, String> e : Json.readFlatMap(def.getJobData()).entrySet()) {
            map.put(e.getKey(), e.getValue());
        }
        if (def.getJobKind() == JobKind.HTTP) {
            map.put(JobDataKeys.HTTP_URL, def.getTarget());
            map.put(JobDataKeys.HTTP_METHOD, def.getHttpMethod() == null ? JobDefinition.DEFAULT_HTTP_METHOD : def.getHttpMethod());
            map.put(JobDataKeys.HTTP_TIMEOUT_SECONDS, String.valueOf(
                    def.getHttpTimeoutSeconds() > 0 ? def.getHttpTimeoutSeconds() : JobDefinition.DEFAULT_HTTP_TIMEOUT_SECONDS));
            map.put(JobDataKeys.HTTP_SKIP_SSL, String.valueOf(def.isSkipSslValidation()));
            if (def.getHttpHeaders() != null) {
                map.put(JobDataKeys.HTTP_HEADERS, def.getHttpHeaders());
            }
            if (def.getHttpBody() != null) {
                map.put(JobDataKeys.HTTP_BODY, def.getHttpBody());
            }
        } else {
            map.put(JobDataKeys.TARGET, def.getTarget());
        }
        return map;
    }

    public JobDetail buildJob(JobDefinition def) {
        return JobBuilder.newJob(def.getJobKind() == JobKind.HTTP ? HttpCallJob.class : ClassInvocationJob.class)
                .withIdentity(jobKey(def))
                .withDescription(def.getDescription())
                .usingJobData(jobData(def))
                .storeDurably()
                .build();
    }

    /** Cron trigger evaluated in the display zone; a start time in the past starts now. */
    public Trigger buildTrigger(JobDefinition def, JobDetail detail) {
        TriggerBuilder<Trigger> b = TriggerBuilder.newTrigger()
                .withIdentity(triggerKey(def))
                .forJob(detail)
                .withDescription(def.getDescription());
        Date now = new Date();
        Date start = toDate(def.getStartTime());
        b.startAt(start != null && start.after(now) ? start : now);
        if (def.getEndTime() != null) {
            b.endAt(toDate(def.getEndTime()));
        }
        return b.withSchedule(CronScheduleBuilder.cronSchedule(def.getCronExpression())
                        .inTimeZone(TimeZone.getTimeZone(zone)))
                .build();
    }

    public Date toDate(LocalDateTime t) {
        return t == null ? null : Date.from(t.atZone(zone).toInstant());
    }

    public LocalDateTime toLocal(Instant i) {
        return i == null ? null : LocalDateTime.ofInstant(i, zone);
    }

    public LocalDateTime toLocal(Date d) {
        return d == null ? null : toLocal(d.toInstant());
    }
}
