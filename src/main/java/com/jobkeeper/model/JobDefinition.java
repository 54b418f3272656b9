package com.jobkeeper.model;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonIgnoreProperties;

import java.time.LocalDateTime;
import java.util.Objects;

/**
 * Durable description of a schedulable job. Identified by (jobName, jobGroup),
 * which is also the Quartz job key.
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public class JobDefinition {
    public static final String DEFAULT_GROUP = "DEFAULT";
    public static final String DEFAULT_CRON = "0 0/1 * * * ?";
    public static final String DEFAULT_HTTP_METHOD = "GET";
    public static final int DEFAULT_HTTP_TIMEOUT_SECONDS = 60;

    private String jobName;
    private String jobGroup = DEFAULT_GROUP;
    private String triggerName;
    private String triggerGroup;
    private String cronExpression = DEFAULT_CRON;
    private String description;
    private JobKind jobKind = JobKind.CLASS;
    private String target;
    private String jobData;
    private String httpMethod = DEFAULT_HTTP_METHOD;
    private String httpHeaders;
    private String httpBody;
    private int httpTimeoutSeconds = DEFAULT_HTTP_TIMEOUT_SECONDS;
    private boolean skipSslValidation;
    private LocalDateTime startTime;
    private LocalDateTime endTime;
    private JobStatus status = JobStatus.NORMAL;
    private boolean enabled = true;
    private LocalDateTime nextRunTime;
    private LocalDateTime previousRunTime;
    private String remark;
    private LocalDateTime createTime;
    private LocalDateTime updateTime;
    private String createBy;
    private String updateBy;

    public JobDefinition() {
    }

    public JobDefinition(String jobName, String jobGroup) {
        this.jobName = jobName;
        this.jobGroup = jobGroup;
    }

    /** Field-by-field copy. */
    public JobDefinition copy() {
        JobDefinition c = new JobDefinition(jobName, jobGroup);
        c.triggerName = triggerName;
        c.triggerGroup = triggerGroup;
        c.cronExpression = cronExpression;
        c.description = description;
        c.jobKind = jobKind;
        c.target = target;
        c.jobData = jobData;
        c.httpMethod = httpMethod;
        c.httpHeaders = httpHeaders;
        c.httpBody = httpBody;
        c.httpTimeoutSeconds = httpTimeoutSeconds;
        c.skipSslValidation = skipSslValidation;
        c.startTime = startTime;
        c.endTime = endTime;
        c.status = status;
        c.enabled = enabled;
        c.nextRunTime = nextRunTime;
        c.previousRunTime = previousRunTime;
        c.remark = remark;
        c.createTime = createTime;
        c.updateTime = updateTime;
        c.createBy = createBy;
        c.updateBy = updateBy;
        return c;
    }

    /** Returns true when both definitions share the same identity. */
    public boolean sameIdentity(String name, String group) {
        return Objects.equals(jobName, name) && Objects.equals(jobGroup, group);
    }

    @JsonIgnore
    public String getIdentity() {
        return jobGroup + "." + jobName;
    }

    public String getJobName() { return jobName; }
    public void setJobName(String jobName) { this.jobName = jobName; }

    public String getJobGroup() { return jobGroup; }
    public void setJobGroup(String jobGroup) { this.jobGroup = jobGroup; }

    public String getTriggerName() { return triggerName; }
    public void setTriggerName(String triggerName) { this.triggerName = triggerName; }

    public String getTriggerGroup() { return triggerGroup; }
    public void setTriggerGroup(String triggerGroup) { this.triggerGroup = triggerGroup; }

    public String getCronExpression() { return cronExpression; }
    public void setCronExpression(String cronExpression) { this.cronExpression = cronExpression; }

    public String getDescription() { return description; }
    public void setDescription(String description) { this.description = description; }

    public JobKind getJobKind() { return jobKind; }
    public void setJobKind(JobKind jobKind) { this.jobKind = jobKind; }

    /** Class reference for {@link JobKind#CLASS}, absolute URL for {@link JobKind#HTTP}. */
    public String getTarget() { return target; }
    public void setTarget(String target) { this.target = target; }

    /** Flat JSON object with string keys. */
    public String getJobData() { return jobData; }
    public void setJobData(String jobData) { this.jobData = jobData; }

    public String getHttpMethod() { return httpMethod; }
    public void setHttpMethod(String httpMethod) { this.httpMethod = httpMethod; }

    /** JSON object mapping header names to values. */
    public String getHttpHeaders() { return httpHeaders; }
    public void setHttpHeaders(String httpHeaders) { this.httpHeaders = httpHeaders; }

    public String getHttpBody() { return httpBody; }
    public void setHttpBody(String httpBody) { this.httpBody = httpBody; }

    public int getHttpTimeoutSeconds() { return httpTimeoutSeconds; }
    public void setHttpTimeoutSeconds(int httpTimeoutSeconds) { this.httpTimeoutSeconds = httpTimeoutSeconds; }

    public boolean isSkipSslValidation() { return skipSslValidation; }
    public void setSkipSslValidation(boolean skipSslValidation) { this.skipSslValidation = skipSslValidation; }

    public LocalDateTime getStartTime() { return startTime; }
    public void setStartTime(LocalDateTime startTime) { this.startTime = startTime; }

    public LocalDateTime getEndTime() { return endTime; }
    public void setEndTime(LocalDateTime endTime) { this.endTime = endTime; }

    public JobStatus getStatus() { return status; }
    public void setStatus(JobStatus status) { this.status = status; }

    public boolean isEnabled() { return enabled; }
    public void setEnabled(boolean enabled) { this.enabled = enabled; }

    public LocalDateTime getNextRunTime() { return nextRunTime; }
    public void setNextRunTime(LocalDateTime nextRunTime) { this.nextRunTime = nextRunTime; }

    public LocalDateTime getPreviousRunTime() { return previousRunTime; }
    public void setPreviousRunTime(LocalDateTime previousRunTime) { this.previousRunTime = previousRunTime; }

    public String getRemark() { return remark; }
    public void setRemark(String remark) { this.remark = remark; }

    public LocalDateTime getCreateTime() { return createTime; }
    public void setCreateTime(LocalDateTime createTime) { this.createTime = createTime; }

    public LocalDateTime getUpdateTime() { return updateTime; }
    public void setUpdateTime(LocalDateTime updateTime) { this.updateTime = updateTime; }

    public String getCreateBy() { return createBy; }
    public void setCreateBy(String createBy) { this.createBy = createBy; }

    public String getUpdateBy() { return updateBy; }
    public void setUpdateBy(String updateBy) { this.updateBy = updateBy; }

    @Override
    public String toString() {
        return "JobDefinition{" + getIdentity() + ", cron=" + cronExpression + ", kind=" + jobKind
                + ", status=" + status + ", enabled=" + enabled + '}';
    }
}
