package com.jobkeeper.model;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;

import java.time.LocalDateTime;
import java.util.UUID;

/**
 * One row per firing attempt. Written once after the firing completes.
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public class ExecutionLogEntry {
    private String logId = UUID.randomUUID().toString();
    private String jobName;
    private String jobGroup;
    private String triggerName;
    private String triggerGroup;
    private LogStatus status = LogStatus.RUNNING;
    private LocalDateTime startTime;
    private LocalDateTime endTime;
    private Long durationMillis;
    private String message;
    private String exception;
    private String errorMessage;
    private String errorStackTrace;
    private String result;
    private String jobData;
    private LocalDateTime createTime = LocalDateTime.now();

    public ExecutionLogEntry() {
    }

    public ExecutionLogEntry(String jobName, String jobGroup) {
        this.jobName = jobName;
        this.jobGroup = jobGroup;
    }

    public String getLogId() { return logId; }
    public void setLogId(String logId) { this.logId = logId; }

    public String getJobName() { return jobName; }
    public void setJobName(String jobName) { this.jobName = jobName; }

    public String getJobGroup() { return jobGroup; }
    public void setJobGroup(String jobGroup) { this.jobGroup = jobGroup; }

    public String getTriggerName() { return triggerName; }
    public void setTriggerName(String triggerName) { this.triggerName = triggerName; }

    public String getTriggerGroup() { return triggerGroup; }
    public void setTriggerGroup(String triggerGroup) { this.triggerGroup = triggerGroup; }

    public LogStatus getStatus() { return status; }
    public void setStatus(LogStatus status) { this.status = status; }

    public LocalDateTime getStartTime() { return startTime; }
    public void setStartTime(LocalDateTime startTime) { this.startTime = startTime; }

    public LocalDateTime getEndTime() { return endTime; }
    public void setEndTime(LocalDateTime endTime) { this.endTime = endTime; }

    public Long getDurationMillis() { return durationMillis; }
    public void setDurationMillis(Long durationMillis) { this.durationMillis = durationMillis; }

    public String getMessage() { return message; }
    public void setMessage(String message) { this.message = message; }

    public String getException() { return exception; }
    public void setException(String exception) { this.exception = exception; }

    public String getErrorMessage() { return errorMessage; }
    public void setErrorMessage(String errorMessage) { this.errorMessage = errorMessage; }

    public String getErrorStackTrace() { return errorStackTrace; }
    public void setErrorStackTrace(String errorStackTrace) { this.errorStackTrace = errorStackTrace; }

    public String getResult() { return result; }
    public void setResult(String result) { this.result = result; }

    public String getJobData() { return jobData; }
    public void setJobData(String jobData) { this.jobData = jobData; }

    public LocalDateTime getCreateTime() { return createTime; }
    public void setCreateTime(LocalDateTime createTime) { this.createTime = createTime; }
}
