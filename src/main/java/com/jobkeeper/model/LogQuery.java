package com.jobkeeper.model;

import java.time.LocalDateTime;

/**
 * Filter for execution logs. Also used as the delete filter of
 * {@code clearLogs}, where an empty filter matches every row.
 */
public class LogQuery extends PageQuery {
    private String jobName;
    private String jobGroup;
    private LogStatus status;
    private LocalDateTime startTime;
    private LocalDateTime endTime;

    public LogQuery() {
        super(10);
    }

    /** True when no filter field is set. */
    public boolean isEmptyFilter() {
        return (jobName == null || jobName.isEmpty()) && (jobGroup == null || jobGroup.isEmpty())
                && status == null && startTime == null && endTime == null;
    }

    public String getJobName() { return jobName; }
    public void setJobName(String jobName) { this.jobName = jobName; }

    public String getJobGroup() { return jobGroup; }
    public void setJobGroup(String jobGroup) { this.jobGroup = jobGroup; }

    public LogStatus getStatus() { return status; }
    public void setStatus(LogStatus status) { this.status = status; }

    public LocalDateTime getStartTime() { return startTime; }
    public void setStartTime(LocalDateTime startTime) { this.startTime = startTime; }

    public LocalDateTime getEndTime() { return endTime; }
    public void setEndTime(LocalDateTime endTime) { this.endTime = endTime; }
}
