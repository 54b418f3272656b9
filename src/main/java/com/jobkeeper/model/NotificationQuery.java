package com.jobkeeper.model;

import java.time.LocalDateTime;

public class NotificationQuery extends PageQuery {
    private NotificationStatus status;
    private String triggeredBy;
    private LocalDateTime startTime;
    private LocalDateTime endTime;

    public NotificationQuery() {
        super(20);
    }

    public boolean isEmptyFilter() {
        return status == null && (triggeredBy == null || triggeredBy.isEmpty()) && startTime == null && endTime == null;
    }

    public NotificationStatus getStatus() { return status; }
    public void setStatus(NotificationStatus status) { this.status = status; }

    public String getTriggeredBy() { return triggeredBy; }
    public void setTriggeredBy(String triggeredBy) { this.triggeredBy = triggeredBy; }

    public LocalDateTime getStartTime() { return startTime; }
    public void setStartTime(LocalDateTime startTime) { this.startTime = startTime; }

    public LocalDateTime getEndTime() { return endTime; }
    public void setEndTime(LocalDateTime endTime) { this.endTime = endTime; }
}
