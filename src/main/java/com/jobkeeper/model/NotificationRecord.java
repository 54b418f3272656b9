package com.jobkeeper.model;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;

import java.time.LocalDateTime;
import java.util.UUID;

/**
 * Bookkeeping for a single outbound notification attempt.
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public class NotificationRecord {
    private String notificationId = UUID.randomUUID().toString();
    private String title;
    private String content;
    private NotificationStatus status = NotificationStatus.PENDING;
    private String errorMessage;
    private String triggeredBy;
    private LocalDateTime createTime = LocalDateTime.now();
    private LocalDateTime sendTime;
    private Long durationMillis;

    public NotificationRecord() {
    }

    public NotificationRecord(String title, String content, String triggeredBy) {
        this.title = title;
        this.content = content;
        this.triggeredBy = triggeredBy;
    }

    public String getNotificationId() { return notificationId; }
    public void setNotificationId(String notificationId) { this.notificationId = notificationId; }

    public String getTitle() { return title; }
    public void setTitle(String title) { this.title = title; }

    public String getContent() { return content; }
    public void setContent(String content) { this.content = content; }

    public NotificationStatus getStatus() { return status; }
    public void setStatus(NotificationStatus status) { this.status = status; }

    public String getErrorMessage() { return errorMessage; }
    public void setErrorMessage(String errorMessage) { this.errorMessage = errorMessage; }

    public String getTriggeredBy() { return triggeredBy; }
    public void setTriggeredBy(String triggeredBy) { this.triggeredBy = triggeredBy; }

    public LocalDateTime getCreateTime() { return createTime; }
    public void setCreateTime(LocalDateTime createTime) { this.createTime = createTime; }

    public LocalDateTime getSendTime() { return sendTime; }
    public void setSendTime(LocalDateTime sendTime) { this.sendTime = sendTime; }

    public Long getDurationMillis() { return durationMillis; }
    public void setDurationMillis(Long durationMillis) { this.durationMillis = durationMillis; }
}
