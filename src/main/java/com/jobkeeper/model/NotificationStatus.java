package com.jobkeeper.model;

public enum NotificationStatus {
    PENDING,
    SENT,
    FAILED
}
