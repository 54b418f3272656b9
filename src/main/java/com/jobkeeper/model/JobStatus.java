package com.jobkeeper.model;

/**
 * Durable status of a job definition.
 */
public enum JobStatus {
    NORMAL,
    PAUSED,
    COMPLETED,
    ERROR,
    BLOCKED
}
