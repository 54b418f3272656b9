package com.jobkeeper.model;

public enum LogStatus {
    RUNNING,
    SUCCESS,
    FAILED
}
