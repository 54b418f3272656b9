package com.jobkeeper.model;

/** What a job does when it fires. */
public enum JobKind {
    /** Invokes a registered {@link org.quartz.Job} implementation. */
    CLASS,
    /** Calls an HTTP endpoint. */
    HTTP
}
