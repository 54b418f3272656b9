package com.jobkeeper.core;

/**
 * Result of one firing, handed to {@link JobResultListener}s.
 */
public final class JobOutcome {
    private final String jobName;
    private final String jobGroup;
    private final boolean success;
    private final boolean manual;
    private final Long durationMillis;
    private final String errorMessage;

    public JobOutcome(String jobName, String jobGroup, boolean success, boolean manual,
                      Long durationMillis, String errorMessage) {
        this.jobName = jobName;
        this.jobGroup = jobGroup;
        this.success = success;
        this.manual = manual;
        this.durationMillis = durationMillis;
        this.errorMessage = errorMessage;
    }

    public String getJobName() { return jobName; }
    public String getJobGroup() { return jobGroup; }
    public boolean isSuccess() { return success; }
    public boolean isManual() { return manual; }
    public Long getDurationMillis() { return durationMillis; }
    public String getErrorMessage() { return errorMessage; }

    public String getIdentity() {
        return jobGroup + "." + jobName;
    }

    @Override
    public String toString() {
        return "JobOutcome{" + getIdentity() + ", success=" + success + ", manual=" + manual
                + ", durationMillis=" + durationMillis + '}';
    }
}
