package com.jobkeeper.model;

/** Headline counters over jobs and the execution logs of a time window. */
public class JobStats {
    private int totalJobs;
    private int enabledJobs;
    private int disabledJobs;
    private int executingJobs;
    private int successCount;
    private int failedCount;
    private int pausedCount;
    private int blockedCount;

    public int getTotalJobs() { return totalJobs; }
    public void setTotalJobs(int totalJobs) { this.totalJobs = totalJobs; }

    public int getEnabledJobs() { return enabledJobs; }
    public void setEnabledJobs(int enabledJobs) { this.enabledJobs = enabledJobs; }

    public int getDisabledJobs() { return disabledJobs; }
    public void setDisabledJobs(int disabledJobs) { this.disabledJobs = disabledJobs; }

    public int getExecutingJobs() { return executingJobs; }
    public void setExecutingJobs(int executingJobs) { this.executingJobs = executingJobs; }

    public int getSuccessCount() { return successCount; }
    public void setSuccessCount(int successCount) { this.successCount = successCount; }

    public int getFailedCount() { return failedCount; }
    public void setFailedCount(int failedCount) { this.failedCount = failedCount; }

    public int getPausedCount() { return pausedCount; }
    public void setPausedCount(int pausedCount) { this.pausedCount = pausedCount; }

    public int getBlockedCount() { return blockedCount; }
    public void setBlockedCount(int blockedCount) { this.blockedCount = blockedCount; }
}
