package com.jobkeeper.model;

public class JobQuery extends PageQuery {
    private String jobName;
    private String jobGroup;
    private JobStatus status;
    private Boolean enabled;

    public JobQuery() {
        super(20);
    }

    public String getJobName() { return jobName; }
    public void setJobName(String jobName) { this.jobName = jobName; }

    public String getJobGroup() { return jobGroup; }
    public void setJobGroup(String jobGroup) { this.jobGroup = jobGroup; }

    public JobStatus getStatus() { return status; }
    public void setStatus(JobStatus status) { this.status = status; }

    public Boolean getEnabled() { return enabled; }
    public void setEnabled(Boolean enabled) { this.enabled = enabled; }
}
