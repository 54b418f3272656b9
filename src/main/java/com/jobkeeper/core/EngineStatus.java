package com.jobkeeper.core;

/** Point-in-time view of the scheduling engine. */
public final class EngineStatus {
    private final String name;
    private final String instanceId;
    private final boolean started;
    private final boolean shutdown;
    private final boolean standby;
    private final int threadPoolSize;
    private final int jobCount;
    private final int executingCount;

    public EngineStatus(String name, String instanceId, boolean started, boolean shutdown, boolean standby,
                        int threadPoolSize, int jobCount, int executingCount) {
        this.name = name;
        this.instanceId = instanceId;
        this.started = started;
        this.shutdown = shutdown;
        this.standby = standby;
        this.threadPoolSize = threadPoolSize;
        this.jobCount = jobCount;
        this.executingCount = executingCount;
    }

    public String getName() { return name; }
    public String getInstanceId() { return instanceId; }
    public boolean isStarted() { return started; }
    public boolean isShutdown() { return shutdown; }
    public boolean isStandby() { return standby; }
    public int getThreadPoolSize() { return threadPoolSize; }
    public int getJobCount() { return jobCount; }
    public int getExecutingCount() { return executingCount; }
}
