package com.jobkeeper.core;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.TimeUnit;

/**
 * Periodically deletes execution log rows older than the retention window.
 */
public class LogRetentionSweeper {
    private static final Logger log = LoggerFactory.getLogger(LogRetentionSweeper.class);

    private final JobOrchestrator orchestrator;
    private final int retentionDays;
    private final long periodMillis;
    private final ScheduledExecutorService executor = Executors.newSingleThreadScheduledExecutor(r -> {
        Thread t = new Thread(r, "jobkeeper-log-retention");
        t.setDaemon(true);
        return t;
    });

    public LogRetentionSweeper(JobOrchestrator orchestrator, int retentionDays) {
        this(orchestrator, retentionDays, TimeUnit.HOURS.toMillis(1));
    }

    LogRetentionSweeper(JobOrchestrator orchestrator, int retentionDays, long periodMillis) {
        this.orchestrator = orchestrator;
        this.retentionDays = retentionDays;
        this.periodMillis = periodMillis;
    }

    public void start() {
        executor.scheduleAtFixedRate(this::sweep, 0, periodMillis, TimeUnit.MILLISECONDS);
        log.info("Keeping execution logs for {} days", retentionDays);
    }

    /** @return rows removed by this pass */
    int sweep() {
        try {
            int removed = orchestrator.clearExpiredLogs(retentionDays).getData();
            if (removed > 0) {
                log.info("Removed {} execution log rows older than {} days", removed, retentionDays);
            }
            return removed;
        } catch (RuntimeException e) {
            log.warn("Log retention pass failed", e);
            return 0;
        }
    }

    public void stop() {
        executor.shutdownNow();
    }
}
