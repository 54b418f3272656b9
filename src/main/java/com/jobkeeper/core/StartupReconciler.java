package com.jobkeeper.core;

import com.jobkeeper.model.JobDefinition;
import com.jobkeeper.model.JobStatus;
import com.jobkeeper.store.JobStore;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Replays the scheduling step for every stored job that should be running but
 * has no trigger in the engine. Safe to run repeatedly.
 */
public class StartupReconciler {
    private static final Logger log = LoggerFactory.getLogger(StartupReconciler.class);

    private final JobStore store;
    private final SchedulingEngine engine;
    private final JobOrchestrator orchestrator;

    StartupReconciler(JobStore store, SchedulingEngine engine, JobOrchestrator orchestrator) {
        this.store = store;
        this.engine = engine;
        this.orchestrator = orchestrator;
    }

    /**
     * @return number of jobs newly registered with the engine
     */
    public int run() {
        int registered = 0;
        int skipped = 0;
        for (JobDefinition def : store.getAllJobs()) {
            if (!def.isEnabled() || def.getStatus() == JobStatus.PAUSED) {
                skipped++;
                continue;
            }
            if (orchestrator.registerIfMissing(def)) {
                registered++;
            }
        }
        log.info("Reconciled store with engine {}: {} registered, {} not runnable", engineName(), registered, skipped);
        return registered;
    }

    private String engineName() {
        try {
            return engine.status().getName();
        } catch (Exception e) {
            return "?";
        }
    }
}
