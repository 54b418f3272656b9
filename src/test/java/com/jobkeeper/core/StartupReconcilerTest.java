package com.jobkeeper.core;

import com.jobkeeper.model.JobDefinition;
import com.jobkeeper.model.JobStatus;
import com.jobkeeper.store.InMemoryJobStore;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.quartz.JobKey;

import java.time.LocalDateTime;

import static com.jobkeeper.core.EngineFixture.*;
import static org.junit.jupiter.api.Assertions.*;

public class StartupReconcilerTest {
    private EngineFixture fx;

    @BeforeEach
    public void setUp() throws Exception {
        InMemoryJobStore store = new InMemoryJobStore();
        store.addJob(stored("runnable", JobStatus.NORMAL, true));
        store.addJob(stored("paused", JobStatus.PAUSED, true));
        store.addJob(stored("disabled", JobStatus.NORMAL, false));
        fx = new EngineFixture(store);
    }

    @AfterEach
    public void tearDown() {
        fx.shutdown();
    }

    private static JobDefinition stored(String name, JobStatus status, boolean enabled) {
        JobDefinition def = job(name, COUNTING, "0 0 3 * * ?");
        def.setTriggerName(name + "_Trigger");
        def.setTriggerGroup("tests");
        def.setStatus(status);
        def.setEnabled(enabled);
        def.setCreateTime(LocalDateTime.now());
        return def;
    }

    @Test
    public void testRegistersOnlyRunnableJobs() throws Exception {
        assertEquals(1, fx.orchestrator.startScheduler().getData());
        assertTrue(fx.engine.exists(JobKey.jobKey("runnable", "tests")));
        assertFalse(fx.engine.exists(JobKey.jobKey("paused", "tests")));
        assertFalse(fx.engine.exists(JobKey.jobKey("disabled", "tests")));
        assertNotNull(fx.store.getJob("runnable", "tests").getNextRunTime());
    }

    @Test
    public void testSecondRunIsANoOp() throws Exception {
        fx.orchestrator.startScheduler();
        assertEquals(0, fx.orchestrator.getReconciler().run());
        assertEquals(1, fx.engine.triggersOf(JobKey.jobKey("runnable", "tests")).size());
    }

    @Test
    public void testReplaysJobLostByEngine() throws Exception {
        fx.orchestrator.startScheduler();
        fx.engine.delete(JobKey.jobKey("runnable", "tests"));
        assertEquals(1, fx.orchestrator.getReconciler().run());
        assertTrue(fx.engine.exists(JobKey.jobKey("runnable", "tests")));
    }
}
