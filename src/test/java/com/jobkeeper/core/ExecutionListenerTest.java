package com.jobkeeper.core;

import com.jobkeeper.model.ExecutionLogEntry;
import com.jobkeeper.model.JobStatus;
import com.jobkeeper.model.LogStatus;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.quartz.JobExecutionContext;
import org.quartz.Trigger;
import org.quartz.listeners.TriggerListenerSupport;

import java.util.List;
import java.util.concurrent.CopyOnWriteArrayList;

import static com.jobkeeper.core.EngineFixture.*;
import static org.junit.jupiter.api.Assertions.*;

public class ExecutionListenerTest {
    private EngineFixture fx;

    @BeforeEach
    public void setUp() throws Exception {
        fx = new EngineFixture();
    }

    @AfterEach
    public void tearDown() {
        fx.shutdown();
    }

    @Test
    public void testScheduledFiringOfPausedJobIsBlockedWithoutLogRow() throws Exception {
        // engine trigger stays active; only the stored status says paused
        assertTrue(fx.orchestrator.addJob(job("quiet", COUNTING, EVERY_SECOND)).isSuccess());
        assertTrue(fx.store.updateJobStatus("quiet", "tests", JobStatus.PAUSED));
        int vetoedBefore = Metrics.getInstance().getVetoedCount();

        fx.orchestrator.startScheduler();
        Thread.sleep(2500);

        assertEquals(0, fx.runs.get());
        assertTrue(fx.logs("quiet").isEmpty());
        assertTrue(Metrics.getInstance().getVetoedCount() > vetoedBefore);
    }

    @Test
    public void testVetoByAnotherListenerWritesFailedRow() throws Exception {
        fx.engine.addTriggerListener(new TriggerListenerSupport() {
            @Override
            public String getName() {
                return "veto-everything";
            }

            @Override
            public boolean vetoJobExecution(Trigger trigger, JobExecutionContext context) {
                return true;
            }
        });
        fx.orchestrator.startScheduler();
        fx.orchestrator.addJob(job("blocked", COUNTING, NEVER_DURING_TEST));
        fx.orchestrator.triggerJob("blocked", "tests");

        assertTrue(waitFor(() -> fx.logs("blocked").size() == 1, 5000));
        ExecutionLogEntry e = fx.logs("blocked").get(0);
        assertEquals(LogStatus.FAILED, e.getStatus());
        assertNull(e.getDurationMillis());
        assertEquals(0, fx.runs.get());
    }

    @Test
    public void testResultListenersSeeEveryOutcome() throws Exception {
        List<JobOutcome> outcomes = new CopyOnWriteArrayList<>();
        fx.listener.addResultListener(outcomes::add);
        fx.listener.addResultListener(o -> {
            throw new IllegalStateException("listener bug");
        });
        fx.orchestrator.startScheduler();
        fx.orchestrator.addJob(job("ok", COUNTING, NEVER_DURING_TEST));
        fx.orchestrator.addJob(job("bad", FAILING, NEVER_DURING_TEST));
        fx.orchestrator.triggerJob("ok", "tests");
        fx.orchestrator.triggerJob("bad", "tests");

        assertTrue(waitFor(() -> outcomes.size() == 2, 5000));
        JobOutcome ok = outcomes.stream().filter(o -> o.getJobName().equals("ok")).findFirst().orElseThrow();
        JobOutcome bad = outcomes.stream().filter(o -> o.getJobName().equals("bad")).findFirst().orElseThrow();
        assertTrue(ok.isSuccess());
        assertTrue(ok.isManual());
        assertNotNull(ok.getDurationMillis());
        assertFalse(bad.isSuccess());
        assertEquals("disk full", bad.getErrorMessage());
        // a throwing listener does not cost the log row
        assertEquals(1, fx.logs("bad").size());
    }

    @Test
    public void testSnapshotCarriesUserJobData() throws Exception {
        fx.orchestrator.startScheduler();
        com.jobkeeper.model.JobDefinition def = job("data", COUNTING, NEVER_DURING_TEST);
        def.setJobData("{\"region\":\"eu-west\",\"retries\":3}");
        fx.orchestrator.addJob(def);
        fx.orchestrator.triggerJob("data", "tests");

        assertTrue(waitFor(() -> fx.logs("data").size() == 1, 5000));
        String snapshot = fx.logs("data").get(0).getJobData();
        assertEquals("eu-west", Json.readFlatMap(snapshot).get("region"));
        assertEquals("3", Json.readFlatMap(snapshot).get("retries"));
    }
}
