package com.jobkeeper.core;

import com.jobkeeper.model.ExecutionLogEntry;
import com.jobkeeper.model.JobDefinition;
import com.jobkeeper.model.LogQuery;
import com.jobkeeper.store.InMemoryJobStore;
import com.jobkeeper.store.JobStore;
import org.quartz.Job;
import org.quartz.JobExecutionContext;
import org.quartz.JobExecutionException;
import org.quartz.SchedulerException;

import java.time.ZoneId;
import java.util.List;
import java.util.UUID;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.function.BooleanSupplier;

/**
 * A real Quartz engine wired to an in-memory store, with two registered test jobs.
 */
class EngineFixture {
    static final String COUNTING = "counting";
    static final String FAILING = "failing";
    /** Far enough in the future that only manual firings happen during a test. */
    static final String NEVER_DURING_TEST = "0 0 0 1 1 ? 2099";
    static final String EVERY_SECOND = "* * * * * ?";

    final AtomicInteger runs = new AtomicInteger();
    final JobStore store;
    final JobClassRegistry registry = new JobClassRegistry();
    final QuartzSchedulingEngine engine;
    final JobOrchestrator orchestrator;
    final ExecutionListener listener;

    EngineFixture() throws SchedulerException {
        this(new InMemoryJobStore());
    }

    EngineFixture(JobStore store) throws SchedulerException {
        this.store = store;
        registry.register(COUNTING, () -> new CountingJob(runs));
        registry.register(FAILING, FailingJob::new);
        engine = new QuartzSchedulingEngine("test-" + UUID.randomUUID(), 2, new KeeperJobFactory(registry));
        orchestrator = new JobOrchestrator(store, engine, registry, new JobDetailFactory(ZoneId.systemDefault()));
        listener = new ExecutionListener(orchestrator);
        engine.addTriggerListener(listener);
        engine.addJobListener(listener);
    }

    static JobDefinition job(String name, String target, String cron) {
        JobDefinition def = new JobDefinition(name, "tests");
        def.setTarget(target);
        def.setCronExpression(cron);
        return def;
    }

    List<ExecutionLogEntry> logs(String jobName) {
        LogQuery q = new LogQuery();
        q.setJobName(jobName);
        q.setPageSize(100);
        return store.getExecutionLogs(q).getItems();
    }

    void shutdown() {
        orchestrator.shutdownScheduler();
    }

    static boolean waitFor(BooleanSupplier condition, long timeoutMillis) throws InterruptedException {
        long deadline = System.currentTimeMillis() + timeoutMillis;
        while (System.currentTimeMillis() < deadline) {
            if (condition.getAsBoolean()) {
                return true;
            }
            Thread.sleep(50);
        }
        return condition.getAsBoolean();
    }

    static class CountingJob implements Job {
        private final AtomicInteger runs;

        CountingJob(AtomicInteger runs) {
            this.runs = runs;
        }

        @Override
        public void execute(JobExecutionContext context) {
            context.setResult("run " + runs.incrementAndGet());
        }
    }

    static class FailingJob implements Job {
        @Override
        public void execute(JobExecutionContext context) throws JobExecutionException {
            throw new JobExecutionException(new IllegalStateException("disk full"));
        }
    }
}
