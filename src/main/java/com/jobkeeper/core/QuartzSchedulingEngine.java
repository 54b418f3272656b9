package com.jobkeeper.core;

import org.quartz.JobDataMap;
import org.quartz.JobDetail;
import org.quartz.JobExecutionContext;
import org.quartz.JobKey;
import org.quartz.JobListener;
import org.quartz.Scheduler;
import org.quartz.SchedulerException;
import org.quartz.SchedulerListener;
import org.quartz.SchedulerMetaData;
import org.quartz.Trigger;
import org.quartz.TriggerKey;
import org.quartz.TriggerListener;
import org.quartz.impl.StdSchedulerFactory;
import org.quartz.impl.matchers.GroupMatcher;
import org.quartz.spi.JobFactory;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Instant;
import java.util.ArrayList;
import java.util.Collections;
import java.util.Date;
import java.util.List;
import java.util.Properties;
import java.util.concurrent.CopyOnWriteArrayList;

/**
 * {@link SchedulingEngine} backed by a Quartz scheduler using the in-memory
 * RAMJobStore. Listeners are remembered so that a scheduler recreated after
 * shutdown gets them again.
 */
public class QuartzSchedulingEngine implements SchedulingEngine {
    private static final Logger log = LoggerFactory.getLogger(QuartzSchedulingEngine.class);

    private final String name;
    private final int threadCount;
    private final JobFactory jobFactory;
    private final List<JobListener> jobListeners = new CopyOnWriteArrayList<>();
    private final List<TriggerListener> triggerListeners = new CopyOnWriteArrayList<>();
    private final List<SchedulerListener> schedulerListeners = new CopyOnWriteArrayList<>();
    private volatile Scheduler scheduler;

    public QuartzSchedulingEngine(String name, int threadCount, JobFactory jobFactory) throws SchedulerException {
        this.name = name;
        this.threadCount = threadCount;
        this.jobFactory = jobFactory;
        this.scheduler = create();
    }

    private Scheduler create() throws SchedulerException {
        Properties p = new Properties();
        p.setProperty(StdSchedulerFactory.PROP_SCHED_INSTANCE_NAME, name);
        p.setProperty(StdSchedulerFactory.PROP_THREAD_POOL_CLASS, "org.quartz.simpl.SimpleThreadPool");
        p.setProperty("org.quartz.threadPool.threadCount", String.valueOf(threadCount));
        p.setProperty(StdSchedulerFactory.PROP_JOB_STORE_CLASS, "org.quartz.simpl.RAMJobStore");
        p.setProperty("org.quartz.jobStore.misfireThreshold", "60000");
        Scheduler s = new StdSchedulerFactory(p).getScheduler();
        if (jobFactory != null) {
            s.setJobFactory(jobFactory);
        }
        for (JobListener l : jobListeners) {
            s.getListenerManager().addJobListener(l);
        }
        for (TriggerListener l : triggerListeners) {
            s.getListenerManager().addTriggerListener(l);
        }
        for (SchedulerListener l : schedulerListeners) {
            s.getListenerManager().addSchedulerListener(l);
        }
        log.debug("Created scheduler {} with {} threads", name, threadCount);
        return s;
    }

    private Scheduler scheduler() {
        return scheduler;
    }

    @Override
    public synchronized void start() throws SchedulerException {
        if (scheduler.isShutdown()) {
            scheduler = create();
        }
        scheduler.start();
        log.info("Scheduler {} started", name);
    }

    @Override
    public synchronized void shutdown() throws SchedulerException {
        if (!scheduler.isShutdown()) {
            scheduler.shutdown(false);
            log.info("Scheduler {} shut down", name);
        }
    }

    @Override
    public EngineStatus status() throws SchedulerException {
        Scheduler s = scheduler();
        SchedulerMetaData md = s.getMetaData();
        int jobs = 0;
        int executing = 0;
        if (!s.isShutdown()) {
            jobs = s.getJobKeys(GroupMatcher.anyJobGroup()).size();
            executing = s.getCurrentlyExecutingJobs().size();
        }
        return new EngineStatus(md.getSchedulerName(), md.getSchedulerInstanceId(), md.isStarted(),
                md.isShutdown(), md.isInStandbyMode(), md.getThreadPoolSize(), jobs, executing);
    }

    @Override
    public void schedule(JobDetail detail, Trigger trigger, boolean replace) throws SchedulerException {
        scheduler().scheduleJob(detail, Collections.singleton(trigger), replace);
    }

    @Override
    public boolean unschedule(TriggerKey key) throws SchedulerException {
        return scheduler().unscheduleJob(key);
    }

    @Override
    public boolean delete(JobKey key) throws SchedulerException {
        return scheduler().deleteJob(key);
    }

    @Override
    public void pause(JobKey key) throws SchedulerException {
        scheduler().pauseJob(key);
    }

    @Override
    public void resume(JobKey key) throws SchedulerException {
        scheduler().resumeJob(key);
    }

    @Override
    public void addDurable(JobDetail detail) throws SchedulerException {
        scheduler().addJob(detail, true);
    }

    @Override
    public void triggerNow(JobKey key, JobDataMap data) throws SchedulerException {
        scheduler().triggerJob(key, data);
    }

    @Override
    public boolean exists(JobKey key) throws SchedulerException {
        return scheduler().checkExists(key);
    }

    @Override
    public List<TriggerTimes> triggersOf(JobKey key) throws SchedulerException {
        Scheduler s = scheduler();
        List<TriggerTimes> out = new ArrayList<>();
        for (Trigger t : s.getTriggersOfJob(key)) {
            boolean paused = s.getTriggerState(t.getKey()) == Trigger.TriggerState.PAUSED;
            out.add(new TriggerTimes(t.getKey(), instant(t.getNextFireTime()), instant(t.getPreviousFireTime()), paused));
        }
        return out;
    }

    private static Instant instant(Date d) {
        return d == null ? null : d.toInstant();
    }

    @Override
    public List<JobKey> currentlyExecuting() throws SchedulerException {
        List<JobKey> keys = new ArrayList<>();
        for (JobExecutionContext ctx : scheduler().getCurrentlyExecutingJobs()) {
            keys.add(ctx.getJobDetail().getKey());
        }
        return keys;
    }

    @Override
    public void clear() throws SchedulerException {
        scheduler().clear();
    }

    @Override
    public void addJobListener(JobListener listener) throws SchedulerException {
        jobListeners.add(listener);
        scheduler().getListenerManager().addJobListener(listener);
    }

    @Override
    public void addTriggerListener(TriggerListener listener) throws SchedulerException {
        triggerListeners.add(listener);
        scheduler().getListenerManager().addTriggerListener(listener);
    }

    @Override
    public void addSchedulerListener(SchedulerListener listener) throws SchedulerException {
        schedulerListeners.add(listener);
        scheduler().getListenerManager().addSchedulerListener(listener);
    }
}
