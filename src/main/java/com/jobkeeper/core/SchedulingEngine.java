package com.jobkeeper.core;

import org.quartz.JobDataMap;
import org.quartz.JobDetail;
import org.quartz.JobKey;
import org.quartz.JobListener;
import org.quartz.SchedulerException;
import org.quartz.SchedulerListener;
import org.quartz.Trigger;
import org.quartz.TriggerKey;
import org.quartz.TriggerListener;

import java.util.List;

/**
 * Thin facade over the live trigger engine. The engine keeps its state in
 * memory only; durability belongs to the job store.
 */
public interface SchedulingEngine {

    /** Starts the engine, creating a fresh one if the previous instance was shut down. */
    void start() throws SchedulerException;

    void shutdown() throws SchedulerException;

    EngineStatus status() throws SchedulerException;

    /** Registers a job with a single trigger, replacing an existing registration when asked to. */
    void schedule(JobDetail detail, Trigger trigger, boolean replace) throws SchedulerException;

    boolean unschedule(TriggerKey key) throws SchedulerException;

    /** Removes the job and all of its triggers. Returns false when the job was unknown. */
    boolean delete(JobKey key) throws SchedulerException;

    void pause(JobKey key) throws SchedulerException;

    void resume(JobKey key) throws SchedulerException;

    /** Stores a job without triggers so it can be fired on demand. */
    void addDurable(JobDetail detail) throws SchedulerException;

    /** Fires the job once, now, with {@code data} merged into the firing's job data. */
    void triggerNow(JobKey key, JobDataMap data) throws SchedulerException;

    boolean exists(JobKey key) throws SchedulerException;

    List<TriggerTimes> triggersOf(JobKey key) throws SchedulerException;

    List<JobKey> currentlyExecuting() throws SchedulerException;

    /** Drops every job and trigger. */
    void clear() throws SchedulerException;

    void addJobListener(JobListener listener) throws SchedulerException;

    void addTriggerListener(TriggerListener listener) throws SchedulerException;

    void addSchedulerListener(SchedulerListener listener) throws SchedulerException;
}
