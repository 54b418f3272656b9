package com.jobkeeper.core;

import com.jobkeeper.jobs.ClassInvocationJob;
import com.jobkeeper.jobs.HttpCallJob;
import org.quartz.Job;
import org.quartz.Scheduler;
import org.quartz.SchedulerException;
import org.quartz.spi.JobFactory;
import org.quartz.spi.TriggerFiredBundle;

/**
 * Quartz job factory that builds the two job shells without reflection.
 */
public class KeeperJobFactory implements JobFactory {
    private final JobClassRegistry registry;

    public KeeperJobFactory(JobClassRegistry registry) {
        this.registry = registry;
    }

    @Override
    public Job newJob(TriggerFiredBundle bundle, Scheduler scheduler) throws SchedulerException {
        Class<? extends Job> type = bundle.getJobDetail().getJobClass();
        if (type == ClassInvocationJob.class) {
            return new ClassInvocationJob(registry);
        }
        if (type == HttpCallJob.class) {
            return new HttpCallJob();
        }
        throw new SchedulerException("Unsupported job class " + type.getName());
    }
}
