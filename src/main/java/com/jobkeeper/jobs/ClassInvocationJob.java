package com.jobkeeper.jobs;

import com.jobkeeper.core.JobClassRegistry;
import com.jobkeeper.core.JobDataKeys;
import org.quartz.DisallowConcurrentExecution;
import org.quartz.InterruptableJob;
import org.quartz.Job;
import org.quartz.JobExecutionContext;
import org.quartz.JobExecutionException;
import org.quartz.UnableToInterruptJobException;

/**
 * Runs the registered job named in the job data. Firings of one job identity
 * never overlap.
 */
@DisallowConcurrentExecution
public class ClassInvocationJob implements InterruptableJob {
    private final JobClassRegistry registry;
    private volatile Job delegate;

    public ClassInvocationJob(JobClassRegistry registry) {
        this.registry = registry;
    }

    @Override
    public void execute(JobExecutionContext context) throws JobExecutionException {
        String target = context.getMergedJobDataMap().getString(JobDataKeys.TARGET);
        Job job = registry.create(target);
        if (job == null) {
            throw new JobExecutionException("Job class " + target + " is not registered");
        }
        delegate = job;
        job.execute(context);
    }

    /** Forwards the interrupt when the delegate supports it; other jobs run to completion. */
    @Override
    public void interrupt() throws UnableToInterruptJobException {
        Job job = delegate;
        if (job instanceof InterruptableJob ij) {
            ij.interrupt();
        }
    }
}
