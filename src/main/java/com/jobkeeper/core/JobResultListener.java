package com.jobkeeper.core;

/**
 * Listener notified when a job firing finishes.
 */
public interface JobResultListener {
    /**
     * Invoked after the execution log of a firing has been written.
     *
     * @param outcome what happened
     */
    void jobFinished(JobOutcome outcome);
}
