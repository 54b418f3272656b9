package com.jobkeeper.core;

/**
 * JMX view of job execution counters.
 */
public interface MetricsMBean {
    int getSuccessCount();
    int getFailureCount();
    int getVetoedCount();
    long getTotalDurationMillis();
    double getAverageDurationMillis();
}
