package com.jobkeeper.core;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import javax.management.JMException;
import javax.management.MBeanServer;
import javax.management.ObjectName;
import java.lang.management.ManagementFactory;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.atomic.AtomicLong;

/**
 * Process-wide execution counters, exposed over JMX and by {@link MetricsServer}.
 */
public final class Metrics implements MetricsMBean {
    private static final Logger log = LoggerFactory.getLogger(Metrics.class);
    private static final Metrics INSTANCE = new Metrics();

    private final AtomicInteger successCount = new AtomicInteger();
    private final AtomicInteger failureCount = new AtomicInteger();
    private final AtomicInteger vetoedCount = new AtomicInteger();
    private final AtomicLong totalDuration = new AtomicLong();
    private final AtomicInteger durationSamples = new AtomicInteger();

    private Metrics() {}

    public static Metrics getInstance() {
        return INSTANCE;
    }

    /** Registers the MBean with the platform server once. */
    public static void init() {
        try {
            MBeanServer server = ManagementFactory.getPlatformMBeanServer();
            ObjectName name = new ObjectName("com.jobkeeper.core:type=Metrics");
            if (!server.isRegistered(name)) {
                server.registerMBean(INSTANCE, name);
            }
        } catch (JMException e) {
            log.warn("Could not register metrics MBean: {}", e.getMessage());
        }
    }

    public void recordSuccess() {
        successCount.incrementAndGet();
    }

    public void recordFailure() {
        failureCount.incrementAndGet();
    }

    /** A scheduled firing that was suppressed because its job is paused. */
    public void recordVetoed() {
        vetoedCount.incrementAndGet();
    }

    public void recordDuration(long millis) {
        totalDuration.addAndGet(millis);
        durationSamples.incrementAndGet();
    }

    @Override
    public int getSuccessCount() {
        return successCount.get();
    }

    @Override
    public int getFailureCount() {
        return failureCount.get();
    }

    @Override
    public int getVetoedCount() {
        return vetoedCount.get();
    }

    @Override
    public long getTotalDurationMillis() {
        return totalDuration.get();
    }

    @Override
    public double getAverageDurationMillis() {
        int samples = durationSamples.get();
        return samples == 0 ? 0.0 : totalDuration.get() / (double) samples;
    }

    static void reset() {
        INSTANCE.successCount.set(0);
        INSTANCE.failureCount.set(0);
        INSTANCE.vetoedCount.set(0);
        INSTANCE.totalDuration.set(0);
        INSTANCE.durationSamples.set(0);
    }
}
