package com.jobkeeper.core;

import org.quartz.TriggerKey;

import java.time.Instant;

/**
 * Snapshot of one live trigger: its key, UTC fire times and whether it is paused.
 */
public final class TriggerTimes {
    private final TriggerKey key;
    private final Instant nextFireTime;
    private final Instant previousFireTime;
    private final boolean paused;

    public TriggerTimes(TriggerKey key, Instant nextFireTime, Instant previousFireTime, boolean paused) {
        this.key = key;
        this.nextFireTime = nextFireTime;
        this.previousFireTime = previousFireTime;
        this.paused = paused;
    }

    public TriggerKey getKey() { return key; }
    public Instant getNextFireTime() { return nextFireTime; }
    public Instant getPreviousFireTime() { return previousFireTime; }
    public boolean isPaused() { return paused; }
}
