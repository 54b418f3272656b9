package com.jobkeeper.notify;

import org.quartz.SchedulerException;
import org.quartz.listeners.SchedulerListenerSupport;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Forwards engine-level errors to the {@link NotificationDispatcher}.
 */
public class SchedulerErrorListener extends SchedulerListenerSupport {
    private static final Logger log = LoggerFactory.getLogger(SchedulerErrorListener.class);

    private final NotificationDispatcher dispatcher;

    public SchedulerErrorListener(NotificationDispatcher dispatcher) {
        this.dispatcher = dispatcher;
    }

    @Override
    public void schedulerError(String msg, SchedulerException cause) {
        log.error("Scheduler error: {}", msg, cause);
        dispatcher.notifySchedulerError(msg, cause);
    }
}
