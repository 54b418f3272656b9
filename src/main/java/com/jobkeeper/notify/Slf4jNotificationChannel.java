package com.jobkeeper.notify;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Writes notifications to the {@code com.jobkeeper.notifications} logger.
 */
public class Slf4jNotificationChannel implements NotificationChannel {
    private static final Logger log = LoggerFactory.getLogger("com.jobkeeper.notifications");

    @Override
    public boolean send(String title, String content, String format) {
        log.info("{}\n{}", title, content);
        return true;
    }
}
