package com.jobkeeper.notify;

/**
 * Transport that delivers one rendered notification.
 */
public interface NotificationChannel {
    /**
     * @param format one of {@code html}, {@code markdown}, {@code txt}
     * @return true when the message was accepted
     * @throws Exception when delivery failed with a cause worth recording
     */
    boolean send(String title, String content, String format) throws Exception;
}
