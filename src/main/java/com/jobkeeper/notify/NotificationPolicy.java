package com.jobkeeper.notify;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;

import java.util.Locale;

/**
 * Which events produce notifications and how they are rendered. Persisted as
 * JSON in the setting {@value #SETTING_KEY}.
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public class NotificationPolicy {
    public static final String SETTING_KEY = "notification.policy";

    public static final String FORMAT_HTML = "html";
    public static final String FORMAT_MARKDOWN = "markdown";
    public static final String FORMAT_TXT = "txt";

    private boolean enabled;
    private boolean notifyOnSuccess;
    private boolean notifyOnFailure = true;
    private boolean notifyOnSchedulerError = true;
    private String format = FORMAT_TXT;

    public boolean isEnabled() { return enabled; }
    public void setEnabled(boolean enabled) { this.enabled = enabled; }

    public boolean isNotifyOnSuccess() { return notifyOnSuccess; }
    public void setNotifyOnSuccess(boolean notifyOnSuccess) { this.notifyOnSuccess = notifyOnSuccess; }

    public boolean isNotifyOnFailure() { return notifyOnFailure; }
    public void setNotifyOnFailure(boolean notifyOnFailure) { this.notifyOnFailure = notifyOnFailure; }

    public boolean isNotifyOnSchedulerError() { return notifyOnSchedulerError; }
    public void setNotifyOnSchedulerError(boolean notifyOnSchedulerError) { this.notifyOnSchedulerError = notifyOnSchedulerError; }

    public String getFormat() { return format; }

    /** Unknown formats fall back to plain text. */
    public void setFormat(String format) {
        String f = format == null ? FORMAT_TXT : format.trim().toLowerCase(Locale.ROOT);
        this.format = FORMAT_HTML.equals(f) || FORMAT_MARKDOWN.equals(f) ? f : FORMAT_TXT;
    }
}
