package com.jobkeeper.core;

/**
 * Reserved job-data keys. User job data never uses the {@code jobkeeper.} prefix.
 */
public final class JobDataKeys {
    /** Present and true on firings requested through a manual trigger. */
    public static final String MANUAL = "jobkeeper.manual";
    /** Registered name of the class job to invoke. */
    public static final String TARGET = "jobkeeper.target";
    public static final String HTTP_URL = "jobkeeper.http.url";
    public static final String HTTP_METHOD = "jobkeeper.http.method";
    public static final String HTTP_HEADERS = "jobkeeper.http.headers";
    public static final String HTTP_BODY = "jobkeeper.http.body";
    public static final String HTTP_TIMEOUT_SECONDS = "jobkeeper.http.timeoutSeconds";
    public static final String HTTP_SKIP_SSL = "jobkeeper.http.skipSsl";

    public static final String PREFIX = "jobkeeper.";

    private JobDataKeys() {}
}
