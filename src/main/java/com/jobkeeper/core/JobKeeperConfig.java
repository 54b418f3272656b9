package com.jobkeeper.core;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.time.ZoneId;
import java.util.Properties;

/**
 * Configuration lookup: system property, then environment variable, then the
 * optional properties file loaded with {@link #load(Path)}.
 */
public final class JobKeeperConfig {
    private static final Logger log = LoggerFactory.getLogger(JobKeeperConfig.class);

    public static final String STORAGE_TYPE = "STORAGE_TYPE";
    public static final String FILE_STORAGE_PATH = "FILE_STORAGE_PATH";
    public static final String FILE_BACKUP_ENABLED = "FILE_BACKUP_ENABLED";
    public static final String FILE_BACKUP_PATH = "FILE_BACKUP_PATH";
    public static final String FILE_BACKUP_MAX_FILES = "FILE_BACKUP_MAX_FILES";
    public static final String FILE_BACKUP_INTERVAL_MINUTES = "FILE_BACKUP_INTERVAL_MINUTES";
    public static final String JDBC_URL = "JDBC_URL";
    public static final String JDBC_USER = "JDBC_USER";
    public static final String JDBC_PASSWORD = "JDBC_PASSWORD";
    public static final String SCHEDULER_NAME = "SCHEDULER_NAME";
    public static final String THREAD_POOL_SIZE = "THREAD_POOL_SIZE";
    public static final String DISPLAY_ZONE = "DISPLAY_ZONE";
    public static final String AUTO_START_SCHEDULER = "AUTO_START_SCHEDULER";
    public static final String LOG_RETENTION_DAYS = "LOG_RETENTION_DAYS";
    public static final String NOTIFY_WEBHOOK_URL = "NOTIFY_WEBHOOK_URL";
    public static final String METRICS_PORT = "METRICS_PORT";

    private static final Properties fileProps = new Properties();

    private JobKeeperConfig() {}

    /** Path from {@code jobkeeper.properties} or {@code JOBKEEPER_PROPERTIES}, else {@code jobkeeper.properties}. */
    public static Path defaultPath() {
        String p = System.getProperty("jobkeeper.properties");
        if (p == null || p.isEmpty()) {
            p = System.getenv("JOBKEEPER_PROPERTIES");
        }
        if (p == null || p.isEmpty()) {
            p = "jobkeeper.properties";
        }
        return Paths.get(p);
    }

    /** Replaces the file layer with the contents of {@code path}; a missing file clears it. */
    public static synchronized void load(Path path) {
        Properties p = new Properties();
        if (Files.exists(path)) {
            try (InputStream in = Files.newInputStream(path)) {
                p.load(in);
                log.info("Loaded {} settings from {}", p.size(), path);
            } catch (IOException e) {
                log.warn("Could not read {}: {}", path, e.getMessage());
            }
        }
        fileProps.clear();
        fileProps.putAll(p);
    }

    public static synchronized String get(String key, String def) {
        String v = System.getProperty(key);
        if (v == null || v.isEmpty()) {
            v = System.getenv(key);
        }
        if (v == null || v.isEmpty()) {
            v = fileProps.getProperty(key);
        }
        return v == null || v.isEmpty() ? def : v;
    }

    public static int getInt(String key, int def) {
        String v = get(key, null);
        if (v == null) {
            return def;
        }
        try {
            return Integer.parseInt(v.trim());
        } catch (NumberFormatException e) {
            log.warn("Ignoring invalid {}: {}", key, v);
            return def;
        }
    }

    public static boolean getBoolean(String key, boolean def) {
        String v = get(key, null);
        return v == null ? def : Boolean.parseBoolean(v.trim());
    }

    public static ZoneId zone() {
        String z = get(DISPLAY_ZONE, null);
        if (z == null) {
            return ZoneId.systemDefault();
        }
        try {
            return ZoneId.of(z.trim());
        } catch (RuntimeException e) {
            log.warn("Ignoring invalid {}: {}", DISPLAY_ZONE, z);
            return ZoneId.systemDefault();
        }
    }
}
