package com.jobkeeper.store;

import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.jobkeeper.core.Json;
import com.jobkeeper.model.DistributionEntry;
import com.jobkeeper.model.ExecutionLogEntry;
import com.jobkeeper.model.JobDefinition;
import com.jobkeeper.model.JobQuery;
import com.jobkeeper.model.JobStats;
import com.jobkeeper.model.JobStatus;
import com.jobkeeper.model.LogQuery;
import com.jobkeeper.model.NotificationQuery;
import com.jobkeeper.model.NotificationRecord;
import com.jobkeeper.model.Page;
import com.jobkeeper.model.Setting;
import com.jobkeeper.model.StatsQuery;
import com.jobkeeper.model.TrendPoint;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.InputStream;
import java.io.OutputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.nio.file.StandardOpenOption;
import java.time.Duration;
import java.time.Instant;
import java.time.LocalDateTime;
import java.time.format.DateTimeFormatter;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.locks.ReadWriteLock;
import java.util.concurrent.locks.ReentrantReadWriteLock;
import java.util.stream.Collectors;
import java.util.stream.Stream;

/**
 * JobStore keeping each collection in its own JSON file. Readers share a
 * per-file read lock; writers take the write lock and rewrite the whole file.
 * When a backup directory is configured the previous file content is copied
 * there before an overwrite, at most once per backup interval.
 */
public class FileJobStore implements JobStore {
    private static final Logger log = LoggerFactory.getLogger(FileJobStore.class);
    private static final DateTimeFormatter BACKUP_STAMP = DateTimeFormatter.ofPattern("yyyyMMddHHmmssSSS");

    private static final TypeReference<List<JobDefinition>> JOBS = new TypeReference<>() {};
    private static final TypeReference<List<ExecutionLogEntry>> LOGS = new TypeReference<>() {};
    private static final TypeReference<List<Setting>> SETTINGS = new TypeReference<>() {};
    private static final TypeReference<List<NotificationRecord>> NOTIFICATIONS = new TypeReference<>() {};

    private final ObjectMapper mapper = Json.mapper();
    private final Path jobsFile;
    private final Path logsFile;
    private final Path settingsFile;
    private final Path notificationsFile;
    private final Path backupDir;
    private final int maxBackupFiles;
    private final Duration backupInterval;
    private final Map<Path, ReadWriteLock> locks = new ConcurrentHashMap<>();
    private final Map<Path, Instant> lastBackup = new ConcurrentHashMap<>();

    public FileJobStore(Path storageDir) {
        this(storageDir, null, 0, Duration.ZERO);
    }

    /**
     * @param backupDir      where backups go, or {@code null} to disable them
     * @param maxBackupFiles backups kept per data file
     * @param backupInterval minimum time between two backups of the same file
     */
    public FileJobStore(Path storageDir, Path backupDir, int maxBackupFiles, Duration backupInterval) {
        this.jobsFile = storageDir.resolve("jobs.json");
        this.logsFile = storageDir.resolve("logs.json");
        this.settingsFile = storageDir.resolve("settings.json");
        this.notificationsFile = storageDir.resolve("notifications.json");
        this.backupDir = backupDir;
        this.maxBackupFiles = maxBackupFiles;
        this.backupInterval = backupInterval;
    }

    private interface Mutation<T> {
        /** Applies the change in place; returns false to abort without writing. */
        boolean apply(List<T> items);
    }

    private ReadWriteLock lockFor(Path file) {
        return locks.computeIfAbsent(file, k -> new ReentrantReadWriteLock());
    }

    private <T> List<T> read(Path file, TypeReference<List<T>> type) throws IOException {
        if (!Files.exists(file)) {
            return new ArrayList<>();
        }
        try (InputStream in = Files.newInputStream(file, StandardOpenOption.READ)) {
            if (Files.size(file) == 0) {
                return new ArrayList<>();
            }
            List<T> items = mapper.readValue(in, type);
            return items == null ? new ArrayList<>() : items;
        }
    }

    /** Loads a collection for querying; unreadable files count as empty. */
    private <T> List<T> load(Path file, TypeReference<List<T>> type) {
        ReadWriteLock lock = lockFor(file);
        lock.readLock().lock();
        try {
            return read(file, type);
        } catch (IOException e) {
            log.error("Failed to read {}", file, e);
            return new ArrayList<>();
        } finally {
            lock.readLock().unlock();
        }
    }

    private <T> void write(Path file, List<T> items) throws IOException {
        Path dir = file.toAbsolutePath().getParent();
        if (dir != null) {
            Files.createDirectories(dir);
        }
        backup(file);
        try (OutputStream out = Files.newOutputStream(file, StandardOpenOption.CREATE,
                StandardOpenOption.TRUNCATE_EXISTING, StandardOpenOption.WRITE)) {
            mapper.writerWithDefaultPrettyPrinter().writeValue(out, items);
        }
    }

    /**
     * Read-modify-write under the file's write lock. A file that cannot be
     * read fails the mutation instead of being overwritten.
     */
    private <T> boolean mutate(Path file, TypeReference<List<T>> type, String action, Mutation<T> change) {
        ReadWriteLock lock = lockFor(file);
        lock.writeLock().lock();
        try {
            List<T> items = read(file, type);
            if (!change.apply(items)) {
                return false;
            }
            write(file, items);
            return true;
        } catch (IOException | RuntimeException e) {
            log.error("Failed to {} in {}", action, file, e);
            return false;
        } finally {
            lock.writeLock().unlock();
        }
    }

    private void backup(Path file) {
        if (backupDir == null || !Files.exists(file)) {
            return;
        }
        Instant now = Instant.now();
        Instant last = lastBackup.get(file);
        if (last != null && Duration.between(last, now).compareTo(backupInterval) < 0) {
            return;
        }
        String base = baseName(file);
        try {
            Files.createDirectories(backupDir);
            Path target = backupDir.resolve(base + "_" + BACKUP_STAMP.format(LocalDateTime.now()) + ".json");
            Files.copy(file, target, StandardCopyOption.REPLACE_EXISTING);
            lastBackup.put(file, now);
            pruneBackups(base);
        } catch (IOException e) {
            log.warn("Backup of {} failed", file, e);
        }
    }

    private void pruneBackups(String base) throws IOException {
        List<Path> backups;
        try (Stream<Path> s = Files.list(backupDir)) {
            backups = s.filter(p -> {
                String n = p.getFileName().toString();
                return n.startsWith(base + "_") && n.endsWith(".json");
            }).sorted(Collections.reverseOrder()).collect(Collectors.toList());
        }
        for (int i = maxBackupFiles; i < backups.size(); i++) {
            Files.deleteIfExists(backups.get(i));
            log.debug("Removed old backup {}", backups.get(i));
        }
    }

    private static String baseName(Path file) {
        String n = file.getFileName().toString();
        int dot = n.lastIndexOf('.');
        return dot < 0 ? n : n.substring(0, dot);
    }

    @Override
    public boolean initialize() {
        try {
            for (Path f : List.of(jobsFile, logsFile, settingsFile, notificationsFile)) {
                ReadWriteLock lock = lockFor(f);
                lock.writeLock().lock();
                try {
                    if (!Files.exists(f)) {
                        write(f, Collections.emptyList());
                    }
                } finally {
                    lock.writeLock().unlock();
                }
            }
            log.info("File store initialized in {}", jobsFile.toAbsolutePath().getParent());
            return true;
        } catch (IOException e) {
            log.error("Failed to initialize file store", e);
            return false;
        }
    }

    @Override
    public boolean isInitialized() {
        return Files.exists(jobsFile) && Files.exists(logsFile);
    }

    @Override
    public boolean addJob(JobDefinition job) {
        return mutate(jobsFile, JOBS, "add job", jobs -> {
            if (jobs.stream().anyMatch(j -> j.sameIdentity(job.getJobName(), job.getJobGroup()))) {
                log.warn("Job {} already exists", job.getIdentity());
                return false;
            }
            jobs.add(job);
            return true;
        });
    }

    @Override
    public boolean updateJob(JobDefinition job) {
        return mutate(jobsFile, JOBS, "update job", jobs -> {
            for (int i = 0; i < jobs.size(); i++) {
                if (jobs.get(i).sameIdentity(job.getJobName(), job.getJobGroup())) {
                    jobs.set(i, job);
                    return true;
                }
            }
            log.warn("Job {} not found for update", job.getIdentity());
            return false;
        });
    }

    @Override
    public boolean deleteJob(String jobName, String jobGroup) {
        return mutate(jobsFile, JOBS, "delete job", jobs -> jobs.removeIf(j -> j.sameIdentity(jobName, jobGroup)));
    }

    @Override
    public JobDefinition getJob(String jobName, String jobGroup) {
        for (JobDefinition j : load(jobsFile, JOBS)) {
            if (j.sameIdentity(jobName, jobGroup)) {
                return j;
            }
        }
        return null;
    }

    @Override
    public Page<JobDefinition> getJobs(JobQuery query) {
        return StoreQueries.queryJobs(load(jobsFile, JOBS), query);
    }

    @Override
    public List<JobDefinition> getAllJobs() {
        return load(jobsFile, JOBS);
    }

    @Override
    public boolean updateJobStatus(String jobName, String jobGroup, JobStatus status) {
        return mutate(jobsFile, JOBS, "update job status", jobs -> {
            for (JobDefinition j : jobs) {
                if (j.sameIdentity(jobName, jobGroup)) {
                    j.setStatus(status);
                    j.setUpdateTime(LocalDateTime.now());
                    return true;
                }
            }
            return false;
        });
    }

    @Override
    public boolean addExecutionLog(ExecutionLogEntry entry) {
        return mutate(logsFile, LOGS, "add execution log", logs -> logs.add(entry));
    }

    @Override
    public Page<ExecutionLogEntry> getExecutionLogs(LogQuery query) {
        return StoreQueries.queryLogs(load(logsFile, LOGS), query);
    }

    @Override
    public int clearExpiredLogs(int retentionDays) {
        LocalDateTime cutoff = LocalDateTime.now().minusDays(retentionDays);
        int[] removed = new int[1];
        mutate(logsFile, LOGS, "clear expired logs", logs -> {
            int before = logs.size();
            logs.removeIf(l -> l.getCreateTime() != null && l.getCreateTime().isBefore(cutoff));
            removed[0] = before - logs.size();
            return removed[0] > 0;
        });
        if (removed[0] > 0) {
            log.info("Removed {} expired log rows", removed[0]);
        }
        return removed[0];
    }

    @Override
    public boolean clearLogs(LogQuery filter) {
        return mutate(logsFile, LOGS, "clear logs", logs -> {
            if (filter == null || filter.isEmptyFilter()) {
                logs.clear();
            } else {
                logs.removeIf(l -> StoreQueries.matches(l, filter));
            }
            return true;
        });
    }

    @Override
    public JobStats getJobStats(StatsQuery query) {
        List<ExecutionLogEntry> window = StoreQueries.inWindow(load(logsFile, LOGS), query.window(LocalDateTime.now()));
        return StoreQueries.jobStats(load(jobsFile, JOBS), window);
    }

    @Override
    public List<DistributionEntry> getJobStatusDistribution() {
        return StoreQueries.statusDistribution(load(jobsFile, JOBS));
    }

    @Override
    public List<DistributionEntry> getJobTypeDistribution() {
        return StoreQueries.typeDistribution(load(jobsFile, JOBS));
    }

    @Override
    public List<TrendPoint> getExecutionTrend(StatsQuery query) {
        return StoreQueries.trend(StoreQueries.inWindow(load(logsFile, LOGS), query.window(LocalDateTime.now())));
    }

    @Override
    public List<DistributionEntry> getExecutionTimeDistribution(StatsQuery query) {
        return StoreQueries.durationHistogram(
                StoreQueries.inWindow(load(logsFile, LOGS), query.window(LocalDateTime.now())));
    }

    @Override
    public boolean saveSetting(Setting setting) {
        return mutate(settingsFile, SETTINGS, "save setting", settings -> {
            LocalDateTime now = LocalDateTime.now();
            setting.setUpdateTime(now);
            for (int i = 0; i < settings.size(); i++) {
                if (settings.get(i).getKey().equals(setting.getKey())) {
                    setting.setCreateTime(settings.get(i).getCreateTime());
                    settings.set(i, setting);
                    return true;
                }
            }
            setting.setCreateTime(now);
            settings.add(setting);
            return true;
        });
    }

    @Override
    public Setting getSetting(String key) {
        for (Setting s : load(settingsFile, SETTINGS)) {
            if (s.getKey().equals(key)) {
                return s;
            }
        }
        return null;
    }

    @Override
    public List<Setting> getAllSettings() {
        return load(settingsFile, SETTINGS);
    }

    @Override
    public boolean addNotification(NotificationRecord record) {
        return mutate(notificationsFile, NOTIFICATIONS, "add notification", list -> list.add(record));
    }

    @Override
    public boolean updateNotification(NotificationRecord record) {
        return mutate(notificationsFile, NOTIFICATIONS, "update notification", list -> {
            for (int i = 0; i < list.size(); i++) {
                if (list.get(i).getNotificationId().equals(record.getNotificationId())) {
                    list.set(i, record);
                    return true;
                }
            }
            return false;
        });
    }

    @Override
    public NotificationRecord getNotification(String notificationId) {
        for (NotificationRecord n : load(notificationsFile, NOTIFICATIONS)) {
            if (n.getNotificationId().equals(notificationId)) {
                return n;
            }
        }
        return null;
    }

    @Override
    public Page<NotificationRecord> getNotifications(NotificationQuery query) {
        return StoreQueries.queryNotifications(load(notificationsFile, NOTIFICATIONS), query);
    }

    @Override
    public boolean deleteNotification(String notificationId) {
        return mutate(notificationsFile, NOTIFICATIONS, "delete notification",
                list -> list.removeIf(n -> n.getNotificationId().equals(notificationId)));
    }

    @Override
    public boolean clearNotifications(NotificationQuery filter) {
        return mutate(notificationsFile, NOTIFICATIONS, "clear notifications", list -> {
            if (filter == null || filter.isEmptyFilter()) {
                list.clear();
            } else {
                list.removeIf(n -> StoreQueries.matches(n, filter));
            }
            return true;
        });
    }
}
