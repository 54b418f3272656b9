package com.jobkeeper.core;

import com.jobkeeper.notify.NotificationChannel;
import com.jobkeeper.notify.NotificationDispatcher;
import com.jobkeeper.notify.SchedulerErrorListener;
import com.jobkeeper.notify.Slf4jNotificationChannel;
import com.jobkeeper.notify.WebhookNotificationChannel;
import com.jobkeeper.store.FileJobStore;
import com.jobkeeper.store.InMemoryJobStore;
import com.jobkeeper.store.JdbcJobStore;
import com.jobkeeper.store.JobStore;
import org.h2.jdbcx.JdbcDataSource;
import org.quartz.SchedulerException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.nio.file.Path;
import java.nio.file.Paths;
import java.time.Duration;
import java.time.ZoneId;
import java.util.Locale;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;

/**
 * Wires store, engine, orchestrator, listeners and notifications together
 * from {@link JobKeeperConfig}.
 */
public class JobKeeper {
    private static final Logger log = LoggerFactory.getLogger(JobKeeper.class);

    private final JobStore store;
    private final JobClassRegistry registry;
    private final SchedulingEngine engine;
    private final JobOrchestrator orchestrator;
    private final ExecutionListener executionListener;
    private final NotificationDispatcher notifications;
    private final ExecutorService notifyExecutor;
    private final LogRetentionSweeper sweeper;
    private volatile boolean started;

    /** Builds everything from configuration, including the store backend. */
    public JobKeeper(JobClassRegistry registry) throws SchedulerException {
        this(createStore(), registry, null);
    }

    public JobKeeper(JobStore store, JobClassRegistry registry, NotificationChannel channel) throws SchedulerException {
        ZoneId zone = JobKeeperConfig.zone();
        this.store = store;
        this.registry = registry;
        this.engine = new QuartzSchedulingEngine(
                JobKeeperConfig.get(JobKeeperConfig.SCHEDULER_NAME, "JobKeeper_Scheduler"),
                JobKeeperConfig.getInt(JobKeeperConfig.THREAD_POOL_SIZE, 10),
                new KeeperJobFactory(registry));
        this.orchestrator = new JobOrchestrator(store, engine, registry, new JobDetailFactory(zone));

        this.notifyExecutor = Executors.newSingleThreadExecutor(r -> {
            Thread t = new Thread(r, "jobkeeper-notify");
            t.setDaemon(true);
            return t;
        });
        this.notifications = new NotificationDispatcher(store,
                channel != null ? channel : createChannel(), notifyExecutor, zone);

        this.executionListener = new ExecutionListener(orchestrator);
        executionListener.addResultListener(notifications);
        engine.addTriggerListener(executionListener);
        engine.addJobListener(executionListener);
        engine.addSchedulerListener(new SchedulerErrorListener(notifications));

        int retention = JobKeeperConfig.getInt(JobKeeperConfig.LOG_RETENTION_DAYS, 0);
        this.sweeper = retention > 0 ? new LogRetentionSweeper(orchestrator, retention) : null;
    }

    /** Chooses the backend named by {@code STORAGE_TYPE}: memory, file or jdbc. */
    public static JobStore createStore() {
        String type = JobKeeperConfig.get(JobKeeperConfig.STORAGE_TYPE, "memory").trim().toLowerCase(Locale.ROOT);
        switch (type) {
            case "memory":
                return new InMemoryJobStore();
            case "file": {
                Path dir = Paths.get(JobKeeperConfig.get(JobKeeperConfig.FILE_STORAGE_PATH, "data/jobkeeper"));
                if (!JobKeeperConfig.getBoolean(JobKeeperConfig.FILE_BACKUP_ENABLED, false)) {
                    return new FileJobStore(dir);
                }
                Path backups = Paths.get(JobKeeperConfig.get(JobKeeperConfig.FILE_BACKUP_PATH,
                        dir.resolve("backups").toString()));
                return new FileJobStore(dir, backups,
                        JobKeeperConfig.getInt(JobKeeperConfig.FILE_BACKUP_MAX_FILES, 10),
                        Duration.ofMinutes(JobKeeperConfig.getInt(JobKeeperConfig.FILE_BACKUP_INTERVAL_MINUTES, 60)));
            }
            case "jdbc": {
                String url = JobKeeperConfig.get(JobKeeperConfig.JDBC_URL, null);
                if (url == null) {
                    throw new IllegalStateException(JobKeeperConfig.JDBC_URL + " is required for jdbc storage");
                }
                JdbcDataSource ds = new JdbcDataSource();
                ds.setURL(url);
                ds.setUser(JobKeeperConfig.get(JobKeeperConfig.JDBC_USER, ""));
                ds.setPassword(JobKeeperConfig.get(JobKeeperConfig.JDBC_PASSWORD, ""));
                return new JdbcJobStore(ds);
            }
            default:
                throw new IllegalStateException("Unknown " + JobKeeperConfig.STORAGE_TYPE + ": " + type);
        }
    }

    private static NotificationChannel createChannel() {
        String webhook = JobKeeperConfig.get(JobKeeperConfig.NOTIFY_WEBHOOK_URL, null);
        return webhook == null ? new Slf4jNotificationChannel() : new WebhookNotificationChannel(webhook);
    }

    /**
     * Registers metrics and, unless {@code AUTO_START_SCHEDULER=false}, starts the
     * engine and reconciles it with the store.
     */
    public synchronized void start() {
        Metrics.init();
        MetricsServer.init();
        if (JobKeeperConfig.getBoolean(JobKeeperConfig.AUTO_START_SCHEDULER, true)) {
            OperationResult<Integer> result = orchestrator.startScheduler();
            if (result.isSuccess()) {
                log.info("JobKeeper started, {} jobs registered", result.getData());
            } else {
                log.error("JobKeeper could not start the scheduler: {}", result.getMessage());
            }
        }
        if (sweeper != null) {
            sweeper.start();
        }
        started = true;
    }

    public synchronized void shutdown() {
        if (sweeper != null) {
            sweeper.stop();
        }
        orchestrator.shutdownScheduler();
        notifyExecutor.shutdown();
        try {
            if (!notifyExecutor.awaitTermination(5, TimeUnit.SECONDS)) {
                notifyExecutor.shutdownNow();
            }
        } catch (InterruptedException e) {
            notifyExecutor.shutdownNow();
            Thread.currentThread().interrupt();
        }
        MetricsServer.stop();
        started = false;
    }

    public boolean isStarted() {
        return started;
    }

    public JobOrchestrator getOrchestrator() {
        return orchestrator;
    }

    public NotificationDispatcher getNotifications() {
        return notifications;
    }

    public JobClassRegistry getRegistry() {
        return registry;
    }

    public JobStore getStore() {
        return store;
    }

    SchedulingEngine getEngine() {
        return engine;
    }
}
