package com.jobkeeper.store;

import com.jobkeeper.model.DistributionEntry;
import com.jobkeeper.model.ExecutionLogEntry;
import com.jobkeeper.model.JobDefinition;
import com.jobkeeper.model.JobKind;
import com.jobkeeper.model.JobQuery;
import com.jobkeeper.model.JobStats;
import com.jobkeeper.model.JobStatus;
import com.jobkeeper.model.LogQuery;
import com.jobkeeper.model.LogStatus;
import com.jobkeeper.model.NotificationQuery;
import com.jobkeeper.model.NotificationRecord;
import com.jobkeeper.model.NotificationStatus;
import com.jobkeeper.model.Page;
import com.jobkeeper.model.PageQuery;
import com.jobkeeper.model.Setting;
import com.jobkeeper.model.StatsQuery;
import com.jobkeeper.model.TrendPoint;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import javax.sql.DataSource;
import java.sql.Connection;
import java.sql.PreparedStatement;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.sql.Statement;
import java.sql.Types;
import java.time.LocalDateTime;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Locale;
import java.util.Map;

/**
 * JobStore backed by a JDBC DataSource. The schema is created on first use
 * with {@code CREATE TABLE IF NOT EXISTS}; upserts use H2's
 * {@code MERGE INTO ... KEY(...)}. Filtering and paging run in SQL with the
 * same semantics as {@link StoreQueries}; aggregates reuse StoreQueries.
 */
public class JdbcJobStore implements JobStore {
    private static final Logger log = LoggerFactory.getLogger(JdbcJobStore.class);

    private static final String JOB_COLUMNS = "job_name, job_group, trigger_name, trigger_group, cron_expression, "
            + "description, job_kind, target, job_data, http_method, http_headers, http_body, http_timeout_seconds, "
            + "skip_ssl_validation, start_time, end_time, status, enabled, next_run_time, previous_run_time, remark, "
            + "create_time, update_time, create_by, update_by";
    private static final String LOG_COLUMNS = "log_id, job_name, job_group, trigger_name, trigger_group, status, "
            + "start_time, end_time, duration_ms, message, exception_text, error_message, error_stack_trace, "
            + "result_text, job_data, create_time";
    private static final String NOTIFICATION_COLUMNS = "notification_id, title, content, status, error_message, "
            + "triggered_by, create_time, send_time, duration_ms";

    private static final Map<String, String> JOB_SORT = Map.of(
            "jobname", "job_name", "jobgroup", "job_group", "status", "status", "enabled", "enabled",
            "isenabled", "enabled", "createtime", "create_time", "updatetime", "update_time",
            "previousruntime", "previous_run_time", "nextruntime", "next_run_time");
    private static final Map<String, String> LOG_SORT = Map.of(
            "jobname", "job_name", "jobgroup", "job_group", "status", "status", "createtime", "create_time",
            "starttime", "start_time", "endtime", "end_time", "duration", "duration_ms");
    private static final Map<String, String> NOTIFICATION_SORT = Map.of(
            "title", "title", "status", "status", "createtime", "create_time", "sendtime", "send_time");

    private final DataSource dataSource;

    public JdbcJobStore(DataSource dataSource) {
        this.dataSource = dataSource;
        initialize();
    }

    @Override
    public boolean initialize() {
        try (Connection c = dataSource.getConnection();
             Statement s = c.createStatement()) {
            s.executeUpdate("CREATE TABLE IF NOT EXISTS jk_jobs ("
                    + "job_name VARCHAR(200) NOT NULL, job_group VARCHAR(200) NOT NULL, "
                    + "trigger_name VARCHAR(200), trigger_group VARCHAR(200), cron_expression VARCHAR(120), "
                    + "description VARCHAR(1000), job_kind VARCHAR(16), target VARCHAR(2000), job_data CLOB, "
                    + "http_method VARCHAR(16), http_headers CLOB, http_body CLOB, http_timeout_seconds INT, "
                    + "skip_ssl_validation BOOLEAN, start_time TIMESTAMP, end_time TIMESTAMP, status VARCHAR(16), "
                    + "enabled BOOLEAN, next_run_time TIMESTAMP, previous_run_time TIMESTAMP, remark VARCHAR(1000), "
                    + "create_time TIMESTAMP, update_time TIMESTAMP, create_by VARCHAR(100), update_by VARCHAR(100), "
                    + "PRIMARY KEY (job_name, job_group))");
            s.executeUpdate("CREATE TABLE IF NOT EXISTS jk_job_logs ("
                    + "log_id VARCHAR(64) PRIMARY KEY, job_name VARCHAR(200), job_group VARCHAR(200), "
                    + "trigger_name VARCHAR(200), trigger_group VARCHAR(200), status VARCHAR(16), "
                    + "start_time TIMESTAMP, end_time TIMESTAMP, duration_ms BIGINT, message CLOB, "
                    + "exception_text CLOB, error_message CLOB, error_stack_trace CLOB, result_text CLOB, "
                    + "job_data CLOB, create_time TIMESTAMP)");
            s.executeUpdate("CREATE TABLE IF NOT EXISTS jk_settings ("
                    + "setting_key VARCHAR(200) PRIMARY KEY, setting_value CLOB, description VARCHAR(1000), "
                    + "enabled BOOLEAN, create_time TIMESTAMP, update_time TIMESTAMP)");
            s.executeUpdate("CREATE TABLE IF NOT EXISTS jk_notifications ("
                    + "notification_id VARCHAR(64) PRIMARY KEY, title VARCHAR(500), content CLOB, "
                    + "status VARCHAR(16), error_message CLOB, triggered_by VARCHAR(400), "
                    + "create_time TIMESTAMP, send_time TIMESTAMP, duration_ms BIGINT)");
            return true;
        } catch (SQLException e) {
            log.error("Failed to initialize schema", e);
            return false;
        }
    }

    @Override
    public boolean isInitialized() {
        try (Connection c = dataSource.getConnection();
             Statement s = c.createStatement();
             ResultSet rs = s.executeQuery("SELECT COUNT(*) FROM jk_jobs WHERE 1 = 0")) {
            return true;
        } catch (SQLException e) {
            return false;
        }
    }

    // ---- SQL helpers ----

    /** Collects a WHERE clause and its parameters. */
    private static final class Where {
        private final StringBuilder sql = new StringBuilder();
        private final List<Object> params = new ArrayList<>();

        private Where and(String condition, Object param) {
            sql.append(sql.length() == 0 ? " WHERE " : " AND ").append(condition);
            params.add(param);
            return this;
        }

        Where contains(String column, String value) {
            if (value == null || value.isEmpty()) {
                return this;
            }
            String escaped = value.toLowerCase(Locale.ROOT)
                    .replace("\\", "\\\\").replace("%", "\\%").replace("_", "\\_");
            return and("LOWER(" + column + ") LIKE ? ESCAPE '\\'", "%" + escaped + "%");
        }

        Where eq(String column, Object value) {
            if (value == null) {
                return this;
            }
            return and(column + " = ?", value instanceof Enum ? ((Enum<?>) value).name() : value);
        }

        Where from(String column, LocalDateTime t) {
            return t == null ? this : and(column + " >= ?", t);
        }

        Where to(String column, LocalDateTime t) {
            return t == null ? this : and(column + " <= ?", t);
        }

        void bind(PreparedStatement ps, int offset) throws SQLException {
            for (int i = 0; i < params.size(); i++) {
                ps.setObject(offset + i + 1, params.get(i));
            }
        }

        @Override
        public String toString() {
            return sql.toString();
        }
    }

    private static String orderBy(PageQuery q, Map<String, String> columns) {
        String key = q.getSortBy() == null ? "" : q.getSortBy().toLowerCase(Locale.ROOT);
        String column = columns.get(key);
        if (column == null) {
            return " ORDER BY create_time DESC NULLS LAST";
        }
        return q.isAscending()
                ? " ORDER BY " + column + " ASC NULLS FIRST"
                : " ORDER BY " + column + " DESC NULLS LAST";
    }

    private interface RowMapper<T> {
        T map(ResultSet rs) throws SQLException;
    }

    private <T> List<T> select(String sql, Where where, RowMapper<T> mapper, Object... trailing) throws SQLException {
        List<T> list = new ArrayList<>();
        try (Connection c = dataSource.getConnection();
             PreparedStatement ps = c.prepareStatement(sql)) {
            where.bind(ps, 0);
            for (int i = 0; i < trailing.length; i++) {
                ps.setObject(where.params.size() + i + 1, trailing[i]);
            }
            try (ResultSet rs = ps.executeQuery()) {
                while (rs.next()) {
                    list.add(mapper.map(rs));
                }
            }
        }
        return list;
    }

    private long count(String table, Where where) throws SQLException {
        try (Connection c = dataSource.getConnection();
             PreparedStatement ps = c.prepareStatement("SELECT COUNT(*) FROM " + table + where)) {
            where.bind(ps, 0);
            try (ResultSet rs = ps.executeQuery()) {
                rs.next();
                return rs.getLong(1);
            }
        }
    }

    private int update(String sql, Object... params) throws SQLException {
        try (Connection c = dataSource.getConnection();
             PreparedStatement ps = c.prepareStatement(sql)) {
            for (int i = 0; i < params.length; i++) {
                Object p = params[i];
                if (p == null) {
                    ps.setNull(i + 1, Types.NULL);
                } else {
                    ps.setObject(i + 1, p instanceof Enum ? ((Enum<?>) p).name() : p);
                }
            }
            return ps.executeUpdate();
        }
    }

    private <T> Page<T> page(String table, String columns, Where where, PageQuery q,
                             Map<String, String> sort, RowMapper<T> mapper) throws SQLException {
        long total = count(table, where);
        int size = Math.max(q.getPageSize(), 0);
        long offset = (long) Math.max(q.getPageIndex() - 1, 0) * size;
        List<T> items = select("SELECT " + columns + " FROM " + table + where + orderBy(q, sort)
                + " LIMIT ? OFFSET ?", where, mapper, size, offset);
        return new Page<>(items, total, q.getPageIndex(), q.getPageSize());
    }

    private static LocalDateTime time(ResultSet rs, String column) throws SQLException {
        return rs.getObject(column, LocalDateTime.class);
    }

    private static <E extends Enum<E>> E enumValue(Class<E> type, String name) {
        return name == null ? null : Enum.valueOf(type, name);
    }

    private static Long nullableLong(ResultSet rs, String column) throws SQLException {
        long v = rs.getLong(column);
        return rs.wasNull() ? null : v;
    }

    // ---- row mapping ----

    private static JobDefinition mapJob(ResultSet rs) throws SQLException {
        JobDefinition j = new JobDefinition(rs.getString("job_name"), rs.getString("job_group"));
        j.setTriggerName(rs.getString("trigger_name"));
        j.setTriggerGroup(rs.getString("trigger_group"));
        j.setCronExpression(rs.getString("cron_expression"));
        j.setDescription(rs.getString("description"));
        j.setJobKind(enumValue(JobKind.class, rs.getString("job_kind")));
        j.setTarget(rs.getString("target"));
        j.setJobData(rs.getString("job_data"));
        j.setHttpMethod(rs.getString("http_method"));
        j.setHttpHeaders(rs.getString("http_headers"));
        j.setHttpBody(rs.getString("http_body"));
        j.setHttpTimeoutSeconds(rs.getInt("http_timeout_seconds"));
        j.setSkipSslValidation(rs.getBoolean("skip_ssl_validation"));
        j.setStartTime(time(rs, "start_time"));
        j.setEndTime(time(rs, "end_time"));
        j.setStatus(enumValue(JobStatus.class, rs.getString("status")));
        j.setEnabled(rs.getBoolean("enabled"));
        j.setNextRunTime(time(rs, "next_run_time"));
        j.setPreviousRunTime(time(rs, "previous_run_time"));
        j.setRemark(rs.getString("remark"));
        j.setCreateTime(time(rs, "create_time"));
        j.setUpdateTime(time(rs, "update_time"));
        j.setCreateBy(rs.getString("create_by"));
        j.setUpdateBy(rs.getString("update_by"));
        return j;
    }

    private static Object[] jobParams(JobDefinition j) {
        return new Object[] {j.getJobName(), j.getJobGroup(), j.getTriggerName(), j.getTriggerGroup(),
                j.getCronExpression(), j.getDescription(), j.getJobKind(), j.getTarget(), j.getJobData(),
                j.getHttpMethod(), j.getHttpHeaders(), j.getHttpBody(), j.getHttpTimeoutSeconds(),
                j.isSkipSslValidation(), j.getStartTime(), j.getEndTime(), j.getStatus(), j.isEnabled(),
                j.getNextRunTime(), j.getPreviousRunTime(), j.getRemark(), j.getCreateTime(), j.getUpdateTime(),
                j.getCreateBy(), j.getUpdateBy()};
    }

    private static ExecutionLogEntry mapLog(ResultSet rs) throws SQLException {
        ExecutionLogEntry l = new ExecutionLogEntry(rs.getString("job_name"), rs.getString("job_group"));
        l.setLogId(rs.getString("log_id"));
        l.setTriggerName(rs.getString("trigger_name"));
        l.setTriggerGroup(rs.getString("trigger_group"));
        l.setStatus(enumValue(LogStatus.class, rs.getString("status")));
        l.setStartTime(time(rs, "start_time"));
        l.setEndTime(time(rs, "end_time"));
        l.setDurationMillis(nullableLong(rs, "duration_ms"));
        l.setMessage(rs.getString("message"));
        l.setException(rs.getString("exception_text"));
        l.setErrorMessage(rs.getString("error_message"));
        l.setErrorStackTrace(rs.getString("error_stack_trace"));
        l.setResult(rs.getString("result_text"));
        l.setJobData(rs.getString("job_data"));
        l.setCreateTime(time(rs, "create_time"));
        return l;
    }

    private static NotificationRecord mapNotification(ResultSet rs) throws SQLException {
        NotificationRecord n = new NotificationRecord(rs.getString("title"), rs.getString("content"),
                rs.getString("triggered_by"));
        n.setNotificationId(rs.getString("notification_id"));
        n.setStatus(enumValue(NotificationStatus.class, rs.getString("status")));
        n.setErrorMessage(rs.getString("error_message"));
        n.setCreateTime(time(rs, "create_time"));
        n.setSendTime(time(rs, "send_time"));
        n.setDurationMillis(nullableLong(rs, "duration_ms"));
        return n;
    }

    private static Setting mapSetting(ResultSet rs) throws SQLException {
        Setting s = new Setting(rs.getString("setting_key"), rs.getString("setting_value"));
        s.setDescription(rs.getString("description"));
        s.setEnabled(rs.getBoolean("enabled"));
        s.setCreateTime(time(rs, "create_time"));
        s.setUpdateTime(time(rs, "update_time"));
        return s;
    }

    private static Where jobFilter(JobQuery q) {
        return new Where().contains("job_name", q.getJobName()).contains("job_group", q.getJobGroup())
                .eq("status", q.getStatus()).eq("enabled", q.getEnabled());
    }

    private static Where logFilter(LogQuery q) {
        return new Where().contains("job_name", q.getJobName()).contains("job_group", q.getJobGroup())
                .eq("status", q.getStatus()).from("start_time", q.getStartTime()).to("start_time", q.getEndTime());
    }

    private static Where notificationFilter(NotificationQuery q) {
        return new Where().eq("status", q.getStatus()).contains("triggered_by", q.getTriggeredBy())
                .from("create_time", q.getStartTime()).to("create_time", q.getEndTime());
    }

    private static Where identity(String jobName, String jobGroup) {
        return new Where().eq("job_name", jobName).eq("job_group", jobGroup);
    }

    // ---- jobs ----

    @Override
    public boolean addJob(JobDefinition job) {
        try {
            return update("INSERT INTO jk_jobs (" + JOB_COLUMNS + ") VALUES "
                    + "(?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?)", jobParams(job)) == 1;
        } catch (SQLException e) {
            log.error("Failed to add job {}", job.getIdentity(), e);
            return false;
        }
    }

    @Override
    public boolean updateJob(JobDefinition job) {
        Object[] all = jobParams(job);
        Object[] params = new Object[all.length];
        System.arraycopy(all, 2, params, 0, all.length - 2);
        params[all.length - 2] = job.getJobName();
        params[all.length - 1] = job.getJobGroup();
        try {
            return update("UPDATE jk_jobs SET trigger_name = ?, trigger_group = ?, cron_expression = ?, "
                    + "description = ?, job_kind = ?, target = ?, job_data = ?, http_method = ?, http_headers = ?, "
                    + "http_body = ?, http_timeout_seconds = ?, skip_ssl_validation = ?, start_time = ?, "
                    + "end_time = ?, status = ?, enabled = ?, next_run_time = ?, previous_run_time = ?, remark = ?, "
                    + "create_time = ?, update_time = ?, create_by = ?, update_by = ? "
                    + "WHERE job_name = ? AND job_group = ?", params) == 1;
        } catch (SQLException e) {
            log.error("Failed to update job {}", job.getIdentity(), e);
            return false;
        }
    }

    @Override
    public boolean deleteJob(String jobName, String jobGroup) {
        try {
            return update("DELETE FROM jk_jobs WHERE job_name = ? AND job_group = ?", jobName, jobGroup) > 0;
        } catch (SQLException e) {
            log.error("Failed to delete job {}.{}", jobGroup, jobName, e);
            return false;
        }
    }

    @Override
    public JobDefinition getJob(String jobName, String jobGroup) {
        try {
            List<JobDefinition> rows = select("SELECT " + JOB_COLUMNS + " FROM jk_jobs" + identity(jobName, jobGroup),
                    identity(jobName, jobGroup), JdbcJobStore::mapJob);
            return rows.isEmpty() ? null : rows.get(0);
        } catch (SQLException e) {
            log.error("Failed to load job {}.{}", jobGroup, jobName, e);
            return null;
        }
    }

    @Override
    public Page<JobDefinition> getJobs(JobQuery query) {
        try {
            return page("jk_jobs", JOB_COLUMNS, jobFilter(query), query, JOB_SORT, JdbcJobStore::mapJob);
        } catch (SQLException e) {
            log.error("Failed to query jobs", e);
            return Page.empty(query);
        }
    }

    @Override
    public List<JobDefinition> getAllJobs() {
        try {
            return select("SELECT " + JOB_COLUMNS + " FROM jk_jobs ORDER BY create_time DESC NULLS LAST",
                    new Where(), JdbcJobStore::mapJob);
        } catch (SQLException e) {
            log.error("Failed to load jobs", e);
            return new ArrayList<>();
        }
    }

    @Override
    public boolean updateJobStatus(String jobName, String jobGroup, JobStatus status) {
        try {
            return update("UPDATE jk_jobs SET status = ?, update_time = ? WHERE job_name = ? AND job_group = ?",
                    status, LocalDateTime.now(), jobName, jobGroup) > 0;
        } catch (SQLException e) {
            log.error("Failed to update status of {}.{}", jobGroup, jobName, e);
            return false;
        }
    }

    // ---- logs ----

    @Override
    public boolean addExecutionLog(ExecutionLogEntry l) {
        try {
            return update("INSERT INTO jk_job_logs (" + LOG_COLUMNS + ") VALUES "
                            + "(?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?)",
                    l.getLogId(), l.getJobName(), l.getJobGroup(), l.getTriggerName(), l.getTriggerGroup(),
                    l.getStatus(), l.getStartTime(), l.getEndTime(), l.getDurationMillis(), l.getMessage(),
                    l.getException(), l.getErrorMessage(), l.getErrorStackTrace(), l.getResult(), l.getJobData(),
                    l.getCreateTime()) == 1;
        } catch (SQLException e) {
            log.error("Failed to add execution log for {}.{}", l.getJobGroup(), l.getJobName(), e);
            return false;
        }
    }

    @Override
    public Page<ExecutionLogEntry> getExecutionLogs(LogQuery query) {
        try {
            return page("jk_job_logs", LOG_COLUMNS, logFilter(query), query, LOG_SORT, JdbcJobStore::mapLog);
        } catch (SQLException e) {
            log.error("Failed to query execution logs", e);
            return Page.empty(query);
        }
    }

    @Override
    public int clearExpiredLogs(int retentionDays) {
        try {
            int removed = update("DELETE FROM jk_job_logs WHERE create_time < ?",
                    LocalDateTime.now().minusDays(retentionDays));
            if (removed > 0) {
                log.info("Removed {} expired log rows", removed);
            }
            return removed;
        } catch (SQLException e) {
            log.error("Failed to clear expired logs", e);
            return 0;
        }
    }

    @Override
    public boolean clearLogs(LogQuery filter) {
        Where where = filter == null ? new Where() : logFilter(filter);
        try (Connection c = dataSource.getConnection();
             PreparedStatement ps = c.prepareStatement("DELETE FROM jk_job_logs" + where)) {
            where.bind(ps, 0);
            ps.executeUpdate();
            return true;
        } catch (SQLException e) {
            log.error("Failed to clear logs", e);
            return false;
        }
    }

    private List<ExecutionLogEntry> logsInWindow(StatsQuery query) throws SQLException {
        LocalDateTime[] window = query.window(LocalDateTime.now());
        Where where = new Where().from("start_time", window[0]).to("start_time", window[1]);
        return select("SELECT " + LOG_COLUMNS + " FROM jk_job_logs" + where, where, JdbcJobStore::mapLog);
    }

    @Override
    public JobStats getJobStats(StatsQuery query) {
        try {
            return StoreQueries.jobStats(getAllJobs(), logsInWindow(query));
        } catch (SQLException e) {
            log.error("Failed to compute job stats", e);
            return new JobStats();
        }
    }

    @Override
    public List<DistributionEntry> getJobStatusDistribution() {
        return StoreQueries.statusDistribution(getAllJobs());
    }

    @Override
    public List<DistributionEntry> getJobTypeDistribution() {
        return StoreQueries.typeDistribution(getAllJobs());
    }

    @Override
    public List<TrendPoint> getExecutionTrend(StatsQuery query) {
        try {
            return StoreQueries.trend(logsInWindow(query));
        } catch (SQLException e) {
            log.error("Failed to compute execution trend", e);
            return Collections.emptyList();
        }
    }

    @Override
    public List<DistributionEntry> getExecutionTimeDistribution(StatsQuery query) {
        try {
            return StoreQueries.durationHistogram(logsInWindow(query));
        } catch (SQLException e) {
            log.error("Failed to compute execution time distribution", e);
            return Collections.emptyList();
        }
    }

    // ---- settings ----

    @Override
    public boolean saveSetting(Setting setting) {
        LocalDateTime now = LocalDateTime.now();
        Setting existing = getSetting(setting.getKey());
        setting.setCreateTime(existing != null && existing.getCreateTime() != null ? existing.getCreateTime() : now);
        setting.setUpdateTime(now);
        try {
            update("MERGE INTO jk_settings (setting_key, setting_value, description, enabled, create_time, update_time) "
                            + "KEY(setting_key) VALUES (?, ?, ?, ?, ?, ?)",
                    setting.getKey(), setting.getValue(), setting.getDescription(), setting.isEnabled(),
                    setting.getCreateTime(), setting.getUpdateTime());
            return true;
        } catch (SQLException e) {
            log.error("Failed to save setting {}", setting.getKey(), e);
            return false;
        }
    }

    @Override
    public Setting getSetting(String key) {
        Where where = new Where().eq("setting_key", key);
        try {
            List<Setting> rows = select("SELECT * FROM jk_settings" + where, where, JdbcJobStore::mapSetting);
            return rows.isEmpty() ? null : rows.get(0);
        } catch (SQLException e) {
            log.error("Failed to load setting {}", key, e);
            return null;
        }
    }

    @Override
    public List<Setting> getAllSettings() {
        try {
            return select("SELECT * FROM jk_settings ORDER BY setting_key", new Where(), JdbcJobStore::mapSetting);
        } catch (SQLException e) {
            log.error("Failed to load settings", e);
            return new ArrayList<>();
        }
    }

    // ---- notifications ----

    @Override
    public boolean addNotification(NotificationRecord n) {
        try {
            return update("INSERT INTO jk_notifications (" + NOTIFICATION_COLUMNS + ") VALUES (?, ?, ?, ?, ?, ?, ?, ?, ?)",
                    n.getNotificationId(), n.getTitle(), n.getContent(), n.getStatus(), n.getErrorMessage(),
                    n.getTriggeredBy(), n.getCreateTime(), n.getSendTime(), n.getDurationMillis()) == 1;
        } catch (SQLException e) {
            log.error("Failed to add notification", e);
            return false;
        }
    }

    @Override
    public boolean updateNotification(NotificationRecord n) {
        try {
            return update("UPDATE jk_notifications SET title = ?, content = ?, status = ?, error_message = ?, "
                            + "triggered_by = ?, create_time = ?, send_time = ?, duration_ms = ? "
                            + "WHERE notification_id = ?",
                    n.getTitle(), n.getContent(), n.getStatus(), n.getErrorMessage(), n.getTriggeredBy(),
                    n.getCreateTime(), n.getSendTime(), n.getDurationMillis(), n.getNotificationId()) == 1;
        } catch (SQLException e) {
            log.error("Failed to update notification {}", n.getNotificationId(), e);
            return false;
        }
    }

    @Override
    public NotificationRecord getNotification(String notificationId) {
        Where where = new Where().eq("notification_id", notificationId);
        try {
            List<NotificationRecord> rows = select("SELECT " + NOTIFICATION_COLUMNS + " FROM jk_notifications" + where,
                    where, JdbcJobStore::mapNotification);
            return rows.isEmpty() ? null : rows.get(0);
        } catch (SQLException e) {
            log.error("Failed to load notification {}", notificationId, e);
            return null;
        }
    }

    @Override
    public Page<NotificationRecord> getNotifications(NotificationQuery query) {
        try {
            return page("jk_notifications", NOTIFICATION_COLUMNS, notificationFilter(query), query,
                    NOTIFICATION_SORT, JdbcJobStore::mapNotification);
        } catch (SQLException e) {
            log.error("Failed to query notifications", e);
            return Page.empty(query);
        }
    }

    @Override
    public boolean deleteNotification(String notificationId) {
        try {
            return update("DELETE FROM jk_notifications WHERE notification_id = ?", notificationId) > 0;
        } catch (SQLException e) {
            log.error("Failed to delete notification {}", notificationId, e);
            return false;
        }
    }

    @Override
    public boolean clearNotifications(NotificationQuery filter) {
        Where where = filter == null ? new Where() : notificationFilter(filter);
        try (Connection c = dataSource.getConnection();
             PreparedStatement ps = c.prepareStatement("DELETE FROM jk_notifications" + where)) {
            where.bind(ps, 0);
            ps.executeUpdate();
            return true;
        } catch (SQLException e) {
            log.error("Failed to clear notifications", e);
            return false;
        }
    }
}
