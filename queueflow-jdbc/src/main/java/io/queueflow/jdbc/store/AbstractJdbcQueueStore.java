package io.queueflow.jdbc.store;

import io.queueflow.Backoff;
import io.queueflow.JobOptions;
import io.queueflow.jdbc.JdbcTemplate;
import io.queueflow.model.Job;
import io.queueflow.model.JobReceipt;
import io.queueflow.model.JobRequest;
import io.queueflow.model.JobState;
import io.queueflow.model.RecurringJob;
import io.queueflow.model.RecurringJobRequest;

import java.sql.Connection;
import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.Objects;

/**
 * Base JDBC queue store with standard SQL implementations.
 *
 * <p>Jobs live in {@code <prefix>_job}, keyed by {@code (queue, job_id)}; recurring
 * registrations live in {@code <prefix>_recurring}, keyed by {@code (queue, job_key)}.
 * Every method runs on the connection it is given and leaves transaction control to
 * the caller.
 *
 * <p>Subclasses override {@link #claim} and {@link #purge} to provide
 * database-specific strategies. Register custom implementations via
 * {@code META-INF/services/io.queueflow.jdbc.store.AbstractJdbcQueueStore}.
 *
 * @see JdbcQueueStores
 */
public abstract class AbstractJdbcQueueStore {
    public static final String DEFAULT_TABLE_PREFIX = "queueflow";
    private static final String TABLE_PREFIX_PATTERN = "[a-zA-Z_][a-zA-Z0-9_]*";
    private static final int MAX_ERROR_LENGTH = 4000;
    // keeps saturated exponential backoffs within TIMESTAMP range
    private static final long MAX_RETRY_DELAY_MS = Duration.ofDays(365L * 100).toMillis();

    protected static final String CLAIMABLE =
            "((state IN (" + JobState.WAITING.code() + "," + JobState.DELAYED.code() + ") AND available_at <= ?)"
                    + " OR (state=" + JobState.ACTIVE.code() + " AND locked_at < ?))";

    // a stalled takeover counts as an attempt; listed first since MySQL applies SET clauses in order
    protected static final String COUNT_STALLED_ATTEMPT =
            "attempts_made=CASE WHEN state=" + JobState.ACTIVE.code()
                    + " THEN attempts_made+1 ELSE attempts_made END";

    static final String STALLED_ERROR = "Job stalled more than allowed";

    protected static final String JOB_COLUMNS =
            "queue, job_id, name, payload, attempts_made, max_attempts, backoff_type, backoff_delay_ms, created_at";

    protected static final JdbcTemplate.RowMapper<Job> JOB_ROW_MAPPER = rs -> {
        String backoffType = rs.getString("backoff_type");
        Backoff backoff = backoffType == null ? null
                : new Backoff(Backoff.Type.valueOf(backoffType), rs.getLong("backoff_delay_ms"));
        return new Job(
                rs.getString("job_id"),
                rs.getString("queue"),
                rs.getString("name"),
                rs.getString("payload"),
                rs.getInt("attempts_made"),
                rs.getInt("max_attempts"),
                backoff,
                rs.getTimestamp("created_at").toInstant());
    };

    private static final JdbcTemplate.RowMapper<RecurringJob> RECURRING_ROW_MAPPER = rs -> new RecurringJob(
            rs.getString("job_key"),
            rs.getString("job_id"),
            rs.getString("name"),
            rs.getString("queue"),
            rs.getString("pattern"),
            rs.getString("tz"),
            JdbcTemplate.instant(rs, "next_run_at"));

    private final String tablePrefix;

    protected AbstractJdbcQueueStore() {
        this(DEFAULT_TABLE_PREFIX);
    }

    protected AbstractJdbcQueueStore(String tablePrefix) {
        Objects.requireNonNull(tablePrefix, "tablePrefix");
        if (!tablePrefix.matches(TABLE_PREFIX_PATTERN)) {
            throw new IllegalArgumentException("Invalid table prefix: " + tablePrefix);
        }
        this.tablePrefix = tablePrefix;
    }

    /**
     * Unique identifier for this queue store (e.g., "mysql", "postgresql", "h2").
     */
    public abstract String name();

    /**
     * JDBC URL prefixes this queue store handles (e.g., "jdbc:mysql:", "jdbc:tidb:").
     */
    public abstract List<String> jdbcUrlPrefixes();

    /**
     * Returns a store of the same dialect using a different table prefix.
     */
    public abstract AbstractJdbcQueueStore withTablePrefix(String tablePrefix);

    /**
     * Classpath location of the DDL for this dialect, or {@code null} if none ships.
     */
    public String schemaResource() {
        return "schema/" + name() + ".sql";
    }

    public String tablePrefix() {
        return tablePrefix;
    }

    protected String jobTable() {
        return tablePrefix + "_job";
    }

    protected String recurringTable() {
        return tablePrefix + "_recurring";
    }

    // ── Jobs ────────────────────────────────────────────────────────

    /**
     * Inserts a job unless one with the same id exists in the queue.
     *
     * @return receipt of the stored job; {@code duplicate} is set if nothing was inserted
     */
    public JobReceipt insertJob(Connection conn, String queue, JobRequest request, Instant now) {
        JobReceipt existing = findReceipt(conn, queue, request.jobId());
        if (existing != null) {
            return existing;
        }
        JobOptions options = request.options();
        Backoff backoff = options.backoff();
        JobState state = options.delayMs() > 0 ? JobState.DELAYED : JobState.WAITING;
        String sql = "INSERT INTO " + jobTable() + " (" +
                "queue, job_id, name, payload, state, attempts_made, max_attempts, backoff_type, " +
                "backoff_delay_ms, available_at, created_at, finished_at, locked_by, locked_at, last_error" +
                ") VALUES (?,?,?,?,?,?,?,?,?,?,?,NULL,NULL,NULL,NULL)";
        JdbcTemplate.update(conn, sql,
                queue, request.jobId(), request.name(), request.payloadJson(), state.code(), 0,
                options.effectiveAttempts(),
                backoff == null ? null : backoff.type().name(),
                backoff == null ? null : backoff.delayMs(),
                now.plusMillis(options.delayMs()), now);
        return new JobReceipt(request.jobId(), queue, request.name(), now, false);
    }

    /** Returns a duplicate receipt for an existing job, or {@code null}. */
    public JobReceipt findReceipt(Connection conn, String queue, String jobId) {
        String sql = "SELECT job_id, queue, name, created_at FROM " + jobTable() + " WHERE queue=? AND job_id=?";
        List<JobReceipt> rows = JdbcTemplate.query(conn, sql, rs -> new JobReceipt(
                rs.getString("job_id"),
                rs.getString("queue"),
                rs.getString("name"),
                rs.getTimestamp("created_at").toInstant(),
                true), queue, jobId);
        return rows.isEmpty() ? null : rows.get(0);
    }

    /** Returns the state of a job, or {@code null} if it does not exist. */
    public JobState findState(Connection conn, String queue, String jobId) {
        String sql = "SELECT state FROM " + jobTable() + " WHERE queue=? AND job_id=?";
        List<JobState> rows = JdbcTemplate.query(conn, sql,
                rs -> JobState.fromCode(rs.getInt("state")), queue, jobId);
        return rows.isEmpty() ? null : rows.get(0);
    }

    /**
     * Claims up to {@code limit} jobs for {@code lockToken}: due waiting or delayed
     * jobs, and active jobs whose lock is older than {@code lockExpiry}. Claimed jobs
     * become active, oldest first.
     *
     * <p>Taking over a stalled job counts as an attempt. A stalled job with no attempts
     * left is failed instead, see {@link #failExhaustedStalled}.
     *
     * <p>The default uses an UPDATE with a subquery followed by a SELECT (H2-compatible).
     */
    public List<Job> claim(Connection conn, String queue, String lockToken, Instant now,
            Instant lockExpiry, int limit) {
        failExhaustedStalled(conn, queue, now, lockExpiry);
        String claimSql = "UPDATE " + jobTable() + " SET " + COUNT_STALLED_ATTEMPT +
                ", state=" + JobState.ACTIVE.code() + ", locked_by=?, locked_at=? WHERE queue=? AND job_id IN (" +
                "SELECT job_id FROM " + jobTable() + " WHERE queue=? AND " + CLAIMABLE +
                " ORDER BY available_at, created_at LIMIT ?)";
        int updated = JdbcTemplate.update(conn, claimSql,
                lockToken, now, queue, queue, now, lockExpiry, limit);
        if (updated == 0) {
            return List.of();
        }
        return selectClaimed(conn, queue, lockToken);
    }

    /**
     * Fails active jobs whose lock is older than {@code lockExpiry} and whose takeover
     * would use up their last attempt. Claim implementations call this before claiming.
     *
     * @return rows failed
     */
    protected int failExhaustedStalled(Connection conn, String queue, Instant now, Instant lockExpiry) {
        String sql = "UPDATE " + jobTable() +
                " SET attempts_made=attempts_made+1, state=" + JobState.FAILED.code() +
                ", finished_at=?, last_error=?, locked_by=NULL, locked_at=NULL" +
                " WHERE queue=? AND state=" + JobState.ACTIVE.code() +
                " AND locked_at < ? AND attempts_made+1 >= max_attempts";
        return JdbcTemplate.update(conn, sql, now, STALLED_ERROR, queue, lockExpiry);
    }

    /**
     * Selects rows claimed under the given lock token.
     * Shared by subclasses that use a two-phase claim (UPDATE then SELECT).
     */
    protected List<Job> selectClaimed(Connection conn, String queue, String lockToken) {
        String sql = "SELECT " + JOB_COLUMNS + " FROM " + jobTable() +
                " WHERE queue=? AND locked_by=? AND state=" + JobState.ACTIVE.code() +
                " ORDER BY available_at, created_at";
        return JdbcTemplate.query(conn, sql, JOB_ROW_MAPPER, queue, lockToken);
    }

    /**
     * Marks an active job completed.
     *
     * @return rows updated (0 if the job is no longer held by this claim)
     */
    public int markCompleted(Connection conn, Job job, Instant now) {
        String sql = "UPDATE " + jobTable() +
                " SET state=" + JobState.COMPLETED.code() + ", finished_at=?, locked_by=NULL, locked_at=NULL" +
                " WHERE queue=? AND job_id=? AND state=" + JobState.ACTIVE.code();
        return JdbcTemplate.update(conn, sql, now, job.queue(), job.id());
    }

    /**
     * Records a failed attempt. The job becomes delayed until its backoff elapses if
     * attempts remain, otherwise failed.
     *
     * @return the resulting state
     */
    public JobState markFailed(Connection conn, Job job, String error, Instant now) {
        int attemptsMade = job.attemptsMade() + 1;
        String truncated = truncateError(error);
        if (attemptsMade < job.maxAttempts()) {
            long delayMs = job.backoff() == null ? 0L : job.backoff().delayMsFor(attemptsMade);
            Instant availableAt = now.plusMillis(Math.min(delayMs, MAX_RETRY_DELAY_MS));
            String sql = "UPDATE " + jobTable() +
                    " SET state=" + JobState.DELAYED.code() +
                    ", attempts_made=?, available_at=?, last_error=?, locked_by=NULL, locked_at=NULL" +
                    " WHERE queue=? AND job_id=? AND state=" + JobState.ACTIVE.code();
            JdbcTemplate.update(conn, sql, attemptsMade, availableAt, truncated, job.queue(), job.id());
            return JobState.DELAYED;
        }
        String sql = "UPDATE " + jobTable() +
                " SET state=" + JobState.FAILED.code() +
                ", attempts_made=?, finished_at=?, last_error=?, locked_by=NULL, locked_at=NULL" +
                " WHERE queue=? AND job_id=? AND state=" + JobState.ACTIVE.code();
        JdbcTemplate.update(conn, sql, attemptsMade, now, truncated, job.queue(), job.id());
        return JobState.FAILED;
    }

    /**
     * Deletes up to {@code limit} jobs in a terminal state finished before {@code olderThan}.
     *
     * @return rows deleted
     */
    public int purge(Connection conn, String queue, JobState state, Instant olderThan, int limit) {
        String sql = "DELETE FROM " + jobTable() + " WHERE queue=? AND job_id IN (" +
                "SELECT job_id FROM " + jobTable() +
                " WHERE queue=? AND state=? AND finished_at < ? ORDER BY finished_at LIMIT ?)";
        return JdbcTemplate.update(conn, sql, queue, queue, state.code(), olderThan, limit);
    }

    // ── Recurring registrations ─────────────────────────────────────

    public List<RecurringJob> listRecurring(Connection conn, String queue) {
        String sql = "SELECT job_key, job_id, name, queue, pattern, tz, next_run_at FROM " + recurringTable() +
                " WHERE queue=? ORDER BY created_at";
        return JdbcTemplate.query(conn, sql, RECURRING_ROW_MAPPER, queue);
    }

    public int deleteRecurring(Connection conn, String queue, String key) {
        String sql = "DELETE FROM " + recurringTable() + " WHERE queue=? AND job_key=?";
        return JdbcTemplate.update(conn, sql, queue, key);
    }

    /** Inserts a registration. The caller removes any row with the same key first. */
    public RecurringJob insertRecurring(Connection conn, String queue, RecurringJobRequest request,
            Instant nextRunAt, Instant now) {
        String sql = "INSERT INTO " + recurringTable() +
                " (queue, job_key, job_id, name, pattern, tz, payload, next_run_at, created_at)" +
                " VALUES (?,?,?,?,?,?,?,?,?)";
        JdbcTemplate.update(conn, sql, queue, request.key(), request.jobId(), request.name(),
                request.pattern(), request.tz(), request.payloadJson(), nextRunAt, now);
        return new RecurringJob(request.key(), request.jobId(), request.name(), queue,
                request.pattern(), request.tz(), nextRunAt);
    }

    /** Returns registrations whose next run is at or before {@code now}. */
    public List<DueRecurring> selectDueRecurring(Connection conn, String queue, Instant now) {
        String sql = "SELECT job_key, job_id, name, queue, pattern, tz, next_run_at, payload FROM " +
                recurringTable() + " WHERE queue=? AND next_run_at <= ? ORDER BY next_run_at";
        return JdbcTemplate.query(conn, sql,
                rs -> new DueRecurring(RECURRING_ROW_MAPPER.map(rs), rs.getString("payload")), queue, now);
    }

    /**
     * Moves a registration's next run from {@code expected} to {@code next}.
     *
     * @return 1 if this caller advanced it, 0 if another caller already did
     */
    public int advanceRecurring(Connection conn, String queue, String key, Instant expected, Instant next) {
        String sql = "UPDATE " + recurringTable() + " SET next_run_at=? WHERE queue=? AND job_key=? AND next_run_at=?";
        return JdbcTemplate.update(conn, sql, next, queue, key, expected);
    }

    /**
     * A due recurring registration with the payload its jobs carry.
     *
     * @param job         the registration
     * @param payloadJson encoded payload
     */
    public record DueRecurring(RecurringJob job, String payloadJson) {
    }

    private static String truncateError(String error) {
        if (error == null || error.length() <= MAX_ERROR_LENGTH) {
            return error;
        }
        return error.substring(0, MAX_ERROR_LENGTH - 3) + "...";
    }
}
