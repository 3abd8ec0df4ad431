package io.queueflow.jdbc;

import io.queueflow.JobOptions;
import io.queueflow.jdbc.store.AbstractJdbcQueueStore;
import io.queueflow.jdbc.store.AbstractJdbcQueueStore.DueRecurring;
import io.queueflow.model.Job;
import io.queueflow.model.JobReceipt;
import io.queueflow.model.JobRequest;
import io.queueflow.model.JobState;
import io.queueflow.model.RecurringJob;
import io.queueflow.model.RecurringJobRequest;
import io.queueflow.spi.BrokerConnection;

import javax.sql.DataSource;
import java.sql.Connection;
import java.sql.SQLException;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.temporal.ChronoUnit;
import java.util.List;
import java.util.Objects;
import java.util.concurrent.atomic.AtomicLong;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * {@link BrokerConnection} backed by two database tables.
 *
 * <p>Each operation borrows a connection from the {@link DataSource} and returns it
 * before completing. Claims, recurring job installation and recurring job
 * materialization run in a transaction. Timestamps are truncated to milliseconds so
 * stored values compare equal to the ones written.
 *
 * <p>Instances are created by {@link JdbcConnectionFactory}.
 */
public final class JdbcBrokerConnection implements BrokerConnection {
    private static final Logger logger = Logger.getLogger(JdbcBrokerConnection.class.getName());

    private final DataSource dataSource;
    private final AbstractJdbcQueueStore store;
    private final Clock clock;
    private final Duration lockTimeout;
    private final AtomicLong claimSequence = new AtomicLong();
    private volatile boolean closed;

    JdbcBrokerConnection(DataSource dataSource, AbstractJdbcQueueStore store, Clock clock, Duration lockTimeout) {
        this.dataSource = Objects.requireNonNull(dataSource, "dataSource");
        this.store = Objects.requireNonNull(store, "store");
        this.clock = Objects.requireNonNull(clock, "clock");
        this.lockTimeout = Objects.requireNonNull(lockTimeout, "lockTimeout");
    }

    public AbstractJdbcQueueStore store() {
        return store;
    }

    @FunctionalInterface
    private interface Work<T> {
        T run(Connection conn);
    }

    private <T> T withConnection(Work<T> work) {
        ensureOpen();
        try (Connection conn = dataSource.getConnection()) {
            conn.setAutoCommit(true);
            return work.run(conn);
        } catch (SQLException e) {
            throw new QueueStoreException("Failed to obtain connection", e);
        }
    }

    private <T> T inTransaction(Work<T> work) {
        ensureOpen();
        try (Connection conn = dataSource.getConnection()) {
            conn.setAutoCommit(false);
            try {
                T result = work.run(conn);
                conn.commit();
                return result;
            } catch (RuntimeException e) {
                rollback(conn, e);
                throw e;
            } finally {
                conn.setAutoCommit(true);
            }
        } catch (SQLException e) {
            throw new QueueStoreException("Failed to obtain connection", e);
        }
    }

    private static void rollback(Connection conn, RuntimeException cause) {
        try {
            conn.rollback();
        } catch (SQLException e) {
            cause.addSuppressed(e);
        }
    }

    private void ensureOpen() {
        if (closed) {
            throw new QueueStoreException("Broker connection is closed");
        }
    }

    private Instant now() {
        return clock.instant().truncatedTo(ChronoUnit.MILLIS);
    }

    @Override
    public JobReceipt enqueue(String queue, JobRequest request) {
        Objects.requireNonNull(queue, "queue");
        Objects.requireNonNull(request, "request");
        return withConnection(conn -> {
            try {
                return store.insertJob(conn, queue, request, now());
            } catch (QueueStoreException e) {
                if (e.isDuplicateKey()) {
                    // lost an insert race for the same job id
                    JobReceipt existing = store.findReceipt(conn, queue, request.jobId());
                    if (existing != null) {
                        return existing;
                    }
                }
                throw e;
            }
        });
    }

    @Override
    public List<RecurringJob> listRecurring(String queue) {
        return withConnection(conn -> store.listRecurring(conn, queue));
    }

    @Override
    public boolean removeRecurring(String queue, String key) {
        return withConnection(conn -> store.deleteRecurring(conn, queue, key) > 0);
    }

    @Override
    public RecurringJob addRecurring(String queue, RecurringJobRequest request) {
        CronSchedule schedule = CronSchedule.parse(request.pattern(), request.tz());
        return inTransaction(conn -> {
            Instant now = now();
            store.deleteRecurring(conn, queue, request.key());
            return store.insertRecurring(conn, queue, request, schedule.next(now), now);
        });
    }

    @Override
    public List<Job> claim(String queue, String consumerId, int limit) {
        if (limit <= 0) {
            return List.of();
        }
        materializeDue(queue);
        String lockToken = consumerId + "#" + claimSequence.incrementAndGet();
        return inTransaction(conn -> {
            Instant now = now();
            return store.claim(conn, queue, lockToken, now, now.minus(lockTimeout), limit);
        });
    }

    /**
     * Turns every due recurring registration of the queue into an ordinary job and
     * advances its next run. Concurrent callers are resolved by the conditional
     * advance; the job id {@code repeat:<key>:<fireTimeMillis>} makes a repeated
     * insert a no-op.
     *
     * @return number of jobs materialized
     */
    public int materializeDue(String queue) {
        List<DueRecurring> due = withConnection(conn -> store.selectDueRecurring(conn, queue, now()));
        int materialized = 0;
        for (DueRecurring entry : due) {
            try {
                if (materialize(queue, entry)) {
                    materialized++;
                }
            } catch (IllegalArgumentException e) {
                logger.log(Level.SEVERE, "Recurring job " + entry.job().key() + " has an invalid schedule", e);
            }
        }
        return materialized;
    }

    private boolean materialize(String queue, DueRecurring entry) {
        RecurringJob recurring = entry.job();
        CronSchedule schedule = CronSchedule.parse(recurring.pattern(), recurring.tz());
        Instant fireTime = recurring.nextRunAt();
        return inTransaction(conn -> {
            Instant now = now();
            Instant next = schedule.next(now);
            if (store.advanceRecurring(conn, queue, recurring.key(), fireTime, next) == 0) {
                return false;
            }
            String jobId = "repeat:" + recurring.key() + ":" + fireTime.toEpochMilli();
            JobRequest request = new JobRequest(recurring.name(), entry.payloadJson(),
                    JobOptions.builder().jobId(jobId).build());
            JobReceipt receipt = store.insertJob(conn, queue, request, now);
            logger.log(Level.FINE, "Recurring job {0} fired as {1}{2}",
                    new Object[]{recurring.key(), jobId, receipt.duplicate() ? " (already present)" : ""});
            return !receipt.duplicate();
        });
    }

    @Override
    public void complete(Job job) {
        int updated = withConnection(conn -> store.markCompleted(conn, job, now()));
        if (updated == 0) {
            logger.log(Level.WARNING, "Job {0} was no longer active when completed", job.id());
        }
    }

    @Override
    public JobState fail(Job job, String error) {
        return withConnection(conn -> store.markFailed(conn, job, error, now()));
    }

    @Override
    public int purge(String queue, JobState state, Instant olderThan, int limit) {
        if (state != JobState.COMPLETED && state != JobState.FAILED) {
            throw new IllegalArgumentException("Only COMPLETED or FAILED jobs can be purged, got: " + state);
        }
        return withConnection(conn -> store.purge(conn, queue, state, olderThan, limit));
    }

    /** Returns the state of a job, or {@code null} if it does not exist. */
    public JobState state(String queue, String jobId) {
        return withConnection(conn -> store.findState(conn, queue, jobId));
    }

    /** Marks this connection closed. The {@link DataSource} is owned by the caller and stays open. */
    @Override
    public void close() {
        closed = true;
    }
}
