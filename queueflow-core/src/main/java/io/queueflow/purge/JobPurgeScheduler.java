package io.queueflow.purge;

import io.queueflow.model.JobState;
import io.queueflow.spi.ConnectionProvider;
import io.queueflow.util.DaemonThreadFactory;

import java.time.Duration;
import java.time.Instant;
import java.util.Collection;
import java.util.Objects;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.ScheduledFuture;
import java.util.concurrent.TimeUnit;
import java.util.function.Supplier;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Periodically deletes finished jobs from the broker.
 *
 * <p>Completed jobs are kept for {@code completedRetention} and failed jobs for
 * {@code failedRetention} after they finish. Each cycle visits every queue the
 * worker serves and deletes in batches until a batch comes back short.
 *
 * <p>Create instances via {@link #builder()}.
 */
public final class JobPurgeScheduler implements AutoCloseable {
    private static final Logger logger = Logger.getLogger(JobPurgeScheduler.class.getName());

    private final ConnectionProvider connectionProvider;
    private final Supplier<? extends Collection<String>> queues;
    private final Duration completedRetention;
    private final Duration failedRetention;
    private final int batchSize;
    private final long intervalSeconds;

    private ScheduledExecutorService scheduler;
    private volatile ScheduledFuture<?> purgeTask;
    private volatile boolean closed;

    private JobPurgeScheduler(Builder builder) {
        this.connectionProvider = Objects.requireNonNull(builder.connectionProvider, "connectionProvider");
        this.queues = Objects.requireNonNull(builder.queues, "queues");
        if (builder.completedRetention != null && builder.completedRetention.isNegative()) {
            throw new IllegalArgumentException("completedRetention must be >= 0");
        }
        if (builder.failedRetention != null && builder.failedRetention.isNegative()) {
            throw new IllegalArgumentException("failedRetention must be >= 0");
        }
        if (builder.batchSize <= 0) {
            throw new IllegalArgumentException("batchSize must be > 0");
        }
        if (builder.intervalSeconds <= 0L) {
            throw new IllegalArgumentException("intervalSeconds must be > 0");
        }
        this.completedRetention = builder.completedRetention != null
                ? builder.completedRetention : Duration.ofSeconds(100);
        this.failedRetention = builder.failedRetention != null
                ? builder.failedRetention : Duration.ofSeconds(500);
        this.batchSize = builder.batchSize;
        this.intervalSeconds = builder.intervalSeconds;
    }

    public static Builder builder() {
        return new Builder();
    }

    /**
     * Starts the purge schedule. Subsequent calls are no-ops.
     */
    public synchronized void start() {
        if (closed) {
            throw new IllegalStateException("JobPurgeScheduler has been closed");
        }
        if (purgeTask != null) {
            return;
        }
        scheduler = Executors.newSingleThreadScheduledExecutor(new DaemonThreadFactory("queueflow-purge-"));
        purgeTask = scheduler.scheduleWithFixedDelay(
                this::runOnce, intervalSeconds, intervalSeconds, TimeUnit.SECONDS);
    }

    /**
     * Runs one purge cycle over all queues. May be called directly.
     *
     * @return total number of jobs deleted
     */
    public int runOnce() {
        if (closed) {
            return 0;
        }
        int total = 0;
        Instant now = Instant.now();
        for (String queue : queues.get()) {
            try {
                total += purge(queue, JobState.COMPLETED, now.minus(completedRetention));
                total += purge(queue, JobState.FAILED, now.minus(failedRetention));
            } catch (Throwable t) {
                logger.log(Level.SEVERE, "Purge cycle failed for queue " + queue, t);
            }
        }
        if (total > 0) {
            logger.log(Level.FINE, "Purged {0} finished jobs", total);
        }
        return total;
    }

    private int purge(String queue, JobState state, Instant cutoff) {
        int total = 0;
        int deleted;
        do {
            deleted = connectionProvider.get().purge(queue, state, cutoff, batchSize);
            total += deleted;
        } while (deleted >= batchSize);
        return total;
    }

    /** Cancels the schedule and shuts down the purge thread. */
    @Override
    public synchronized void close() {
        closed = true;
        if (purgeTask != null) {
            purgeTask.cancel(false);
            purgeTask = null;
        }
        if (scheduler != null) {
            scheduler.shutdownNow();
            try {
                scheduler.awaitTermination(5, TimeUnit.SECONDS);
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
            }
        }
    }

    /** Builder for {@link JobPurgeScheduler}. */
    public static final class Builder {
        private ConnectionProvider connectionProvider;
        private Supplier<? extends Collection<String>> queues;
        private Duration completedRetention;
        private Duration failedRetention;
        private int batchSize = 500;
        private long intervalSeconds = 60;

        private Builder() {
        }

        /** <b>Required.</b> */
        public Builder connectionProvider(ConnectionProvider connectionProvider) {
            this.connectionProvider = connectionProvider;
            return this;
        }

        /**
         * Sets the source of queue names to purge, read at every cycle.
         *
         * <p><b>Required.</b>
         */
        public Builder queues(Supplier<? extends Collection<String>> queues) {
            this.queues = queues;
            return this;
        }

        /** Optional. Defaults to 100 seconds. */
        public Builder completedRetention(Duration completedRetention) {
            this.completedRetention = completedRetention;
            return this;
        }

        /** Optional. Defaults to 500 seconds. */
        public Builder failedRetention(Duration failedRetention) {
            this.failedRetention = failedRetention;
            return this;
        }

        /** Optional. Defaults to {@code 500}. Must be &gt; 0. */
        public Builder batchSize(int batchSize) {
            this.batchSize = batchSize;
            return this;
        }

        /** Optional. Defaults to {@code 60}. Must be &gt; 0. */
        public Builder intervalSeconds(long intervalSeconds) {
            this.intervalSeconds = intervalSeconds;
            return this;
        }

        public JobPurgeScheduler build() {
            return new JobPurgeScheduler(this);
        }
    }
}
