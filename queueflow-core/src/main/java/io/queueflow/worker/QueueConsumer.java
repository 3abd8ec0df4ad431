package io.queueflow.worker;

import io.queueflow.ConfigurationException;
import io.queueflow.model.Job;
import io.queueflow.spi.ConnectionProvider;
import io.queueflow.spi.MetricsExporter;
import io.queueflow.util.DaemonThreadFactory;
import io.queueflow.util.JobIds;

import java.util.List;
import java.util.Objects;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.Semaphore;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Pull loop serving one queue with a bounded number of concurrent handler invocations.
 *
 * <p>A single poller thread claims as many jobs as there are free slots and hands
 * each to a fixed pool of {@code concurrency} worker threads. When nothing is due
 * the poller sleeps for the poll interval. Broker errors are logged and the loop
 * backs off; they never terminate the consumer.
 *
 * <p>Create instances via {@link #builder()}. {@link #start()} and {@link #close()}
 * are synchronized.
 */
public final class QueueConsumer implements AutoCloseable {
    private static final Logger logger = Logger.getLogger(QueueConsumer.class.getName());

    private final String queue;
    private final String consumerId;
    private final int concurrency;
    private final ConnectionProvider connectionProvider;
    private final JobDispatcher dispatcher;
    private final MetricsExporter metrics;
    private final long pollIntervalMs;
    private final long errorBackoffMs;
    private final long drainTimeoutMs;

    private final Semaphore slots;
    private final AtomicInteger active = new AtomicInteger();
    private ExecutorService poller;
    private ExecutorService workers;
    private volatile boolean running;
    private volatile boolean closed;

    private QueueConsumer(Builder builder) {
        this.queue = Objects.requireNonNull(builder.queue, "queue");
        this.connectionProvider = Objects.requireNonNull(builder.connectionProvider, "connectionProvider");
        this.dispatcher = Objects.requireNonNull(builder.dispatcher, "dispatcher");
        if (builder.concurrency < 1) {
            throw new IllegalArgumentException("concurrency must be >= 1");
        }
        if (builder.pollIntervalMs <= 0) {
            throw new IllegalArgumentException("pollIntervalMs must be > 0");
        }
        if (builder.drainTimeoutMs < 0) {
            throw new IllegalArgumentException("drainTimeoutMs must be >= 0");
        }
        this.concurrency = builder.concurrency;
        this.pollIntervalMs = builder.pollIntervalMs;
        this.errorBackoffMs = Math.max(builder.pollIntervalMs, 1000L);
        this.drainTimeoutMs = builder.drainTimeoutMs;
        this.metrics = builder.metrics != null ? builder.metrics : MetricsExporter.NOOP;
        this.consumerId = JobIds.consumer(queue);
        this.slots = new Semaphore(concurrency);
    }

    public static Builder builder() {
        return new Builder();
    }

    public String queue() {
        return queue;
    }

    public String consumerId() {
        return consumerId;
    }

    public int concurrency() {
        return concurrency;
    }

    /** Number of handler invocations currently running. */
    public int activeCount() {
        return active.get();
    }

    public boolean isRunning() {
        return running;
    }

    /**
     * Starts the poller and worker threads. Subsequent calls are no-ops.
     */
    public synchronized void start() {
        if (closed) {
            throw new IllegalStateException("QueueConsumer for queue " + queue + " has been closed");
        }
        if (running) {
            return;
        }
        running = true;
        workers = Executors.newFixedThreadPool(concurrency,
                new DaemonThreadFactory("queueflow-" + queue + "-worker-"));
        poller = Executors.newSingleThreadExecutor(
                new DaemonThreadFactory("queueflow-" + queue + "-poller-"));
        poller.execute(this::pollLoop);
        logger.log(Level.FINE, "Consumer {0} started with concurrency {1}",
                new Object[]{consumerId, concurrency});
    }

    private void pollLoop() {
        while (running && !Thread.currentThread().isInterrupted()) {
            try {
                slots.acquire();
                int free = 1 + slots.drainPermits();
                List<Job> jobs;
                try {
                    jobs = connectionProvider.get().claim(queue, consumerId, free);
                } catch (RuntimeException e) {
                    slots.release(free);
                    throw e;
                }
                if (jobs.size() < free) {
                    slots.release(free - jobs.size());
                }
                for (Job job : jobs) {
                    submit(job);
                }
                if (jobs.isEmpty()) {
                    TimeUnit.MILLISECONDS.sleep(pollIntervalMs);
                }
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
            } catch (ConfigurationException e) {
                logger.log(Level.SEVERE, "Consumer for queue " + queue + " has no broker connection", e);
                pause(errorBackoffMs);
            } catch (Throwable t) {
                logger.log(Level.WARNING, "Failed to fetch jobs for queue " + queue, t);
                pause(errorBackoffMs);
            }
        }
    }

    private void submit(Job job) {
        try {
            workers.execute(() -> process(job));
        } catch (RejectedExecutionException e) {
            // closing; the job stays active and is reclaimed once its lock expires
            slots.release();
            logger.log(Level.FINE, "Consumer closing, job {0} left for redelivery", job.id());
        }
    }

    private void process(Job job) {
        metrics.recordActiveJobs(queue, active.incrementAndGet());
        try {
            dispatcher.dispatch(job);
        } catch (Throwable t) {
            logger.log(Level.SEVERE, "Dispatch error for job " + job.id(), t);
        } finally {
            metrics.recordActiveJobs(queue, active.decrementAndGet());
            slots.release();
        }
    }

    private void pause(long millis) {
        try {
            TimeUnit.MILLISECONDS.sleep(millis);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
        }
    }

    /**
     * Stops claiming jobs and waits up to the drain timeout for running handlers to
     * finish. Handlers still running after that are interrupted.
     */
    @Override
    public synchronized void close() {
        closed = true;
        if (!running) {
            return;
        }
        running = false;
        poller.shutdownNow();
        workers.shutdown();
        try {
            poller.awaitTermination(5, TimeUnit.SECONDS);
            if (!workers.awaitTermination(drainTimeoutMs, TimeUnit.MILLISECONDS)) {
                logger.log(Level.WARNING, "Drain timeout exceeded for queue " + queue
                        + "; interrupting " + active.get() + " running handler(s)");
                workers.shutdownNow();
                workers.awaitTermination(5, TimeUnit.SECONDS);
            }
        } catch (InterruptedException e) {
            workers.shutdownNow();
            Thread.currentThread().interrupt();
        }
    }

    /** Builder for {@link QueueConsumer}. */
    public static final class Builder {
        private String queue;
        private int concurrency = 5;
        private ConnectionProvider connectionProvider;
        private JobDispatcher dispatcher;
        private MetricsExporter metrics;
        private long pollIntervalMs = 1000;
        private long drainTimeoutMs = 5000;

        private Builder() {
        }

        /**
         * Sets the queue to consume.
         *
         * <p><b>Required.</b>
         */
        public Builder queue(String queue) {
            this.queue = queue;
            return this;
        }

        /**
         * Sets the maximum number of concurrent handler invocations.
         *
         * <p>Optional. Defaults to {@code 5}. Must be &ge; 1.
         */
        public Builder concurrency(int concurrency) {
            this.concurrency = concurrency;
            return this;
        }

        /**
         * Sets the provider of the shared broker connection.
         *
         * <p><b>Required.</b>
         */
        public Builder connectionProvider(ConnectionProvider connectionProvider) {
            this.connectionProvider = connectionProvider;
            return this;
        }

        /**
         * Sets the dispatcher that runs claimed jobs.
         *
         * <p><b>Required.</b>
         */
        public Builder dispatcher(JobDispatcher dispatcher) {
            this.dispatcher = dispatcher;
            return this;
        }

        /**
         * Sets the metrics exporter.
         *
         * <p>Optional. Defaults to {@link MetricsExporter#NOOP}.
         */
        public Builder metrics(MetricsExporter metrics) {
            this.metrics = metrics;
            return this;
        }

        /**
         * Sets how long the poller sleeps when no job is due.
         *
         * <p>Optional. Defaults to {@code 1000} ms. Must be &gt; 0.
         */
        public Builder pollIntervalMs(long pollIntervalMs) {
            this.pollIntervalMs = pollIntervalMs;
            return this;
        }

        /**
         * Sets how long {@link QueueConsumer#close()} waits for running handlers.
         *
         * <p>Optional. Defaults to {@code 5000} ms. Must be &ge; 0.
         */
        public Builder drainTimeoutMs(long drainTimeoutMs) {
            this.drainTimeoutMs = drainTimeoutMs;
            return this;
        }

        /**
         * Builds the consumer. Call {@link QueueConsumer#start()} to begin consuming.
         *
         * @throws NullPointerException     if {@code queue}, {@code connectionProvider}
         *                                  or {@code dispatcher} is null
         * @throws IllegalArgumentException if a numeric setting is out of range
         */
        public QueueConsumer build() {
            return new QueueConsumer(this);
        }
    }
}
