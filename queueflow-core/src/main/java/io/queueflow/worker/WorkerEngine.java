package io.queueflow.worker;

import io.queueflow.purge.JobPurgeScheduler;
import io.queueflow.registry.DefaultTaskRegistry;
import io.queueflow.registry.TaskDefinition;
import io.queueflow.registry.TaskRegistry;
import io.queueflow.spi.ConnectionProvider;
import io.queueflow.spi.MetricsExporter;
import io.queueflow.spi.PayloadCodec;
import io.queueflow.util.DaemonThreadFactory;

import java.time.Duration;
import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Owns the task registry and one {@link QueueConsumer} per queue.
 *
 * <p>The engine is {@code idle} until {@link #start()}, which opens the shared
 * connection and creates a consumer for every queue that has a registered task.
 * Tasks registered while started get a consumer for their queue immediately if
 * none exists. {@link #stop()} closes all consumers, releases the connection and
 * returns to {@code idle}; the engine may be started again afterwards.
 * {@link #close()} is terminal.
 *
 * <p>Registry mutation and consumer creation are guarded by one lock, so at most one
 * consumer exists per queue no matter how many threads start the engine.
 */
public final class WorkerEngine implements AutoCloseable {
    private static final Logger logger = Logger.getLogger(WorkerEngine.class.getName());

    private final DefaultTaskRegistry registry;
    private final ConnectionProvider connectionProvider;
    private final MetricsExporter metrics;
    private final JobDispatcher dispatcher;
    private final int defaultConcurrency;
    private final long pollIntervalMs;
    private final long drainTimeoutMs;
    private final Duration completedRetention;
    private final Duration failedRetention;
    private final long purgeIntervalSeconds;

    private final Object lock = new Object();
    private final Map<String, QueueConsumer> consumers = new ConcurrentHashMap<>();
    private final ExecutorService lifecycle;
    private JobPurgeScheduler purgeScheduler;
    private volatile boolean started;
    private volatile boolean closed;

    private WorkerEngine(Builder builder) {
        this.registry = builder.registry != null ? builder.registry : new DefaultTaskRegistry();
        this.connectionProvider = Objects.requireNonNull(builder.connectionProvider, "connectionProvider");
        PayloadCodec codec = builder.payloadCodec != null ? builder.payloadCodec : PayloadCodec.getDefault();
        this.metrics = builder.metrics != null ? builder.metrics : MetricsExporter.NOOP;
        if (builder.defaultConcurrency < 1) {
            throw new IllegalArgumentException("defaultConcurrency must be >= 1");
        }
        if (builder.pollIntervalMs <= 0) {
            throw new IllegalArgumentException("pollIntervalMs must be > 0");
        }
        if (builder.drainTimeoutMs < 0) {
            throw new IllegalArgumentException("drainTimeoutMs must be >= 0");
        }
        if (builder.purgeIntervalSeconds <= 0) {
            throw new IllegalArgumentException("purgeIntervalSeconds must be > 0");
        }
        this.defaultConcurrency = builder.defaultConcurrency;
        this.pollIntervalMs = builder.pollIntervalMs;
        this.drainTimeoutMs = builder.drainTimeoutMs;
        this.completedRetention = builder.completedRetention;
        this.failedRetention = builder.failedRetention;
        this.purgeIntervalSeconds = builder.purgeIntervalSeconds;
        this.dispatcher = new JobDispatcher(registry, connectionProvider, codec, metrics);
        this.lifecycle = Executors.newSingleThreadExecutor(new DaemonThreadFactory("queueflow-lifecycle-"));
    }

    public static Builder builder() {
        return new Builder();
    }

    public TaskRegistry registry() {
        return registry;
    }

    public ConnectionProvider connectionProvider() {
        return connectionProvider;
    }

    public MetricsExporter metrics() {
        return metrics;
    }

    public boolean isStarted() {
        return started;
    }

    /** Queues that currently have a live consumer. */
    public Set<String> activeQueues() {
        return Collections.unmodifiableSet(new LinkedHashSet<>(consumers.keySet()));
    }

    /**
     * Adds or replaces a task definition. If the engine is started and the task's
     * queue has no consumer yet, one is created and started.
     */
    public void registerTask(TaskDefinition<?> definition) {
        synchronized (lock) {
            TaskDefinition<?> previous = registry.register(definition);
            if (previous != null) {
                logger.log(Level.FINE, "Task {0} re-registered on queue {1}",
                        new Object[]{definition.id(), definition.queue()});
            } else {
                logger.log(Level.FINE, "Task {0} registered on queue {1}",
                        new Object[]{definition.id(), definition.queue()});
            }
            if (started && !consumers.containsKey(definition.queue())) {
                startConsumer(definition.queue());
            }
        }
    }

    /**
     * Starts consuming every queue with a registered task. Returns immediately if
     * already started.
     *
     * @throws io.queueflow.ConfigurationException if no connection is configured
     * @throws io.queueflow.BrokerException         if the broker cannot be reached
     */
    public void start() {
        synchronized (lock) {
            if (closed) {
                throw new IllegalStateException("WorkerEngine has been closed");
            }
            if (started) {
                return;
            }
            connectionProvider.get();
            for (String queue : registry.queues()) {
                startConsumer(queue);
            }
            purgeScheduler = JobPurgeScheduler.builder()
                    .connectionProvider(connectionProvider)
                    .queues(this::activeQueues)
                    .completedRetention(completedRetention)
                    .failedRetention(failedRetention)
                    .intervalSeconds(purgeIntervalSeconds)
                    .build();
            purgeScheduler.start();
            started = true;
            logger.log(Level.INFO, "Worker started, serving queues {0}", consumers.keySet());
        }
    }

    /**
     * Starts the engine on a background thread without waiting. Failures are logged.
     */
    public void startAsync() {
        if (started || closed) {
            return;
        }
        try {
            lifecycle.execute(() -> {
                try {
                    start();
                } catch (RuntimeException e) {
                    logger.log(Level.SEVERE, "Failed to start worker", e);
                }
            });
        } catch (RejectedExecutionException e) {
            logger.log(Level.FINE, "Worker closing, start request ignored");
        }
    }

    private void startConsumer(String queue) {
        QueueConsumer consumer = QueueConsumer.builder()
                .queue(queue)
                .concurrency(registry.concurrencyFor(queue, defaultConcurrency))
                .connectionProvider(connectionProvider)
                .dispatcher(dispatcher)
                .metrics(metrics)
                .pollIntervalMs(pollIntervalMs)
                .drainTimeoutMs(drainTimeoutMs)
                .build();
        consumers.put(queue, consumer);
        consumer.start();
        logger.log(Level.FINE, "Consumer created for queue {0} with concurrency {1}",
                new Object[]{queue, consumer.concurrency()});
    }

    /**
     * Closes every consumer, waiting for running handlers up to the drain timeout,
     * and releases the shared connection. No-op if not started.
     *
     * <p>Consumers are detached under the lock and drained outside it, so running
     * handlers may still register tasks while the engine stops.
     */
    public void stop() {
        JobPurgeScheduler purge;
        List<QueueConsumer> live;
        synchronized (lock) {
            if (!started) {
                return;
            }
            started = false;
            purge = purgeScheduler;
            purgeScheduler = null;
            live = new ArrayList<>(consumers.values());
            consumers.clear();
        }
        if (purge != null) {
            purge.close();
        }
        for (QueueConsumer consumer : live) {
            consumer.close();
        }
        synchronized (lock) {
            // a start() during the drain owns the connection now
            if (!started) {
                connectionProvider.reset();
            }
        }
        logger.log(Level.INFO, "Worker stopped");
    }

    /** Stops the engine and releases its lifecycle thread. The engine cannot be restarted. */
    @Override
    public void close() {
        stop();
        synchronized (lock) {
            closed = true;
        }
        lifecycle.shutdown();
        try {
            if (!lifecycle.awaitTermination(5, TimeUnit.SECONDS)) {
                lifecycle.shutdownNow();
            }
        } catch (InterruptedException e) {
            lifecycle.shutdownNow();
            Thread.currentThread().interrupt();
        }
    }

    /** Builder for {@link WorkerEngine}. */
    public static final class Builder {
        private DefaultTaskRegistry registry;
        private ConnectionProvider connectionProvider;
        private PayloadCodec payloadCodec;
        private MetricsExporter metrics;
        private int defaultConcurrency = 5;
        private long pollIntervalMs = 1000;
        private long drainTimeoutMs = 5000;
        private Duration completedRetention = Duration.ofSeconds(100);
        private Duration failedRetention = Duration.ofSeconds(500);
        private long purgeIntervalSeconds = 60;

        private Builder() {
        }

        /** Optional. Defaults to an empty {@link DefaultTaskRegistry}. */
        public Builder registry(DefaultTaskRegistry registry) {
            this.registry = registry;
            return this;
        }

        /** <b>Required.</b> */
        public Builder connectionProvider(ConnectionProvider connectionProvider) {
            this.connectionProvider = connectionProvider;
            return this;
        }

        /** Optional. Defaults to {@link PayloadCodec#getDefault()}. */
        public Builder payloadCodec(PayloadCodec payloadCodec) {
            this.payloadCodec = payloadCodec;
            return this;
        }

        /** Optional. Defaults to {@link MetricsExporter#NOOP}. */
        public Builder metrics(MetricsExporter metrics) {
            this.metrics = metrics;
            return this;
        }

        /**
         * Sets the concurrency of consumers whose queue has no task with an explicit limit.
         *
         * <p>Optional. Defaults to {@code 5}.
         */
        public Builder defaultConcurrency(int defaultConcurrency) {
            this.defaultConcurrency = defaultConcurrency;
            return this;
        }

        /** Optional. Defaults to {@code 1000} ms. */
        public Builder pollIntervalMs(long pollIntervalMs) {
            this.pollIntervalMs = pollIntervalMs;
            return this;
        }

        /** Optional. Defaults to {@code 5000} ms. */
        public Builder drainTimeoutMs(long drainTimeoutMs) {
            this.drainTimeoutMs = drainTimeoutMs;
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

        /** Optional. Defaults to {@code 60}. */
        public Builder purgeIntervalSeconds(long purgeIntervalSeconds) {
            this.purgeIntervalSeconds = purgeIntervalSeconds;
            return this;
        }

        public WorkerEngine build() {
            return new WorkerEngine(this);
        }
    }
}
