package io.queueflow;

import io.queueflow.connection.LazyConnectionProvider;
import io.queueflow.model.RecurringJob;
import io.queueflow.model.RecurringJobRequest;
import io.queueflow.producer.QueueProducer;
import io.queueflow.registry.TaskDefinition;
import io.queueflow.registry.TaskRegistry;
import io.queueflow.schedule.ScheduleReconciler;
import io.queueflow.spi.ConnectionFactory;
import io.queueflow.spi.ConnectionProvider;
import io.queueflow.spi.MetricsExporter;
import io.queueflow.spi.PayloadCodec;
import io.queueflow.util.QueueNames;
import io.queueflow.worker.WorkerEngine;

import java.time.Duration;
import java.util.Map;
import java.util.Objects;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Entry point for declaring tasks and running the worker that executes them.
 *
 * <p>One instance owns a task registry, a {@link WorkerEngine} and the shared
 * broker connection. Its lifetime belongs to the host application: build it once
 * at startup, share it, and {@link #close()} it on shutdown. Several isolated
 * instances may coexist in one process.
 *
 * <pre>{@code
 * QueueFlow queueFlow = QueueFlow.builder()
 *     .connectionFactory(new JdbcConnectionFactory(dataSource))
 *     .build();
 *
 * Task<Welcome> welcome = queueFlow.defineTask(
 *     TaskConfig.builder("email.welcome", Welcome.class)
 *         .run(payload -> mailer.sendWelcome(payload.userId()))
 *         .build());
 *
 * welcome.trigger(new Welcome("1"));
 * }</pre>
 *
 * <p>Declaring tasks never touches the broker. The worker starts on the first
 * trigger or schedule installation, or eagerly via {@link #startWorker()}.
 */
public final class QueueFlow implements AutoCloseable {

    private final String defaultQueue;
    private final ConnectionProvider connectionProvider;
    private final PayloadCodec payloadCodec;
    private final MetricsExporter metrics;
    private final WorkerEngine worker;
    private final ScheduleReconciler reconciler;
    private final Map<String, QueueProducer> producers = new ConcurrentHashMap<>();

    private QueueFlow(Builder builder) {
        if (builder.connectionProvider != null && builder.connectionFactory != null) {
            throw new IllegalArgumentException("Set either connectionProvider or connectionFactory, not both");
        }
        if (builder.connectionProvider != null) {
            this.connectionProvider = builder.connectionProvider;
        } else if (builder.connectionFactory != null) {
            this.connectionProvider = new LazyConnectionProvider(builder.connectionFactory);
        } else {
            this.connectionProvider = ConnectionProvider.unconfigured();
        }
        this.defaultQueue = builder.defaultQueue == null || builder.defaultQueue.isBlank()
                ? QueueNames.DEFAULT_QUEUE : builder.defaultQueue;
        this.payloadCodec = builder.payloadCodec != null ? builder.payloadCodec : PayloadCodec.getDefault();
        this.metrics = builder.metrics != null ? builder.metrics : MetricsExporter.NOOP;
        this.worker = WorkerEngine.builder()
                .connectionProvider(connectionProvider)
                .payloadCodec(payloadCodec)
                .metrics(metrics)
                .defaultConcurrency(builder.defaultConcurrency)
                .pollIntervalMs(builder.pollIntervalMs)
                .drainTimeoutMs(builder.drainTimeoutMs)
                .completedRetention(builder.completedRetention)
                .failedRetention(builder.failedRetention)
                .purgeIntervalSeconds(builder.purgeIntervalSeconds)
                .build();
        this.reconciler = new ScheduleReconciler(worker, metrics);
    }

    public static Builder builder() {
        return new Builder();
    }

    /**
     * Registers a one-shot task. Pure in-memory; redeclaring an id replaces the
     * previous registration.
     */
    public <T> Task<T> defineTask(TaskConfig<T> config) {
        Objects.requireNonNull(config, "config");
        TaskDefinition<T> definition = new TaskDefinition<>(
                config.id(),
                QueueNames.resolve(config.queue(), config.id(), defaultQueue),
                config.payloadType(),
                config.handler(),
                config.errorHandler(),
                config.concurrency());
        worker.registerTask(definition);
        return new Task<>(definition, this);
    }

    /**
     * Registers a recurring task and installs its schedule in the background,
     * replacing any registration previously installed under the same id.
     *
     * @return a handle whose {@link ScheduledTask#installation()} reports the outcome
     */
    public <T> ScheduledTask<T> scheduleTask(ScheduledTaskConfig<T> config) {
        Objects.requireNonNull(config, "config");
        TaskDefinition<T> definition = new TaskDefinition<>(
                config.id(),
                QueueNames.resolve(config.queue(), config.id(), defaultQueue),
                config.payloadType(),
                config.handler(),
                config.errorHandler(),
                config.concurrency());
        definition.checkPayload(config.payload());
        worker.registerTask(definition);
        String payloadJson = config.payload() == null ? "{}" : payloadCodec.encode(config.payload());
        RecurringJobRequest request = new RecurringJobRequest(
                config.id(), config.id(), config.cron(), config.tz(), payloadJson);
        CompletableFuture<RecurringJob> installation = reconciler.installAsync(definition.queue(), request);
        return new ScheduledTask<>(definition, config.cron(), config.tz(), installation);
    }

    /**
     * Starts the worker now instead of on first use. No-op if already started.
     *
     * @throws ConfigurationException if no broker connection is configured
     * @throws BrokerException        if the broker cannot be reached
     */
    public void startWorker() {
        worker.start();
    }

    /**
     * Stops the worker, waiting for running handlers up to the drain timeout. The
     * worker starts again on the next trigger or {@link #startWorker()}.
     */
    public void stopWorker() {
        worker.stop();
    }

    public TaskRegistry registry() {
        return worker.registry();
    }

    public WorkerEngine worker() {
        return worker;
    }

    public String defaultQueue() {
        return defaultQueue;
    }

    PayloadCodec payloadCodec() {
        return payloadCodec;
    }

    QueueProducer producer(String queue) {
        return producers.computeIfAbsent(queue, q -> new QueueProducer(q, connectionProvider, metrics));
    }

    /** Stops the worker and releases all threads. The instance cannot be used afterwards. */
    @Override
    public void close() {
        reconciler.close();
        worker.close();
    }

    /** Builder for {@link QueueFlow}. */
    public static final class Builder {
        private ConnectionProvider connectionProvider;
        private ConnectionFactory connectionFactory;
        private String defaultQueue = QueueNames.DEFAULT_QUEUE;
        private int defaultConcurrency = 5;
        private long pollIntervalMs = 1000;
        private long drainTimeoutMs = 5000;
        private Duration completedRetention = Duration.ofSeconds(100);
        private Duration failedRetention = Duration.ofSeconds(500);
        private long purgeIntervalSeconds = 60;
        private PayloadCodec payloadCodec;
        private MetricsExporter metrics;

        private Builder() {
        }

        /**
         * Sets the provider of the shared broker connection.
         *
         * <p>Optional. Without a provider or factory every broker call fails with
         * {@link ConfigurationException}.
         */
        public Builder connectionProvider(ConnectionProvider connectionProvider) {
            this.connectionProvider = connectionProvider;
            return this;
        }

        /**
         * Sets a factory for the shared connection, opened lazily on first use.
         */
        public Builder connectionFactory(ConnectionFactory connectionFactory) {
            this.connectionFactory = connectionFactory;
            return this;
        }

        /** Optional. Defaults to {@code "default"}. */
        public Builder defaultQueue(String defaultQueue) {
            this.defaultQueue = defaultQueue;
            return this;
        }

        /** Optional. Defaults to {@code 5}. Must be &ge; 1. */
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

        public QueueFlow build() {
            return new QueueFlow(this);
        }
    }
}
