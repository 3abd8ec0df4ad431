package io.queueflow.schedule;

import io.queueflow.model.RecurringJob;
import io.queueflow.model.RecurringJobRequest;
import io.queueflow.spi.BrokerConnection;
import io.queueflow.spi.MetricsExporter;
import io.queueflow.util.DaemonThreadFactory;
import io.queueflow.worker.WorkerEngine;

import java.util.Objects;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Installs the recurring registration of a scheduled task so that exactly one
 * registration exists for the task id in its queue.
 *
 * <p>Each installation starts the worker, removes every registration whose id or
 * name equals the task id, then adds one using the task id as both name and job id.
 * Installations run one at a time on a dedicated thread.
 */
public final class ScheduleReconciler implements AutoCloseable {
    private static final Logger logger = Logger.getLogger(ScheduleReconciler.class.getName());

    private final WorkerEngine engine;
    private final MetricsExporter metrics;
    private final ExecutorService executor;

    public ScheduleReconciler(WorkerEngine engine, MetricsExporter metrics) {
        this.engine = Objects.requireNonNull(engine, "engine");
        this.metrics = Objects.requireNonNull(metrics, "metrics");
        this.executor = Executors.newSingleThreadExecutor(new DaemonThreadFactory("queueflow-scheduler-"));
    }

    /**
     * Queues an installation and returns without waiting.
     *
     * @return completes with the installed registration, or exceptionally with the
     *     failure (which is also logged at SEVERE)
     */
    public CompletableFuture<RecurringJob> installAsync(String queue, RecurringJobRequest request) {
        CompletableFuture<RecurringJob> result = new CompletableFuture<>();
        try {
            executor.execute(() -> {
                try {
                    result.complete(install(queue, request));
                } catch (Throwable t) {
                    result.completeExceptionally(t);
                }
            });
        } catch (RejectedExecutionException e) {
            logger.log(Level.SEVERE, "Cannot schedule " + request.name() + ": reconciler is closed", e);
            result.completeExceptionally(e);
        }
        return result;
    }

    /**
     * Installs a registration on the calling thread.
     *
     * @throws io.queueflow.ConfigurationException if no connection is configured
     * @throws io.queueflow.BrokerException         if a broker round trip fails
     * @throws IllegalArgumentException             if the pattern or time zone is rejected
     */
    public RecurringJob install(String queue, RecurringJobRequest request) {
        String taskId = request.name();
        try {
            engine.start();
            BrokerConnection connection = engine.connectionProvider().get();
            int removed = 0;
            for (RecurringJob existing : connection.listRecurring(queue)) {
                if (existing.belongsTo(taskId) && connection.removeRecurring(queue, existing.key())) {
                    removed++;
                }
            }
            RecurringJob installed = connection.addRecurring(queue, request);
            metrics.incrementScheduleInstalled(queue);
            logger.log(Level.INFO, "Recurring job {0} installed on queue {1} with pattern \"{2}\" (replaced {3})",
                    new Object[]{taskId, queue, request.pattern(), removed});
            return installed;
        } catch (RuntimeException e) {
            metrics.incrementScheduleFailed(queue);
            logger.log(Level.SEVERE, "Failed to install recurring job " + taskId + " on queue " + queue, e);
            throw e;
        }
    }

    @Override
    public void close() {
        executor.shutdown();
        try {
            if (!executor.awaitTermination(5, TimeUnit.SECONDS)) {
                executor.shutdownNow();
            }
        } catch (InterruptedException e) {
            executor.shutdownNow();
            Thread.currentThread().interrupt();
        }
    }
}
