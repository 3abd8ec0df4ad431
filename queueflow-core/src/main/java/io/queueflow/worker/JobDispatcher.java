package io.queueflow.worker;

import io.queueflow.model.Job;
import io.queueflow.model.JobState;
import io.queueflow.registry.TaskDefinition;
import io.queueflow.registry.TaskRegistry;
import io.queueflow.spi.ConnectionProvider;
import io.queueflow.spi.MetricsExporter;
import io.queueflow.spi.PayloadCodec;

import java.util.Objects;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Routes a delivered job to the handler registered under its name and reports the
 * outcome to the broker.
 *
 * <ul>
 *   <li>No handler registered: the job is marked failed and logged at SEVERE.</li>
 *   <li>Handler returns: the job is marked completed.</li>
 *   <li>Handler throws anything (or the payload cannot be decoded): the job is marked
 *       failed, then the task's error handler, if any, is invoked with the error and
 *       payload. An {@link Error} reaches the error handler wrapped in an
 *       {@link ExecutionException}. A failure inside the error handler is only logged.</li>
 * </ul>
 *
 * <p>Nothing thrown while processing one job escapes {@link #dispatch(Job)}, except a
 * {@link VirtualMachineError}, which is rethrown after the job has been marked failed.
 */
public final class JobDispatcher {
    private static final Logger logger = Logger.getLogger(JobDispatcher.class.getName());
    private static final int MAX_ERROR_LENGTH = 4000;

    private final TaskRegistry registry;
    private final ConnectionProvider connectionProvider;
    private final PayloadCodec payloadCodec;
    private final MetricsExporter metrics;

    public JobDispatcher(TaskRegistry registry, ConnectionProvider connectionProvider,
            PayloadCodec payloadCodec, MetricsExporter metrics) {
        this.registry = Objects.requireNonNull(registry, "registry");
        this.connectionProvider = Objects.requireNonNull(connectionProvider, "connectionProvider");
        this.payloadCodec = Objects.requireNonNull(payloadCodec, "payloadCodec");
        this.metrics = Objects.requireNonNull(metrics, "metrics");
    }

    /**
     * Processes one claimed job to completion or failure.
     *
     * @param job the claimed job
     */
    public void dispatch(Job job) {
        TaskDefinition<?> definition = registry.find(job.name());
        if (definition == null) {
            UnroutableJobException failure = new UnroutableJobException("No handler for task: " + job.name());
            logger.log(Level.SEVERE, "Unroutable job " + job.id() + " on queue " + job.queue(), failure);
            metrics.incrementJobUnroutable(job.queue());
            markFailed(job, failure);
            return;
        }
        invoke(definition, job);
    }

    private <T> void invoke(TaskDefinition<T> definition, Job job) {
        T payload = null;
        long start = System.nanoTime();
        try {
            payload = payloadCodec.decode(job.payloadJson(), definition.payloadType());
            definition.handler().run(payload);
        } catch (Throwable t) {
            metrics.recordHandlerDurationMs(job.queue(), elapsedMs(start));
            logger.log(Level.WARNING, "Job " + job.id() + " of task " + job.name()
                    + " failed on attempt " + job.attemptNumber() + "/" + job.maxAttempts(), t);
            markFailed(job, t);
            // error handlers receive Errors wrapped, with the Error as cause
            notifyErrorHandler(definition, job, t instanceof Exception e ? e : new ExecutionException(t), payload);
            if (t instanceof VirtualMachineError vmError) {
                throw vmError;
            }
            return;
        }
        metrics.recordHandlerDurationMs(job.queue(), elapsedMs(start));
        markCompleted(job);
    }

    private <T> void notifyErrorHandler(TaskDefinition<T> definition, Job job, Exception error, T payload) {
        if (definition.errorHandler() == null) {
            return;
        }
        try {
            definition.errorHandler().onError(error, payload);
        } catch (Throwable handlerError) {
            metrics.incrementErrorHandlerFailure(job.queue());
            logger.log(Level.WARNING, "Error in onError handler for " + job.name(), handlerError);
            if (handlerError instanceof VirtualMachineError vmError) {
                throw vmError;
            }
        }
    }

    private void markCompleted(Job job) {
        try {
            connectionProvider.get().complete(job);
            metrics.incrementJobCompleted(job.queue());
        } catch (RuntimeException e) {
            // the job stays active and is redelivered once its lock expires
            logger.log(Level.SEVERE, "Failed to mark job " + job.id() + " completed", e);
        }
    }

    private void markFailed(Job job, Throwable failure) {
        metrics.incrementJobFailed(job.queue());
        try {
            JobState state = connectionProvider.get().fail(job, describe(failure));
            if (state == JobState.DELAYED) {
                logger.log(Level.FINE, "Job {0} scheduled for retry", job.id());
            }
        } catch (RuntimeException e) {
            logger.log(Level.SEVERE, "Failed to mark job " + job.id() + " failed", e);
        }
    }

    private static String describe(Throwable failure) {
        String message = failure.getMessage();
        String error = message == null ? failure.getClass().getName() : message;
        if (error.length() <= MAX_ERROR_LENGTH) {
            return error;
        }
        return error.substring(0, MAX_ERROR_LENGTH - 3) + "...";
    }

    private static long elapsedMs(long startNanos) {
        return Math.max(0L, TimeUnit.NANOSECONDS.toMillis(System.nanoTime() - startNanos));
    }
}
