package io.queueflow.spi;

/**
 * Observability hook for exporting job and schedule counters to a metrics backend.
 *
 * <p>Every method takes the queue the event happened on. The {@link #NOOP}
 * instance discards everything.
 */
public interface MetricsExporter {

    /**
     * No-op instance that discards all metrics.
     */
    MetricsExporter NOOP = new Noop();

    /** A job was accepted by the broker. */
    void incrementJobEnqueued(String queue);

    /** A job handler finished successfully. */
    void incrementJobCompleted(String queue);

    /** A job was marked failed (handler error, decode error, or unknown task). */
    void incrementJobFailed(String queue);

    /** A delivered job named a task with no registered handler. */
    void incrementJobUnroutable(String queue);

    /** A task's error handler itself threw. */
    default void incrementErrorHandlerFailure(String queue) {
    }

    /** A recurring schedule was installed. */
    default void incrementScheduleInstalled(String queue) {
    }

    /** A recurring schedule could not be installed. */
    default void incrementScheduleFailed(String queue) {
    }

    /**
     * Records the time spent inside a task handler.
     *
     * @param durationMs handler execution time in milliseconds (non-negative)
     */
    default void recordHandlerDurationMs(String queue, long durationMs) {
    }

    /**
     * Records the number of handler invocations currently running on a queue's consumer.
     */
    default void recordActiveJobs(String queue, int active) {
    }

    /**
     * Default no-op implementation.
     */
    final class Noop implements MetricsExporter {
        @Override
        public void incrementJobEnqueued(String queue) {
        }

        @Override
        public void incrementJobCompleted(String queue) {
        }

        @Override
        public void incrementJobFailed(String queue) {
        }

        @Override
        public void incrementJobUnroutable(String queue) {
        }
    }
}
