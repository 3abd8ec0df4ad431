package io.queueflow.worker;

/**
 * Raised when a delivered job names a task with no registered handler.
 *
 * <p>This usually means a consumer is running ahead of the deploy that declares
 * the task. The job is marked failed; the broker's retry policy still applies.
 */
public final class UnroutableJobException extends Exception {

    public UnroutableJobException(String message) {
        super(message);
    }
}
