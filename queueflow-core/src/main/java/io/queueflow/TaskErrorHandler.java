package io.queueflow;

/**
 * Callback invoked after a job of the task has been marked failed.
 *
 * <p>Exceptions thrown from here are logged and otherwise ignored; they never
 * replace the original job failure.
 *
 * @param <T> the payload type
 */
@FunctionalInterface
public interface TaskErrorHandler<T> {

    /**
     * @param error   the failure raised by the task handler (or payload decoding)
     * @param payload the original payload, or {@code null} if it could not be decoded
     * @throws Exception ignored apart from being logged
     */
    void onError(Exception error, T payload) throws Exception;
}
