package io.queueflow;

/**
 * Task logic invoked once per delivered job.
 *
 * <p>Handlers run on consumer worker threads. Delivery is at-least-once, so a
 * handler may see the same payload more than once; use the job id for
 * deduplication where it matters.
 *
 * @param <T> the payload type
 */
@FunctionalInterface
public interface TaskHandler<T> {

    /**
     * Processes one job payload.
     *
     * @param payload the decoded payload ({@code null} for {@link Void} tasks)
     * @throws Exception if processing fails; the job is marked failed and the
     *                   broker applies the job's retry policy
     */
    void run(T payload) throws Exception;
}
