package io.queueflow.registry;

import java.util.Set;

/**
 * Read view of the task registry used by the dispatch loop.
 *
 * @see DefaultTaskRegistry
 */
public interface TaskRegistry {

    /**
     * Returns the definition registered under a task id.
     *
     * @param taskId the task id (the job name on delivery)
     * @return the definition, or {@code null} if none is registered
     */
    TaskDefinition<?> find(String taskId);

    /**
     * Returns the distinct queue names across all registered definitions.
     */
    Set<String> queues();

    /**
     * Returns the concurrency limit for a queue's consumer: the largest limit set by
     * any task on that queue, or {@code defaultConcurrency} if none sets one.
     */
    int concurrencyFor(String queue, int defaultConcurrency);
}
