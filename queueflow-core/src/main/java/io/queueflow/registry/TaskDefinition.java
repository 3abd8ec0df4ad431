package io.queueflow.registry;

import io.queueflow.PayloadTypeException;
import io.queueflow.TaskErrorHandler;
import io.queueflow.TaskHandler;

import java.util.Objects;

/**
 * Immutable registration of a task: where its jobs are queued and how they are handled.
 *
 * @param id           globally unique task id, also the name of every job of the task
 * @param queue        resolved queue name
 * @param payloadType  declared payload type; payloads are decoded into it on delivery
 * @param handler      task logic
 * @param errorHandler optional callback run after a failed attempt, may be {@code null}
 * @param concurrency  optional concurrency limit for the queue's consumer, may be {@code null}
 * @param <T> the payload type
 */
public record TaskDefinition<T>(
    String id,
    String queue,
    Class<T> payloadType,
    TaskHandler<T> handler,
    TaskErrorHandler<T> errorHandler,
    Integer concurrency
) {

    public TaskDefinition {
        Objects.requireNonNull(id, "id");
        Objects.requireNonNull(queue, "queue");
        Objects.requireNonNull(payloadType, "payloadType");
        Objects.requireNonNull(handler, "handler");
        if (id.isBlank()) {
            throw new IllegalArgumentException("id cannot be blank");
        }
        if (queue.isBlank()) {
            throw new IllegalArgumentException("queue cannot be blank");
        }
        if (concurrency != null && concurrency < 1) {
            throw new IllegalArgumentException("concurrency must be >= 1, got: " + concurrency);
        }
    }

    /**
     * Checks that a payload is acceptable for this task.
     *
     * @throws io.queueflow.PayloadTypeException if it is not an instance of the declared type
     */
    public void checkPayload(Object payload) {
        if (payload != null && !payloadType.isInstance(payload)) {
            throw new PayloadTypeException("Task " + id + " expects payload of type "
                    + payloadType.getName() + " but got " + payload.getClass().getName());
        }
    }
}
