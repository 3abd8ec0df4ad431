package io.queueflow;

import io.queueflow.model.JobReceipt;
import io.queueflow.producer.QueueProducer;
import io.queueflow.registry.TaskDefinition;
import io.queueflow.util.JobIds;

import java.util.Objects;

/**
 * Handle to a declared one-shot task.
 *
 * <p>Obtained from {@link QueueFlow#defineTask(TaskConfig)}. Thread-safe.
 *
 * @param <T> the payload type
 */
public final class Task<T> {
    private final TaskDefinition<T> definition;
    private final QueueFlow owner;
    private volatile QueueProducer producer;

    Task(TaskDefinition<T> definition, QueueFlow owner) {
        this.definition = Objects.requireNonNull(definition, "definition");
        this.owner = Objects.requireNonNull(owner, "owner");
    }

    public String id() {
        return definition.id();
    }

    /** The resolved queue. */
    public String queue() {
        return definition.queue();
    }

    public TaskDefinition<T> definition() {
        return definition;
    }

    /**
     * Enqueues a job with a freshly generated job id.
     *
     * @see #trigger(Object, JobOptions)
     */
    public JobReceipt trigger(T payload) {
        return trigger(payload, JobOptions.none());
    }

    /**
     * Enqueues a job and returns once the broker has accepted it. The worker is
     * started in the background if it is not running yet; this call does not wait
     * for it.
     *
     * @param payload the payload, must be an instance of the task's payload type
     * @param options options merged over a generated job id; pass an explicit
     *                {@code jobId} to make the trigger idempotent
     * @return the broker's receipt
     * @throws PayloadTypeException    if the payload has the wrong type
     * @throws ConfigurationException  if no broker connection is configured
     * @throws BrokerException         if the broker rejects the job or cannot be reached
     */
    public JobReceipt trigger(T payload, JobOptions options) {
        Objects.requireNonNull(options, "options");
        definition.checkPayload(payload);
        String payloadJson = owner.payloadCodec().encode(payload);
        JobOptions merged = options.withDefaults(JobOptions.builder().jobId(JobIds.next(id())).build());
        QueueProducer queueProducer = producer();
        owner.worker().startAsync();
        return queueProducer.enqueue(id(), payloadJson, merged);
    }

    private QueueProducer producer() {
        QueueProducer current = producer;
        if (current == null) {
            synchronized (this) {
                current = producer;
                if (current == null) {
                    current = owner.producer(queue());
                    producer = current;
                }
            }
        }
        return current;
    }

    @Override
    public String toString() {
        return "Task{id=" + id() + ", queue=" + queue() + "}";
    }
}
