package io.queueflow.model;

import io.queueflow.Backoff;

import java.time.Instant;

/**
 * A job delivered to a consumer. {@code name} is the id of the task that handles it.
 *
 * @param id           broker-wide job id
 * @param queue        queue the job was claimed from
 * @param name         task id used for routing
 * @param payloadJson  encoded payload
 * @param attemptsMade failed attempts recorded before this delivery
 * @param maxAttempts  attempts allowed by the job's options
 * @param backoff      retry delay policy, or {@code null} for immediate retry
 * @param createdAt    time the job was enqueued
 */
public record Job(
    String id,
    String queue,
    String name,
    String payloadJson,
    int attemptsMade,
    int maxAttempts,
    Backoff backoff,
    Instant createdAt
) {

    /** Returns the 1-based number of the attempt this delivery represents. */
    public int attemptNumber() {
        return attemptsMade + 1;
    }
}
