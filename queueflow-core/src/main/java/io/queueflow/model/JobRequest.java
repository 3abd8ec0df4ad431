package io.queueflow.model;

import io.queueflow.JobOptions;

import java.util.Objects;

/**
 * A job to enqueue. The job id is carried by {@code options} and must be set.
 *
 * @param name        task id used for routing on delivery
 * @param payloadJson encoded payload
 * @param options     options passed through to the broker
 */
public record JobRequest(String name, String payloadJson, JobOptions options) {

    public JobRequest {
        Objects.requireNonNull(name, "name");
        Objects.requireNonNull(payloadJson, "payloadJson");
        Objects.requireNonNull(options, "options");
        Objects.requireNonNull(options.jobId(), "options.jobId");
    }

    public String jobId() {
        return options.jobId();
    }
}
