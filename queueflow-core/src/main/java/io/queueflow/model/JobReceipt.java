package io.queueflow.model;

import java.time.Instant;

/**
 * Acknowledgement that the broker durably accepted a job.
 *
 * @param jobId     id of the accepted job
 * @param queue     queue the job was added to
 * @param name      task id
 * @param createdAt enqueue time of the stored job
 * @param duplicate {@code true} if a job with the same id already existed and nothing was added
 */
public record JobReceipt(String jobId, String queue, String name, Instant createdAt, boolean duplicate) {
}
