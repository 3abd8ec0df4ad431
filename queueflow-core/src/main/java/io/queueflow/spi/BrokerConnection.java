package io.queueflow.spi;

import io.queueflow.model.Job;
import io.queueflow.model.JobReceipt;
import io.queueflow.model.JobRequest;
import io.queueflow.model.JobState;
import io.queueflow.model.RecurringJob;
import io.queueflow.model.RecurringJobRequest;

import java.time.Instant;
import java.util.List;

/**
 * Shared handle to the durable queue store.
 *
 * <p>The broker owns every piece of durable state: pending jobs, recurring job
 * registrations, and the retry/backoff bookkeeping requested through
 * {@link io.queueflow.JobOptions}. Delivery is at-least-once. The engine never
 * mutates a connection directly; it only calls the operations below.
 *
 * <p>Implementations must be thread-safe: one instance is shared by every
 * producer and consumer in the process. Failures surface as
 * {@link io.queueflow.BrokerException}.
 *
 * @see ConnectionProvider
 */
public interface BrokerConnection extends AutoCloseable {

    /**
     * Durably adds a job to a queue. Returns once the broker has accepted it.
     * A job whose id already exists in the queue is not added again.
     *
     * @param queue   target queue
     * @param request the job to add
     * @return acknowledgement of the stored job
     */
    JobReceipt enqueue(String queue, JobRequest request);

    /**
     * Lists the recurring job registrations installed in a queue.
     */
    List<RecurringJob> listRecurring(String queue);

    /**
     * Removes a recurring job registration.
     *
     * @return {@code true} if a registration was removed
     */
    boolean removeRecurring(String queue, String key);

    /**
     * Installs a recurring job registration, replacing one with the same key.
     *
     * @throws IllegalArgumentException if the pattern or time zone is malformed
     */
    RecurringJob addRecurring(String queue, RecurringJobRequest request);

    /**
     * Claims up to {@code limit} jobs that are due for delivery and marks them active
     * for {@code consumerId}. Due recurring registrations are materialized first.
     *
     * @return claimed jobs, oldest first; empty if none are due
     */
    List<Job> claim(String queue, String consumerId, int limit);

    /** Marks a claimed job completed. */
    void complete(Job job);

    /**
     * Marks a claimed job failed. The broker schedules another attempt after the
     * job's backoff if attempts remain.
     *
     * @return {@link JobState#DELAYED} if a retry was scheduled, {@link JobState#FAILED} otherwise
     */
    JobState fail(Job job, String error);

    /**
     * Deletes up to {@code limit} jobs in a terminal state that finished before {@code olderThan}.
     *
     * @return number of jobs deleted
     */
    int purge(String queue, JobState state, Instant olderThan, int limit);

    /** Releases broker resources. Must be idempotent. */
    @Override
    void close();
}
