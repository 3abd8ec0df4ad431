/**
 * The worker: per-queue consumers and job dispatch.
 *
 * <p>{@link io.queueflow.worker.WorkerEngine} owns one
 * {@link io.queueflow.worker.QueueConsumer} per queue. Each consumer claims due jobs
 * up to its concurrency limit and hands them to the
 * {@link io.queueflow.worker.JobDispatcher}, which runs the registered handler and
 * reports the outcome to the broker. Jobs naming an unknown task fail with
 * {@link io.queueflow.worker.UnroutableJobException}.
 */
package io.queueflow.worker;
