/**
 * Scheduled deletion of finished jobs.
 *
 * @see io.queueflow.purge.JobPurgeScheduler
 */
package io.queueflow.purge;
