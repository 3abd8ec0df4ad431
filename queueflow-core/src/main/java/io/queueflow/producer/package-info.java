/**
 * Queue-bound producers used by {@link io.queueflow.Task#trigger(Object, io.queueflow.JobOptions)}.
 */
package io.queueflow.producer;
