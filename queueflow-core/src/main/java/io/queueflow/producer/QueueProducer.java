package io.queueflow.producer;

import io.queueflow.JobOptions;
import io.queueflow.model.JobReceipt;
import io.queueflow.model.JobRequest;
import io.queueflow.spi.ConnectionProvider;
import io.queueflow.spi.MetricsExporter;

import java.util.Objects;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Enqueues jobs into one queue through the shared broker connection.
 *
 * <p>Instances are obtained from {@link io.queueflow.QueueFlow} and shared by all
 * tasks of the same queue.
 */
public final class QueueProducer {
    private static final Logger logger = Logger.getLogger(QueueProducer.class.getName());

    private final String queue;
    private final ConnectionProvider connectionProvider;
    private final MetricsExporter metrics;

    public QueueProducer(String queue, ConnectionProvider connectionProvider, MetricsExporter metrics) {
        this.queue = Objects.requireNonNull(queue, "queue");
        this.connectionProvider = Objects.requireNonNull(connectionProvider, "connectionProvider");
        this.metrics = Objects.requireNonNull(metrics, "metrics");
    }

    public String queue() {
        return queue;
    }

    /**
     * Adds a job and returns once the broker has accepted it.
     *
     * @param name        task id
     * @param payloadJson encoded payload
     * @param options     job options; the job id must be set
     * @return the broker's receipt
     * @throws io.queueflow.ConfigurationException if no connection is configured
     * @throws io.queueflow.BrokerException         if the broker rejects or cannot be reached
     */
    public JobReceipt enqueue(String name, String payloadJson, JobOptions options) {
        JobReceipt receipt = connectionProvider.get().enqueue(queue, new JobRequest(name, payloadJson, options));
        if (receipt.duplicate()) {
            logger.log(Level.FINE, "Job {0} already present in queue {1}", new Object[]{receipt.jobId(), queue});
        } else {
            metrics.incrementJobEnqueued(queue);
        }
        return receipt;
    }
}
