package io.queueflow;

/**
 * Base unchecked exception for queueflow failures.
 *
 * @see ConfigurationException
 * @see BrokerException
 */
public class QueueFlowException extends RuntimeException {

    public QueueFlowException(String message) {
        super(message);
    }

    public QueueFlowException(String message, Throwable cause) {
        super(message, cause);
    }
}
