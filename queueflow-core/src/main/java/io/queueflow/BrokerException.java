package io.queueflow;

/**
 * Thrown when the broker cannot be reached or rejects an operation
 * (enqueue, schedule reconciliation, claim, acknowledgement).
 */
public class BrokerException extends QueueFlowException {

    public BrokerException(String message) {
        super(message);
    }

    public BrokerException(String message, Throwable cause) {
        super(message, cause);
    }
}
