package io.queueflow;

/**
 * Thrown when a connection-dependent operation runs without a configured broker
 * connection, or when the wiring is otherwise invalid.
 *
 * <p>Configuration errors are never retried.
 */
public final class ConfigurationException extends QueueFlowException {

    public ConfigurationException(String message) {
        super(message);
    }

    public ConfigurationException(String message, Throwable cause) {
        super(message, cause);
    }
}
