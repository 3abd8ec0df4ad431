package io.queueflow.spi;

/**
 * Opens a new broker connection.
 *
 * @see io.queueflow.connection.LazyConnectionProvider
 */
@FunctionalInterface
public interface ConnectionFactory {

    /**
     * @return a new connection
     * @throws io.queueflow.BrokerException if the broker cannot be reached
     */
    BrokerConnection connect();
}
