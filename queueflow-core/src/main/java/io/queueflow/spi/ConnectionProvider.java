package io.queueflow.spi;

import io.queueflow.ConfigurationException;

/**
 * Supplies the one shared broker connection of a process.
 *
 * <p>The connection is created lazily on the first {@link #get()}, at most once,
 * and reused by all producers and consumers until {@link #reset()}.
 *
 * @see io.queueflow.connection.LazyConnectionProvider
 */
public interface ConnectionProvider {

    /**
     * Returns the shared connection, creating it on first use.
     *
     * @return the connection
     * @throws ConfigurationException if no connection is configured
     * @throws io.queueflow.BrokerException if the broker cannot be reached
     */
    BrokerConnection get();

    /**
     * Closes and forgets the shared connection; the next {@link #get()} opens a new one.
     */
    void reset();

    /**
     * Returns a provider that fails every {@link #get()} with a {@link ConfigurationException}.
     */
    static ConnectionProvider unconfigured() {
        return new ConnectionProvider() {
            @Override
            public BrokerConnection get() {
                throw new ConfigurationException(
                        "No broker connection configured; set a connectionProvider or connectionFactory");
            }

            @Override
            public void reset() {
            }
        };
    }
}
