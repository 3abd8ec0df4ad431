package io.queueflow.connection;

import io.queueflow.spi.BrokerConnection;
import io.queueflow.spi.ConnectionFactory;
import io.queueflow.spi.ConnectionProvider;

import java.util.Objects;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * {@link ConnectionProvider} that opens the shared connection on first use.
 *
 * <p>Creation is guarded so concurrent first callers observe a single
 * connection. A failed creation is not cached: the next {@link #get()} tries again.
 */
public final class LazyConnectionProvider implements ConnectionProvider, AutoCloseable {
    private static final Logger logger = Logger.getLogger(LazyConnectionProvider.class.getName());

    private final ConnectionFactory factory;
    private final Object lock = new Object();
    private volatile BrokerConnection connection;

    public LazyConnectionProvider(ConnectionFactory factory) {
        this.factory = Objects.requireNonNull(factory, "factory");
    }

    @Override
    public BrokerConnection get() {
        BrokerConnection current = connection;
        if (current != null) {
            return current;
        }
        synchronized (lock) {
            if (connection == null) {
                connection = Objects.requireNonNull(factory.connect(), "connectionFactory returned null");
                logger.fine("Opened broker connection");
            }
            return connection;
        }
    }

    /** Returns whether a connection is currently open. */
    public boolean isConnected() {
        return connection != null;
    }

    @Override
    public void reset() {
        BrokerConnection previous;
        synchronized (lock) {
            previous = connection;
            connection = null;
        }
        if (previous != null) {
            try {
                previous.close();
            } catch (RuntimeException e) {
                logger.log(Level.WARNING, "Failed to close broker connection", e);
            }
        }
    }

    @Override
    public void close() {
        reset();
    }
}
