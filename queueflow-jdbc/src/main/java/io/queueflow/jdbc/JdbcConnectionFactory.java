package io.queueflow.jdbc;

import io.queueflow.jdbc.store.AbstractJdbcQueueStore;
import io.queueflow.jdbc.store.JdbcQueueStores;
import io.queueflow.spi.BrokerConnection;
import io.queueflow.spi.ConnectionFactory;

import javax.sql.DataSource;
import java.sql.Connection;
import java.sql.SQLException;
import java.time.Clock;
import java.time.Duration;
import java.util.Objects;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * {@link ConnectionFactory} opening {@link JdbcBrokerConnection}s on a {@link DataSource}.
 *
 * <pre>{@code
 * QueueFlow queueFlow = QueueFlow.builder()
 *     .connectionFactory(JdbcConnectionFactory.builder()
 *         .dataSource(dataSource)
 *         .lockTimeout(Duration.ofMinutes(10))
 *         .build())
 *     .build();
 * }</pre>
 *
 * <p>{@link #connect()} checks that the database is reachable, so an unreachable
 * broker surfaces when the worker starts rather than on the first poll.
 */
public final class JdbcConnectionFactory implements ConnectionFactory {
    private static final Logger logger = Logger.getLogger(JdbcConnectionFactory.class.getName());

    private final DataSource dataSource;
    private final AbstractJdbcQueueStore store;
    private final Duration lockTimeout;
    private final Clock clock;

    private JdbcConnectionFactory(Builder builder) {
        this.dataSource = Objects.requireNonNull(builder.dataSource, "dataSource");
        if (builder.lockTimeout != null && (builder.lockTimeout.isNegative() || builder.lockTimeout.isZero())) {
            throw new IllegalArgumentException("lockTimeout must be > 0");
        }
        this.store = builder.store;
        this.lockTimeout = builder.lockTimeout != null ? builder.lockTimeout : Duration.ofMinutes(5);
        this.clock = builder.clock != null ? builder.clock : Clock.systemUTC();
    }

    /** Shorthand for a factory with a detected store and default settings. */
    public JdbcConnectionFactory(DataSource dataSource) {
        this(builder().dataSource(dataSource));
    }

    public static Builder builder() {
        return new Builder();
    }

    @Override
    public BrokerConnection connect() {
        AbstractJdbcQueueStore resolved = store;
        try (Connection conn = dataSource.getConnection()) {
            if (resolved == null) {
                resolved = JdbcQueueStores.detect(conn.getMetaData().getURL());
            }
        } catch (SQLException e) {
            throw new QueueStoreException("Database unreachable", e);
        }
        logger.log(Level.FINE, "Connected {0} queue store with table prefix {1}",
                new Object[]{resolved.name(), resolved.tablePrefix()});
        return new JdbcBrokerConnection(dataSource, resolved, clock, lockTimeout);
    }

    /** Builder for {@link JdbcConnectionFactory}. */
    public static final class Builder {
        private DataSource dataSource;
        private AbstractJdbcQueueStore store;
        private Duration lockTimeout;
        private Clock clock;

        private Builder() {
        }

        /**
         * <b>Required.</b>
         */
        public Builder dataSource(DataSource dataSource) {
            this.dataSource = dataSource;
            return this;
        }

        /**
         * Sets the SQL dialect and table prefix.
         *
         * <p>Optional. Defaults to the store detected from the DataSource's JDBC URL
         * with the default table prefix.
         */
        public Builder store(AbstractJdbcQueueStore store) {
            this.store = store;
            return this;
        }

        /**
         * Sets how long an active job may stay locked before another consumer may
         * reclaim it.
         *
         * <p>Optional. Defaults to 5 minutes. Must be &gt; 0.
         */
        public Builder lockTimeout(Duration lockTimeout) {
            this.lockTimeout = lockTimeout;
            return this;
        }

        /**
         * Optional. Defaults to {@link Clock#systemUTC()}.
         */
        public Builder clock(Clock clock) {
            this.clock = clock;
            return this;
        }

        public JdbcConnectionFactory build() {
            return new JdbcConnectionFactory(this);
        }
    }
}
