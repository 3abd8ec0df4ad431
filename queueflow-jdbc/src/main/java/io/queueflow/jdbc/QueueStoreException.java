package io.queueflow.jdbc;

import io.queueflow.BrokerException;

import java.sql.SQLException;

/**
 * Unchecked exception wrapping JDBC errors thrown by the table-backed broker.
 */
public final class QueueStoreException extends BrokerException {

    public QueueStoreException(String message) {
        super(message);
    }

    public QueueStoreException(String message, Throwable cause) {
        super(message, cause);
    }

    /** Whether the underlying SQL error is a unique or primary key violation. */
    public boolean isDuplicateKey() {
        return getCause() instanceof SQLException sql
                && sql.getSQLState() != null
                && sql.getSQLState().startsWith("23");
    }
}
