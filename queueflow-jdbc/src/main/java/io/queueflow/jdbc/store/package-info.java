/**
 * Dialect-specific SQL for the table-backed broker.
 *
 * @see io.queueflow.jdbc.store.AbstractJdbcQueueStore
 * @see io.queueflow.jdbc.store.JdbcQueueStores
 */
package io.queueflow.jdbc.store;
