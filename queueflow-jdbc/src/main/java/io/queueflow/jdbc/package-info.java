/**
 * Table-backed broker for queueflow.
 *
 * <p>{@link io.queueflow.jdbc.JdbcConnectionFactory} opens
 * {@link io.queueflow.jdbc.JdbcBrokerConnection}s that keep jobs and recurring
 * registrations in two tables. Dialects for H2, MySQL and PostgreSQL are detected
 * from the JDBC URL via {@link io.queueflow.jdbc.store.JdbcQueueStores}. DDL ships
 * under {@code schema/<dialect>.sql}.
 *
 * <p>Recurring registrations are evaluated with {@link io.queueflow.jdbc.CronSchedule}
 * and turned into ordinary jobs when a consumer of their queue claims work.
 */
package io.queueflow.jdbc;
