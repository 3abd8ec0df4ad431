/**
 * Spring Boot auto-configuration for QueueFlow.
 *
 * <p>Adding the starter to an application with a {@link javax.sql.DataSource} provides a
 * {@link io.queueflow.QueueFlow} bean backed by the JDBC queue store. Settings live under
 * {@code queueflow.*}; see {@link io.queueflow.spring.boot.QueueFlowProperties}.
 *
 * <pre>{@code
 * queueflow.worker.auto-start=true
 * queueflow.jdbc.initialize-schema=true
 * queueflow.retention.completed=10m
 * }</pre>
 */
package io.queueflow.spring.boot;
