/**
 * Micrometer bridge for exporting job and schedule metrics to Prometheus, Grafana, and other backends.
 *
 * <p>{@link io.queueflow.micrometer.MicrometerMetricsExporter} implements the
 * {@link io.queueflow.spi.MetricsExporter} SPI using per-queue Micrometer counters,
 * gauges and distribution summaries.
 *
 * @see io.queueflow.micrometer.MicrometerMetricsExporter
 */
package io.queueflow.micrometer;
