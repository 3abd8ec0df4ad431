/**
 * Service Provider Interfaces (SPI) for plugging queueflow into a broker and a
 * metrics backend.
 *
 * @see io.queueflow.spi.BrokerConnection
 * @see io.queueflow.spi.ConnectionProvider
 * @see io.queueflow.spi.PayloadCodec
 * @see io.queueflow.spi.MetricsExporter
 */
package io.queueflow.spi;
