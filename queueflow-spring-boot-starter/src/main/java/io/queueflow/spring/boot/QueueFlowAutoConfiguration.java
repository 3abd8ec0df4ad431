package io.queueflow.spring.boot;

import com.fasterxml.jackson.databind.ObjectMapper;
import io.queueflow.QueueFlow;
import io.queueflow.codec.JacksonPayloadCodec;
import io.queueflow.connection.LazyConnectionProvider;
import io.queueflow.jdbc.JdbcConnectionFactory;
import io.queueflow.jdbc.SchemaInitializer;
import io.queueflow.jdbc.store.AbstractJdbcQueueStore;
import io.queueflow.jdbc.store.JdbcQueueStores;
import io.queueflow.spi.ConnectionFactory;
import io.queueflow.spi.ConnectionProvider;
import io.queueflow.spi.MetricsExporter;
import io.queueflow.spi.PayloadCodec;

import org.springframework.beans.factory.ObjectProvider;
import org.springframework.boot.autoconfigure.AutoConfiguration;
import org.springframework.boot.autoconfigure.condition.ConditionalOnBean;
import org.springframework.boot.autoconfigure.condition.ConditionalOnClass;
import org.springframework.boot.autoconfigure.condition.ConditionalOnMissingBean;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.boot.autoconfigure.jackson.JacksonAutoConfiguration;
import org.springframework.boot.autoconfigure.jdbc.DataSourceAutoConfiguration;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;

import javax.sql.DataSource;

/**
 * Auto-configuration for QueueFlow.
 *
 * <p>Wires a {@link QueueFlow} on the application's {@link DataSource}: the queue
 * store is detected from the JDBC URL, connections are opened lazily, and payloads
 * are encoded with the context's {@link ObjectMapper} when there is one.
 * Applications declare their tasks by injecting the {@link QueueFlow} bean.
 *
 * @see QueueFlowProperties
 * @see QueueFlowMicrometerAutoConfiguration
 */
@AutoConfiguration(after = {DataSourceAutoConfiguration.class, JacksonAutoConfiguration.class})
@ConditionalOnClass({QueueFlow.class, JdbcConnectionFactory.class})
@ConditionalOnBean(DataSource.class)
@EnableConfigurationProperties(QueueFlowProperties.class)
public class QueueFlowAutoConfiguration {

    @Bean
    @ConditionalOnMissingBean
    public AbstractJdbcQueueStore queueStore(DataSource dataSource, QueueFlowProperties props) {
        AbstractJdbcQueueStore detected = JdbcQueueStores.detect(dataSource);
        String tablePrefix = props.getJdbc().getTablePrefix();
        AbstractJdbcQueueStore store = detected.tablePrefix().equals(tablePrefix)
                ? detected
                : detected.withTablePrefix(tablePrefix);
        if (props.getJdbc().isInitializeSchema()) {
            SchemaInitializer.initialize(dataSource, store);
        }
        return store;
    }

    @Bean
    @ConditionalOnMissingBean(ConnectionFactory.class)
    public JdbcConnectionFactory queueFlowConnectionFactory(DataSource dataSource,
            AbstractJdbcQueueStore queueStore, QueueFlowProperties props) {
        return JdbcConnectionFactory.builder()
                .dataSource(dataSource)
                .store(queueStore)
                .lockTimeout(props.getWorker().getLockTimeout())
                .build();
    }

    @Bean
    @ConditionalOnMissingBean(ConnectionProvider.class)
    public LazyConnectionProvider queueFlowConnectionProvider(ConnectionFactory connectionFactory) {
        return new LazyConnectionProvider(connectionFactory);
    }

    @Bean
    @ConditionalOnMissingBean(PayloadCodec.class)
    public JacksonPayloadCodec queueFlowPayloadCodec(ObjectProvider<ObjectMapper> objectMapper) {
        ObjectMapper mapper = objectMapper.getIfAvailable();
        return mapper != null ? new JacksonPayloadCodec(mapper) : JacksonPayloadCodec.getDefault();
    }

    @Bean(destroyMethod = "close")
    @ConditionalOnMissingBean
    public QueueFlow queueFlow(QueueFlowProperties props,
            ConnectionProvider connectionProvider,
            PayloadCodec payloadCodec,
            ObjectProvider<MetricsExporter> metricsProvider) {
        var builder = QueueFlow.builder()
                .connectionProvider(connectionProvider)
                .defaultQueue(props.getDefaultQueue())
                .defaultConcurrency(props.getWorker().getDefaultConcurrency())
                .pollIntervalMs(props.getWorker().getPollIntervalMs())
                .drainTimeoutMs(props.getWorker().getDrainTimeoutMs())
                .completedRetention(props.getRetention().getCompleted())
                .failedRetention(props.getRetention().getFailed())
                .purgeIntervalSeconds(props.getRetention().getIntervalSeconds())
                .payloadCodec(payloadCodec);
        MetricsExporter metrics = metricsProvider.getIfAvailable();
        if (metrics != null) {
            builder.metrics(metrics);
        }
        return builder.build();
    }

    @Bean
    @ConditionalOnProperty(prefix = "queueflow.worker", name = "auto-start", havingValue = "true")
    public QueueFlowWorkerStarter queueFlowWorkerStarter(QueueFlow queueFlow) {
        return new QueueFlowWorkerStarter(queueFlow);
    }
}
