package io.queueflow.spring.boot;

import io.micrometer.core.instrument.MeterRegistry;
import io.queueflow.micrometer.MicrometerMetricsExporter;
import io.queueflow.spi.MetricsExporter;

import org.springframework.boot.autoconfigure.AutoConfiguration;
import org.springframework.boot.autoconfigure.condition.ConditionalOnBean;
import org.springframework.boot.autoconfigure.condition.ConditionalOnClass;
import org.springframework.boot.autoconfigure.condition.ConditionalOnMissingBean;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;

/**
 * Auto-configuration for Micrometer metrics integration.
 *
 * <p>Creates a {@link MicrometerMetricsExporter} when Micrometer is on the classpath,
 * a {@link MeterRegistry} bean exists and {@code queueflow.metrics.enabled} is true
 * (default).
 *
 * <p>Runs before {@link QueueFlowAutoConfiguration} so the {@link MetricsExporter}
 * bean is available for injection into the {@link io.queueflow.QueueFlow}.
 */
@AutoConfiguration(
        before = QueueFlowAutoConfiguration.class,
        afterName = "org.springframework.boot.actuate.autoconfigure.metrics.CompositeMeterRegistryAutoConfiguration")
@ConditionalOnClass({MicrometerMetricsExporter.class, MeterRegistry.class})
@ConditionalOnBean(MeterRegistry.class)
@ConditionalOnProperty(prefix = "queueflow.metrics", name = "enabled", matchIfMissing = true)
@EnableConfigurationProperties(QueueFlowProperties.class)
public class QueueFlowMicrometerAutoConfiguration {

    @Bean(destroyMethod = "close")
    @ConditionalOnMissingBean(MetricsExporter.class)
    public MicrometerMetricsExporter micrometerMetricsExporter(
            MeterRegistry meterRegistry, QueueFlowProperties props) {
        return new MicrometerMetricsExporter(meterRegistry, props.getMetrics().getNamePrefix());
    }
}
