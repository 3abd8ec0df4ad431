package io.queueflow.micrometer;

import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.DistributionSummary;
import io.micrometer.core.instrument.Gauge;
import io.micrometer.core.instrument.Meter;
import io.micrometer.core.instrument.MeterRegistry;
import io.queueflow.spi.MetricsExporter;

import java.util.ArrayList;
import java.util.Map;
import java.util.Objects;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Micrometer-based implementation of {@link MetricsExporter}.
 *
 * <p>Meters are registered lazily the first time a queue reports, each tagged with
 * {@code queue=<name>}.
 *
 * <h3>Counters</h3>
 * <ul>
 *   <li>{@code queueflow.job.enqueued} - jobs accepted by the broker</li>
 *   <li>{@code queueflow.job.completed} - handlers that finished successfully</li>
 *   <li>{@code queueflow.job.failed} - jobs marked failed</li>
 *   <li>{@code queueflow.job.unroutable} - jobs naming an unknown task</li>
 *   <li>{@code queueflow.job.error_handler.failed} - error handlers that threw</li>
 *   <li>{@code queueflow.schedule.installed} - recurring schedules installed</li>
 *   <li>{@code queueflow.schedule.failed} - recurring schedules that could not be installed</li>
 * </ul>
 *
 * <h3>Gauges and summaries</h3>
 * <ul>
 *   <li>{@code queueflow.consumer.active} - handlers currently running</li>
 *   <li>{@code queueflow.handler.duration.ms} - handler execution time in milliseconds</li>
 * </ul>
 *
 * @see MetricsExporter
 */
public final class MicrometerMetricsExporter implements MetricsExporter, AutoCloseable {

    private final MeterRegistry registry;
    private final String namePrefix;
    private final Map<String, Meter> meters = new ConcurrentHashMap<>();
    private final Map<String, AtomicInteger> activeJobs = new ConcurrentHashMap<>();
    private volatile boolean closed;

    /**
     * Creates an exporter with the default metric name prefix {@code "queueflow"}.
     *
     * @param registry the Micrometer meter registry
     */
    public MicrometerMetricsExporter(MeterRegistry registry) {
        this(registry, "queueflow");
    }

    /**
     * Creates an exporter with a custom metric name prefix for multi-instance use.
     *
     * @param registry   the Micrometer meter registry
     * @param namePrefix prefix for all meter names (e.g. {@code "billing.queueflow"})
     */
    public MicrometerMetricsExporter(MeterRegistry registry, String namePrefix) {
        Objects.requireNonNull(registry, "registry");
        Objects.requireNonNull(namePrefix, "namePrefix");
        if (namePrefix.isEmpty()) {
            throw new IllegalArgumentException("namePrefix must not be empty");
        }
        if (namePrefix.endsWith(".")) {
            throw new IllegalArgumentException("namePrefix must not end with '.'");
        }
        this.registry = registry;
        this.namePrefix = namePrefix;
    }

    @Override
    public void incrementJobEnqueued(String queue) {
        increment("job.enqueued", "Jobs accepted by the broker", queue);
    }

    @Override
    public void incrementJobCompleted(String queue) {
        increment("job.completed", "Jobs whose handler finished successfully", queue);
    }

    @Override
    public void incrementJobFailed(String queue) {
        increment("job.failed", "Jobs marked failed", queue);
    }

    @Override
    public void incrementJobUnroutable(String queue) {
        increment("job.unroutable", "Jobs naming a task with no handler", queue);
    }

    @Override
    public void incrementErrorHandlerFailure(String queue) {
        increment("job.error_handler.failed", "Task error handlers that threw", queue);
    }

    @Override
    public void incrementScheduleInstalled(String queue) {
        increment("schedule.installed", "Recurring schedules installed", queue);
    }

    @Override
    public void incrementScheduleFailed(String queue) {
        increment("schedule.failed", "Recurring schedules that could not be installed", queue);
    }

    @Override
    public void recordHandlerDurationMs(String queue, long durationMs) {
        if (closed) return;
        DistributionSummary summary = (DistributionSummary) meters.computeIfAbsent(
                key("handler.duration.ms", queue),
                k -> DistributionSummary.builder(namePrefix + ".handler.duration.ms")
                        .description("Task handler execution time in milliseconds")
                        .baseUnit("milliseconds")
                        .tag("queue", queue)
                        .register(registry));
        summary.record(durationMs);
    }

    @Override
    public void recordActiveJobs(String queue, int active) {
        if (closed) return;
        AtomicInteger value = activeJobs.computeIfAbsent(queue, q -> {
            AtomicInteger holder = new AtomicInteger();
            meters.put(key("consumer.active", q),
                    Gauge.builder(namePrefix + ".consumer.active", holder, AtomicInteger::get)
                            .description("Task handlers currently running")
                            .tag("queue", q)
                            .register(registry));
            return holder;
        });
        value.set(active);
    }

    private void increment(String name, String description, String queue) {
        if (closed) return;
        Counter counter = (Counter) meters.computeIfAbsent(key(name, queue),
                k -> Counter.builder(namePrefix + "." + name)
                        .description(description)
                        .tag("queue", queue)
                        .register(registry));
        counter.increment();
    }

    private static String key(String name, String queue) {
        return name + "|" + queue;
    }

    /**
     * Removes all meters registered by this exporter from the registry.
     *
     * <p>Call this when the exporter is no longer needed (e.g. when the
     * {@link io.queueflow.QueueFlow} is closed) to prevent stale gauges.
     */
    @Override
    public void close() {
        closed = true;
        RuntimeException first = null;
        for (Meter meter : new ArrayList<>(meters.values())) {
            try {
                registry.remove(meter);
            } catch (RuntimeException e) {
                if (first == null) first = e; else first.addSuppressed(e);
            }
        }
        meters.clear();
        activeJobs.clear();
        if (first != null) throw first;
    }
}
