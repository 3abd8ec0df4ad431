package io.queueflow.schedule;

import io.queueflow.ConfigurationException;
import io.queueflow.InMemoryBrokerConnection;
import io.queueflow.connection.LazyConnectionProvider;
import io.queueflow.model.RecurringJob;
import io.queueflow.model.RecurringJobRequest;
import io.queueflow.spi.ConnectionProvider;
import io.queueflow.spi.MetricsExporter;
import io.queueflow.worker.WorkerEngine;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;

import static org.junit.jupiter.api.Assertions.*;

class ScheduleReconcilerTest {

    private static final class CountingMetrics implements MetricsExporter {
        final AtomicInteger installed = new AtomicInteger();
        final AtomicInteger failed = new AtomicInteger();

        @Override
        public void incrementJobEnqueued(String queue) {
        }

        @Override
        public void incrementJobCompleted(String queue) {
        }

        @Override
        public void incrementJobFailed(String queue) {
        }

        @Override
        public void incrementJobUnroutable(String queue) {
        }

        @Override
        public void incrementScheduleInstalled(String queue) {
            installed.incrementAndGet();
        }

        @Override
        public void incrementScheduleFailed(String queue) {
            failed.incrementAndGet();
        }
    }

    private static WorkerEngine engine(ConnectionProvider provider) {
        return WorkerEngine.builder()
                .connectionProvider(provider)
                .pollIntervalMs(20)
                .build();
    }

    private static RecurringJobRequest daily(String pattern) {
        return new RecurringJobRequest("reports.daily", "reports.daily", pattern, null, "{}");
    }

    @Test
    void removesEveryRegistrationOfTheTask() {
        InMemoryBrokerConnection broker = new InMemoryBrokerConnection();
        broker.putRecurring(new RecurringJob("a", "reports.daily", "legacy", "reports", "0 1 * * *", null, null));
        broker.putRecurring(new RecurringJob("b", "other", "reports.daily", "reports", "0 2 * * *", null, null));
        broker.putRecurring(new RecurringJob("c", "reports.weekly", "reports.weekly", "reports", "0 3 * * 1", null, null));
        CountingMetrics metrics = new CountingMetrics();

        try (WorkerEngine engine = engine(new LazyConnectionProvider(() -> broker));
             ScheduleReconciler reconciler = new ScheduleReconciler(engine, metrics)) {
            RecurringJob installed = reconciler.install("reports", daily("0 9 * * *"));

            assertEquals("reports.daily:reports.daily::0 9 * * *", installed.key());
            assertTrue(engine.isStarted());
        }

        List<RecurringJob> remaining = broker.listRecurring("reports");
        assertEquals(2, remaining.size());
        assertTrue(remaining.stream().anyMatch(r -> r.key().equals("c")));
        assertEquals(1, remaining.stream().filter(r -> r.belongsTo("reports.daily")).count());
        assertEquals(1, metrics.installed.get());
        assertEquals(0, metrics.failed.get());
    }

    @Test
    void asyncInstallationsRunInOrder() throws Exception {
        InMemoryBrokerConnection broker = new InMemoryBrokerConnection();
        try (WorkerEngine engine = engine(new LazyConnectionProvider(() -> broker));
             ScheduleReconciler reconciler = new ScheduleReconciler(engine, MetricsExporter.NOOP)) {
            CompletableFuture<RecurringJob> first = reconciler.installAsync("reports", daily("0 9 * * *"));
            CompletableFuture<RecurringJob> second = reconciler.installAsync("reports", daily("0 10 * * *"));

            second.get(5, TimeUnit.SECONDS);
            assertTrue(first.isDone());
        }

        List<RecurringJob> remaining = broker.listRecurring("reports");
        assertEquals(1, remaining.size());
        assertEquals("0 10 * * *", remaining.get(0).pattern());
    }

    @Test
    void rejectedPatternFailsInstallation() {
        InMemoryBrokerConnection broker = new InMemoryBrokerConnection();
        CountingMetrics metrics = new CountingMetrics();
        try (WorkerEngine engine = engine(new LazyConnectionProvider(() -> broker));
             ScheduleReconciler reconciler = new ScheduleReconciler(engine, metrics)) {
            ExecutionException e = assertThrows(ExecutionException.class,
                    () -> reconciler.installAsync("reports", daily("bad")).get(5, TimeUnit.SECONDS));
            assertInstanceOf(IllegalArgumentException.class, e.getCause());
        }
        assertEquals(1, metrics.failed.get());
        assertEquals(0, metrics.installed.get());
    }

    @Test
    void missingConnectionFailsInstallation() {
        try (WorkerEngine engine = engine(ConnectionProvider.unconfigured());
             ScheduleReconciler reconciler = new ScheduleReconciler(engine, MetricsExporter.NOOP)) {
            assertThrows(ConfigurationException.class, () -> reconciler.install("reports", daily("0 9 * * *")));
        }
    }

    @Test
    void closedReconcilerRejectsInstallations() {
        try (WorkerEngine engine = engine(ConnectionProvider.unconfigured())) {
            ScheduleReconciler reconciler = new ScheduleReconciler(engine, MetricsExporter.NOOP);
            reconciler.close();

            CompletableFuture<RecurringJob> result = reconciler.installAsync("reports", daily("0 9 * * *"));
            assertTrue(result.isCompletedExceptionally());
        }
    }
}
