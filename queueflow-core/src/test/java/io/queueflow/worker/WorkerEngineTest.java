package io.queueflow.worker;

import io.queueflow.ConfigurationException;
import io.queueflow.InMemoryBrokerConnection;
import io.queueflow.TaskHandler;
import io.queueflow.connection.LazyConnectionProvider;
import io.queueflow.registry.TaskDefinition;
import io.queueflow.spi.ConnectionProvider;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;
import java.util.Set;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicInteger;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNotNull;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

class WorkerEngineTest {

    private static final TaskHandler<Void> NOOP = ignored -> {
    };

    private static TaskDefinition<Void> def(String id, String queue) {
        return new TaskDefinition<>(id, queue, Void.class, NOOP, null, null);
    }

    private static WorkerEngine engine(ConnectionProvider provider) {
        return WorkerEngine.builder()
                .connectionProvider(provider)
                .pollIntervalMs(20)
                .build();
    }

    @Test
    void builderValidation() {
        assertThrows(NullPointerException.class, () -> WorkerEngine.builder().build());
        assertThrows(IllegalArgumentException.class, () -> WorkerEngine.builder()
                .connectionProvider(ConnectionProvider.unconfigured())
                .defaultConcurrency(0)
                .build());
        assertThrows(IllegalArgumentException.class, () -> WorkerEngine.builder()
                .connectionProvider(ConnectionProvider.unconfigured())
                .pollIntervalMs(0)
                .build());
    }

    @Test
    void registrationBeforeStartDoesNotConnect() {
        AtomicInteger connects = new AtomicInteger();
        try (WorkerEngine engine = engine(new LazyConnectionProvider(() -> {
            connects.incrementAndGet();
            return new InMemoryBrokerConnection();
        }))) {
            engine.registerTask(def("email.welcome", "email"));
            assertEquals(0, connects.get());
            assertFalse(engine.isStarted());
            assertTrue(engine.activeQueues().isEmpty());
        }
    }

    @Test
    void startCreatesOneConsumerPerQueue() {
        try (WorkerEngine engine = engine(new LazyConnectionProvider(InMemoryBrokerConnection::new))) {
            engine.registerTask(def("email.welcome", "email"));
            engine.registerTask(def("email.reset", "email"));
            engine.registerTask(def("reports.daily", "reports"));

            engine.start();
            engine.start();

            assertTrue(engine.isStarted());
            assertEquals(Set.of("email", "reports"), engine.activeQueues());
        }
    }

    @Test
    void concurrentStartsYieldSingleStart() throws Exception {
        AtomicInteger connects = new AtomicInteger();
        try (WorkerEngine engine = engine(new LazyConnectionProvider(() -> {
            connects.incrementAndGet();
            return new InMemoryBrokerConnection();
        }))) {
            engine.registerTask(def("email.welcome", "email"));
            CountDownLatch go = new CountDownLatch(1);
            ExecutorService pool = Executors.newFixedThreadPool(8);
            try {
                List<Future<?>> futures = new ArrayList<>();
                for (int i = 0; i < 8; i++) {
                    futures.add(pool.submit(() -> {
                        go.await();
                        engine.start();
                        return null;
                    }));
                }
                go.countDown();
                for (Future<?> future : futures) {
                    future.get(5, TimeUnit.SECONDS);
                }
            } finally {
                pool.shutdownNow();
            }
            assertEquals(1, connects.get());
            assertEquals(Set.of("email"), engine.activeQueues());
        }
    }

    @Test
    void taskRegisteredAfterStartGetsConsumer() {
        try (WorkerEngine engine = engine(new LazyConnectionProvider(InMemoryBrokerConnection::new))) {
            engine.registerTask(def("email.welcome", "email"));
            engine.start();

            engine.registerTask(def("billing.charge", "billing"));
            engine.registerTask(def("email.reset", "email"));

            assertEquals(Set.of("email", "billing"), engine.activeQueues());
        }
    }

    @Test
    void startFailsWithoutConnection() {
        try (WorkerEngine engine = engine(ConnectionProvider.unconfigured())) {
            engine.registerTask(def("email.welcome", "email"));
            assertThrows(ConfigurationException.class, engine::start);
            assertFalse(engine.isStarted());
            assertTrue(engine.activeQueues().isEmpty());
        }
    }

    @Test
    void stopReleasesConnectionAndAllowsRestart() {
        InMemoryBrokerConnection broker = new InMemoryBrokerConnection();
        try (WorkerEngine engine = engine(new LazyConnectionProvider(() -> broker))) {
            engine.registerTask(def("email.welcome", "email"));
            engine.stop();
            assertEquals(0, broker.closeCount.get());

            engine.start();
            engine.stop();
            assertEquals(1, broker.closeCount.get());
            assertFalse(engine.isStarted());
            assertTrue(engine.activeQueues().isEmpty());

            engine.start();
            assertEquals(Set.of("email"), engine.activeQueues());
        }
    }

    @Test
    void runningHandlerCanRegisterTasksWhileEngineStops() throws Exception {
        InMemoryBrokerConnection broker = new InMemoryBrokerConnection();
        CountDownLatch running = new CountDownLatch(1);
        AtomicBoolean registered = new AtomicBoolean();
        try (WorkerEngine engine = WorkerEngine.builder()
                .connectionProvider(new LazyConnectionProvider(() -> broker))
                .pollIntervalMs(20)
                .drainTimeoutMs(10_000)
                .build()) {
            engine.registerTask(new TaskDefinition<>("email.welcome", "email", Void.class, ignored -> {
                running.countDown();
                long deadline = System.nanoTime() + TimeUnit.SECONDS.toNanos(5);
                while (engine.isStarted() && System.nanoTime() < deadline) {
                    Thread.sleep(10);
                }
                engine.registerTask(def("email.followup", "email"));
                registered.set(true);
            }, null, null));
            engine.start();
            broker.inject("email", "email.welcome", "null");
            assertTrue(running.await(5, TimeUnit.SECONDS));

            long start = System.nanoTime();
            engine.stop();
            long elapsedMs = TimeUnit.NANOSECONDS.toMillis(System.nanoTime() - start);

            assertTrue(registered.get());
            assertTrue(elapsedMs < 5_000, "stop took " + elapsedMs + " ms");
            assertEquals(1, broker.completeCount.get());
            assertNotNull(engine.registry().find("email.followup"));
            assertTrue(engine.activeQueues().isEmpty());
        }
    }

    @Test
    void closedEngineCannotStart() {
        WorkerEngine engine = engine(new LazyConnectionProvider(InMemoryBrokerConnection::new));
        engine.close();
        assertThrows(IllegalStateException.class, engine::start);
    }
}
