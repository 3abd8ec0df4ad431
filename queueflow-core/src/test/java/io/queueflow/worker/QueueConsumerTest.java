package io.queueflow.worker;

import io.queueflow.InMemoryBrokerConnection;
import io.queueflow.TaskHandler;
import io.queueflow.registry.DefaultTaskRegistry;
import io.queueflow.registry.TaskDefinition;
import io.queueflow.spi.ConnectionProvider;
import io.queueflow.spi.MetricsExporter;
import io.queueflow.spi.PayloadCodec;
import org.junit.jupiter.api.Test;

import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

class QueueConsumerTest {

    private final InMemoryBrokerConnection broker = new InMemoryBrokerConnection();
    private final DefaultTaskRegistry registry = new DefaultTaskRegistry();
    private final ConnectionProvider provider = new ConnectionProvider() {
        @Override
        public InMemoryBrokerConnection get() {
            return broker;
        }

        @Override
        public void reset() {
        }
    };

    private QueueConsumer consumer(int concurrency) {
        return QueueConsumer.builder()
                .queue("work")
                .concurrency(concurrency)
                .connectionProvider(provider)
                .dispatcher(new JobDispatcher(registry, provider, PayloadCodec.getDefault(), MetricsExporter.NOOP))
                .pollIntervalMs(10)
                .drainTimeoutMs(2000)
                .build();
    }

    @Test
    void builderValidation() {
        assertThrows(NullPointerException.class, () -> QueueConsumer.builder().build());
        assertThrows(IllegalArgumentException.class, () -> QueueConsumer.builder()
                .queue("work").connectionProvider(provider)
                .dispatcher(new JobDispatcher(registry, provider, PayloadCodec.getDefault(), MetricsExporter.NOOP))
                .concurrency(0)
                .build());
    }

    @Test
    void runsUpToConcurrencyInParallel() throws Exception {
        CountDownLatch allRunning = new CountDownLatch(3);
        CountDownLatch release = new CountDownLatch(1);
        TaskHandler<Void> handler = ignored -> {
            allRunning.countDown();
            release.await(5, TimeUnit.SECONDS);
        };
        registry.register(new TaskDefinition<>("work.item", "work", Void.class, handler, null, null));
        for (int i = 0; i < 4; i++) {
            broker.inject("work", "work.item", "null");
        }

        try (QueueConsumer consumer = consumer(3)) {
            consumer.start();
            assertTrue(allRunning.await(5, TimeUnit.SECONDS));
            Thread.sleep(100);
            assertEquals(3, consumer.activeCount());
            release.countDown();
            long deadline = System.nanoTime() + TimeUnit.SECONDS.toNanos(5);
            while (broker.completeCount.get() < 4 && System.nanoTime() < deadline) {
                Thread.sleep(10);
            }
            assertEquals(4, broker.completeCount.get());
        }
    }

    @Test
    void brokerErrorsDoNotStopTheLoop() throws Exception {
        AtomicInteger runs = new AtomicInteger();
        registry.register(new TaskDefinition<>("work.item", "work", Void.class,
                ignored -> runs.incrementAndGet(), null, null));
        broker.inject("work", "work.item", "null");
        broker.failClaim = true;

        try (QueueConsumer consumer = consumer(1)) {
            consumer.start();
            Thread.sleep(100);
            assertEquals(0, runs.get());
            assertTrue(consumer.isRunning());

            broker.failClaim = false;
            long deadline = System.nanoTime() + TimeUnit.SECONDS.toNanos(5);
            while (runs.get() == 0 && System.nanoTime() < deadline) {
                Thread.sleep(10);
            }
            assertEquals(1, runs.get());
        }
    }

    @Test
    void closeWaitsForRunningHandler() throws Exception {
        CountDownLatch started = new CountDownLatch(1);
        AtomicInteger finished = new AtomicInteger();
        registry.register(new TaskDefinition<>("work.item", "work", Void.class,
                ignored -> {
                    started.countDown();
                    Thread.sleep(200);
                    finished.incrementAndGet();
                }, null, null));
        broker.inject("work", "work.item", "null");

        QueueConsumer consumer = consumer(1);
        consumer.start();
        assertTrue(started.await(5, TimeUnit.SECONDS));
        consumer.close();

        assertEquals(1, finished.get());
        assertFalse(consumer.isRunning());
        assertThrows(IllegalStateException.class, consumer::start);
    }
}
