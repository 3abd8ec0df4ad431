package io.queueflow.purge;

import io.queueflow.InMemoryBrokerConnection;
import io.queueflow.model.Job;
import io.queueflow.model.JobReceipt;
import io.queueflow.spi.ConnectionProvider;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.List;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertThrows;

class JobPurgeSchedulerTest {

    private final InMemoryBrokerConnection broker = new InMemoryBrokerConnection();
    private final ConnectionProvider provider = new ConnectionProvider() {
        @Override
        public InMemoryBrokerConnection get() {
            return broker;
        }

        @Override
        public void reset() {
        }
    };

    @Test
    void builderValidation() {
        assertThrows(NullPointerException.class, () -> JobPurgeScheduler.builder().build());
        assertThrows(IllegalArgumentException.class, () -> JobPurgeScheduler.builder()
                .connectionProvider(provider).queues(List::of).batchSize(0).build());
        assertThrows(IllegalArgumentException.class, () -> JobPurgeScheduler.builder()
                .connectionProvider(provider).queues(List::of).completedRetention(Duration.ofSeconds(-1)).build());
    }

    @Test
    void purgesFinishedJobsPastRetentionInBatches() throws Exception {
        for (int i = 0; i < 5; i++) {
            broker.inject("work", "work.item", "null");
        }
        List<Job> claimed = broker.claim("work", "c", 5);
        for (int i = 0; i < 3; i++) {
            broker.complete(claimed.get(i));
        }
        broker.fail(claimed.get(3), "boom");
        Thread.sleep(20);

        JobPurgeScheduler scheduler = JobPurgeScheduler.builder()
                .connectionProvider(provider)
                .queues(() -> List.of("work"))
                .completedRetention(Duration.ZERO)
                .failedRetention(Duration.ofHours(1))
                .batchSize(2)
                .build();
        try {
            assertEquals(3, scheduler.runOnce());
        } finally {
            scheduler.close();
        }
        // failed job kept by its longer retention, active job untouched
        assertEquals(2, broker.size());
        assertEquals(0, scheduler.runOnce());
    }

    @Test
    void unfinishedJobsAreKept() {
        JobReceipt waiting = broker.inject("work", "work.item", "null");
        JobPurgeScheduler scheduler = JobPurgeScheduler.builder()
                .connectionProvider(provider)
                .queues(() -> List.of("work"))
                .completedRetention(Duration.ZERO)
                .failedRetention(Duration.ZERO)
                .build();
        try {
            assertEquals(0, scheduler.runOnce());
        } finally {
            scheduler.close();
        }
        assertEquals(1, broker.size());
        assertNull(broker.state("work", "missing"));
        assertEquals(waiting.jobId(), broker.claim("work", "c", 1).get(0).id());
    }
}
