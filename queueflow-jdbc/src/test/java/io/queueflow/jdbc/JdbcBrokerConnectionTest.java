package io.queueflow.jdbc;

import io.queueflow.Backoff;
import io.queueflow.JobOptions;
import io.queueflow.jdbc.store.H2QueueStore;
import io.queueflow.model.Job;
import io.queueflow.model.JobReceipt;
import io.queueflow.model.JobRequest;
import io.queueflow.model.JobState;
import io.queueflow.model.RecurringJob;
import io.queueflow.model.RecurringJobRequest;
import org.h2.jdbcx.JdbcDataSource;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.UUID;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

class JdbcBrokerConnectionTest {
    private static final Instant START = Instant.parse("2024-05-01T08:00:00Z");

    private MutableClock clock;
    private JdbcBrokerConnection broker;

    @BeforeEach
    void setUp() {
        JdbcDataSource ds = new JdbcDataSource();
        ds.setURL("jdbc:h2:mem:" + UUID.randomUUID() + ";DB_CLOSE_DELAY=-1");
        H2QueueStore store = new H2QueueStore();
        SchemaInitializer.initialize(ds, store);
        clock = new MutableClock(START);
        broker = (JdbcBrokerConnection) JdbcConnectionFactory.builder()
                .dataSource(ds)
                .store(store)
                .clock(clock)
                .lockTimeout(Duration.ofMinutes(1))
                .build()
                .connect();
    }

    private static JobRequest request(String name, String jobId) {
        return new JobRequest(name, "{\"n\":1}", JobOptions.builder().jobId(jobId).build());
    }

    // ── Enqueue and claim ───────────────────────────────────────────

    @Test
    void enqueuedJobIsClaimedOnce() {
        JobReceipt receipt = broker.enqueue("email", request("email.welcome", "j1"));
        assertFalse(receipt.duplicate());
        assertEquals(START, receipt.createdAt());
        assertEquals(JobState.WAITING, broker.state("email", "j1"));

        List<Job> claimed = broker.claim("email", "c1", 10);
        assertEquals(1, claimed.size());
        Job job = claimed.get(0);
        assertEquals("j1", job.id());
        assertEquals("email", job.queue());
        assertEquals("email.welcome", job.name());
        assertEquals("{\"n\":1}", job.payloadJson());
        assertEquals(1, job.attemptNumber());
        assertEquals(JobState.ACTIVE, broker.state("email", "j1"));

        assertTrue(broker.claim("email", "c2", 10).isEmpty());
    }

    @Test
    void duplicateJobIdReturnsExistingReceipt() {
        broker.enqueue("email", request("email.welcome", "same"));
        clock.advance(Duration.ofSeconds(5));

        JobReceipt second = broker.enqueue("email", request("email.welcome", "same"));
        assertTrue(second.duplicate());
        assertEquals(START, second.createdAt());
        assertEquals(1, broker.claim("email", "c1", 10).size());
    }

    @Test
    void sameJobIdInAnotherQueueIsDistinct() {
        broker.enqueue("email", request("email.welcome", "id"));
        JobReceipt other = broker.enqueue("billing", request("billing.charge", "id"));
        assertFalse(other.duplicate());
    }

    @Test
    void claimRespectsLimitAndOrder() {
        broker.enqueue("email", request("email.welcome", "a"));
        clock.advance(Duration.ofMillis(10));
        broker.enqueue("email", request("email.welcome", "b"));
        clock.advance(Duration.ofMillis(10));
        broker.enqueue("email", request("email.welcome", "c"));

        List<Job> first = broker.claim("email", "c1", 2);
        assertEquals(List.of("a", "b"), first.stream().map(Job::id).toList());
        List<Job> rest = broker.claim("email", "c1", 2);
        assertEquals(List.of("c"), rest.stream().map(Job::id).toList());
        assertTrue(broker.claim("email", "c1", 0).isEmpty());
    }

    @Test
    void claimOnlySeesOwnQueue() {
        broker.enqueue("billing", request("billing.charge", "b1"));
        assertTrue(broker.claim("email", "c1", 10).isEmpty());
    }

    @Test
    void delayedJobWaitsUntilDue() {
        broker.enqueue("email", new JobRequest("email.welcome", "{}",
                JobOptions.builder().jobId("later").delay(Duration.ofSeconds(30)).build()));
        assertEquals(JobState.DELAYED, broker.state("email", "later"));
        assertTrue(broker.claim("email", "c1", 10).isEmpty());

        clock.advance(Duration.ofSeconds(30));
        assertEquals(1, broker.claim("email", "c1", 10).size());
    }

    // ── Acknowledgement ─────────────────────────────────────────────

    @Test
    void completedJobIsNotClaimedAgain() {
        broker.enqueue("email", request("email.welcome", "j1"));
        Job job = broker.claim("email", "c1", 1).get(0);

        broker.complete(job);

        assertEquals(JobState.COMPLETED, broker.state("email", "j1"));
        clock.advance(Duration.ofHours(1));
        assertTrue(broker.claim("email", "c1", 10).isEmpty());
    }

    @Test
    void failedJobRetriesWithBackoffThenFails() {
        broker.enqueue("email", new JobRequest("email.welcome", "{}", JobOptions.builder()
                .jobId("retry")
                .attempts(2)
                .backoff(Backoff.fixed(Duration.ofSeconds(10)))
                .build()));

        Job first = broker.claim("email", "c1", 1).get(0);
        assertEquals(JobState.DELAYED, broker.fail(first, "boom"));
        assertTrue(broker.claim("email", "c1", 1).isEmpty());

        clock.advance(Duration.ofSeconds(10));
        Job second = broker.claim("email", "c1", 1).get(0);
        assertEquals(2, second.attemptNumber());
        assertEquals(JobState.FAILED, broker.fail(second, "boom again"));
        assertEquals(JobState.FAILED, broker.state("email", "retry"));

        clock.advance(Duration.ofDays(1));
        assertTrue(broker.claim("email", "c1", 1).isEmpty());
    }

    @Test
    void singleAttemptJobFailsImmediately() {
        broker.enqueue("email", request("email.welcome", "once"));
        Job job = broker.claim("email", "c1", 1).get(0);
        assertEquals(JobState.FAILED, broker.fail(job, "x".repeat(10_000)));
    }

    @Test
    void stalledJobIsReclaimedAfterLockTimeout() {
        broker.enqueue("email", new JobRequest("email.welcome", "{}",
                JobOptions.builder().jobId("stuck").attempts(2).build()));
        Job job = broker.claim("email", "c1", 1).get(0);

        clock.advance(Duration.ofSeconds(59));
        assertTrue(broker.claim("email", "c2", 1).isEmpty());

        clock.advance(Duration.ofSeconds(2));
        List<Job> reclaimed = broker.claim("email", "c2", 1);
        assertEquals(1, reclaimed.size());
        assertEquals(job.id(), reclaimed.get(0).id());
        assertEquals(job.attemptsMade() + 1, reclaimed.get(0).attemptsMade());
        assertEquals(2, reclaimed.get(0).attemptNumber());
    }

    @Test
    void stalledJobWithoutAttemptsLeftIsFailed() {
        broker.enqueue("email", request("email.welcome", "stuck"));
        Job job = broker.claim("email", "c1", 1).get(0);

        clock.advance(Duration.ofSeconds(61));
        assertTrue(broker.claim("email", "c2", 1).isEmpty());
        assertEquals(JobState.FAILED, broker.state("email", "stuck"));

        // the original holder can no longer complete it
        broker.complete(job);
        assertEquals(JobState.FAILED, broker.state("email", "stuck"));

        clock.advance(Duration.ofMinutes(5));
        assertTrue(broker.claim("email", "c3", 1).isEmpty());
    }

    @Test
    void repeatedlyStalledJobRunsOutOfAttempts() {
        broker.enqueue("email", new JobRequest("email.welcome", "{}",
                JobOptions.builder().jobId("stuck").attempts(2).build()));
        broker.claim("email", "c1", 1);

        clock.advance(Duration.ofSeconds(61));
        assertEquals(1, broker.claim("email", "c2", 1).size());

        clock.advance(Duration.ofSeconds(61));
        assertTrue(broker.claim("email", "c3", 1).isEmpty());
        assertEquals(JobState.FAILED, broker.state("email", "stuck"));
    }

    // ── Recurring registrations ─────────────────────────────────────

    @Test
    void addListAndRemoveRecurring() {
        RecurringJob added = broker.addRecurring("reports",
                new RecurringJobRequest("reports.daily", "reports.daily", "0 9 * * *", null, "{}"));
        assertEquals("reports.daily:reports.daily::0 9 * * *", added.key());
        assertEquals(Instant.parse("2024-05-01T09:00:00Z"), added.nextRunAt());

        List<RecurringJob> listed = broker.listRecurring("reports");
        assertEquals(List.of(added), listed);
        assertTrue(broker.listRecurring("email").isEmpty());

        assertTrue(broker.removeRecurring("reports", added.key()));
        assertFalse(broker.removeRecurring("reports", added.key()));
        assertTrue(broker.listRecurring("reports").isEmpty());
    }

    @Test
    void addingSameKeyReplacesRegistration() {
        RecurringJobRequest request = new RecurringJobRequest("reports.daily", "reports.daily",
                "0 9 * * *", "Europe/Berlin", "{}");
        broker.addRecurring("reports", request);
        broker.addRecurring("reports", request);
        assertEquals(1, broker.listRecurring("reports").size());
        assertEquals("Europe/Berlin", broker.listRecurring("reports").get(0).tz());
    }

    @Test
    void invalidPatternIsRejected() {
        assertThrows(IllegalArgumentException.class, () -> broker.addRecurring("reports",
                new RecurringJobRequest("reports.daily", "reports.daily", "bad", null, "{}")));
        assertThrows(IllegalArgumentException.class, () -> broker.addRecurring("reports",
                new RecurringJobRequest("reports.daily", "reports.daily", "0 9 * * *", "Nowhere/Zone", "{}")));
        assertTrue(broker.listRecurring("reports").isEmpty());
    }

    @Test
    void dueRegistrationFiresOnceAndAdvances() {
        RecurringJob added = broker.addRecurring("reports",
                new RecurringJobRequest("reports.daily", "reports.daily", "0 9 * * *", null, "{\"day\":true}"));
        assertTrue(broker.claim("reports", "c1", 10).isEmpty());

        clock.advance(Duration.ofHours(1));
        List<Job> fired = broker.claim("reports", "c1", 10);
        assertEquals(1, fired.size());
        Job job = fired.get(0);
        assertEquals("reports.daily", job.name());
        assertEquals("{\"day\":true}", job.payloadJson());
        assertEquals("repeat:" + added.key() + ":" + added.nextRunAt().toEpochMilli(), job.id());

        assertEquals(0, broker.materializeDue("reports"));
        assertEquals(Instant.parse("2024-05-02T09:00:00Z"), broker.listRecurring("reports").get(0).nextRunAt());
    }

    @Test
    void missedFiresCollapseIntoOne() {
        broker.addRecurring("reports",
                new RecurringJobRequest("reports.hourly", "reports.hourly", "0 * * * *", null, "{}"));

        clock.advance(Duration.ofHours(5).plusMinutes(30));
        assertEquals(1, broker.materializeDue("reports"));
        assertEquals(Instant.parse("2024-05-01T14:00:00Z"), broker.listRecurring("reports").get(0).nextRunAt());
    }

    // ── Purge ───────────────────────────────────────────────────────

    @Test
    void purgeDeletesOldTerminalJobs() {
        broker.enqueue("email", request("email.welcome", "done"));
        clock.advance(Duration.ofMillis(1));
        broker.enqueue("email", request("email.welcome", "dead"));
        clock.advance(Duration.ofMillis(1));
        broker.enqueue("email", request("email.welcome", "pending"));
        broker.complete(broker.claim("email", "c1", 1).get(0));
        broker.fail(broker.claim("email", "c1", 1).get(0), "boom");

        clock.advance(Duration.ofMinutes(10));
        Instant cutoff = clock.instant().minusSeconds(60);
        assertEquals(1, broker.purge("email", JobState.COMPLETED, cutoff, 100));
        assertEquals(1, broker.purge("email", JobState.FAILED, cutoff, 100));
        assertNull(broker.state("email", "done"));
        assertNull(broker.state("email", "dead"));
        assertEquals(JobState.WAITING, broker.state("email", "pending"));
    }

    @Test
    void purgeKeepsRecentJobsAndHonorsLimit() {
        for (int i = 0; i < 3; i++) {
            broker.enqueue("email", request("email.welcome", "j" + i));
        }
        for (Job job : broker.claim("email", "c1", 3)) {
            broker.complete(job);
        }
        assertEquals(0, broker.purge("email", JobState.COMPLETED, START.minusSeconds(1), 100));
        assertEquals(2, broker.purge("email", JobState.COMPLETED, START.plusSeconds(1), 2));
        assertEquals(1, broker.purge("email", JobState.COMPLETED, START.plusSeconds(1), 2));
    }

    @Test
    void purgeRejectsNonTerminalState() {
        assertThrows(IllegalArgumentException.class,
                () -> broker.purge("email", JobState.WAITING, START, 10));
    }

    // ── Lifecycle ───────────────────────────────────────────────────

    @Test
    void closedConnectionRejectsOperations() {
        broker.close();
        assertThrows(QueueStoreException.class, () -> broker.enqueue("email", request("email.welcome", "j")));
        assertThrows(QueueStoreException.class, () -> broker.claim("email", "c1", 1));
        assertThrows(QueueStoreException.class, () -> broker.listRecurring("email"));
    }
}
