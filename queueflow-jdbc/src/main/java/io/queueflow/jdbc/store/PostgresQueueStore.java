package io.queueflow.jdbc.store;

import io.queueflow.jdbc.JdbcTemplate;
import io.queueflow.model.Job;
import io.queueflow.model.JobState;

import java.sql.Connection;
import java.time.Instant;
import java.util.List;

/**
 * PostgreSQL queue store.
 *
 * <p>Uses {@code FOR UPDATE SKIP LOCKED} with {@code RETURNING} for a
 * single-round-trip claim, so concurrent consumers never claim the same row.
 */
public final class PostgresQueueStore extends AbstractJdbcQueueStore {

    public PostgresQueueStore() {
        super();
    }

    public PostgresQueueStore(String tablePrefix) {
        super(tablePrefix);
    }

    @Override
    public AbstractJdbcQueueStore withTablePrefix(String tablePrefix) {
        return new PostgresQueueStore(tablePrefix);
    }

    @Override
    public String name() {
        return "postgresql";
    }

    @Override
    public List<String> jdbcUrlPrefixes() {
        return List.of("jdbc:postgresql:");
    }

    @Override
    public List<Job> claim(Connection conn, String queue, String lockToken, Instant now,
            Instant lockExpiry, int limit) {
        failExhaustedStalled(conn, queue, now, lockExpiry);
        String sql = "UPDATE " + jobTable() + " SET " + COUNT_STALLED_ATTEMPT +
                ", state=" + JobState.ACTIVE.code() + ", locked_by=?, locked_at=? WHERE queue=? AND job_id IN (" +
                "SELECT job_id FROM " + jobTable() + " WHERE queue=? AND " + CLAIMABLE +
                " ORDER BY available_at, created_at LIMIT ?" +
                " FOR UPDATE SKIP LOCKED" +
                ") RETURNING " + JOB_COLUMNS;
        return JdbcTemplate.updateReturning(conn, sql, JOB_ROW_MAPPER,
                lockToken, now, queue, queue, now, lockExpiry, limit);
    }
}
