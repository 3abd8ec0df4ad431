package io.queueflow.jdbc.store;

import io.queueflow.jdbc.JdbcTemplate;
import io.queueflow.model.Job;
import io.queueflow.model.JobState;

import java.sql.Connection;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * MySQL 8 queue store. Also compatible with TiDB.
 *
 * <p>Claims by locking candidate rows with {@code SELECT ... FOR UPDATE SKIP LOCKED},
 * then updating them by id; the caller must run {@link #claim} inside a transaction.
 * Purges use {@code DELETE ... ORDER BY ... LIMIT} since MySQL rejects LIMIT in an
 * IN subquery.
 */
public final class MySqlQueueStore extends AbstractJdbcQueueStore {

    public MySqlQueueStore() {
        super();
    }

    public MySqlQueueStore(String tablePrefix) {
        super(tablePrefix);
    }

    @Override
    public AbstractJdbcQueueStore withTablePrefix(String tablePrefix) {
        return new MySqlQueueStore(tablePrefix);
    }

    @Override
    public String name() {
        return "mysql";
    }

    @Override
    public List<String> jdbcUrlPrefixes() {
        return List.of("jdbc:mysql:", "jdbc:tidb:");
    }

    @Override
    public List<Job> claim(Connection conn, String queue, String lockToken, Instant now,
            Instant lockExpiry, int limit) {
        failExhaustedStalled(conn, queue, now, lockExpiry);
        String selectSql = "SELECT job_id FROM " + jobTable() + " WHERE queue=? AND " + CLAIMABLE +
                " ORDER BY available_at, created_at LIMIT ? FOR UPDATE SKIP LOCKED";
        List<String> ids = JdbcTemplate.query(conn, selectSql, rs -> rs.getString("job_id"),
                queue, now, lockExpiry, limit);
        if (ids.isEmpty()) {
            return List.of();
        }
        String placeholders = String.join(",", Collections.nCopies(ids.size(), "?"));
        String updateSql = "UPDATE " + jobTable() + " SET " + COUNT_STALLED_ATTEMPT +
                ", state=" + JobState.ACTIVE.code() + ", locked_by=?, locked_at=? WHERE queue=? AND job_id IN (" + placeholders + ")";
        List<Object> params = new ArrayList<>();
        params.add(lockToken);
        params.add(now);
        params.add(queue);
        params.addAll(ids);
        JdbcTemplate.update(conn, updateSql, params.toArray());
        return selectClaimed(conn, queue, lockToken);
    }

    @Override
    public int purge(Connection conn, String queue, JobState state, Instant olderThan, int limit) {
        String sql = "DELETE FROM " + jobTable() +
                " WHERE queue=? AND state=? AND finished_at < ? ORDER BY finished_at LIMIT ?";
        return JdbcTemplate.update(conn, sql, queue, state.code(), olderThan, limit);
    }
}
