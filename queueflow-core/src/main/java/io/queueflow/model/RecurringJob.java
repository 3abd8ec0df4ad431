package io.queueflow.model;

import java.time.Instant;

/**
 * A recurring job registration installed in a queue.
 *
 * @param key       unique key of the registration ({@code name:id:tz:pattern})
 * @param id        stable job id the registration was installed with
 * @param name      task id the materialized jobs are routed to
 * @param queue     owning queue
 * @param pattern   cron pattern
 * @param tz        IANA time zone id, or {@code null} for UTC
 * @param nextRunAt next fire time, or {@code null} if not yet computed
 */
public record RecurringJob(
    String key,
    String id,
    String name,
    String queue,
    String pattern,
    String tz,
    Instant nextRunAt
) {

    /**
     * Whether this registration belongs to the given task, matched by id or by name.
     */
    public boolean belongsTo(String taskId) {
        return taskId.equals(id) || taskId.equals(name);
    }
}
