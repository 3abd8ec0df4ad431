package io.queueflow;

import io.queueflow.model.RecurringJob;
import io.queueflow.registry.TaskDefinition;

import java.util.Objects;
import java.util.concurrent.CompletableFuture;

/**
 * Handle to a declared recurring task. It has no trigger; jobs are produced by the
 * broker from the recurring registration installed at declaration time.
 *
 * <p>Installation runs in the background. {@link #installation()} exposes its
 * outcome: callers that need to know the schedule is in place can wait on it.
 *
 * @param <T> the payload type
 */
public final class ScheduledTask<T> {
    private final TaskDefinition<T> definition;
    private final String cron;
    private final String tz;
    private final CompletableFuture<RecurringJob> installation;

    ScheduledTask(TaskDefinition<T> definition, String cron, String tz,
            CompletableFuture<RecurringJob> installation) {
        this.definition = Objects.requireNonNull(definition, "definition");
        this.cron = Objects.requireNonNull(cron, "cron");
        this.tz = tz;
        this.installation = Objects.requireNonNull(installation, "installation");
    }

    public String id() {
        return definition.id();
    }

    public String queue() {
        return definition.queue();
    }

    public String cron() {
        return cron;
    }

    /** IANA zone id, or {@code null} for UTC. */
    public String tz() {
        return tz;
    }

    public TaskDefinition<T> definition() {
        return definition;
    }

    /**
     * Completes with the installed registration once reconciliation finishes, or
     * exceptionally if it failed. The returned future is a copy; completing it has
     * no effect on the installation.
     */
    public CompletableFuture<RecurringJob> installation() {
        return installation.copy();
    }

    @Override
    public String toString() {
        return "ScheduledTask{id=" + id() + ", queue=" + queue() + ", cron=" + cron
                + (tz == null ? "" : ", tz=" + tz) + "}";
    }
}
