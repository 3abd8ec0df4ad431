package io.queueflow.registry;

import java.util.Collections;
import java.util.LinkedHashSet;
import java.util.Map;
import java.util.Objects;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Thread-safe registry of task definitions keyed by task id.
 *
 * <p>Registering an id that is already present replaces the previous definition
 * (last write wins). There is no unregister operation.
 *
 * <pre>{@code
 * DefaultTaskRegistry registry = new DefaultTaskRegistry();
 * registry.register(new TaskDefinition<>("email.welcome", "email", Welcome.class,
 *     payload -> mailer.sendWelcome(payload), null, null));
 * }</pre>
 */
public final class DefaultTaskRegistry implements TaskRegistry {

    private final Map<String, TaskDefinition<?>> definitions = new ConcurrentHashMap<>();

    /**
     * Adds or replaces a definition.
     *
     * @param definition the definition
     * @return the definition previously registered under the same id, or {@code null}
     */
    public TaskDefinition<?> register(TaskDefinition<?> definition) {
        Objects.requireNonNull(definition, "definition");
        return definitions.put(definition.id(), definition);
    }

    @Override
    public TaskDefinition<?> find(String taskId) {
        return taskId == null ? null : definitions.get(taskId);
    }

    @Override
    public Set<String> queues() {
        Set<String> queues = new LinkedHashSet<>();
        for (TaskDefinition<?> definition : definitions.values()) {
            queues.add(definition.queue());
        }
        return Collections.unmodifiableSet(queues);
    }

    @Override
    public int concurrencyFor(String queue, int defaultConcurrency) {
        int limit = 0;
        for (TaskDefinition<?> definition : definitions.values()) {
            if (definition.queue().equals(queue) && definition.concurrency() != null) {
                limit = Math.max(limit, definition.concurrency());
            }
        }
        return limit > 0 ? limit : defaultConcurrency;
    }

    /** Number of registered definitions. */
    public int size() {
        return definitions.size();
    }
}
