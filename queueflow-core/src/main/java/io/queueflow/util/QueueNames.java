package io.queueflow.util;

import java.util.Objects;

/**
 * Queue name resolution for task declarations.
 *
 * <ol>
 *   <li>an explicit queue wins;</li>
 *   <li>otherwise the part of the task id before its first {@code '.'}, if that part is
 *       not empty;</li>
 *   <li>otherwise the configured default queue ({@value #DEFAULT_QUEUE} when unset).</li>
 * </ol>
 */
public final class QueueNames {
    public static final String DEFAULT_QUEUE = "default";
    public static final char NAMESPACE_SEPARATOR = '.';

    private QueueNames() {
    }

    /**
     * @param explicitQueue queue set on the declaration, may be {@code null}
     * @param taskId        the task id
     * @param defaultQueue  the configured default queue
     * @return the effective queue name
     */
    public static String resolve(String explicitQueue, String taskId, String defaultQueue) {
        Objects.requireNonNull(taskId, "taskId");
        if (explicitQueue != null && !explicitQueue.isEmpty()) {
            return explicitQueue;
        }
        int separator = taskId.indexOf(NAMESPACE_SEPARATOR);
        if (separator > 0) {
            return taskId.substring(0, separator);
        }
        return defaultQueue == null || defaultQueue.isEmpty() ? DEFAULT_QUEUE : defaultQueue;
    }
}
