package io.queueflow.util;

import com.github.f4b6a3.ulid.UlidCreator;

import java.util.Locale;

/**
 * Generates job and consumer identifiers.
 */
public final class JobIds {

    private JobIds() {
    }

    /**
     * Returns a fresh job id for a task: {@code <taskId>-<epochMillis>-<suffix>}.
     * The suffix is the random part of a monotonic ULID, so ids generated in the
     * same millisecond never collide.
     */
    public static String next(String taskId) {
        String ulid = UlidCreator.getMonotonicUlid().toString();
        // the first 10 characters of a ULID encode the timestamp
        return taskId + "-" + System.currentTimeMillis() + "-" + ulid.substring(10).toLowerCase(Locale.ROOT);
    }

    /**
     * Returns a consumer id unique to this process for the given queue.
     */
    public static String consumer(String queue) {
        return queue + "-" + UlidCreator.getUlid().toString().toLowerCase(Locale.ROOT);
    }
}
