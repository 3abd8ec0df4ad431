package io.queueflow;

import java.time.Duration;
import java.util.Objects;

/**
 * Retry delay policy attached to a job and applied by the broker when a delivery
 * attempt fails and attempts remain.
 *
 * <ul>
 *   <li>{@link Type#FIXED} waits {@code delayMs} between attempts.</li>
 *   <li>{@link Type#EXPONENTIAL} waits {@code delayMs * 2^(attemptsMade-1)}, saturating at
 *       {@link Long#MAX_VALUE}.</li>
 * </ul>
 *
 * @param type    the policy type
 * @param delayMs base delay in milliseconds (&ge; 0)
 */
public record Backoff(Type type, long delayMs) {

    public enum Type {
        FIXED,
        EXPONENTIAL
    }

    public Backoff {
        Objects.requireNonNull(type, "type");
        if (delayMs < 0) {
            throw new IllegalArgumentException("delayMs must be >= 0, got: " + delayMs);
        }
    }

    public static Backoff fixed(Duration delay) {
        return new Backoff(Type.FIXED, Objects.requireNonNull(delay, "delay").toMillis());
    }

    public static Backoff exponential(Duration delay) {
        return new Backoff(Type.EXPONENTIAL, Objects.requireNonNull(delay, "delay").toMillis());
    }

    /**
     * Computes the delay before the next attempt.
     *
     * @param attemptsMade attempts already made, including the one that just failed (1-based)
     * @return delay in milliseconds (non-negative)
     */
    public long delayMsFor(int attemptsMade) {
        if (attemptsMade <= 0 || delayMs == 0) {
            return 0L;
        }
        if (type == Type.FIXED) {
            return delayMs;
        }
        if (attemptsMade >= 63) {
            return Long.MAX_VALUE;
        }
        long factor = 1L << (attemptsMade - 1);
        // Saturate instead of overflowing
        if (factor > Long.MAX_VALUE / delayMs) {
            return Long.MAX_VALUE;
        }
        return delayMs * factor;
    }
}
