package io.queueflow;

import java.time.Duration;
import java.util.Objects;

/**
 * Per-job options passed through to the broker verbatim.
 *
 * <p>All fields are optional. {@link #withDefaults(JobOptions)} overlays the values
 * set here on top of a set of defaults; {@link Task#trigger(Object, JobOptions)}
 * uses it to keep a freshly generated job id unless the caller supplies one.
 *
 * <pre>{@code
 * task.trigger(payload, JobOptions.builder()
 *     .delay(Duration.ofSeconds(5))
 *     .attempts(3)
 *     .backoff(Backoff.exponential(Duration.ofSeconds(1)))
 *     .build());
 * }</pre>
 */
public final class JobOptions {
    /** Attempts the broker allows when none are set. */
    public static final int DEFAULT_ATTEMPTS = 1;

    private static final JobOptions NONE = new Builder().build();

    private final String jobId;
    private final Duration delay;
    private final Integer attempts;
    private final Backoff backoff;

    private JobOptions(Builder builder) {
        if (builder.jobId != null && builder.jobId.isBlank()) {
            throw new IllegalArgumentException("jobId cannot be blank");
        }
        if (builder.delay != null && builder.delay.isNegative()) {
            throw new IllegalArgumentException("delay must be >= 0");
        }
        if (builder.attempts != null && builder.attempts < 1) {
            throw new IllegalArgumentException("attempts must be >= 1");
        }
        this.jobId = builder.jobId;
        this.delay = builder.delay;
        this.attempts = builder.attempts;
        this.backoff = builder.backoff;
    }

    public static Builder builder() {
        return new Builder();
    }

    /** Returns options with nothing set. */
    public static JobOptions none() {
        return NONE;
    }

    /** Explicit job id (idempotency key), or {@code null}. */
    public String jobId() {
        return jobId;
    }

    /** Delay before the job becomes eligible, or {@code null}. */
    public Duration delay() {
        return delay;
    }

    /** Maximum delivery attempts, or {@code null}. */
    public Integer attempts() {
        return attempts;
    }

    /** Retry delay policy, or {@code null}. */
    public Backoff backoff() {
        return backoff;
    }

    /** Delay in milliseconds, {@code 0} when unset. */
    public long delayMs() {
        return delay == null ? 0L : delay.toMillis();
    }

    /** Attempts, {@link #DEFAULT_ATTEMPTS} when unset. */
    public int effectiveAttempts() {
        return attempts == null ? DEFAULT_ATTEMPTS : attempts;
    }

    /**
     * Returns a copy in which every field not set on this instance is taken from {@code defaults}.
     *
     * @param defaults the values to fall back to
     * @return merged options
     */
    public JobOptions withDefaults(JobOptions defaults) {
        Objects.requireNonNull(defaults, "defaults");
        return new Builder()
                .jobId(jobId != null ? jobId : defaults.jobId)
                .delay(delay != null ? delay : defaults.delay)
                .attempts(attempts != null ? attempts : defaults.attempts)
                .backoff(backoff != null ? backoff : defaults.backoff)
                .build();
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof JobOptions that)) return false;
        return Objects.equals(jobId, that.jobId)
                && Objects.equals(delay, that.delay)
                && Objects.equals(attempts, that.attempts)
                && Objects.equals(backoff, that.backoff);
    }

    @Override
    public int hashCode() {
        return Objects.hash(jobId, delay, attempts, backoff);
    }

    @Override
    public String toString() {
        return "JobOptions{jobId=" + jobId + ", delay=" + delay
                + ", attempts=" + attempts + ", backoff=" + backoff + "}";
    }

    /** Builder for {@link JobOptions}. */
    public static final class Builder {
        private String jobId;
        private Duration delay;
        private Integer attempts;
        private Backoff backoff;

        private Builder() {
        }

        public Builder jobId(String jobId) {
            this.jobId = jobId;
            return this;
        }

        public Builder delay(Duration delay) {
            this.delay = delay;
            return this;
        }

        public Builder attempts(Integer attempts) {
            this.attempts = attempts;
            return this;
        }

        public Builder backoff(Backoff backoff) {
            this.backoff = backoff;
            return this;
        }

        public JobOptions build() {
            return new JobOptions(this);
        }
    }
}
