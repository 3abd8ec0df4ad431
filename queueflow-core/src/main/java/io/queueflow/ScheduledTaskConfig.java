package io.queueflow;

import java.util.Objects;

/**
 * Declaration of a recurring task, passed to {@link QueueFlow#scheduleTask(ScheduledTaskConfig)}.
 *
 * <p>The cron pattern has 5 fields (minute precision) or 6 fields (leading seconds)
 * and is evaluated in {@code tz}, UTC when unset. Pattern and zone are validated
 * by the broker when the schedule is installed.
 *
 * <pre>{@code
 * queueFlow.scheduleTask(ScheduledTaskConfig.builder("reports.daily", "0 9 * * *")
 *     .tz("Europe/Berlin")
 *     .run(ignored -> reports.buildDaily())
 *     .build());
 * }</pre>
 *
 * @param <T> the payload type carried by every materialized job
 */
public final class ScheduledTaskConfig<T> {
    private final String id;
    private final String cron;
    private final Class<T> payloadType;
    private final T payload;
    private final String queue;
    private final String tz;
    private final TaskHandler<T> handler;
    private final TaskErrorHandler<T> errorHandler;
    private final Integer concurrency;

    private ScheduledTaskConfig(Builder<T> builder) {
        this.id = Objects.requireNonNull(builder.id, "id");
        this.cron = Objects.requireNonNull(builder.cron, "cron");
        this.payloadType = Objects.requireNonNull(builder.payloadType, "payloadType");
        this.handler = Objects.requireNonNull(builder.handler, "run");
        if (id.isBlank()) {
            throw new IllegalArgumentException("id cannot be blank");
        }
        if (cron.isBlank()) {
            throw new IllegalArgumentException("cron cannot be blank");
        }
        if (builder.tz != null && builder.tz.isBlank()) {
            throw new IllegalArgumentException("tz cannot be blank");
        }
        if (builder.concurrency != null && builder.concurrency < 1) {
            throw new IllegalArgumentException("concurrency must be >= 1");
        }
        this.payload = builder.payload;
        this.queue = builder.queue;
        this.tz = builder.tz;
        this.errorHandler = builder.errorHandler;
        this.concurrency = builder.concurrency;
    }

    /** Starts a declaration whose jobs carry no payload. */
    public static Builder<Void> builder(String id, String cron) {
        return new Builder<>(id, cron, Void.class);
    }

    /** Starts a declaration whose jobs carry a fixed payload of the given type. */
    public static <T> Builder<T> builder(String id, String cron, Class<T> payloadType) {
        return new Builder<>(id, cron, payloadType);
    }

    public String id() {
        return id;
    }

    public String cron() {
        return cron;
    }

    public Class<T> payloadType() {
        return payloadType;
    }

    /** Payload of every materialized job, or {@code null}. */
    public T payload() {
        return payload;
    }

    public String queue() {
        return queue;
    }

    /** IANA zone id, or {@code null} for UTC. */
    public String tz() {
        return tz;
    }

    public TaskHandler<T> handler() {
        return handler;
    }

    public TaskErrorHandler<T> errorHandler() {
        return errorHandler;
    }

    public Integer concurrency() {
        return concurrency;
    }

    /** Builder for {@link ScheduledTaskConfig}. */
    public static final class Builder<T> {
        private final String id;
        private final String cron;
        private final Class<T> payloadType;
        private T payload;
        private String queue;
        private String tz;
        private TaskHandler<T> handler;
        private TaskErrorHandler<T> errorHandler;
        private Integer concurrency;

        private Builder(String id, String cron, Class<T> payloadType) {
            this.id = id;
            this.cron = cron;
            this.payloadType = payloadType;
        }

        public Builder<T> payload(T payload) {
            this.payload = payload;
            return this;
        }

        public Builder<T> queue(String queue) {
            this.queue = queue;
            return this;
        }

        public Builder<T> tz(String tz) {
            this.tz = tz;
            return this;
        }

        /** <b>Required.</b> */
        public Builder<T> run(TaskHandler<T> handler) {
            this.handler = handler;
            return this;
        }

        public Builder<T> onError(TaskErrorHandler<T> errorHandler) {
            this.errorHandler = errorHandler;
            return this;
        }

        public Builder<T> concurrency(int concurrency) {
            this.concurrency = concurrency;
            return this;
        }

        public ScheduledTaskConfig<T> build() {
            return new ScheduledTaskConfig<>(this);
        }
    }
}
