package io.queueflow;

import java.util.Objects;

/**
 * Declaration of a one-shot task, passed to {@link QueueFlow#defineTask(TaskConfig)}.
 *
 * <pre>{@code
 * Task<Welcome> welcome = queueFlow.defineTask(
 *     TaskConfig.builder("email.welcome", Welcome.class)
 *         .run(payload -> mailer.sendWelcome(payload.userId()))
 *         .build());
 * }</pre>
 *
 * @param <T> the payload type
 */
public final class TaskConfig<T> {
    private final String id;
    private final Class<T> payloadType;
    private final String queue;
    private final TaskHandler<T> handler;
    private final TaskErrorHandler<T> errorHandler;
    private final Integer concurrency;

    private TaskConfig(Builder<T> builder) {
        this.id = Objects.requireNonNull(builder.id, "id");
        this.payloadType = Objects.requireNonNull(builder.payloadType, "payloadType");
        this.handler = Objects.requireNonNull(builder.handler, "run");
        if (id.isBlank()) {
            throw new IllegalArgumentException("id cannot be blank");
        }
        if (builder.concurrency != null && builder.concurrency < 1) {
            throw new IllegalArgumentException("concurrency must be >= 1");
        }
        this.queue = builder.queue;
        this.errorHandler = builder.errorHandler;
        this.concurrency = builder.concurrency;
    }

    public static <T> Builder<T> builder(String id, Class<T> payloadType) {
        return new Builder<>(id, payloadType);
    }

    public String id() {
        return id;
    }

    public Class<T> payloadType() {
        return payloadType;
    }

    /** Explicit queue, or {@code null} to derive it from the id. */
    public String queue() {
        return queue;
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

    /** Builder for {@link TaskConfig}. */
    public static final class Builder<T> {
        private final String id;
        private final Class<T> payloadType;
        private String queue;
        private TaskHandler<T> handler;
        private TaskErrorHandler<T> errorHandler;
        private Integer concurrency;

        private Builder(String id, Class<T> payloadType) {
            this.id = id;
            this.payloadType = payloadType;
        }

        /**
         * Sets the queue explicitly.
         *
         * <p>Optional. Defaults to the id's prefix before the first {@code '.'}, else
         * the configured default queue.
         */
        public Builder<T> queue(String queue) {
            this.queue = queue;
            return this;
        }

        /**
         * Sets the task logic.
         *
         * <p><b>Required.</b>
         */
        public Builder<T> run(TaskHandler<T> handler) {
            this.handler = handler;
            return this;
        }

        /** Optional callback invoked after a failed attempt. */
        public Builder<T> onError(TaskErrorHandler<T> errorHandler) {
            this.errorHandler = errorHandler;
            return this;
        }

        /** Optional concurrency limit for the queue's consumer. Must be &ge; 1. */
        public Builder<T> concurrency(int concurrency) {
            this.concurrency = concurrency;
            return this;
        }

        public TaskConfig<T> build() {
            return new TaskConfig<>(this);
        }
    }
}
