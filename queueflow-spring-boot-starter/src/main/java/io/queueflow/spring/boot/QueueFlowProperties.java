package io.queueflow.spring.boot;

import org.springframework.boot.context.properties.ConfigurationProperties;

import java.time.Duration;

/**
 * Configuration properties for QueueFlow.
 *
 * @see QueueFlowAutoConfiguration
 */
@ConfigurationProperties(prefix = "queueflow")
public class QueueFlowProperties {

    /**
     * Queue used by task ids without a namespace.
     */
    private String defaultQueue = "default";

    private final Worker worker = new Worker();
    private final Jdbc jdbc = new Jdbc();
    private final Retention retention = new Retention();
    private final Metrics metrics = new Metrics();

    public String getDefaultQueue() {
        return defaultQueue;
    }

    public void setDefaultQueue(String defaultQueue) {
        this.defaultQueue = defaultQueue;
    }

    public Worker getWorker() {
        return worker;
    }

    public Jdbc getJdbc() {
        return jdbc;
    }

    public Retention getRetention() {
        return retention;
    }

    public Metrics getMetrics() {
        return metrics;
    }

    public static class Worker {
        /**
         * Concurrency of queues whose tasks set none.
         */
        private int defaultConcurrency = 5;

        /**
         * Wait between claims when a queue is empty.
         */
        private long pollIntervalMs = 1000;

        /**
         * How long stopping waits for running handlers.
         */
        private long drainTimeoutMs = 5000;

        /**
         * How long a job may stay locked by a consumer before another may reclaim it.
         */
        private Duration lockTimeout = Duration.ofMinutes(5);

        /**
         * Start consuming once the application context is refreshed instead of on the
         * first trigger or schedule.
         */
        private boolean autoStart = false;

        public int getDefaultConcurrency() {
            return defaultConcurrency;
        }

        public void setDefaultConcurrency(int defaultConcurrency) {
            this.defaultConcurrency = defaultConcurrency;
        }

        public long getPollIntervalMs() {
            return pollIntervalMs;
        }

        public void setPollIntervalMs(long pollIntervalMs) {
            this.pollIntervalMs = pollIntervalMs;
        }

        public long getDrainTimeoutMs() {
            return drainTimeoutMs;
        }

        public void setDrainTimeoutMs(long drainTimeoutMs) {
            this.drainTimeoutMs = drainTimeoutMs;
        }

        public Duration getLockTimeout() {
            return lockTimeout;
        }

        public void setLockTimeout(Duration lockTimeout) {
            this.lockTimeout = lockTimeout;
        }

        public boolean isAutoStart() {
            return autoStart;
        }

        public void setAutoStart(boolean autoStart) {
            this.autoStart = autoStart;
        }
    }

    public static class Jdbc {
        /**
         * Prefix of the job and recurring job tables.
         */
        private String tablePrefix = "queueflow";

        /**
         * Create the tables on startup if they do not exist.
         */
        private boolean initializeSchema = false;

        public String getTablePrefix() {
            return tablePrefix;
        }

        public void setTablePrefix(String tablePrefix) {
            this.tablePrefix = tablePrefix;
        }

        public boolean isInitializeSchema() {
            return initializeSchema;
        }

        public void setInitializeSchema(boolean initializeSchema) {
            this.initializeSchema = initializeSchema;
        }
    }

    public static class Retention {
        /**
         * Age after which completed jobs are purged.
         */
        private Duration completed = Duration.ofSeconds(100);

        /**
         * Age after which failed jobs are purged.
         */
        private Duration failed = Duration.ofSeconds(500);

        private long intervalSeconds = 60;

        public Duration getCompleted() {
            return completed;
        }

        public void setCompleted(Duration completed) {
            this.completed = completed;
        }

        public Duration getFailed() {
            return failed;
        }

        public void setFailed(Duration failed) {
            this.failed = failed;
        }

        public long getIntervalSeconds() {
            return intervalSeconds;
        }

        public void setIntervalSeconds(long intervalSeconds) {
            this.intervalSeconds = intervalSeconds;
        }
    }

    public static class Metrics {
        private boolean enabled = true;
        private String namePrefix = "queueflow";

        public boolean isEnabled() {
            return enabled;
        }

        public void setEnabled(boolean enabled) {
            this.enabled = enabled;
        }

        public String getNamePrefix() {
            return namePrefix;
        }

        public void setNamePrefix(String namePrefix) {
            this.namePrefix = namePrefix;
        }
    }
}
