/**
 * Declaration API for queueflow: named tasks executed by a background worker
 * against a durable, broker-backed queue.
 *
 * <h2>Core Design</h2>
 * <p>Tasks are declared on a {@link io.queueflow.QueueFlow} instance. Declaring is
 * in-memory only; each task is bound to a queue resolved from its explicit
 * {@code queue}, else the prefix of its id before the first {@code '.'}, else the
 * configured default queue. {@link io.queueflow.Task#trigger(Object, io.queueflow.JobOptions)}
 * enqueues a job and starts the {@linkplain io.queueflow.worker.WorkerEngine worker}
 * in the background. The worker runs one
 * {@linkplain io.queueflow.worker.QueueConsumer consumer} per queue, each with its own
 * concurrency limit, and routes every delivered job to the handler registered under
 * the job's name.
 *
 * <p>Recurring tasks are declared with
 * {@link io.queueflow.QueueFlow#scheduleTask(io.queueflow.ScheduledTaskConfig)}. Each
 * declaration replaces whatever registration was installed under the same id, so
 * redeploying with a new cron never leaves two schedules behind.
 *
 * <p>Retries, backoff and delays are requested through {@link io.queueflow.JobOptions}
 * and applied by the broker. Delivery is at-least-once.
 *
 * <h2>Module Layout</h2>
 * <ul>
 *   <li><b>queueflow-core</b> - declaration API, worker, SPIs, Jackson payload codec</li>
 *   <li><b>queueflow-jdbc</b> - table-backed broker (H2, MySQL, PostgreSQL)</li>
 *   <li><b>queueflow-micrometer</b> - Micrometer metrics exporter</li>
 *   <li><b>queueflow-spring-boot-starter</b> - auto-configuration</li>
 * </ul>
 *
 * <h2>Quick Start</h2>
 * <pre>{@code
 * try (QueueFlow queueFlow = QueueFlow.builder()
 *     .connectionFactory(new JdbcConnectionFactory(dataSource))
 *     .build()) {
 *
 *     Task<Welcome> welcome = queueFlow.defineTask(
 *         TaskConfig.builder("email.welcome", Welcome.class)
 *             .run(payload -> mailer.sendWelcome(payload.userId()))
 *             .onError((error, payload) -> audit.record(payload, error))
 *             .build());
 *
 *     queueFlow.scheduleTask(ScheduledTaskConfig.builder("reports.daily", "0 9 * * *")
 *         .run(ignored -> reports.buildDaily())
 *         .build());
 *
 *     welcome.trigger(new Welcome("1"));
 * }
 * }</pre>
 *
 * @see io.queueflow.QueueFlow
 * @see io.queueflow.Task
 * @see io.queueflow.ScheduledTask
 * @see io.queueflow.JobOptions
 */
package io.queueflow;
