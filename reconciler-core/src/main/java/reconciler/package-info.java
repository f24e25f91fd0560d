/**
 * Root API of the schedule reconciler: keeps an external scheduler in line with the
 * reminders and task rollovers stored in a relational database.
 *
 * <h2>Core Design</h2>
 * <p>Application code records a sync intent via {@link reconciler.IntentWriter} in the same
 * transaction that changes a reminder or task. The outbox drainer claims intents, reads the
 * current row, {@linkplain reconciler.compile.DesiredStateCompiler compiles} it to a desired
 * schedule and applies that through the idempotent
 * {@linkplain reconciler.gateway.ScheduleGateway gateway}. The scheduler reports fires and
 * exhaustion back through {@link reconciler.feedback.FireCallbackReceiver} into the inbox,
 * whose drainer folds them into storage. An {@linkplain reconciler.sweep.ExpirySweeper expiry
 * sweep} retires reminders whose window has ended.
 *
 * <p>Every step is safe to repeat: delivery is at-least-once and the system converges to the
 * stored state.
 *
 * <h2>Module Layout</h2>
 * <ul>
 *   <li><b>reconciler-core</b>: model, compiler, gateway, drainers, SPIs (zero external deps)</li>
 *   <li><b>reconciler-jdbc</b>: JDBC stores and SQL dialects (H2, PostgreSQL)</li>
 *   <li><b>reconciler-micrometer</b>: Micrometer {@link reconciler.spi.MetricsExporter}</li>
 *   <li><b>reconciler-spring-boot-starter</b>: auto-configuration bound from {@code reconciler.*}</li>
 * </ul>
 *
 * <h2>Quick Start</h2>
 * <pre>{@code
 * var connProvider = new DataSourceConnectionProvider(dataSource);
 * var stores = JdbcStores.detect(dataSource);
 *
 * try (Reconciler reconciler = Reconciler.builder()
 *     .connectionProvider(connProvider)
 *     .outboxStore(stores.outbox())
 *     .inboxStore(stores.inbox())
 *     .definitionReader(stores.reader())
 *     .definitionWriter(stores.writer())
 *     .schedulerClient(myClient)
 *     .build()) {
 *   reconciler.start();
 * }
 * }</pre>
 */
package reconciler;
