/**
 * JDBC implementations of the reconciler's store SPIs.
 *
 * <p>{@link reconciler.jdbc.JdbcStores} bundles the outbox, inbox and definition stores
 * for one database. Claims go through a {@link reconciler.jdbc.spi.Dialect} discovered via
 * {@link java.util.ServiceLoader}; schema scripts live under {@code schema/} on the classpath.
 */
package reconciler.jdbc;
