package reconciler.util;

import reconciler.spi.ConnectionProvider;

import java.sql.Connection;
import java.sql.SQLException;

/**
 * Runs a unit of work on one connection inside a single transaction.
 */
public final class Transactions {

  private Transactions() {
  }

  /**
   * Work that runs against a connection with auto-commit disabled.
   *
   * @param <T> result type
   */
  @FunctionalInterface
  public interface Work<T> {
    T execute(Connection conn) throws SQLException;
  }

  /**
   * Opens a connection, runs {@code work} and commits. Rolls back and rethrows if the work
   * fails.
   */
  public static <T> T inTransaction(ConnectionProvider connectionProvider, Work<T> work)
      throws SQLException {
    try (Connection conn = connectionProvider.getConnection()) {
      boolean autoCommit = conn.getAutoCommit();
      conn.setAutoCommit(false);
      try {
        T result = work.execute(conn);
        conn.commit();
        return result;
      } catch (SQLException | RuntimeException | Error e) {
        conn.rollback();
        throw e;
      } finally {
        conn.setAutoCommit(autoCommit);
      }
    }
  }

  /**
   * Opens a connection in auto-commit mode and runs {@code work} on it.
   */
  public static <T> T autoCommit(ConnectionProvider connectionProvider, Work<T> work)
      throws SQLException {
    try (Connection conn = connectionProvider.getConnection()) {
      conn.setAutoCommit(true);
      return work.execute(conn);
    }
  }
}
