package reconciler.quarantine;

import reconciler.model.ClaimedEvent;
import reconciler.spi.ClaimQueue;
import reconciler.spi.ConnectionProvider;

import java.sql.Connection;
import java.sql.SQLException;
import java.time.Clock;
import java.util.List;
import java.util.Objects;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Convenience facade for listing, counting and replaying quarantined rows of one queue.
 *
 * <p>Manages connection lifecycle internally using a {@link ConnectionProvider}. Replay
 * resets a row's attempts and makes it immediately claimable again.
 *
 * @param <E> row type
 * @see ClaimQueue#queryQuarantined
 * @see ClaimQueue#replayQuarantined
 */
public final class QuarantineManager<E extends ClaimedEvent> {
  private static final Logger logger = Logger.getLogger(QuarantineManager.class.getName());

  private final ConnectionProvider connectionProvider;
  private final ClaimQueue<E> queue;
  private final Clock clock;

  public QuarantineManager(ConnectionProvider connectionProvider, ClaimQueue<E> queue) {
    this(connectionProvider, queue, Clock.systemUTC());
  }

  public QuarantineManager(ConnectionProvider connectionProvider, ClaimQueue<E> queue, Clock clock) {
    this.connectionProvider = Objects.requireNonNull(connectionProvider, "connectionProvider");
    this.queue = Objects.requireNonNull(queue, "queue");
    this.clock = Objects.requireNonNull(clock, "clock");
  }

  /**
   * @return quarantined rows, oldest first
   */
  public List<E> list(int limit) {
    try (Connection conn = connectionProvider.getConnection()) {
      return queue.queryQuarantined(conn, limit);
    } catch (SQLException e) {
      logger.log(Level.SEVERE, "Failed to query quarantined rows", e);
      return List.of();
    }
  }

  /**
   * @return {@code true} if the row was replayed, {@code false} if missing or not quarantined
   */
  public boolean replay(long id) {
    try (Connection conn = connectionProvider.getConnection()) {
      return queue.replayQuarantined(conn, id, clock.instant()) > 0;
    } catch (SQLException e) {
      logger.log(Level.SEVERE, "Failed to replay quarantined row " + id, e);
      return false;
    }
  }

  /**
   * Replays every quarantined row, {@code batchSize} at a time.
   *
   * @return total number of rows replayed
   */
  public int replayAll(int batchSize) {
    if (batchSize <= 0) {
      throw new IllegalArgumentException("batchSize must be > 0");
    }
    int total = 0;
    List<E> batch;
    do {
      int replayed = 0;
      try (Connection conn = connectionProvider.getConnection()) {
        batch = queue.queryQuarantined(conn, batchSize);
        for (E event : batch) {
          if (queue.replayQuarantined(conn, event.id(), clock.instant()) > 0) {
            replayed++;
          }
        }
      } catch (SQLException e) {
        logger.log(Level.SEVERE, "Failed to replay quarantined batch", e);
        break;
      }
      total += replayed;
      if (replayed == 0) {
        break;
      }
    } while (batch.size() >= batchSize);
    if (total > 0) {
      logger.log(Level.INFO, "Replayed {0} quarantined rows", total);
    }
    return total;
  }

  public int count() {
    try (Connection conn = connectionProvider.getConnection()) {
      return queue.countQuarantined(conn);
    } catch (SQLException e) {
      logger.log(Level.SEVERE, "Failed to count quarantined rows", e);
      return 0;
    }
  }
}
