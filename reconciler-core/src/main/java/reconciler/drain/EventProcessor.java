package reconciler.drain;

import reconciler.model.ClaimedEvent;

/**
 * Handles one claimed row. Returning normally marks the row processed; throwing records
 * the failure and schedules a retry.
 *
 * <p>Implementations must be idempotent: a row may be processed more than once, and two
 * rows for the same entity may be processed at the same time.
 *
 * @param <E> row type
 */
@FunctionalInterface
public interface EventProcessor<E extends ClaimedEvent> {

  void process(E event) throws Exception;
}
