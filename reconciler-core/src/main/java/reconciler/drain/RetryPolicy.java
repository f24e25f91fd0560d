package reconciler.drain;

/**
 * Computes how long a failed row waits before it can be claimed again.
 *
 * @see ExponentialBackoffRetryPolicy
 */
@FunctionalInterface
public interface RetryPolicy {

  /**
   * @param attempts attempts made so far, including the one that just failed (1-based)
   * @return delay in milliseconds (non-negative)
   */
  long computeDelayMs(int attempts);
}
