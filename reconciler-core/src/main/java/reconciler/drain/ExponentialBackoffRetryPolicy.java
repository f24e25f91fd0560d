package reconciler.drain;

/**
 * Deterministic exponential backoff: {@code min(maxDelay, baseDelay * 2^(attempts-1))}.
 *
 * <p>With the defaults (1 s base, 300 s cap) attempt 1 waits 1 s, attempt 4 waits 8 s and
 * attempt 10 onwards waits 300 s. The delay never decreases as attempts grow.
 */
public final class ExponentialBackoffRetryPolicy implements RetryPolicy {
  public static final long DEFAULT_BASE_DELAY_MS = 1_000L;
  public static final long DEFAULT_MAX_DELAY_MS = 300_000L;

  private final long baseDelayMs;
  private final long maxDelayMs;

  public ExponentialBackoffRetryPolicy() {
    this(DEFAULT_BASE_DELAY_MS, DEFAULT_MAX_DELAY_MS);
  }

  /**
   * @param baseDelayMs delay after the first failed attempt (milliseconds)
   * @param maxDelayMs  upper bound for any delay (milliseconds)
   */
  public ExponentialBackoffRetryPolicy(long baseDelayMs, long maxDelayMs) {
    if (baseDelayMs <= 0) {
      throw new IllegalArgumentException("baseDelayMs must be > 0, got: " + baseDelayMs);
    }
    if (maxDelayMs < baseDelayMs) {
      throw new IllegalArgumentException("maxDelayMs must be >= baseDelayMs, got: " + maxDelayMs);
    }
    this.baseDelayMs = baseDelayMs;
    this.maxDelayMs = maxDelayMs;
  }

  @Override
  public long computeDelayMs(int attempts) {
    if (attempts <= 0) {
      return 0L;
    }
    if (attempts >= 63) {
      return maxDelayMs;
    }
    long factor = 1L << (attempts - 1);
    // Overflow guard: once the factor alone passes the cap ratio the result is the cap.
    if (factor > maxDelayMs / baseDelayMs) {
      return maxDelayMs;
    }
    return Math.min(maxDelayMs, baseDelayMs * factor);
  }
}
