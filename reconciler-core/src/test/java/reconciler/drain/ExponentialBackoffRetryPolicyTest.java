package reconciler.drain;

import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

class ExponentialBackoffRetryPolicyTest {

  private final ExponentialBackoffRetryPolicy policy = new ExponentialBackoffRetryPolicy();

  @Test
  void firstAttemptWaitsOneSecond() {
    assertEquals(1_000L, policy.computeDelayMs(1));
  }

  @Test
  void fourthAttemptWaitsEightSeconds() {
    assertEquals(8_000L, policy.computeDelayMs(4));
  }

  @Test
  void tenthAttemptIsCappedAtFiveMinutes() {
    assertEquals(256_000L, policy.computeDelayMs(9));
    assertEquals(300_000L, policy.computeDelayMs(10));
  }

  @Test
  void delayNeverDecreases() {
    long previous = 0;
    for (int attempt = 1; attempt <= 100; attempt++) {
      long delay = policy.computeDelayMs(attempt);
      assertTrue(delay >= previous, "attempt " + attempt + " went from " + previous + " to " + delay);
      previous = delay;
    }
  }

  @Test
  void handlesAttemptCountAtOverflowBoundary() {
    assertEquals(300_000L, policy.computeDelayMs(31));
    assertEquals(300_000L, policy.computeDelayMs(63));
    assertEquals(300_000L, policy.computeDelayMs(Integer.MAX_VALUE));
  }

  @Test
  void zeroAttemptsReturnsZero() {
    assertEquals(0L, policy.computeDelayMs(0));
  }

  @Test
  void customBaseAndCap() {
    ExponentialBackoffRetryPolicy custom = new ExponentialBackoffRetryPolicy(100, 500);

    assertEquals(100L, custom.computeDelayMs(1));
    assertEquals(400L, custom.computeDelayMs(3));
    assertEquals(500L, custom.computeDelayMs(4));
  }

  @Test
  void rejectsInvalidBounds() {
    assertThrows(IllegalArgumentException.class, () -> new ExponentialBackoffRetryPolicy(0, 1000));
    assertThrows(IllegalArgumentException.class, () -> new ExponentialBackoffRetryPolicy(1000, 10));
  }
}
