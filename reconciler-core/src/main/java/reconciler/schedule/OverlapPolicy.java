package reconciler.schedule;

/**
 * What the scheduler does when a firing is due while the previous run is still going.
 */
public enum OverlapPolicy {
  /** Drop the new firing. */
  SKIP,
  /** Queue at most one firing behind the running one. */
  BUFFER_ONE,
  /** Start every firing regardless. */
  ALLOW_ALL
}
