package reconciler.gateway;

import java.time.Instant;
import java.util.Objects;
import java.util.Optional;

/**
 * The scheduler's answer to "when does this fire next".
 */
public final class NextFireTime {

  public enum Status {
    /** A future fire time is known. */
    SCHEDULED,
    /** The schedule exists, is not paused and has no future fire times. */
    EXHAUSTED,
    /** The schedule was not visible, or is paused with nothing pending. */
    UNKNOWN
  }

  private static final NextFireTime EXHAUSTED = new NextFireTime(Status.EXHAUSTED, null);
  private static final NextFireTime UNKNOWN = new NextFireTime(Status.UNKNOWN, null);

  private final Status status;
  private final Instant at;

  private NextFireTime(Status status, Instant at) {
    this.status = status;
    this.at = at;
  }

  public static NextFireTime scheduled(Instant at) {
    return new NextFireTime(Status.SCHEDULED, Objects.requireNonNull(at, "at"));
  }

  public static NextFireTime exhausted() {
    return EXHAUSTED;
  }

  public static NextFireTime unknown() {
    return UNKNOWN;
  }

  public Status status() {
    return status;
  }

  /** The next fire time; present only when {@link #status()} is {@link Status#SCHEDULED}. */
  public Optional<Instant> at() {
    return Optional.ofNullable(at);
  }

  @Override
  public boolean equals(Object o) {
    if (this == o) return true;
    if (!(o instanceof NextFireTime)) return false;
    NextFireTime that = (NextFireTime) o;
    return status == that.status && Objects.equals(at, that.at);
  }

  @Override
  public int hashCode() {
    return Objects.hash(status, at);
  }

  @Override
  public String toString() {
    return at == null ? status.name() : status.name() + "(" + at + ")";
  }
}
