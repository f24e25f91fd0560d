package reconciler.model;

public enum QueueKind {
  OUTBOX("outbox"),
  INBOX("inbox");

  private final String tag;

  QueueKind(String tag) {
    this.tag = tag;
  }

  /** Lower-case name used in thread names and metric tags. */
  public String tag() {
    return tag;
  }
}
