package reconciler.model;

/**
 * Fact reported by the scheduler side and recorded as an inbox row.
 */
public enum FeedbackKind {
  /** A schedule fired and its unit of work was started. */
  FIRED("fired"),
  /** A schedule has no future fire times left. */
  EXHAUSTED("exhausted"),
  /** A rollover schedule reported the task's next due date. */
  NEXT_DUE_COMPUTED("next_due_computed");

  private final String code;

  FeedbackKind(String code) {
    this.code = code;
  }

  public String code() {
    return code;
  }

  public static FeedbackKind fromCode(String code) {
    for (FeedbackKind kind : values()) {
      if (kind.code.equals(code)) {
        return kind;
      }
    }
    throw new IllegalArgumentException("Unknown inbox kind: " + code);
  }
}
