package reconciler.model;

/**
 * Operation requested by an outbox row.
 */
public enum IntentOp {
  /** Recompute the desired state from storage and apply it. */
  UPSERT("upsert"),
  /** Remove the external schedule without reading storage. */
  DELETE("delete");

  private final String code;

  IntentOp(String code) {
    this.code = code;
  }

  public String code() {
    return code;
  }

  public static IntentOp fromCode(String code) {
    for (IntentOp op : values()) {
      if (op.code.equals(code)) {
        return op;
      }
    }
    throw new IllegalArgumentException("Unknown outbox op: " + code);
  }
}
