package reconciler.model;

/**
 * Kind of domain entity an outbox or inbox row refers to.
 *
 * <p>The {@linkplain #code() code} is the value stored in the {@code entity_type}
 * column; the {@linkplain #handlePrefix() handle prefix} derives the external
 * schedule identity.
 */
public enum EntityType {
  REMINDER("reminder", "reminder-"),
  TASK_ROLLOVER("task_rollover", "task-rollover-");

  private final String code;
  private final String handlePrefix;

  EntityType(String code, String handlePrefix) {
    this.code = code;
    this.handlePrefix = handlePrefix;
  }

  public String code() {
    return code;
  }

  public String handlePrefix() {
    return handlePrefix;
  }

  /**
   * @throws IllegalArgumentException if no entity type has the given code
   */
  public static EntityType fromCode(String code) {
    for (EntityType type : values()) {
      if (type.code.equals(code)) {
        return type;
      }
    }
    throw new IllegalArgumentException("Unknown entity type: " + code);
  }
}
