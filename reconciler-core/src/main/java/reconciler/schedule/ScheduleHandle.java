package reconciler.schedule;

import reconciler.model.EntityType;

import java.util.Objects;

/**
 * External identity of an entity's schedule. Derived only from the entity type and id,
 * so every reconciliation of the same entity addresses the same schedule.
 */
public record ScheduleHandle(EntityType entityType, long entityId) {

  public ScheduleHandle {
    Objects.requireNonNull(entityType, "entityType");
  }

  public static ScheduleHandle of(EntityType entityType, long entityId) {
    return new ScheduleHandle(entityType, entityId);
  }

  /**
   * Parses a handle id such as {@code reminder-42}.
   *
   * @throws IllegalArgumentException if the id has no known prefix or a non-numeric suffix
   */
  public static ScheduleHandle parse(String id) {
    Objects.requireNonNull(id, "id");
    for (EntityType type : EntityType.values()) {
      if (id.startsWith(type.handlePrefix())) {
        try {
          return new ScheduleHandle(type, Long.parseLong(id.substring(type.handlePrefix().length())));
        } catch (NumberFormatException e) {
          throw new IllegalArgumentException("Invalid schedule handle: " + id, e);
        }
      }
    }
    throw new IllegalArgumentException("Invalid schedule handle: " + id);
  }

  /** The id the scheduler knows this schedule by. */
  public String id() {
    return entityType.handlePrefix() + entityId;
  }

  @Override
  public String toString() {
    return id();
  }
}
