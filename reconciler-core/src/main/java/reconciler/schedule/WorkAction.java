package reconciler.schedule;

import reconciler.util.JsonCodec;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;

/**
 * Unit of work the scheduler starts on each fire: a type name plus flat string arguments.
 *
 * <p>Arguments always carry {@link #ARG_ENTITY_TYPE}, {@link #ARG_ENTITY_ID},
 * {@link #ARG_HANDLE} and {@link #ARG_DELETE_AFTER}; the fire callback echoes them
 * back to {@link reconciler.feedback.FireCallbackReceiver}.
 */
public record WorkAction(String workType, Map<String, String> arguments) {
  public static final String ARG_ENTITY_TYPE = "entityType";
  public static final String ARG_ENTITY_ID = "entityId";
  public static final String ARG_HANDLE = "handle";
  public static final String ARG_DELETE_AFTER = "deleteAfter";

  public WorkAction {
    Objects.requireNonNull(workType, "workType");
    arguments = Collections.unmodifiableMap(new LinkedHashMap<>(arguments));
  }

  /** Whether the unit of work asks for its own schedule to be removed after it runs. */
  public boolean deleteAfterFire() {
    return Boolean.parseBoolean(arguments.get(ARG_DELETE_AFTER));
  }

  /** Arguments encoded as the JSON payload handed to the scheduler. */
  public String argumentsJson(JsonCodec codec) {
    return codec.toJson(arguments);
  }
}
