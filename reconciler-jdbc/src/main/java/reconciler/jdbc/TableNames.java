package reconciler.jdbc;

import java.util.Objects;

/**
 * Default table names and table name validation for the JDBC stores.
 */
public final class TableNames {
  public static final String DEFAULT_OUTBOX_TABLE = "reconcile_outbox";
  public static final String DEFAULT_INBOX_TABLE = "reconcile_inbox";
  public static final String DEFAULT_REMINDER_TABLE = "reminders";
  public static final String DEFAULT_TASK_TABLE = "tasks";
  private static final String TABLE_NAME_PATTERN = "[a-zA-Z_][a-zA-Z0-9_]*";

  private TableNames() {}

  public static String validate(String tableName) {
    Objects.requireNonNull(tableName, "tableName");
    if (!tableName.matches(TABLE_NAME_PATTERN)) {
      throw new IllegalArgumentException("Invalid table name: " + tableName);
    }
    return tableName;
  }
}
