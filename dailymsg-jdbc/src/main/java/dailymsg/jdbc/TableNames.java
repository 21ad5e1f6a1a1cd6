package dailymsg.jdbc;

import java.util.Objects;

/**
 * Default table names and table name validation for the JDBC stores.
 */
public final class TableNames {
  public static final String DELIVERY_TABLE = "scheduled_delivery";
  public static final String BUCKET_TABLE = "rate_limit_bucket";
  public static final String HISTORY_TABLE = "message_history";
  private static final String TABLE_NAME_PATTERN = "[a-zA-Z_][a-zA-Z0-9_]*";

  private TableNames() {}

  public static String validate(String tableName) {
    Objects.requireNonNull(tableName, "tableName");
    if (!tableName.matches(TABLE_NAME_PATTERN)) {
      throw new IllegalArgumentException("Invalid table name: " + tableName);
    }
    return tableName;
  }

  /**
   * Returns {@code prefix + baseName}, validated. A {@code null} prefix means none.
   */
  public static String prefixed(String prefix, String baseName) {
    return validate((prefix == null ? "" : prefix) + baseName);
  }
}
