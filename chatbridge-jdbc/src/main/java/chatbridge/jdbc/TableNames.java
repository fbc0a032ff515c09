package chatbridge.jdbc;

import java.util.Objects;
import java.util.regex.Pattern;

/**
 * Table names are concatenated into SQL, so only plain identifiers are accepted.
 */
public final class TableNames {
  public static final String DEFAULT_TABLE = "chat_bridge_store";

  // 63 is the PostgreSQL identifier limit, the lowest of the supported databases.
  private static final int MAX_LENGTH = 63;
  private static final Pattern IDENTIFIER = Pattern.compile("[A-Za-z_][A-Za-z0-9_]*");

  private TableNames() {}

  public static String validate(String tableName) {
    Objects.requireNonNull(tableName, "tableName");
    if (tableName.length() > MAX_LENGTH || !IDENTIFIER.matcher(tableName).matches()) {
      throw new IllegalArgumentException("Invalid table name: " + tableName);
    }
    return tableName;
  }
}
