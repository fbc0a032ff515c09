package chatbridge.jdbc;

import java.sql.Clob;
import java.sql.Connection;
import java.sql.PreparedStatement;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.sql.Timestamp;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;

/**
 * Static JDBC helpers for the key-value statements. SQL failures surface as
 * {@link ChatBridgeStoreException} carrying the statement's verb.
 */
public final class JdbcTemplate {

  @FunctionalInterface
  public interface RowMapper<T> {
    T map(ResultSet rs) throws SQLException;
  }

  @FunctionalInterface
  private interface StatementCallback<T> {
    T apply(PreparedStatement ps) throws SQLException;
  }

  /** Runs INSERT/UPDATE/MERGE/DELETE and returns the affected row count. */
  public static int update(Connection conn, String sql, Object... params) {
    return execute(conn, sql, params, PreparedStatement::executeUpdate);
  }

  public static <T> List<T> query(Connection conn, String sql, RowMapper<T> mapper, Object... params) {
    return execute(conn, sql, params, ps -> {
      try (ResultSet rs = ps.executeQuery()) {
        List<T> rows = new ArrayList<>();
        while (rs.next()) {
          rows.add(mapper.map(rs));
        }
        return rows;
      }
    });
  }

  /** First row of a SELECT, or {@code null}. */
  public static <T> T queryOne(Connection conn, String sql, RowMapper<T> mapper, Object... params) {
    return execute(conn, sql, params, ps -> {
      ps.setMaxRows(1);
      try (ResultSet rs = ps.executeQuery()) {
        return rs.next() ? mapper.map(rs) : null;
      }
    });
  }

  /**
   * Reads a text column that may be declared as CLOB (H2, Oracle-style) or as
   * VARCHAR/TEXT (MySQL, PostgreSQL).
   */
  public static String text(ResultSet rs, int column) throws SQLException {
    Object value = rs.getObject(column);
    if (value instanceof Clob clob) {
      try {
        return clob.getSubString(1, (int) clob.length());
      } finally {
        clob.free();
      }
    }
    return value == null ? null : value.toString();
  }

  private static <T> T execute(Connection conn, String sql, Object[] params,
      StatementCallback<T> callback) {
    try (PreparedStatement ps = conn.prepareStatement(sql)) {
      for (int i = 0; i < params.length; i++) {
        bind(ps, i + 1, params[i]);
      }
      return callback.apply(ps);
    } catch (SQLException e) {
      throw new ChatBridgeStoreException("Failed to execute " + verb(sql), e);
    }
  }

  private static void bind(PreparedStatement ps, int index, Object param) throws SQLException {
    if (param instanceof Instant instant) {
      ps.setTimestamp(index, Timestamp.from(instant));
    } else if (param instanceof String s) {
      ps.setString(index, s);
    } else {
      ps.setObject(index, param);
    }
  }

  private static String verb(String sql) {
    String trimmed = sql.stripLeading();
    int space = trimmed.indexOf(' ');
    return space < 0 ? trimmed : trimmed.substring(0, space);
  }

  private JdbcTemplate() {}
}
