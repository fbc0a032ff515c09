package chatbridge.jdbc;

import java.sql.Connection;
import java.sql.SQLException;

/**
 * Provides JDBC connections for store operations.
 *
 * <p>Callers are responsible for closing the returned connection.
 *
 * @see DataSourceConnectionProvider
 */
@FunctionalInterface
public interface ConnectionProvider {

  /**
   * Obtains a JDBC connection.
   *
   * @return an open connection; the caller must close it
   * @throws SQLException if a connection cannot be obtained
   */
  Connection getConnection() throws SQLException;
}
