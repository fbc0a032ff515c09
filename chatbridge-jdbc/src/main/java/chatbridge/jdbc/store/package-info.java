/**
 * JDBC key-value tables backing the rule and conversation stores.
 *
 * <p>{@link chatbridge.jdbc.store.AbstractJdbcKeyValueStore} provides the shared SQL;
 * subclasses supply the upsert: H2 ({@code MERGE ... KEY}), MySQL
 * ({@code ON DUPLICATE KEY UPDATE}) and PostgreSQL ({@code ON CONFLICT}).
 *
 * @see chatbridge.jdbc.store.JdbcKeyValueStores
 */
package chatbridge.jdbc.store;
