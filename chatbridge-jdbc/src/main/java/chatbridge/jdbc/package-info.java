/**
 * JDBC-backed {@link chatbridge.spi.FilterStore} and {@link chatbridge.spi.ConversationStore}.
 *
 * <p>Both stores share one key-value table; see {@link chatbridge.jdbc.store}.
 *
 * @see chatbridge.jdbc.JdbcFilterStore
 * @see chatbridge.jdbc.JdbcConversationStore
 */
package chatbridge.jdbc;
