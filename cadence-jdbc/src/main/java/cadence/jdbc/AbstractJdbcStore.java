package cadence.jdbc;

import cadence.spi.StoreException;

import java.sql.Connection;
import java.sql.SQLException;
import java.util.Objects;

/**
 * Base of the JDBC stores: one pooled connection per operation, auto-commit unless the
 * operation opens a transaction.
 */
public abstract class AbstractJdbcStore {

  @FunctionalInterface
  protected interface ConnectionCallback<T> {
    T apply(Connection conn) throws SQLException;
  }

  private final ConnectionProvider connectionProvider;
  private final TableNames tables;
  private final JdbcTransactionManager txManager;

  protected AbstractJdbcStore(ConnectionProvider connectionProvider, TableNames tables) {
    this.connectionProvider = Objects.requireNonNull(connectionProvider, "connectionProvider");
    this.tables = Objects.requireNonNull(tables, "tables");
    this.txManager = new JdbcTransactionManager(connectionProvider);
  }

  protected TableNames tables() {
    return tables;
  }

  protected <T> T withConnection(String action, ConnectionCallback<T> callback) {
    try (Connection conn = connectionProvider.getConnection()) {
      return callback.apply(conn);
    } catch (SQLException e) {
      throw new StoreException("Failed to " + action, e);
    }
  }

  /**
   * Runs {@code callback} in a transaction that commits when it returns and rolls back when
   * it throws. A callback that wants to abort without an error calls
   * {@link JdbcTransactionManager.Transaction#rollback()} itself.
   */
  protected <T> T inTransaction(String action, TransactionCallback<T> callback) {
    try (JdbcTransactionManager.Transaction tx = txManager.begin()) {
      T result = callback.apply(tx);
      tx.commit();
      return result;
    } catch (SQLException e) {
      throw new StoreException("Failed to " + action, e);
    }
  }

  @FunctionalInterface
  protected interface TransactionCallback<T> {
    T apply(JdbcTransactionManager.Transaction tx) throws SQLException;
  }
}
