package cadence.jdbc;

import java.sql.Connection;
import java.sql.SQLException;
import java.util.Objects;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Minimal transaction manager for the JDBC stores. Obtains a connection and disables
 * auto-commit.
 *
 * <p>Use via try-with-resources on the returned {@link Transaction}:
 * <pre>{@code
 * try (var tx = txManager.begin()) {
 *     JdbcTemplate.update(tx.connection(), ...);
 *     tx.commit();
 * }
 * }</pre>
 */
public final class JdbcTransactionManager {
  private static final Logger logger = Logger.getLogger(JdbcTransactionManager.class.getName());

  private final ConnectionProvider connectionProvider;

  public JdbcTransactionManager(ConnectionProvider connectionProvider) {
    this.connectionProvider = Objects.requireNonNull(connectionProvider, "connectionProvider");
  }

  /**
   * Begins a new transaction on a fresh connection.
   *
   * @throws SQLException if a connection cannot be obtained
   */
  public Transaction begin() throws SQLException {
    Connection connection = connectionProvider.getConnection();
    try {
      connection.setAutoCommit(false);
    } catch (SQLException e) {
      connection.close();
      throw e;
    }
    return new Transaction(connection);
  }

  /**
   * An active transaction handle. If neither {@link #commit()} nor {@link #rollback()} is
   * called, {@link #close()} rolls back.
   */
  public static final class Transaction implements AutoCloseable {
    private final Connection connection;
    private boolean completed;

    private Transaction(Connection connection) {
      this.connection = connection;
    }

    public Connection connection() {
      return connection;
    }

    public void commit() throws SQLException {
      if (completed) {
        return;
      }
      try {
        connection.commit();
      } catch (SQLException e) {
        safeRollback();
        throw e;
      } finally {
        finish();
      }
    }

    public void rollback() throws SQLException {
      if (completed) {
        return;
      }
      try {
        connection.rollback();
      } finally {
        finish();
      }
    }

    @Override
    public void close() throws SQLException {
      if (!completed) {
        rollback();
      }
    }

    private void finish() throws SQLException {
      completed = true;
      try {
        connection.setAutoCommit(true);
      } finally {
        connection.close();
      }
    }

    private void safeRollback() {
      try {
        connection.rollback();
      } catch (SQLException e) {
        logger.log(Level.WARNING, "Rollback after failed commit also failed", e);
      }
    }
  }
}
