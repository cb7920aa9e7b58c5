package cadence.jdbc;

import cadence.spi.DeviceTokenStore;
import cadence.spi.StoreException;

import java.time.Clock;
import java.util.List;
import java.util.Objects;

/**
 * {@link DeviceTokenStore} keyed by token. Registering a known token moves it to the new owner
 * and reactivates it.
 */
public final class JdbcDeviceTokenStore extends AbstractJdbcStore implements DeviceTokenStore {
  private static final int MAX_ERROR_LENGTH = 1000;

  private final Clock clock;

  public JdbcDeviceTokenStore(ConnectionProvider connectionProvider) {
    this(connectionProvider, TableNames.DEFAULT, Clock.systemUTC());
  }

  public JdbcDeviceTokenStore(ConnectionProvider connectionProvider, TableNames tables, Clock clock) {
    super(connectionProvider, tables);
    this.clock = Objects.requireNonNull(clock, "clock");
  }

  @Override
  public List<String> activeTokens(String ownerId) {
    String sql = "SELECT token FROM " + tables().deviceTokens()
        + " WHERE owner_id=? AND active=? ORDER BY updated_at, token";
    return withConnection("list device tokens of " + ownerId,
        conn -> JdbcTemplate.query(conn, sql, rs -> rs.getString("token"), ownerId, true));
  }

  @Override
  public void register(String ownerId, String token) {
    String table = tables().deviceTokens();
    String updateSql = "UPDATE " + table
        + " SET owner_id=?, active=?, last_error=NULL, updated_at=? WHERE token=?";
    String insertSql = "INSERT INTO " + table
        + " (token, owner_id, active, last_error, updated_at) VALUES (?,?,?,NULL,?)";
    withConnection("register device token of " + ownerId, conn -> {
      int updated = JdbcTemplate.update(conn, updateSql, ownerId, true, clock.instant(), token);
      if (updated > 0) {
        return updated;
      }
      try {
        return JdbcTemplate.update(conn, insertSql, token, ownerId, true, clock.instant());
      } catch (StoreException e) {
        int retried = JdbcTemplate.update(conn, updateSql, ownerId, true, clock.instant(), token);
        if (retried == 0) {
          throw e;
        }
        return retried;
      }
    });
  }

  @Override
  public void unregister(String ownerId, String token) {
    String sql = "DELETE FROM " + tables().deviceTokens() + " WHERE token=? AND owner_id=?";
    withConnection("unregister device token of " + ownerId,
        conn -> JdbcTemplate.update(conn, sql, token, ownerId));
  }

  @Override
  public void deactivate(String token, String error) {
    String sql = "UPDATE " + tables().deviceTokens()
        + " SET active=?, last_error=?, updated_at=? WHERE token=?";
    withConnection("deactivate device token",
        conn -> JdbcTemplate.update(conn, sql, false, truncate(error), clock.instant(), token));
  }

  private static String truncate(String error) {
    if (error == null || error.length() <= MAX_ERROR_LENGTH) {
      return error;
    }
    return error.substring(0, MAX_ERROR_LENGTH - 3) + "...";
  }
}
