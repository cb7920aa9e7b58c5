package cadence.jdbc;

import cadence.model.Notification;
import cadence.model.NotificationPriority;
import cadence.model.NotificationStatus;
import cadence.model.NotificationType;
import cadence.spi.NotificationStore;
import cadence.util.JsonCodec;

import java.time.Instant;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;

/**
 * {@link NotificationStore} over a single table. The {@code data} map is stored as a JSON
 * object.
 */
public final class JdbcNotificationStore extends AbstractJdbcStore implements NotificationStore {

  private static final String COLUMNS = "id, owner_id, type, priority, status, title, message, "
      + "data, created_at, read_at, expires_at";

  private final JsonCodec jsonCodec;
  private final JdbcTemplate.RowMapper<Notification> rowMapper;

  public JdbcNotificationStore(ConnectionProvider connectionProvider) {
    this(connectionProvider, TableNames.DEFAULT, JsonCodec.getDefault());
  }

  public JdbcNotificationStore(ConnectionProvider connectionProvider, TableNames tables,
      JsonCodec jsonCodec) {
    super(connectionProvider, tables);
    this.jsonCodec = Objects.requireNonNull(jsonCodec, "jsonCodec");
    this.rowMapper = rs -> {
      String data = rs.getString("data");
      return new Notification(
          rs.getString("id"),
          rs.getString("owner_id"),
          NotificationType.valueOf(rs.getString("type")),
          NotificationPriority.valueOf(rs.getString("priority")),
          NotificationStatus.valueOf(rs.getString("status")),
          rs.getString("title"),
          rs.getString("message"),
          data == null ? Map.of() : this.jsonCodec.parseObject(data),
          JdbcTemplate.instant(rs, "created_at"),
          JdbcTemplate.instant(rs, "read_at"),
          JdbcTemplate.instant(rs, "expires_at"));
    };
  }

  @Override
  public void create(Notification notification) {
    String sql = "INSERT INTO " + tables().notifications() + " (" + COLUMNS + ")"
        + " VALUES (?,?,?,?,?,?,?,?,?,?,?)";
    String data = notification.data().isEmpty() ? null : jsonCodec.toJson(notification.data());
    withConnection("create notification " + notification.id(), conn -> JdbcTemplate.update(conn, sql,
        notification.id(), notification.ownerId(), notification.type(), notification.priority(),
        notification.status(), notification.title(), notification.message(), data,
        notification.createdAt(), notification.readAt(), notification.expiresAt()));
  }

  @Override
  public Optional<Notification> findById(String notificationId) {
    String sql = "SELECT " + COLUMNS + " FROM " + tables().notifications() + " WHERE id=?";
    return withConnection("find notification " + notificationId,
        conn -> JdbcTemplate.queryOne(conn, sql, rowMapper, notificationId));
  }

  @Override
  public List<Notification> listByOwner(String ownerId, NotificationStatus status, int offset,
      int limit) {
    String sql = "SELECT " + COLUMNS + " FROM " + tables().notifications()
        + " WHERE owner_id=?" + (status != null ? " AND status=?" : "")
        + " ORDER BY created_at DESC, id DESC LIMIT ? OFFSET ?";
    return withConnection("list notifications of " + ownerId, conn -> status != null
        ? JdbcTemplate.query(conn, sql, rowMapper, ownerId, status, limit, offset)
        : JdbcTemplate.query(conn, sql, rowMapper, ownerId, limit, offset));
  }

  @Override
  public int countByStatus(String ownerId, NotificationStatus status) {
    String sql = "SELECT COUNT(*) FROM " + tables().notifications()
        + " WHERE owner_id=? AND status=?";
    return withConnection("count notifications of " + ownerId,
        conn -> JdbcTemplate.queryOne(conn, sql, rs -> rs.getInt(1), ownerId, status).orElse(0));
  }

  @Override
  public int updateStatus(String notificationId, NotificationStatus expected,
      NotificationStatus newStatus, Instant readAt) {
    String table = tables().notifications();
    return withConnection("update notification " + notificationId, conn -> readAt != null
        ? JdbcTemplate.update(conn,
            "UPDATE " + table + " SET status=?, read_at=? WHERE id=? AND status=?",
            newStatus, readAt, notificationId, expected)
        : JdbcTemplate.update(conn,
            "UPDATE " + table + " SET status=? WHERE id=? AND status=?",
            newStatus, notificationId, expected));
  }

  @Override
  public int archiveExpired(String ownerId, Instant now) {
    String sql = "UPDATE " + tables().notifications() + " SET status=?"
        + " WHERE owner_id=? AND status<>? AND expires_at IS NOT NULL AND expires_at<=?";
    return withConnection("archive expired notifications of " + ownerId,
        conn -> JdbcTemplate.update(conn, sql, NotificationStatus.ARCHIVED, ownerId,
            NotificationStatus.ARCHIVED, now));
  }
}
