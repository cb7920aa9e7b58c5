package cadence.jdbc;

import cadence.model.Channel;
import cadence.model.NotificationPreference;
import cadence.model.NotificationPriority;
import cadence.model.NotificationType;
import cadence.spi.PreferenceStore;
import cadence.spi.StoreException;

import java.util.EnumSet;
import java.util.Optional;
import java.util.Set;
import java.util.StringJoiner;

/**
 * {@link PreferenceStore} keyed by {@code (owner_id, type)}. Enabled channels are kept as a
 * comma-separated list of channel names.
 */
public final class JdbcPreferenceStore extends AbstractJdbcStore implements PreferenceStore {

  public JdbcPreferenceStore(ConnectionProvider connectionProvider) {
    this(connectionProvider, TableNames.DEFAULT);
  }

  public JdbcPreferenceStore(ConnectionProvider connectionProvider, TableNames tables) {
    super(connectionProvider, tables);
  }

  @Override
  public Optional<NotificationPreference> find(String ownerId, NotificationType type) {
    String sql = "SELECT owner_id, type, channels, min_priority FROM " + tables().preferences()
        + " WHERE owner_id=? AND type=?";
    return withConnection("find preference of " + ownerId, conn -> JdbcTemplate.queryOne(conn, sql,
        rs -> new NotificationPreference(
            rs.getString("owner_id"),
            NotificationType.valueOf(rs.getString("type")),
            decodeChannels(rs.getString("channels")),
            NotificationPriority.valueOf(rs.getString("min_priority"))),
        ownerId, type));
  }

  /**
   * Updates the row or inserts it. A concurrent insert of the same key makes the insert fail;
   * the update is then retried once.
   */
  @Override
  public void upsert(NotificationPreference preference) {
    String table = tables().preferences();
    String updateSql = "UPDATE " + table + " SET channels=?, min_priority=? WHERE owner_id=? AND type=?";
    String insertSql = "INSERT INTO " + table + " (owner_id, type, channels, min_priority) VALUES (?,?,?,?)";
    String channels = encodeChannels(preference.enabledChannels());
    withConnection("upsert preference of " + preference.ownerId(), conn -> {
      int updated = JdbcTemplate.update(conn, updateSql, channels, preference.minPriority(),
          preference.ownerId(), preference.type());
      if (updated > 0) {
        return updated;
      }
      try {
        return JdbcTemplate.update(conn, insertSql, preference.ownerId(), preference.type(),
            channels, preference.minPriority());
      } catch (StoreException e) {
        int retried = JdbcTemplate.update(conn, updateSql, channels, preference.minPriority(),
            preference.ownerId(), preference.type());
        if (retried == 0) {
          throw e;
        }
        return retried;
      }
    });
  }

  static String encodeChannels(Set<Channel> channels) {
    StringJoiner joiner = new StringJoiner(",");
    for (Channel channel : Channel.values()) {
      if (channels.contains(channel)) {
        joiner.add(channel.name());
      }
    }
    return joiner.toString();
  }

  static Set<Channel> decodeChannels(String value) {
    Set<Channel> channels = EnumSet.noneOf(Channel.class);
    if (value == null || value.isBlank()) {
      return channels;
    }
    for (String name : value.split(",")) {
      channels.add(Channel.valueOf(name.trim()));
    }
    return channels;
  }
}
