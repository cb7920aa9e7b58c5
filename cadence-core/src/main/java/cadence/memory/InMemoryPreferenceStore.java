package cadence.memory;

import cadence.model.NotificationPreference;
import cadence.model.NotificationType;
import cadence.spi.PreferenceStore;

import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;

/** {@link PreferenceStore} held in memory. */
public final class InMemoryPreferenceStore implements PreferenceStore {
  private final Map<String, NotificationPreference> preferences = new ConcurrentHashMap<>();

  @Override
  public Optional<NotificationPreference> find(String ownerId, NotificationType type) {
    return Optional.ofNullable(preferences.get(key(ownerId, type)));
  }

  @Override
  public void upsert(NotificationPreference preference) {
    preferences.put(key(preference.ownerId(), preference.type()), preference);
  }

  private static String key(String ownerId, NotificationType type) {
    return ownerId + '\u0000' + type.name();
  }
}
