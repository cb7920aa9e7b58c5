package cadence.notify;

import cadence.model.Channel;
import cadence.model.NotificationPreference;
import cadence.model.NotificationPriority;
import cadence.model.NotificationType;
import cadence.spi.PreferenceStore;
import cadence.spi.StoreException;

import java.util.Objects;
import java.util.Optional;
import java.util.Set;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Reads and updates per-owner, per-type notification preferences. A preference that does
 * not exist yet is created from the configured {@link PreferenceDefaults} on first resolve.
 */
public final class PreferenceService {
  private static final Logger logger = Logger.getLogger(PreferenceService.class.getName());

  private final PreferenceStore store;
  private final PreferenceDefaults defaults;

  public PreferenceService(PreferenceStore store) {
    this(store, PreferenceDefaults.ALL_CHANNELS);
  }

  public PreferenceService(PreferenceStore store, PreferenceDefaults defaults) {
    this.store = Objects.requireNonNull(store, "store");
    this.defaults = Objects.requireNonNull(defaults, "defaults");
  }

  /**
   * Returns the owner's preference for {@code type}, creating it from the defaults if absent.
   * When the store fails, the defaults are returned without being persisted.
   */
  public NotificationPreference resolve(String ownerId, NotificationType type) {
    Objects.requireNonNull(ownerId, "ownerId");
    Objects.requireNonNull(type, "type");
    Optional<NotificationPreference> existing;
    try {
      existing = store.find(ownerId, type);
    } catch (StoreException e) {
      logger.log(Level.WARNING, "Failed to load preference of " + ownerId + " for " + type
          + "; using defaults", e);
      return defaults.forOwner(ownerId, type);
    }
    if (existing.isPresent()) {
      return existing.get();
    }
    NotificationPreference created = defaults.forOwner(ownerId, type);
    try {
      store.upsert(created);
    } catch (StoreException e) {
      logger.log(Level.WARNING, "Failed to create default preference of " + ownerId
          + " for " + type, e);
    }
    return created;
  }

  /** Replaces the owner's preference for {@code type}. */
  public NotificationPreference update(String ownerId, NotificationType type,
      Set<Channel> enabledChannels, NotificationPriority minPriority) {
    NotificationPreference preference =
        new NotificationPreference(ownerId, type, enabledChannels, minPriority);
    store.upsert(preference);
    return preference;
  }

  public PreferenceDefaults defaults() {
    return defaults;
  }
}
