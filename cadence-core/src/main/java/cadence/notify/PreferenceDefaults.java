package cadence.notify;

import cadence.model.Channel;
import cadence.model.NotificationPreference;
import cadence.model.NotificationPriority;
import cadence.model.NotificationType;

import java.util.Collections;
import java.util.EnumSet;
import java.util.Objects;
import java.util.Set;

/**
 * Preference values applied to an owner who has never configured a notification type.
 */
public record PreferenceDefaults(Set<Channel> channels, NotificationPriority minPriority) {

  /** Every channel enabled, every priority delivered. */
  public static final PreferenceDefaults ALL_CHANNELS =
      new PreferenceDefaults(EnumSet.allOf(Channel.class), NotificationPriority.LOW);

  public PreferenceDefaults {
    Objects.requireNonNull(channels, "channels");
    Objects.requireNonNull(minPriority, "minPriority");
    channels = channels.isEmpty()
        ? Collections.unmodifiableSet(EnumSet.noneOf(Channel.class))
        : Collections.unmodifiableSet(EnumSet.copyOf(channels));
  }

  public NotificationPreference forOwner(String ownerId, NotificationType type) {
    return new NotificationPreference(ownerId, type, channels, minPriority);
  }
}
