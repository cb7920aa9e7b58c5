package cadence.model;

import java.util.Collections;
import java.util.EnumSet;
import java.util.Objects;
import java.util.Set;

/**
 * Per-owner, per-type delivery settings.
 *
 * @param enabledChannels channels that may carry this type; may be empty
 * @param minPriority     notifications below this priority are persisted but not delivered
 */
public record NotificationPreference(
    String ownerId,
    NotificationType type,
    Set<Channel> enabledChannels,
    NotificationPriority minPriority
) {

  public NotificationPreference {
    Objects.requireNonNull(ownerId, "ownerId");
    Objects.requireNonNull(type, "type");
    Objects.requireNonNull(enabledChannels, "enabledChannels");
    Objects.requireNonNull(minPriority, "minPriority");
    enabledChannels = enabledChannels.isEmpty()
        ? Collections.unmodifiableSet(EnumSet.noneOf(Channel.class))
        : Collections.unmodifiableSet(EnumSet.copyOf(enabledChannels));
  }

  public boolean isEnabled(Channel channel) {
    return enabledChannels.contains(channel);
  }

  /** Returns whether a notification of {@code priority} passes the minimum priority. */
  public boolean admits(NotificationPriority priority) {
    return !priority.isBelow(minPriority);
  }
}
