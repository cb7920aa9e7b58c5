package cadence.model;

import java.util.Locale;

/**
 * Lifecycle of a persisted notification: {@code UNREAD -> READ},
 * {@code UNREAD|READ -> ARCHIVED}. Archived notifications are never re-delivered.
 */
public enum NotificationStatus {
  UNREAD,
  READ,
  ARCHIVED;

  public String wireName() {
    return name().toLowerCase(Locale.ROOT);
  }

  public static NotificationStatus parse(String value) {
    if (value == null) {
      throw new IllegalArgumentException("status must not be null");
    }
    return valueOf(value.trim().toUpperCase(Locale.ROOT));
  }
}
