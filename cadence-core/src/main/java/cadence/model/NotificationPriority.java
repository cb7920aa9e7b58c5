package cadence.model;

import java.util.Locale;

/**
 * Ordered notification priority. Comparison uses declaration order:
 * {@code LOW < MEDIUM < HIGH}.
 */
public enum NotificationPriority {
  LOW,
  MEDIUM,
  HIGH;

  public boolean isBelow(NotificationPriority other) {
    return compareTo(other) < 0;
  }

  public String wireName() {
    return name().toLowerCase(Locale.ROOT);
  }

  public static NotificationPriority parse(String value) {
    if (value == null) {
      throw new IllegalArgumentException("priority must not be null");
    }
    return valueOf(value.trim().toUpperCase(Locale.ROOT));
  }
}
