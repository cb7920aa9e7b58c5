package cadence.notify;

import java.time.Instant;
import java.util.Map;
import java.util.Objects;

/**
 * Caller-supplied part of a notification.
 *
 * @param data      structured payload; {@code null} means empty
 * @param expiresAt optional expiry instant
 */
public record NotificationContent(String title, String message, Map<String, String> data,
    Instant expiresAt) {

  public NotificationContent {
    Objects.requireNonNull(title, "title");
    Objects.requireNonNull(message, "message");
    data = data == null ? Map.of() : Map.copyOf(data);
  }

  public static NotificationContent of(String title, String message) {
    return new NotificationContent(title, message, Map.of(), null);
  }

  public static NotificationContent of(String title, String message, Map<String, String> data) {
    return new NotificationContent(title, message, data, null);
  }
}
