package cadence.notify;

import cadence.model.Notification;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Wire shape of a notification as sent to clients:
 * {@code {id, type, priority, status, title, message, data, createdAt, readAt?, expiresAt?}}
 * with lower-case enum names.
 */
public final class NotificationPayloads {

  /** Message type of the live envelope carrying a notification. */
  public static final String NOTIFICATION_MESSAGE_TYPE = "NOTIFICATION";

  private NotificationPayloads() {
  }

  public static Map<String, Object> toMap(Notification notification) {
    Map<String, Object> map = new LinkedHashMap<>();
    map.put("id", notification.id());
    map.put("type", notification.type().wireName());
    map.put("priority", notification.priority().wireName());
    map.put("status", notification.status().wireName());
    map.put("title", notification.title());
    map.put("message", notification.message());
    map.put("data", notification.data());
    map.put("createdAt", notification.createdAt().toString());
    if (notification.readAt() != null) {
      map.put("readAt", notification.readAt().toString());
    }
    if (notification.expiresAt() != null) {
      map.put("expiresAt", notification.expiresAt().toString());
    }
    return map;
  }
}
