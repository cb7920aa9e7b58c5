package cadence.model;

import java.time.Instant;
import java.util.Map;
import java.util.Objects;

/**
 * A persisted notification. The record remains queryable whatever happened on the
 * delivery channels.
 *
 * @param data     structured payload, never {@code null}
 * @param readAt   set on the {@code UNREAD -> READ} transition
 * @param expiresAt optional; once passed, the notification is archived when next read
 */
public record Notification(
    String id,
    String ownerId,
    NotificationType type,
    NotificationPriority priority,
    NotificationStatus status,
    String title,
    String message,
    Map<String, String> data,
    Instant createdAt,
    Instant readAt,
    Instant expiresAt
) {

  public Notification {
    Objects.requireNonNull(id, "id");
    Objects.requireNonNull(ownerId, "ownerId");
    Objects.requireNonNull(type, "type");
    Objects.requireNonNull(priority, "priority");
    Objects.requireNonNull(status, "status");
    Objects.requireNonNull(createdAt, "createdAt");
    data = data == null ? Map.of() : Map.copyOf(data);
  }

  public boolean isExpiredAt(Instant now) {
    return expiresAt != null && !expiresAt.isAfter(now);
  }

  public Notification withStatus(NotificationStatus newStatus, Instant newReadAt) {
    return new Notification(id, ownerId, type, priority, newStatus, title, message, data,
        createdAt, newReadAt, expiresAt);
  }
}
