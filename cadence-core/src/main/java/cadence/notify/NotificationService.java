package cadence.notify;

import cadence.model.Notification;
import cadence.model.NotificationStatus;
import cadence.spi.NotificationStore;

import java.time.Clock;
import java.time.Instant;
import java.util.List;
import java.util.Objects;

/**
 * Owner-facing reads and status transitions of stored notifications.
 *
 * <p>Transitions: {@code UNREAD -> READ} ({@link #markRead}) and
 * {@code UNREAD|READ -> ARCHIVED} ({@link #archive}). Expiry is applied whenever an owner
 * reads: notifications whose {@code expiresAt} has passed are archived first, so they are
 * never returned as unread or read.
 */
public final class NotificationService {
  private final NotificationStore store;
  private final Clock clock;

  public NotificationService(NotificationStore store, Clock clock) {
    this.store = Objects.requireNonNull(store, "store");
    this.clock = Objects.requireNonNull(clock, "clock");
  }

  /**
   * Lists notifications newest first.
   *
   * @param status optional filter, {@code null} for every status
   */
  public List<Notification> list(String ownerId, NotificationStatus status, int offset, int limit) {
    Objects.requireNonNull(ownerId, "ownerId");
    if (offset < 0) {
      throw new IllegalArgumentException("offset must be >= 0");
    }
    if (limit <= 0) {
      throw new IllegalArgumentException("limit must be > 0");
    }
    store.archiveExpired(ownerId, clock.instant());
    return store.listByOwner(ownerId, status, offset, limit);
  }

  public int unreadCount(String ownerId) {
    Objects.requireNonNull(ownerId, "ownerId");
    store.archiveExpired(ownerId, clock.instant());
    return store.countByStatus(ownerId, NotificationStatus.UNREAD);
  }

  /**
   * Returns the notification, archiving it first if it has expired.
   *
   * @throws NotificationNotFoundException if the id is unknown or owned by someone else
   */
  public Notification get(String notificationId, String ownerId) {
    Notification notification = load(notificationId, ownerId);
    Instant now = clock.instant();
    if (notification.status() != NotificationStatus.ARCHIVED && notification.isExpiredAt(now)) {
      return transition(notification, NotificationStatus.ARCHIVED, notification.readAt());
    }
    return notification;
  }

  /**
   * Marks an unread notification as read. Read and archived notifications are returned
   * unchanged; an expired one is archived instead.
   */
  public Notification markRead(String notificationId, String ownerId) {
    Notification notification = get(notificationId, ownerId);
    if (notification.status() != NotificationStatus.UNREAD) {
      return notification;
    }
    return transition(notification, NotificationStatus.READ, clock.instant());
  }

  /** Archives the notification. Archiving twice is a no-op. */
  public Notification archive(String notificationId, String ownerId) {
    Notification notification = get(notificationId, ownerId);
    if (notification.status() == NotificationStatus.ARCHIVED) {
      return notification;
    }
    return transition(notification, NotificationStatus.ARCHIVED, notification.readAt());
  }

  private Notification transition(Notification current, NotificationStatus target, Instant readAt) {
    int updated = store.updateStatus(current.id(), current.status(), target, readAt);
    if (updated == 1) {
      return current.withStatus(target, readAt);
    }
    // lost a race with a concurrent transition; report what is stored now
    return load(current.id(), current.ownerId());
  }

  private Notification load(String notificationId, String ownerId) {
    Objects.requireNonNull(notificationId, "notificationId");
    Objects.requireNonNull(ownerId, "ownerId");
    return store.findById(notificationId)
        .filter(n -> n.ownerId().equals(ownerId))
        .orElseThrow(() -> new NotificationNotFoundException(notificationId));
  }
}
