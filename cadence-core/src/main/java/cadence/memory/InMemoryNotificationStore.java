package cadence.memory;

import cadence.model.Notification;
import cadence.model.NotificationStatus;
import cadence.spi.NotificationStore;
import cadence.spi.StoreException;

import java.time.Instant;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/** {@link NotificationStore} held in memory. */
public final class InMemoryNotificationStore implements NotificationStore {
  private static final Comparator<Notification> NEWEST_FIRST =
      Comparator.comparing(Notification::createdAt).reversed()
          .thenComparing(Notification::id, Comparator.reverseOrder());

  private final Map<String, Notification> notifications = new LinkedHashMap<>();

  @Override
  public synchronized void create(Notification notification) {
    if (notifications.containsKey(notification.id())) {
      throw new StoreException("Duplicate notification id: " + notification.id());
    }
    notifications.put(notification.id(), notification);
  }

  @Override
  public synchronized Optional<Notification> findById(String notificationId) {
    return Optional.ofNullable(notifications.get(notificationId));
  }

  @Override
  public synchronized List<Notification> listByOwner(String ownerId, NotificationStatus status,
      int offset, int limit) {
    List<Notification> matching = new ArrayList<>();
    for (Notification notification : notifications.values()) {
      if (notification.ownerId().equals(ownerId)
          && (status == null || notification.status() == status)) {
        matching.add(notification);
      }
    }
    matching.sort(NEWEST_FIRST);
    if (offset >= matching.size()) {
      return new ArrayList<>();
    }
    return new ArrayList<>(matching.subList(offset, Math.min(matching.size(), offset + limit)));
  }

  @Override
  public synchronized int countByStatus(String ownerId, NotificationStatus status) {
    int count = 0;
    for (Notification notification : notifications.values()) {
      if (notification.ownerId().equals(ownerId) && notification.status() == status) {
        count++;
      }
    }
    return count;
  }

  @Override
  public synchronized int updateStatus(String notificationId, NotificationStatus expected,
      NotificationStatus newStatus, Instant readAt) {
    Notification current = notifications.get(notificationId);
    if (current == null || current.status() != expected) {
      return 0;
    }
    Instant effectiveReadAt = readAt != null ? readAt : current.readAt();
    notifications.put(notificationId, current.withStatus(newStatus, effectiveReadAt));
    return 1;
  }

  @Override
  public synchronized int archiveExpired(String ownerId, Instant now) {
    int archived = 0;
    for (Map.Entry<String, Notification> entry : notifications.entrySet()) {
      Notification notification = entry.getValue();
      if (notification.ownerId().equals(ownerId)
          && notification.status() != NotificationStatus.ARCHIVED
          && notification.isExpiredAt(now)) {
        entry.setValue(notification.withStatus(NotificationStatus.ARCHIVED, notification.readAt()));
        archived++;
      }
    }
    return archived;
  }
}
