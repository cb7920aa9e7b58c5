package cadence.spi;

import cadence.model.Notification;
import cadence.model.NotificationStatus;

import java.time.Instant;
import java.util.List;
import java.util.Optional;

/**
 * Persistence contract for notification records.
 */
public interface NotificationStore {

    /**
     * Persists a new notification.
     *
     * @throws StoreException if the record cannot be written
     */
    void create(Notification notification);

    Optional<Notification> findById(String notificationId);

    /**
     * Lists an owner's notifications, newest first.
     *
     * @param status optional status filter ({@code null} for all)
     */
    List<Notification> listByOwner(String ownerId, NotificationStatus status, int offset, int limit);

    int countByStatus(String ownerId, NotificationStatus status);

    /**
     * Moves a notification from {@code expected} to {@code newStatus}.
     *
     * @param readAt value to store in {@code readAt}; {@code null} keeps the current value
     * @return the number of rows updated (0 if the status was no longer {@code expected})
     */
    int updateStatus(String notificationId, NotificationStatus expected, NotificationStatus newStatus,
            Instant readAt);

    /**
     * Archives every UNREAD or READ notification of {@code ownerId} whose {@code expiresAt}
     * is at or before {@code now}.
     *
     * @return the number of notifications archived
     */
    int archiveExpired(String ownerId, Instant now);
}
