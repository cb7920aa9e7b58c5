package cadence.notify;

/**
 * Thrown when a notification id is unknown or belongs to another owner.
 */
public class NotificationNotFoundException extends RuntimeException {

  public NotificationNotFoundException(String notificationId) {
    super("Notification not found: " + notificationId);
  }
}
