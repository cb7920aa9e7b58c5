package cadence.notify;

import cadence.live.ConnectionRegistry;
import cadence.live.SendOutcome;
import cadence.model.Channel;
import cadence.model.Notification;

import java.util.Objects;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Pushes notifications to the owner's live connections. An owner without connections is not
 * a failure; an owner whose every connection failed is.
 */
public final class InAppChannelSender implements ChannelSender {
  private static final Logger logger = Logger.getLogger(InAppChannelSender.class.getName());

  private final ConnectionRegistry registry;

  public InAppChannelSender(ConnectionRegistry registry) {
    this.registry = Objects.requireNonNull(registry, "registry");
  }

  @Override
  public Channel channel() {
    return Channel.IN_APP;
  }

  @Override
  public void deliver(Notification notification) {
    SendOutcome outcome = registry.sendToOwner(notification.ownerId(),
        NotificationPayloads.NOTIFICATION_MESSAGE_TYPE, NotificationPayloads.toMap(notification));
    if (outcome.delivered() == 0 && outcome.pruned() > 0) {
      throw new ChannelDeliveryException(Channel.IN_APP, "All " + outcome.pruned()
          + " live connections of " + notification.ownerId() + " failed");
    }
    logger.log(Level.FINE, () -> "Notification " + notification.id() + " reached "
        + outcome.delivered() + " live connections");
  }
}
