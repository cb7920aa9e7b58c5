package cadence.notify;

import cadence.model.Channel;
import cadence.model.Notification;
import cadence.spi.DeviceTokenStore;
import cadence.spi.PushSender;
import cadence.spi.PushSender.PushResult;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Sends notifications to the owner's active push device tokens. Tokens the push service
 * rejects are deactivated with the reported error.
 */
public final class PushChannelSender implements ChannelSender {
  private static final Logger logger = Logger.getLogger(PushChannelSender.class.getName());

  private final PushSender pushSender;
  private final DeviceTokenStore tokenStore;

  public PushChannelSender(PushSender pushSender, DeviceTokenStore tokenStore) {
    this.pushSender = Objects.requireNonNull(pushSender, "pushSender");
    this.tokenStore = Objects.requireNonNull(tokenStore, "tokenStore");
  }

  @Override
  public Channel channel() {
    return Channel.PUSH;
  }

  @Override
  public void deliver(Notification notification) throws Exception {
    List<String> tokens = tokenStore.activeTokens(notification.ownerId());
    if (tokens.isEmpty()) {
      logger.log(Level.FINE, "No active device tokens for " + notification.ownerId());
      return;
    }
    Map<String, String> data = new LinkedHashMap<>(notification.data());
    data.put("notificationId", notification.id());
    data.put("type", notification.type().wireName());
    data.put("priority", notification.priority().wireName());

    List<PushResult> results = pushSender.send(tokens, notification.title(),
        notification.message(), data);
    int failed = 0;
    for (PushResult result : results) {
      if (!result.success()) {
        failed++;
        tokenStore.deactivate(result.token(), result.error());
        logger.log(Level.INFO, "Deactivated push token of " + notification.ownerId()
            + ": " + result.error());
      }
    }
    if (failed > 0 && failed == tokens.size()) {
      throw new ChannelDeliveryException(Channel.PUSH,
          "Push failed for all " + failed + " devices of " + notification.ownerId());
    }
  }
}
