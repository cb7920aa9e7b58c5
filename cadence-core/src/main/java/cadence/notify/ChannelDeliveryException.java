package cadence.notify;

import cadence.model.Channel;

/**
 * Thrown by a {@link ChannelSender} when a notification could not be handed to its channel.
 * The dispatcher logs and counts it; the caller of
 * {@link NotificationDispatcher#announce announce} never sees it.
 */
public class ChannelDeliveryException extends RuntimeException {
  private final Channel channel;

  public ChannelDeliveryException(Channel channel, String message) {
    super(message);
    this.channel = channel;
  }

  public ChannelDeliveryException(Channel channel, String message, Throwable cause) {
    super(message, cause);
    this.channel = channel;
  }

  public Channel channel() {
    return channel;
  }
}
