package cadence.model;

import java.util.Locale;

/**
 * Delivery medium for a notification.
 *
 * <p>The dispatcher maps each constant to a {@link cadence.notify.ChannelSender};
 * adding a channel means adding a constant and registering a sender.
 */
public enum Channel {
  /** Live duplex connections tracked by {@link cadence.live.ConnectionRegistry}. */
  IN_APP,
  EMAIL,
  PUSH;

  public String wireName() {
    return name().toLowerCase(Locale.ROOT);
  }
}
