package cadence.notify;

import cadence.model.Channel;
import cadence.model.Notification;

/**
 * Delivers notifications over one {@link Channel}.
 *
 * <p>Senders are registered with {@link NotificationDispatcher.Builder#sender(ChannelSender)}
 * and looked up by {@link #channel()}. {@link #deliver} runs on a dispatcher worker thread
 * and may be interrupted when it exceeds the per-send timeout.
 */
public interface ChannelSender {

    Channel channel();

    /**
     * Delivers one notification.
     *
     * @throws Exception if delivery failed; the dispatcher logs it and moves on
     */
    void deliver(Notification notification) throws Exception;
}
