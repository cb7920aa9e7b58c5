/**
 * Notification persistence, preference resolution and multi-channel delivery.
 *
 * <p>{@link cadence.notify.NotificationDispatcher} is the entry point; channels plug in as
 * {@link cadence.notify.ChannelSender} implementations.
 */
package cadence.notify;
