package cadence.notify;

import cadence.model.Channel;
import cadence.model.Notification;
import cadence.model.NotificationPreference;
import cadence.model.NotificationPriority;
import cadence.model.NotificationStatus;
import cadence.model.NotificationType;
import cadence.spi.MetricsExporter;
import cadence.spi.NotificationStore;
import cadence.util.TimeLimitedExecutor;

import java.time.Clock;
import java.time.Duration;
import java.util.ArrayList;
import java.util.Collections;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.UUID;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.function.Supplier;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Persists notifications and fans them out to the channels the owner has enabled.
 *
 * <p>{@link #announce} always stores the notification first. If its priority passes the
 * owner's minimum priority, one delivery task per enabled channel is handed to the channel
 * pool, each bounded by the send timeout. Channel failures and timeouts are logged and counted;
 * they never change the stored notification or reach the caller.
 *
 * <p>With {@code channelWorkerCount(0)} deliveries run inline on the calling thread, in
 * {@link Channel} declaration order, without a timeout.
 *
 * <p>Create instances via {@link #builder()}. This class is thread-safe.
 */
public final class NotificationDispatcher implements AutoCloseable {
  private static final Logger logger = Logger.getLogger(NotificationDispatcher.class.getName());

  private final NotificationStore notificationStore;
  private final PreferenceService preferenceService;
  private final Map<Channel, ChannelSender> senders;
  private final TimeLimitedExecutor channelPool;
  private final MetricsExporter metrics;
  private final Clock clock;
  private final Supplier<String> idGenerator;
  private final long drainTimeoutMs;

  private NotificationDispatcher(Builder builder) {
    this.notificationStore = Objects.requireNonNull(builder.notificationStore, "notificationStore");
    this.preferenceService = Objects.requireNonNull(builder.preferenceService, "preferenceService");
    this.metrics = builder.metrics != null ? builder.metrics : MetricsExporter.NOOP;
    this.clock = builder.clock != null ? builder.clock : Clock.systemUTC();
    this.idGenerator = builder.idGenerator != null
        ? builder.idGenerator : () -> UUID.randomUUID().toString();
    this.drainTimeoutMs = builder.drainTimeoutMs;
    this.senders = Collections.unmodifiableMap(new EnumMap<>(builder.senders));

    Objects.requireNonNull(builder.sendTimeout, "sendTimeout");
    if (builder.sendTimeout.isNegative() || builder.sendTimeout.isZero()) {
      throw new IllegalArgumentException("sendTimeout must be positive");
    }
    if (builder.channelWorkerCount < 0) {
      throw new IllegalArgumentException("channelWorkerCount must be >= 0");
    }
    this.channelPool = builder.channelWorkerCount > 0
        ? new TimeLimitedExecutor("cadence-notify-", builder.channelWorkerCount, builder.sendTimeout)
        : null;
  }

  public static Builder builder() {
    return new Builder();
  }

  /**
   * Stores a new notification for {@code ownerId} and delivers it on the enabled channels.
   *
   * @return the stored notification
   * @throws cadence.spi.StoreException if the notification cannot be persisted
   */
  public Notification announce(String ownerId, NotificationType type, NotificationPriority priority,
      NotificationContent content) {
    Objects.requireNonNull(ownerId, "ownerId");
    Objects.requireNonNull(type, "type");
    Objects.requireNonNull(priority, "priority");
    Objects.requireNonNull(content, "content");

    Notification notification = new Notification(idGenerator.get(), ownerId, type, priority,
        NotificationStatus.UNREAD, content.title(), content.message(), content.data(),
        clock.instant(), null, content.expiresAt());
    notificationStore.create(notification);
    metrics.incrementNotificationsCreated();

    NotificationPreference preference = preferenceService.resolve(ownerId, type);
    if (!preference.admits(priority)) {
      metrics.incrementNotificationsSuppressed();
      logger.log(Level.FINE, "Notification " + notification.id() + " below minimum priority "
          + preference.minPriority() + "; stored only");
      return notification;
    }

    for (Channel channel : Channel.values()) {
      if (!preference.isEnabled(channel)) {
        continue;
      }
      ChannelSender sender = senders.get(channel);
      if (sender == null) {
        logger.log(Level.FINE, "No sender registered for " + channel + "; skipping");
        continue;
      }
      dispatch(sender, notification);
    }
    return notification;
  }

  private void dispatch(ChannelSender sender, Notification notification) {
    Delivery delivery = new Delivery(sender.channel(), notification.id());
    if (channelPool == null) {
      try {
        sender.deliver(notification);
        delivery.succeeded();
      } catch (Exception e) {
        delivery.failed(e);
      }
      return;
    }
    try {
      channelPool.submit(() -> {
        try {
          sender.deliver(notification);
          delivery.succeeded();
        } catch (Exception e) {
          delivery.failed(e);
        }
        return null;
      }, delivery::timedOut);
    } catch (RejectedExecutionException e) {
      delivery.failed(e);
    }
  }

  /** Channels with a registered sender. */
  public List<Channel> channels() {
    return new ArrayList<>(senders.keySet());
  }

  /**
   * Stops accepting deliveries and waits for running ones up to the drain timeout.
   */
  @Override
  public void close() {
    if (channelPool != null) {
      channelPool.close(drainTimeoutMs);
    }
  }

  /** Records the first outcome of one channel delivery; later outcomes are ignored. */
  private final class Delivery {
    private final Channel channel;
    private final String notificationId;
    private final AtomicBoolean settled = new AtomicBoolean(false);

    private Delivery(Channel channel, String notificationId) {
      this.channel = channel;
      this.notificationId = notificationId;
    }

    void succeeded() {
      if (settled.compareAndSet(false, true)) {
        metrics.incrementChannelDelivered(channel);
      }
    }

    void failed(Exception e) {
      if (settled.compareAndSet(false, true)) {
        metrics.incrementChannelFailed(channel);
        logger.log(Level.WARNING, channel + " delivery failed for notification " + notificationId, e);
      }
    }

    void timedOut() {
      if (settled.compareAndSet(false, true)) {
        metrics.incrementChannelFailed(channel);
        logger.log(Level.WARNING, channel + " delivery timed out for notification " + notificationId);
      }
    }
  }

  /** Builder for {@link NotificationDispatcher}. */
  public static final class Builder {
    private NotificationStore notificationStore;
    private PreferenceService preferenceService;
    private final Map<Channel, ChannelSender> senders = new EnumMap<>(Channel.class);
    private int channelWorkerCount = 4;
    private Duration sendTimeout = Duration.ofSeconds(10);
    private MetricsExporter metrics;
    private Clock clock;
    private Supplier<String> idGenerator;
    private long drainTimeoutMs = 5000;

    private Builder() {}

    /** <b>Required.</b> Store every announced notification is written to. */
    public Builder notificationStore(NotificationStore notificationStore) {
      this.notificationStore = notificationStore;
      return this;
    }

    /** <b>Required.</b> Resolves the owner's channels and minimum priority. */
    public Builder preferenceService(PreferenceService preferenceService) {
      this.preferenceService = preferenceService;
      return this;
    }

    /**
     * Registers the sender for its {@link ChannelSender#channel() channel}, replacing any
     * sender previously registered for that channel.
     */
    public Builder sender(ChannelSender sender) {
      Objects.requireNonNull(sender, "sender");
      this.senders.put(Objects.requireNonNull(sender.channel(), "sender.channel()"), sender);
      return this;
    }

    /**
     * Sets the number of delivery threads.
     *
     * <p>Optional. Defaults to {@code 4}. Must be &ge; 0; {@code 0} delivers inline on the
     * announcing thread.
     */
    public Builder channelWorkerCount(int channelWorkerCount) {
      this.channelWorkerCount = channelWorkerCount;
      return this;
    }

    /** Maximum running time of one channel delivery. Defaults to 10 seconds. */
    public Builder sendTimeout(Duration sendTimeout) {
      this.sendTimeout = sendTimeout;
      return this;
    }

    public Builder metrics(MetricsExporter metrics) {
      this.metrics = metrics;
      return this;
    }

    public Builder clock(Clock clock) {
      this.clock = clock;
      return this;
    }

    /** Supplies notification ids. Defaults to random UUIDs. */
    public Builder idGenerator(Supplier<String> idGenerator) {
      this.idGenerator = idGenerator;
      return this;
    }

    public Builder drainTimeoutMs(long drainTimeoutMs) {
      this.drainTimeoutMs = drainTimeoutMs;
      return this;
    }

    /**
     * @throws NullPointerException if {@code notificationStore} or {@code preferenceService}
     *     is null
     * @throws IllegalArgumentException if {@code channelWorkerCount < 0} or the send timeout
     *     is not positive
     */
    public NotificationDispatcher build() {
      return new NotificationDispatcher(this);
    }
  }
}
