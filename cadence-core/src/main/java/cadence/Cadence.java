package cadence;

import cadence.live.ConnectionRegistry;
import cadence.notify.Alerts;
import cadence.notify.EmailChannelSender;
import cadence.notify.InAppChannelSender;
import cadence.notify.NotificationDispatcher;
import cadence.notify.NotificationService;
import cadence.notify.PreferenceDefaults;
import cadence.notify.PreferenceService;
import cadence.notify.PushChannelSender;
import cadence.recurrence.RecurrenceCalculator;
import cadence.schedule.BroadcastTickListener;
import cadence.schedule.DefinitionService;
import cadence.schedule.GeneratedEventListener;
import cadence.schedule.RecurringEventAnnouncer;
import cadence.schedule.ScheduleProcessor;
import cadence.spi.DefinitionStore;
import cadence.spi.DeviceTokenStore;
import cadence.spi.EmailSender;
import cadence.spi.MetricsExporter;
import cadence.spi.NotificationStore;
import cadence.spi.PreferenceStore;
import cadence.spi.PushSender;
import cadence.spi.RecipientDirectory;

import java.time.Clock;
import java.time.Duration;
import java.time.ZoneId;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * Wires the connection registry, the notification dispatcher and the schedule processor
 * into one runtime.
 *
 * <p>Generated events are announced to their owners as {@code RECURRING_TRANSACTION}
 * notifications, and every tick that generated something is broadcast to all live clients.
 * Email and push channels are enabled when their collaborators are configured; the in-app
 * channel is always present.
 *
 * <h2>Usage</h2>
 * <pre>{@code
 * try (Cadence cadence = Cadence.builder()
 *     .definitionStore(definitions)
 *     .notificationStore(notifications)
 *     .preferenceStore(preferences)
 *     .build()) {
 *   cadence.start();
 *   cadence.connections().register(userId, connection);
 *   ...
 * }
 * }</pre>
 *
 * <p>{@link #close()} stops the processor, then the dispatcher, then the registry, then a
 * closeable metrics exporter, and rethrows the first failure with later ones suppressed.
 */
public final class Cadence implements AutoCloseable {
  private final ConnectionRegistry connections;
  private final NotificationDispatcher dispatcher;
  private final ScheduleProcessor processor;
  private final DefinitionService definitions;
  private final NotificationService notifications;
  private final PreferenceService preferences;
  private final Alerts alerts;
  private final MetricsExporter metrics;

  private Cadence(ConnectionRegistry connections, NotificationDispatcher dispatcher,
      ScheduleProcessor processor, DefinitionService definitions,
      NotificationService notifications, PreferenceService preferences, Alerts alerts,
      MetricsExporter metrics) {
    this.connections = connections;
    this.dispatcher = dispatcher;
    this.processor = processor;
    this.definitions = definitions;
    this.notifications = notifications;
    this.preferences = preferences;
    this.alerts = alerts;
    this.metrics = metrics;
  }

  public static Builder builder() {
    return new Builder();
  }

  /** Starts the tick schedule. */
  public void start() {
    processor.start();
  }

  public ConnectionRegistry connections() {
    return connections;
  }

  public NotificationDispatcher dispatcher() {
    return dispatcher;
  }

  public ScheduleProcessor processor() {
    return processor;
  }

  public DefinitionService definitions() {
    return definitions;
  }

  public NotificationService notifications() {
    return notifications;
  }

  public PreferenceService preferences() {
    return preferences;
  }

  public Alerts alerts() {
    return alerts;
  }

  @Override
  public void close() {
    RuntimeException first = null;
    try {
      processor.close();
    } catch (RuntimeException e) {
      first = e;
    }
    try {
      dispatcher.close();
    } catch (RuntimeException e) {
      if (first == null) first = e; else first.addSuppressed(e);
    }
    try {
      connections.close();
    } catch (RuntimeException e) {
      if (first == null) first = e; else first.addSuppressed(e);
    }
    if (metrics instanceof AutoCloseable closeable) {
      try {
        closeable.close();
      } catch (Exception e) {
        RuntimeException re = (e instanceof RuntimeException r) ? r : new RuntimeException(e);
        if (first == null) first = re; else first.addSuppressed(re);
      }
    }
    if (first != null) {
      throw first;
    }
  }

  /** Builder for {@link Cadence}. */
  public static final class Builder {
    private DefinitionStore definitionStore;
    private NotificationStore notificationStore;
    private PreferenceStore preferenceStore;
    private DeviceTokenStore deviceTokenStore;
    private PushSender pushSender;
    private EmailSender emailSender;
    private RecipientDirectory recipientDirectory;
    private ConnectionRegistry connectionRegistry;
    private MetricsExporter metrics;
    private Clock clock;
    private ZoneId zone;
    private PreferenceDefaults preferenceDefaults;
    private final List<GeneratedEventListener> listeners = new ArrayList<>();

    private Duration tickInterval = Duration.ofHours(1);
    private int batchSize = 100;
    private int workerCount = 4;
    private int listenerWorkerCount = 1;
    private Duration definitionTimeout = Duration.ofSeconds(30);
    private Duration inFlightLease = Duration.ZERO;
    private int channelWorkerCount = 4;
    private Duration channelSendTimeout = Duration.ofSeconds(10);
    private int liveSendWorkerCount = 8;
    private Duration liveSendTimeout = Duration.ofSeconds(10);
    private boolean announceGeneratedEvents = true;
    private boolean broadcastTicks = true;
    private long drainTimeoutMs = 5000;
    private final AtomicBoolean built = new AtomicBoolean(false);

    private Builder() {}

    /** <b>Required.</b> */
    public Builder definitionStore(DefinitionStore definitionStore) {
      this.definitionStore = definitionStore;
      return this;
    }

    /** <b>Required.</b> */
    public Builder notificationStore(NotificationStore notificationStore) {
      this.notificationStore = notificationStore;
      return this;
    }

    /** <b>Required.</b> */
    public Builder preferenceStore(PreferenceStore preferenceStore) {
      this.preferenceStore = preferenceStore;
      return this;
    }

    /** Enables the push channel together with {@link #pushSender}. */
    public Builder deviceTokenStore(DeviceTokenStore deviceTokenStore) {
      this.deviceTokenStore = deviceTokenStore;
      return this;
    }

    /** Enables the push channel together with {@link #deviceTokenStore}. */
    public Builder pushSender(PushSender pushSender) {
      this.pushSender = pushSender;
      return this;
    }

    /** Enables the email channel together with {@link #recipientDirectory}. */
    public Builder emailSender(EmailSender emailSender) {
      this.emailSender = emailSender;
      return this;
    }

    /** Enables the email channel together with {@link #emailSender}. */
    public Builder recipientDirectory(RecipientDirectory recipientDirectory) {
      this.recipientDirectory = recipientDirectory;
      return this;
    }

    /**
     * Uses an existing registry instead of building one. The registry is still closed by
     * {@link Cadence#close()}.
     */
    public Builder connectionRegistry(ConnectionRegistry connectionRegistry) {
      this.connectionRegistry = connectionRegistry;
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

    /** Zone for calendar arithmetic. Defaults to UTC. */
    public Builder zone(ZoneId zone) {
      this.zone = zone;
      return this;
    }

    /** Defaults applied to owners without a stored preference. Defaults to all channels, LOW. */
    public Builder preferenceDefaults(PreferenceDefaults preferenceDefaults) {
      this.preferenceDefaults = preferenceDefaults;
      return this;
    }

    /** Adds a listener invoked for each generated event, after the built-in announcer. */
    public Builder listener(GeneratedEventListener listener) {
      this.listeners.add(Objects.requireNonNull(listener, "listener"));
      return this;
    }

    public Builder tickInterval(Duration tickInterval) {
      this.tickInterval = tickInterval;
      return this;
    }

    public Builder batchSize(int batchSize) {
      this.batchSize = batchSize;
      return this;
    }

    public Builder workerCount(int workerCount) {
      this.workerCount = workerCount;
      return this;
    }

    /** Threads announcing generated events; {@code 0} announces inline after each claim. */
    public Builder listenerWorkerCount(int listenerWorkerCount) {
      this.listenerWorkerCount = listenerWorkerCount;
      return this;
    }

    public Builder definitionTimeout(Duration definitionTimeout) {
      this.definitionTimeout = definitionTimeout;
      return this;
    }

    /** Lease after which a stuck definition may be taken over; {@link Duration#ZERO} never expires. */
    public Builder inFlightLease(Duration inFlightLease) {
      this.inFlightLease = inFlightLease;
      return this;
    }

    public Builder channelWorkerCount(int channelWorkerCount) {
      this.channelWorkerCount = channelWorkerCount;
      return this;
    }

    public Builder channelSendTimeout(Duration channelSendTimeout) {
      this.channelSendTimeout = channelSendTimeout;
      return this;
    }

    public Builder liveSendWorkerCount(int liveSendWorkerCount) {
      this.liveSendWorkerCount = liveSendWorkerCount;
      return this;
    }

    public Builder liveSendTimeout(Duration liveSendTimeout) {
      this.liveSendTimeout = liveSendTimeout;
      return this;
    }

    /** Whether generated events are announced as notifications. Defaults to {@code true}. */
    public Builder announceGeneratedEvents(boolean announceGeneratedEvents) {
      this.announceGeneratedEvents = announceGeneratedEvents;
      return this;
    }

    /** Whether productive ticks are broadcast to live clients. Defaults to {@code true}. */
    public Builder broadcastTicks(boolean broadcastTicks) {
      this.broadcastTicks = broadcastTicks;
      return this;
    }

    public Builder drainTimeoutMs(long drainTimeoutMs) {
      this.drainTimeoutMs = drainTimeoutMs;
      return this;
    }

    /**
     * Builds the runtime. Call {@link Cadence#start()} to begin ticking.
     *
     * @throws IllegalStateException if called twice on the same builder
     * @throws NullPointerException  if a required store is missing
     */
    public Cadence build() {
      if (!built.compareAndSet(false, true)) {
        throw new IllegalStateException("build() already called on this builder");
      }
      Objects.requireNonNull(definitionStore, "definitionStore");
      Objects.requireNonNull(notificationStore, "notificationStore");
      Objects.requireNonNull(preferenceStore, "preferenceStore");
      MetricsExporter effectiveMetrics = metrics != null ? metrics : MetricsExporter.NOOP;
      Clock effectiveClock = clock != null ? clock : Clock.systemUTC();
      RecurrenceCalculator calculator = zone != null
          ? new RecurrenceCalculator(zone) : RecurrenceCalculator.UTC;
      PreferenceService preferences = new PreferenceService(preferenceStore,
          preferenceDefaults != null ? preferenceDefaults : PreferenceDefaults.ALL_CHANNELS);

      ConnectionRegistry registry = connectionRegistry != null
          ? connectionRegistry
          : ConnectionRegistry.builder()
              .sendWorkerCount(liveSendWorkerCount)
              .sendTimeout(liveSendTimeout)
              .metrics(effectiveMetrics)
              .clock(effectiveClock)
              .build();

      NotificationDispatcher dispatcher;
      try {
        NotificationDispatcher.Builder db = NotificationDispatcher.builder()
            .notificationStore(notificationStore)
            .preferenceService(preferences)
            .sender(new InAppChannelSender(registry))
            .channelWorkerCount(channelWorkerCount)
            .sendTimeout(channelSendTimeout)
            .metrics(effectiveMetrics)
            .clock(effectiveClock)
            .drainTimeoutMs(drainTimeoutMs);
        if (emailSender != null && recipientDirectory != null) {
          db.sender(new EmailChannelSender(emailSender, recipientDirectory));
        }
        if (pushSender != null && deviceTokenStore != null) {
          db.sender(new PushChannelSender(pushSender, deviceTokenStore));
        }
        dispatcher = db.build();
      } catch (RuntimeException e) {
        registry.close();
        throw e;
      }

      Alerts alerts = new Alerts(dispatcher);
      ScheduleProcessor processor;
      try {
        ScheduleProcessor.Builder pb = ScheduleProcessor.builder()
            .definitionStore(definitionStore)
            .calculator(calculator)
            .clock(effectiveClock)
            .tickInterval(tickInterval)
            .batchSize(batchSize)
            .workerCount(workerCount)
            .listenerWorkerCount(listenerWorkerCount)
            .definitionTimeout(definitionTimeout)
            .inFlightLease(inFlightLease)
            .metrics(effectiveMetrics)
            .drainTimeoutMs(drainTimeoutMs);
        if (announceGeneratedEvents) {
          pb.listener(new RecurringEventAnnouncer(alerts));
        }
        for (GeneratedEventListener listener : listeners) {
          pb.listener(listener);
        }
        if (broadcastTicks) {
          pb.tickListener(new BroadcastTickListener(registry));
        }
        processor = pb.build();
      } catch (RuntimeException e) {
        dispatcher.close();
        registry.close();
        throw e;
      }

      DefinitionService definitions = new DefinitionService(definitionStore, calculator,
          effectiveClock);
      NotificationService notifications = new NotificationService(notificationStore,
          effectiveClock);
      return new Cadence(registry, dispatcher, processor, definitions, notifications,
          preferences, alerts, effectiveMetrics);
    }
  }
}
