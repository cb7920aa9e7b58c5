package cadence.micrometer;

import cadence.model.Channel;
import cadence.spi.MetricsExporter;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.Gauge;
import io.micrometer.core.instrument.Meter;
import io.micrometer.core.instrument.MeterRegistry;

import java.util.ArrayList;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.atomic.AtomicLong;

/**
 * Micrometer-based implementation of {@link MetricsExporter}.
 *
 * <h3>Counters</h3>
 * <ul>
 *   <li>{@code cadence.schedule.ticks}: ticks run</li>
 *   <li>{@code cadence.schedule.ticks.fatal}: ticks aborted because due definitions could not be listed</li>
 *   <li>{@code cadence.schedule.events.generated}: occurrences generated</li>
 *   <li>{@code cadence.schedule.claims.skipped}: occurrences claimed by another processor</li>
 *   <li>{@code cadence.schedule.definitions.failed}: definitions that failed or timed out in a tick</li>
 *   <li>{@code cadence.notify.created}: notifications persisted</li>
 *   <li>{@code cadence.notify.suppressed}: notifications below the owner's minimum priority</li>
 *   <li>{@code cadence.notify.delivered}: channel sends that succeeded, tagged {@code channel}</li>
 *   <li>{@code cadence.notify.failed}: channel sends that failed or timed out, tagged {@code channel}</li>
 *   <li>{@code cadence.live.pruned}: dead live connections removed</li>
 * </ul>
 *
 * <h3>Gauges</h3>
 * <ul>
 *   <li>{@code cadence.schedule.tick.duration.ms}: duration of the last tick</li>
 *   <li>{@code cadence.live.connections}: registered live connections</li>
 * </ul>
 *
 * @see MetricsExporter
 */
public final class MicrometerMetricsExporter implements MetricsExporter, AutoCloseable {

  private final MeterRegistry registry;
  private final Counter ticks;
  private final Counter ticksFatal;
  private final Counter eventsGenerated;
  private final Counter claimsSkipped;
  private final Counter definitionsFailed;
  private final Counter notificationsCreated;
  private final Counter notificationsSuppressed;
  private final Map<Channel, Counter> delivered = new EnumMap<>(Channel.class);
  private final Map<Channel, Counter> failed = new EnumMap<>(Channel.class);
  private final Counter connectionsPruned;
  private final Gauge tickDurationGauge;
  private final Gauge liveConnectionsGauge;

  private final AtomicLong lastTickDurationMs = new AtomicLong();
  private final AtomicInteger liveConnections = new AtomicInteger();
  private volatile boolean closed;

  /**
   * Creates an exporter with the default metric name prefix {@code "cadence"}.
   *
   * @param registry the Micrometer meter registry
   */
  public MicrometerMetricsExporter(MeterRegistry registry) {
    this(registry, "cadence");
  }

  /**
   * Creates an exporter with a custom metric name prefix for multi-instance use.
   *
   * @param registry   the Micrometer meter registry
   * @param namePrefix prefix for all meter names (e.g. {@code "budget.cadence"})
   */
  public MicrometerMetricsExporter(MeterRegistry registry, String namePrefix) {
    Objects.requireNonNull(registry, "registry");
    Objects.requireNonNull(namePrefix, "namePrefix");
    if (namePrefix.isEmpty()) {
      throw new IllegalArgumentException("namePrefix must not be empty");
    }
    if (namePrefix.endsWith(".")) {
      throw new IllegalArgumentException("namePrefix must not end with '.'");
    }

    this.registry = registry;
    this.ticks = Counter.builder(namePrefix + ".schedule.ticks")
        .description("Schedule ticks run")
        .register(registry);
    this.ticksFatal = Counter.builder(namePrefix + ".schedule.ticks.fatal")
        .description("Ticks aborted because due definitions could not be listed")
        .register(registry);
    this.eventsGenerated = Counter.builder(namePrefix + ".schedule.events.generated")
        .description("Occurrences generated")
        .register(registry);
    this.claimsSkipped = Counter.builder(namePrefix + ".schedule.claims.skipped")
        .description("Occurrences already claimed elsewhere")
        .register(registry);
    this.definitionsFailed = Counter.builder(namePrefix + ".schedule.definitions.failed")
        .description("Definitions failed or timed out (retried next tick)")
        .register(registry);
    this.notificationsCreated = Counter.builder(namePrefix + ".notify.created")
        .description("Notifications persisted")
        .register(registry);
    this.notificationsSuppressed = Counter.builder(namePrefix + ".notify.suppressed")
        .description("Notifications below the owner's minimum priority")
        .register(registry);
    for (Channel channel : Channel.values()) {
      delivered.put(channel, Counter.builder(namePrefix + ".notify.delivered")
          .description("Channel sends that succeeded")
          .tag("channel", channel.wireName())
          .register(registry));
      failed.put(channel, Counter.builder(namePrefix + ".notify.failed")
          .description("Channel sends that failed or timed out")
          .tag("channel", channel.wireName())
          .register(registry));
    }
    this.connectionsPruned = Counter.builder(namePrefix + ".live.pruned")
        .description("Dead live connections removed")
        .register(registry);

    this.tickDurationGauge = Gauge.builder(namePrefix + ".schedule.tick.duration.ms",
            lastTickDurationMs, AtomicLong::get)
        .register(registry);
    this.liveConnectionsGauge = Gauge.builder(namePrefix + ".live.connections",
            liveConnections, AtomicInteger::get)
        .register(registry);
  }

  @Override
  public void incrementTicks() {
    if (closed) return;
    ticks.increment();
  }

  @Override
  public void incrementTickFatal() {
    if (closed) return;
    ticksFatal.increment();
  }

  @Override
  public void incrementEventsGenerated() {
    if (closed) return;
    eventsGenerated.increment();
  }

  @Override
  public void incrementClaimsSkipped() {
    if (closed) return;
    claimsSkipped.increment();
  }

  @Override
  public void incrementDefinitionsFailed() {
    if (closed) return;
    definitionsFailed.increment();
  }

  @Override
  public void recordTickDurationMs(long durationMs) {
    if (closed) return;
    lastTickDurationMs.set(durationMs);
  }

  @Override
  public void incrementNotificationsCreated() {
    if (closed) return;
    notificationsCreated.increment();
  }

  @Override
  public void incrementNotificationsSuppressed() {
    if (closed) return;
    notificationsSuppressed.increment();
  }

  @Override
  public void incrementChannelDelivered(Channel channel) {
    if (closed) return;
    delivered.get(channel).increment();
  }

  @Override
  public void incrementChannelFailed(Channel channel) {
    if (closed) return;
    failed.get(channel).increment();
  }

  @Override
  public void incrementConnectionsPruned(int count) {
    if (closed) return;
    connectionsPruned.increment(count);
  }

  @Override
  public void recordLiveConnections(int count) {
    if (closed) return;
    liveConnections.set(count);
  }

  /**
   * Removes all meters registered by this exporter from the registry.
   *
   * <p>{@link cadence.Cadence#close()} calls this, so stale gauges do not outlive the runtime.
   */
  @Override
  public void close() {
    closed = true;
    List<Meter> meters = new ArrayList<>(List.of(ticks, ticksFatal, eventsGenerated,
        claimsSkipped, definitionsFailed, notificationsCreated, notificationsSuppressed,
        connectionsPruned, tickDurationGauge, liveConnectionsGauge));
    meters.addAll(delivered.values());
    meters.addAll(failed.values());
    RuntimeException first = null;
    for (Meter meter : meters) {
      try {
        registry.remove(meter);
      } catch (RuntimeException e) {
        if (first == null) first = e; else first.addSuppressed(e);
      }
    }
    if (first != null) throw first;
  }
}
