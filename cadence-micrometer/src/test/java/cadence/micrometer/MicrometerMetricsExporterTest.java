package cadence.micrometer;

import cadence.model.Channel;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.Gauge;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

class MicrometerMetricsExporterTest {

  private SimpleMeterRegistry registry;
  private MicrometerMetricsExporter exporter;

  @BeforeEach
  void setUp() {
    registry = new SimpleMeterRegistry();
    exporter = new MicrometerMetricsExporter(registry);
  }

  @Test
  void scheduleCounters() {
    exporter.incrementTicks();
    exporter.incrementTicks();
    exporter.incrementTickFatal();
    exporter.incrementEventsGenerated();
    exporter.incrementEventsGenerated();
    exporter.incrementEventsGenerated();
    exporter.incrementClaimsSkipped();
    exporter.incrementDefinitionsFailed();

    assertEquals(2.0, counter("cadence.schedule.ticks").count());
    assertEquals(1.0, counter("cadence.schedule.ticks.fatal").count());
    assertEquals(3.0, counter("cadence.schedule.events.generated").count());
    assertEquals(1.0, counter("cadence.schedule.claims.skipped").count());
    assertEquals(1.0, counter("cadence.schedule.definitions.failed").count());
  }

  @Test
  void notificationCountersAreTaggedByChannel() {
    exporter.incrementNotificationsCreated();
    exporter.incrementNotificationsSuppressed();
    exporter.incrementChannelDelivered(Channel.IN_APP);
    exporter.incrementChannelDelivered(Channel.IN_APP);
    exporter.incrementChannelFailed(Channel.PUSH);

    assertEquals(1.0, counter("cadence.notify.created").count());
    assertEquals(1.0, counter("cadence.notify.suppressed").count());
    assertEquals(2.0, registry.get("cadence.notify.delivered").tag("channel", "in_app").counter().count());
    assertEquals(0.0, registry.get("cadence.notify.delivered").tag("channel", "email").counter().count());
    assertEquals(1.0, registry.get("cadence.notify.failed").tag("channel", "push").counter().count());
  }

  @Test
  void gaugesTrackLatestValues() {
    exporter.recordTickDurationMs(250L);
    exporter.recordLiveConnections(7);
    exporter.incrementConnectionsPruned(3);

    assertEquals(250.0, gauge("cadence.schedule.tick.duration.ms").value());
    assertEquals(7.0, gauge("cadence.live.connections").value());
    assertEquals(3.0, counter("cadence.live.pruned").count());

    exporter.recordLiveConnections(0);
    assertEquals(0.0, gauge("cadence.live.connections").value());
  }

  @Test
  void customPrefix() {
    SimpleMeterRegistry custom = new SimpleMeterRegistry();
    MicrometerMetricsExporter prefixed = new MicrometerMetricsExporter(custom, "budget.cadence");
    prefixed.incrementTicks();

    assertEquals(1.0, custom.get("budget.cadence.schedule.ticks").counter().count());
  }

  @Test
  void invalidPrefixRejected() {
    assertThrows(NullPointerException.class, () -> new MicrometerMetricsExporter(registry, null));
    assertThrows(IllegalArgumentException.class, () -> new MicrometerMetricsExporter(registry, ""));
    assertThrows(IllegalArgumentException.class, () -> new MicrometerMetricsExporter(registry, "x."));
    assertThrows(NullPointerException.class, () -> new MicrometerMetricsExporter(null));
  }

  @Test
  void closeRemovesMetersAndIgnoresLaterCalls() {
    exporter.close();

    assertTrue(registry.getMeters().isEmpty());
    assertDoesNotThrow(() -> {
      exporter.incrementTicks();
      exporter.incrementChannelFailed(Channel.EMAIL);
      exporter.recordLiveConnections(4);
    });
    assertTrue(registry.getMeters().isEmpty());
  }

  private Counter counter(String name) {
    return registry.get(name).counter();
  }

  private Gauge gauge(String name) {
    return registry.get(name).gauge();
  }
}
