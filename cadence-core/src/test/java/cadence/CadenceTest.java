package cadence;

import cadence.live.RecordingConnection;
import cadence.memory.InMemoryDefinitionStore;
import cadence.memory.InMemoryDeviceTokenStore;
import cadence.memory.InMemoryNotificationStore;
import cadence.memory.InMemoryPreferenceStore;
import cadence.model.Channel;
import cadence.model.EntryKind;
import cadence.model.IntervalKind;
import cadence.model.Notification;
import cadence.model.NotificationPriority;
import cadence.model.NotificationStatus;
import cadence.model.NotificationType;
import cadence.model.RecurringDefinition;
import cadence.schedule.BroadcastTickListener;
import cadence.schedule.NewDefinition;
import cadence.schedule.TickReport;
import cadence.spi.PushSender.PushResult;
import org.junit.jupiter.api.Test;

import java.math.BigDecimal;
import java.time.Instant;
import java.util.ArrayList;
import java.util.EnumSet;
import java.util.List;
import java.util.Optional;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

class CadenceTest {

  private final MutableClock clock = new MutableClock(Instant.parse("2024-02-01T00:00:00Z"));
  private final InMemoryDefinitionStore definitionStore = new InMemoryDefinitionStore();
  private final InMemoryNotificationStore notificationStore = new InMemoryNotificationStore();
  private final InMemoryPreferenceStore preferenceStore = new InMemoryPreferenceStore();
  private final RecordingMetrics metrics = new RecordingMetrics();

  private Cadence.Builder inline() {
    return Cadence.builder()
        .definitionStore(definitionStore)
        .notificationStore(notificationStore)
        .preferenceStore(preferenceStore)
        .metrics(metrics)
        .clock(clock)
        .workerCount(0)
        .listenerWorkerCount(0)
        .channelWorkerCount(0)
        .liveSendWorkerCount(0);
  }

  @Test
  void generatedOccurrenceIsAnnouncedAndBroadcast() {
    List<String> emails = new ArrayList<>();
    List<List<String>> pushes = new ArrayList<>();
    InMemoryDeviceTokenStore tokens = new InMemoryDeviceTokenStore(clock);
    tokens.register("alice", "tok-1");

    try (Cadence cadence = inline()
        .emailSender((to, subject, body) -> emails.add(to + ":" + subject))
        .recipientDirectory(owner -> Optional.of(owner + "@example.com"))
        .pushSender((deviceTokens, title, body, data) -> {
          pushes.add(deviceTokens);
          return List.of(PushResult.ok("tok-1"));
        })
        .deviceTokenStore(tokens)
        .build()) {
      RecordingConnection alice = new RecordingConnection("alice-1");
      RecordingConnection bob = new RecordingConnection("bob-1");
      cadence.connections().register("alice", alice);
      cadence.connections().register("bob", bob);
      RecurringDefinition rent = cadence.definitions().create(new NewDefinition("alice",
          new BigDecimal("1200"), EntryKind.EXPENSE, "Housing", "Rent", IntervalKind.MONTHLY,
          Instant.parse("2024-01-31T00:00:00Z"), null));

      TickReport report = cadence.processor().tick(Instant.parse("2024-02-29T12:00:00Z"));

      assertEquals(2, report.generated());
      List<Notification> unread = cadence.notifications().list("alice", NotificationStatus.UNREAD, 0, 10);
      assertEquals(2, unread.size());
      Notification latest = unread.get(0);
      assertEquals(NotificationType.RECURRING_TRANSACTION, latest.type());
      assertEquals(NotificationPriority.LOW, latest.priority());
      assertEquals("A expense of $1200.00 for Rent has been processed", latest.message());
      assertEquals("2024-02-29T00:00:00Z", latest.data().get("occurredAt"));
      assertEquals(rent.id(), latest.data().get("definitionId"));
      assertEquals(cadence.definitions().history(rent.id()).get(1).id(),
          latest.data().get("eventId"));

      assertEquals(3, alice.sent().size());
      assertTrue(alice.sent().get(0).startsWith("{\"type\":\"NOTIFICATION\""));
      assertEquals(BroadcastTickListener.MESSAGE, alice.sent().get(2));
      assertEquals(List.of(BroadcastTickListener.MESSAGE), bob.sent());
      assertEquals(List.of("alice@example.com:Recurring Transaction Processed",
          "alice@example.com:Recurring Transaction Processed"), emails);
      assertEquals(2, pushes.size());
      assertEquals(2, metrics.delivered(Channel.IN_APP));
      assertEquals(2, metrics.delivered(Channel.EMAIL));
      assertEquals(2, metrics.delivered(Channel.PUSH));
      assertEquals(2, cadence.notifications().unreadCount("alice"));
    }
  }

  @Test
  void channelsFollowOwnerPreferences() {
    try (Cadence cadence = inline().build()) {
      RecordingConnection alice = new RecordingConnection("alice-1");
      cadence.connections().register("alice", alice);
      cadence.preferences().update("alice", NotificationType.BUDGET_ALERT,
          EnumSet.of(Channel.EMAIL), NotificationPriority.LOW);

      cadence.alerts().budgetAlert("alice", "Groceries", new BigDecimal("95"), new BigDecimal("100"));

      assertTrue(alice.sent().isEmpty());
      assertEquals(1, cadence.notifications().unreadCount("alice"));
    }
  }

  @Test
  void disabledAnnouncementsOnlyGenerateEvents() {
    try (Cadence cadence = inline().announceGeneratedEvents(false).broadcastTicks(false).build()) {
      RecordingConnection alice = new RecordingConnection("alice-1");
      cadence.connections().register("alice", alice);
      cadence.definitions().create(new NewDefinition("alice", BigDecimal.ONE, EntryKind.INCOME,
          "Interest", null, IntervalKind.DAILY, Instant.parse("2024-01-31T00:00:00Z"), null));

      assertEquals(2, cadence.processor().tick(clock.instant()).generated());

      assertTrue(alice.sent().isEmpty());
      assertEquals(0, cadence.notifications().unreadCount("alice"));
    }
  }

  @Test
  void builderRequiresStoresAndSingleUse() {
    assertThrows(NullPointerException.class, () -> Cadence.builder().build());
    Cadence.Builder builder = inline();
    builder.build().close();
    assertThrows(IllegalStateException.class, builder::build);
  }
}
