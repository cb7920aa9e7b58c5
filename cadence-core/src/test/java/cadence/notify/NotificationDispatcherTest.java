package cadence.notify;

import cadence.MutableClock;
import cadence.RecordingMetrics;
import cadence.memory.InMemoryNotificationStore;
import cadence.memory.InMemoryPreferenceStore;
import cadence.model.Channel;
import cadence.model.Notification;
import cadence.model.NotificationPreference;
import cadence.model.NotificationPriority;
import cadence.model.NotificationStatus;
import cadence.model.NotificationType;
import cadence.spi.NotificationStore;
import cadence.spi.PreferenceStore;
import cadence.spi.StoreException;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.time.Instant;
import java.util.EnumSet;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;

import static org.junit.jupiter.api.Assertions.assertDoesNotThrow;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

class NotificationDispatcherTest {

  private final MutableClock clock = new MutableClock(Instant.parse("2024-05-01T08:00:00Z"));
  private final InMemoryNotificationStore notifications = new InMemoryNotificationStore();
  private final InMemoryPreferenceStore preferenceStore = new InMemoryPreferenceStore();
  private final RecordingMetrics metrics = new RecordingMetrics();
  private final RecordingSender inApp = new RecordingSender(Channel.IN_APP);
  private final RecordingSender email = new RecordingSender(Channel.EMAIL);
  private final RecordingSender push = new RecordingSender(Channel.PUSH);

  private NotificationDispatcher inlineDispatcher() {
    return NotificationDispatcher.builder()
        .notificationStore(notifications)
        .preferenceService(new PreferenceService(preferenceStore))
        .sender(inApp)
        .sender(email)
        .sender(push)
        .channelWorkerCount(0)
        .metrics(metrics)
        .clock(clock)
        .build();
  }

  // ── Builder validation ──────────────────────────────────────────

  @Test
  void builderRejectsMissingStore() {
    assertThrows(NullPointerException.class, () -> NotificationDispatcher.builder()
        .preferenceService(new PreferenceService(preferenceStore))
        .build());
  }

  @Test
  void builderRejectsMissingPreferenceService() {
    assertThrows(NullPointerException.class, () -> NotificationDispatcher.builder()
        .notificationStore(notifications)
        .build());
  }

  @Test
  void builderRejectsNegativeWorkerCount() {
    assertThrows(IllegalArgumentException.class, () -> NotificationDispatcher.builder()
        .notificationStore(notifications)
        .preferenceService(new PreferenceService(preferenceStore))
        .channelWorkerCount(-1)
        .build());
  }

  @Test
  void builderRejectsNonPositiveSendTimeoutEvenInline() {
    assertThrows(IllegalArgumentException.class, () -> NotificationDispatcher.builder()
        .notificationStore(notifications)
        .preferenceService(new PreferenceService(preferenceStore))
        .channelWorkerCount(0)
        .sendTimeout(Duration.ZERO)
        .build());
    assertThrows(IllegalArgumentException.class, () -> NotificationDispatcher.builder()
        .notificationStore(notifications)
        .preferenceService(new PreferenceService(preferenceStore))
        .channelWorkerCount(0)
        .sendTimeout(Duration.ofSeconds(-1))
        .build());
  }

  // ── Persistence and preference filtering ────────────────────────

  @Test
  void announcePersistsUnreadNotification() {
    try (NotificationDispatcher dispatcher = inlineDispatcher()) {
      Notification notification = dispatcher.announce("alice", NotificationType.TRANSACTION,
          NotificationPriority.MEDIUM, NotificationContent.of("Paid", "Rent paid", Map.of("k", "v")));

      Notification stored = notifications.findById(notification.id()).orElseThrow();
      assertEquals(NotificationStatus.UNREAD, stored.status());
      assertEquals("Rent paid", stored.message());
      assertEquals(Map.of("k", "v"), stored.data());
      assertEquals(clock.instant(), stored.createdAt());
      assertEquals(1, metrics.notificationsCreated.get());
    }
  }

  @Test
  void defaultPreferenceDeliversOnEveryChannel() {
    try (NotificationDispatcher dispatcher = inlineDispatcher()) {
      dispatcher.announce("alice", NotificationType.TRANSACTION, NotificationPriority.LOW,
          NotificationContent.of("t", "m"));

      assertEquals(1, inApp.delivered.size());
      assertEquals(1, email.delivered.size());
      assertEquals(1, push.delivered.size());
      assertTrue(preferenceStore.find("alice", NotificationType.TRANSACTION).isPresent());
    }
  }

  @Test
  void belowMinimumPriorityIsStoredButNotSent() {
    preferenceStore.upsert(new NotificationPreference("alice", NotificationType.BUDGET_ALERT,
        EnumSet.of(Channel.IN_APP, Channel.EMAIL), NotificationPriority.MEDIUM));
    try (NotificationDispatcher dispatcher = inlineDispatcher()) {
      Notification notification = dispatcher.announce("alice", NotificationType.BUDGET_ALERT,
          NotificationPriority.LOW, NotificationContent.of("t", "m"));

      assertTrue(notifications.findById(notification.id()).isPresent());
      assertEquals(0, inApp.delivered.size() + email.delivered.size() + push.delivered.size());
      assertEquals(1, metrics.notificationsSuppressed.get());
    }
  }

  @Test
  void atMinimumPriorityGoesToExactlyTheEnabledChannels() {
    preferenceStore.upsert(new NotificationPreference("alice", NotificationType.BUDGET_ALERT,
        EnumSet.of(Channel.IN_APP, Channel.EMAIL), NotificationPriority.MEDIUM));
    try (NotificationDispatcher dispatcher = inlineDispatcher()) {
      dispatcher.announce("alice", NotificationType.BUDGET_ALERT, NotificationPriority.MEDIUM,
          NotificationContent.of("t", "m"));

      assertEquals(1, inApp.delivered.size());
      assertEquals(1, email.delivered.size());
      assertEquals(0, push.delivered.size());
    }
  }

  @Test
  void preferencesArePerType() {
    preferenceStore.upsert(new NotificationPreference("alice", NotificationType.SAVINGS_GOAL,
        EnumSet.noneOf(Channel.class), NotificationPriority.LOW));
    try (NotificationDispatcher dispatcher = inlineDispatcher()) {
      dispatcher.announce("alice", NotificationType.SAVINGS_GOAL, NotificationPriority.HIGH,
          NotificationContent.of("t", "m"));
      dispatcher.announce("alice", NotificationType.TRANSACTION, NotificationPriority.HIGH,
          NotificationContent.of("t", "m"));

      assertEquals(1, inApp.delivered.size());
      assertEquals(NotificationType.TRANSACTION, inApp.delivered.get(0).type());
    }
  }

  @Test
  void channelWithoutSenderIsSkipped() {
    try (NotificationDispatcher dispatcher = NotificationDispatcher.builder()
        .notificationStore(notifications)
        .preferenceService(new PreferenceService(preferenceStore))
        .sender(inApp)
        .channelWorkerCount(0)
        .build()) {
      assertDoesNotThrow(() -> dispatcher.announce("alice", NotificationType.TRANSACTION,
          NotificationPriority.HIGH, NotificationContent.of("t", "m")));
      assertEquals(1, inApp.delivered.size());
      assertEquals(List.of(Channel.IN_APP), dispatcher.channels());
    }
  }

  // ── Failure isolation ───────────────────────────────────────────

  @Test
  void failingChannelDoesNotAffectOthersOrTheCaller() {
    email.failingWith(new ChannelDeliveryException(Channel.EMAIL, "smtp down"));
    try (NotificationDispatcher dispatcher = inlineDispatcher()) {
      Notification notification = dispatcher.announce("alice", NotificationType.TRANSACTION,
          NotificationPriority.HIGH, NotificationContent.of("t", "m"));

      assertEquals(1, inApp.delivered.size());
      assertEquals(1, push.delivered.size());
      assertEquals(1, metrics.failed(Channel.EMAIL));
      assertEquals(1, metrics.delivered(Channel.IN_APP));
      assertEquals(NotificationStatus.UNREAD,
          notifications.findById(notification.id()).orElseThrow().status());
    }
  }

  @Test
  void hangingChannelIsAbandonedAfterSendTimeout() throws Exception {
    email.hanging(10_000);
    try (NotificationDispatcher dispatcher = NotificationDispatcher.builder()
        .notificationStore(notifications)
        .preferenceService(new PreferenceService(preferenceStore))
        .sender(inApp)
        .sender(email)
        .channelWorkerCount(2)
        .sendTimeout(Duration.ofMillis(100))
        .metrics(metrics)
        .build()) {
      dispatcher.announce("alice", NotificationType.TRANSACTION, NotificationPriority.HIGH,
          NotificationContent.of("t", "m"));

      assertTrue(email.attempted.await(5, TimeUnit.SECONDS));
      long deadline = System.currentTimeMillis() + 5_000;
      while (metrics.failed(Channel.EMAIL) == 0 && System.currentTimeMillis() < deadline) {
        Thread.sleep(10);
      }
      assertEquals(1, metrics.failed(Channel.EMAIL));
      assertEquals(0, email.delivered.size());
    }
    assertEquals(1, inApp.delivered.size());
  }

  @Test
  void storeFailurePropagatesAndNothingIsSent() {
    NotificationStore delegate = new InMemoryNotificationStore();
    NotificationStore broken = new NotificationStore() {
      @Override
      public void create(Notification notification) {
        throw new StoreException("disk full");
      }

      @Override
      public Optional<Notification> findById(String notificationId) {
        return delegate.findById(notificationId);
      }

      @Override
      public List<Notification> listByOwner(String ownerId, NotificationStatus status,
          int offset, int limit) {
        return delegate.listByOwner(ownerId, status, offset, limit);
      }

      @Override
      public int countByStatus(String ownerId, NotificationStatus status) {
        return 0;
      }

      @Override
      public int updateStatus(String notificationId, NotificationStatus expected,
          NotificationStatus newStatus, Instant readAt) {
        return 0;
      }

      @Override
      public int archiveExpired(String ownerId, Instant now) {
        return 0;
      }
    };
    try (NotificationDispatcher dispatcher = NotificationDispatcher.builder()
        .notificationStore(broken)
        .preferenceService(new PreferenceService(preferenceStore))
        .sender(inApp)
        .channelWorkerCount(0)
        .build()) {
      assertThrows(StoreException.class, () -> dispatcher.announce("alice",
          NotificationType.TRANSACTION, NotificationPriority.HIGH, NotificationContent.of("t", "m")));
      assertEquals(0, inApp.delivered.size());
    }
  }

  @Test
  void preferenceStoreOutageFallsBackToDefaults() {
    AtomicInteger lookups = new AtomicInteger();
    PreferenceStore outage = new PreferenceStore() {
      @Override
      public Optional<NotificationPreference> find(String ownerId, NotificationType type) {
        lookups.incrementAndGet();
        throw new StoreException("unavailable");
      }

      @Override
      public void upsert(NotificationPreference preference) {
        throw new StoreException("unavailable");
      }
    };
    try (NotificationDispatcher dispatcher = NotificationDispatcher.builder()
        .notificationStore(notifications)
        .preferenceService(new PreferenceService(outage))
        .sender(inApp)
        .channelWorkerCount(0)
        .build()) {
      dispatcher.announce("alice", NotificationType.TRANSACTION, NotificationPriority.LOW,
          NotificationContent.of("t", "m"));

      assertEquals(1, lookups.get());
      assertEquals(1, inApp.delivered.size());
    }
  }
}
