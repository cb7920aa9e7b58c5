package cadence.jdbc;

import cadence.model.Channel;
import cadence.model.NotificationPreference;
import cadence.model.NotificationPriority;
import cadence.model.NotificationType;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.EnumSet;
import java.util.List;
import java.util.Set;

import static org.junit.jupiter.api.Assertions.*;

class JdbcPreferenceAndTokenStoreTest {
  private JdbcPreferenceStore preferences;
  private JdbcDeviceTokenStore tokens;

  @BeforeEach
  void setup() {
    DataSourceConnectionProvider provider = H2Database.create();
    preferences = new JdbcPreferenceStore(provider);
    tokens = new JdbcDeviceTokenStore(provider, TableNames.DEFAULT,
        Clock.fixed(Instant.parse("2024-05-01T00:00:00Z"), ZoneOffset.UTC));
  }

  @Test
  void preferenceUpsertInsertsThenUpdates() {
    assertTrue(preferences.find("alice", NotificationType.BUDGET_ALERT).isEmpty());

    preferences.upsert(new NotificationPreference("alice", NotificationType.BUDGET_ALERT,
        EnumSet.of(Channel.PUSH, Channel.IN_APP), NotificationPriority.MEDIUM));
    preferences.upsert(new NotificationPreference("alice", NotificationType.SAVINGS_GOAL,
        EnumSet.noneOf(Channel.class), NotificationPriority.LOW));
    NotificationPreference found = preferences.find("alice", NotificationType.BUDGET_ALERT).orElseThrow();
    assertEquals(EnumSet.of(Channel.IN_APP, Channel.PUSH), found.enabledChannels());
    assertEquals(NotificationPriority.MEDIUM, found.minPriority());

    preferences.upsert(new NotificationPreference("alice", NotificationType.BUDGET_ALERT,
        EnumSet.of(Channel.EMAIL), NotificationPriority.HIGH));
    found = preferences.find("alice", NotificationType.BUDGET_ALERT).orElseThrow();
    assertEquals(Set.of(Channel.EMAIL), found.enabledChannels());
    assertEquals(NotificationPriority.HIGH, found.minPriority());
    assertTrue(preferences.find("alice", NotificationType.SAVINGS_GOAL).orElseThrow()
        .enabledChannels().isEmpty());
  }

  @Test
  void channelListEncoding() {
    assertEquals("IN_APP,EMAIL,PUSH", JdbcPreferenceStore.encodeChannels(EnumSet.allOf(Channel.class)));
    assertEquals("", JdbcPreferenceStore.encodeChannels(EnumSet.noneOf(Channel.class)));
    assertEquals(EnumSet.of(Channel.EMAIL, Channel.PUSH), JdbcPreferenceStore.decodeChannels("PUSH, EMAIL"));
    assertTrue(JdbcPreferenceStore.decodeChannels("").isEmpty());
  }

  @Test
  void tokensRegisterDeactivateAndMoveBetweenOwners() {
    tokens.register("alice", "tok-1");
    tokens.register("alice", "tok-2");
    tokens.register("alice", "tok-1");
    assertEquals(List.of("tok-1", "tok-2"), tokens.activeTokens("alice"));

    tokens.deactivate("tok-2", "UNREGISTERED");
    assertEquals(List.of("tok-1"), tokens.activeTokens("alice"));

    tokens.register("bob", "tok-2");
    assertEquals(List.of("tok-2"), tokens.activeTokens("bob"));

    tokens.unregister("bob", "tok-1");
    assertEquals(List.of("tok-1"), tokens.activeTokens("alice"));
    tokens.unregister("alice", "tok-1");
    assertTrue(tokens.activeTokens("alice").isEmpty());
  }
}
