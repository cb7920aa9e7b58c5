package cadence.spring.boot;

import cadence.Cadence;
import cadence.jdbc.ConnectionProvider;
import cadence.jdbc.DataSourceConnectionProvider;
import cadence.jdbc.JdbcDefinitionStore;
import cadence.jdbc.JdbcDeviceTokenStore;
import cadence.jdbc.JdbcNotificationStore;
import cadence.jdbc.JdbcPreferenceStore;
import cadence.jdbc.TableNames;
import cadence.live.ConnectionRegistry;
import cadence.memory.InMemoryDefinitionStore;
import cadence.model.Channel;
import cadence.model.EntryKind;
import cadence.model.GeneratedEvent;
import cadence.model.IntervalKind;
import cadence.model.NotificationStatus;
import cadence.model.RecurringDefinition;
import cadence.notify.NotificationService;
import cadence.schedule.DefinitionService;
import cadence.schedule.GeneratedEventListener;
import cadence.schedule.NewDefinition;
import cadence.schedule.TickReport;
import cadence.spi.DefinitionStore;
import cadence.spi.EmailSender;
import cadence.spi.MetricsExporter;
import cadence.spring.CadenceWebSocketHandler;
import cadence.spring.SpringMailEmailSender;

import jakarta.mail.internet.MimeMessage;
import org.junit.jupiter.api.Test;
import org.springframework.boot.autoconfigure.AutoConfigurations;
import org.springframework.boot.autoconfigure.jdbc.DataSourceAutoConfiguration;
import org.springframework.boot.test.context.runner.ApplicationContextRunner;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.mail.javamail.JavaMailSender;
import org.springframework.mail.javamail.JavaMailSenderImpl;

import java.math.BigDecimal;
import java.time.Instant;
import java.util.List;
import java.util.UUID;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;

import static org.junit.jupiter.api.Assertions.*;

class CadenceAutoConfigurationTest {

  private final ApplicationContextRunner runner = new ApplicationContextRunner()
      .withConfiguration(AutoConfigurations.of(
          DataSourceAutoConfiguration.class,
          CadenceAutoConfiguration.class))
      .withPropertyValues(
          "spring.datasource.url=jdbc:h2:mem:cadence_auto_" + UUID.randomUUID()
              + ";MODE=MySQL;DB_CLOSE_DELAY=-1",
          "spring.datasource.driver-class-name=org.h2.Driver",
          "cadence.jdbc.initialize-schema=true",
          "cadence.scheduler.auto-start=false",
          "cadence.scheduler.worker-count=0",
          "cadence.scheduler.listener-worker-count=0");

  @Test
  void createsAllBeans() {
    runner.run(ctx -> {
      assertTrue(ctx.containsBean("cadenceConnectionProvider"));
      assertTrue(ctx.containsBean("cadenceTableNames"));
      assertTrue(ctx.containsBean("cadenceSchemaInitializer"));
      assertTrue(ctx.containsBean("definitionStore"));
      assertTrue(ctx.containsBean("notificationStore"));
      assertTrue(ctx.containsBean("preferenceStore"));
      assertTrue(ctx.containsBean("deviceTokenStore"));
      assertTrue(ctx.containsBean("connectionRegistry"));
      assertTrue(ctx.containsBean("cadence"));
      assertTrue(ctx.containsBean("definitionService"));
      assertTrue(ctx.containsBean("notificationService"));
      assertTrue(ctx.containsBean("preferenceService"));
      assertTrue(ctx.containsBean("alerts"));

      assertInstanceOf(DataSourceConnectionProvider.class, ctx.getBean(ConnectionProvider.class));
      assertInstanceOf(JdbcDefinitionStore.class, ctx.getBean(DefinitionStore.class));
      assertNotNull(ctx.getBean(JdbcNotificationStore.class));
      assertNotNull(ctx.getBean(JdbcPreferenceStore.class));
      assertNotNull(ctx.getBean(JdbcDeviceTokenStore.class));
      assertSame(ctx.getBean(ConnectionRegistry.class), ctx.getBean(Cadence.class).connections());
      assertSame(ctx.getBean(Cadence.class).definitions(), ctx.getBean(DefinitionService.class));
      assertFalse(ctx.containsBean("cadenceWebSocketHandler"));
      assertFalse(ctx.containsBean("springMailEmailSender"));
    });
  }

  @Test
  void generatesAndAnnouncesOverJdbc() {
    runner.withUserConfiguration(ListenerConfig.class).run(ctx -> {
      Cadence cadence = ctx.getBean(Cadence.class);
      cadence.definitions().create(new NewDefinition("alice", new BigDecimal("50.00"),
          EntryKind.EXPENSE, "Utilities", "Internet", IntervalKind.MONTHLY,
          Instant.parse("2024-01-31T00:00:00Z"), Instant.parse("2024-02-29T00:00:00Z")));

      TickReport report = cadence.processor().tick(Instant.parse("2024-03-15T00:00:00Z"));

      assertEquals(2, report.generated());
      assertFalse(report.hasFailures());
      RecordingListener listener = ctx.getBean(RecordingListener.class);
      assertEquals(List.of(Instant.parse("2024-01-31T00:00:00Z"),
          Instant.parse("2024-02-29T00:00:00Z")), listener.occurredAt);
      NotificationService notifications = ctx.getBean(NotificationService.class);
      assertEquals(2, notifications.unreadCount("alice"));
      assertEquals(2, notifications.list("alice", NotificationStatus.UNREAD, 0, 10).size());
      assertTrue(cadence.definitions().listActive("alice").isEmpty());
    });
  }

  @Test
  void customTablePrefix() {
    runner.withPropertyValues("cadence.jdbc.table-prefix=fin_").run(ctx -> {
      assertEquals("fin_", ctx.getBean(TableNames.class).prefix());
      assertEquals("fin_recurring_definition", ctx.getBean(TableNames.class).definitions());
      ctx.getBean(Cadence.class).definitions().create(new NewDefinition("bob", BigDecimal.TEN,
          EntryKind.INCOME, "Salary", "Paycheck", IntervalKind.WEEKLY,
          Instant.parse("2024-01-01T00:00:00Z"), null));
      assertEquals(1, ctx.getBean(DefinitionService.class).listActive("bob").size());
    });
  }

  @Test
  void invalidTablePrefixFailsStartup() {
    runner.withPropertyValues("cadence.jdbc.table-prefix=bad-prefix").run(ctx -> {
      assertNotNull(ctx.getStartupFailure());
      assertInstanceOf(IllegalArgumentException.class, findRootCause(ctx.getStartupFailure()));
    });
  }

  @Test
  void autoStartBeginsTicking() {
    runner.withUserConfiguration(TickCountingConfig.class)
        .withPropertyValues("cadence.scheduler.auto-start=true").run(ctx -> {
          TickCountingMetrics metrics = ctx.getBean(TickCountingMetrics.class);
          assertTrue(metrics.firstTick.await(5, TimeUnit.SECONDS));
        });
  }

  @Test
  void noTicksWithoutAutoStart() {
    runner.withUserConfiguration(TickCountingConfig.class).run(ctx -> {
      TickCountingMetrics metrics = ctx.getBean(TickCountingMetrics.class);
      assertFalse(metrics.firstTick.await(200, TimeUnit.MILLISECONDS));
    });
  }

  @Test
  void wiresSpringMailWhenSenderAddressConfigured() {
    runner.withUserConfiguration(MailConfig.class)
        .withPropertyValues("cadence.dispatch.email-from=noreply@cadence.test")
        .run(ctx -> {
          assertInstanceOf(SpringMailEmailSender.class, ctx.getBean(EmailSender.class));
        });
  }

  @Test
  void skipsSpringMailWithoutSenderAddress() {
    runner.withUserConfiguration(MailConfig.class).run(ctx -> {
      assertFalse(ctx.containsBean("springMailEmailSender"));
    });
  }

  @Test
  void registersWebSocketHandlerWhenEnabled() {
    runner.withPropertyValues("cadence.websocket.enabled=true").run(ctx -> {
      assertTrue(ctx.containsBean("cadenceWebSocketHandler"));
      assertNotNull(ctx.getBean(CadenceWebSocketHandler.class));
    });
  }

  @Test
  void notLoadedWithoutDataSource() {
    new ApplicationContextRunner()
        .withConfiguration(AutoConfigurations.of(CadenceAutoConfiguration.class))
        .run(ctx -> {
          assertFalse(ctx.containsBean("cadence"));
        });
  }

  @Test
  void respectsConditionalOnMissingBean() {
    runner.withUserConfiguration(CustomStoreConfig.class).run(ctx -> {
      assertInstanceOf(InMemoryDefinitionStore.class, ctx.getBean(DefinitionStore.class));
      assertEquals("myDefinitionStore", ctx.getBeanNamesForType(DefinitionStore.class)[0]);
      assertFalse(ctx.containsBean("definitionStore"));
    });
  }

  // ── Test configurations ──────────────────────────────────────

  static class RecordingListener implements GeneratedEventListener {
    final List<Instant> occurredAt = new CopyOnWriteArrayList<>();

    @Override
    public void onGenerated(RecurringDefinition definition, GeneratedEvent event) {
      occurredAt.add(event.occurredAt());
    }
  }

  @Configuration
  static class ListenerConfig {
    @Bean
    RecordingListener recordingListener() {
      return new RecordingListener();
    }
  }

  @Configuration
  static class CustomStoreConfig {
    @Bean
    DefinitionStore myDefinitionStore() {
      return new InMemoryDefinitionStore();
    }
  }

  static class TickCountingMetrics implements MetricsExporter {
    final CountDownLatch firstTick = new CountDownLatch(1);

    @Override
    public void incrementTicks() {
      firstTick.countDown();
    }

    @Override
    public void incrementTickFatal() {}

    @Override
    public void incrementEventsGenerated() {}

    @Override
    public void incrementClaimsSkipped() {}

    @Override
    public void incrementDefinitionsFailed() {}

    @Override
    public void recordTickDurationMs(long durationMs) {}

    @Override
    public void incrementNotificationsCreated() {}

    @Override
    public void incrementChannelDelivered(Channel channel) {}

    @Override
    public void incrementChannelFailed(Channel channel) {}
  }

  @Configuration
  static class TickCountingConfig {
    @Bean
    TickCountingMetrics tickCountingMetrics() {
      return new TickCountingMetrics();
    }
  }

  @Configuration
  static class MailConfig {
    @Bean
    JavaMailSender javaMailSender() {
      return new JavaMailSenderImpl() {
        @Override
        protected void doSend(MimeMessage[] mimeMessages, Object[] originalMessages) {
        }
      };
    }
  }

  private static Throwable findRootCause(Throwable t) {
    while (t.getCause() != null && t.getCause() != t) {
      t = t.getCause();
    }
    return t;
  }
}
