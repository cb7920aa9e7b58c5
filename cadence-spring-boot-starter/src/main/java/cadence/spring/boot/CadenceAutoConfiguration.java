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
import cadence.model.Channel;
import cadence.notify.Alerts;
import cadence.notify.NotificationService;
import cadence.notify.PreferenceDefaults;
import cadence.notify.PreferenceService;
import cadence.schedule.DefinitionService;
import cadence.schedule.GeneratedEventListener;
import cadence.spi.DefinitionStore;
import cadence.spi.DeviceTokenStore;
import cadence.spi.EmailSender;
import cadence.spi.MetricsExporter;
import cadence.spi.NotificationStore;
import cadence.spi.PreferenceStore;
import cadence.spi.PushSender;
import cadence.spi.RecipientDirectory;
import cadence.spring.CadenceWebSocketHandler;
import cadence.spring.SpringMailEmailSender;
import cadence.util.JsonCodec;

import org.springframework.beans.factory.ObjectProvider;
import org.springframework.boot.autoconfigure.AutoConfiguration;
import org.springframework.boot.autoconfigure.condition.ConditionalOnBean;
import org.springframework.boot.autoconfigure.condition.ConditionalOnClass;
import org.springframework.boot.autoconfigure.condition.ConditionalOnMissingBean;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.boot.autoconfigure.condition.ConditionalOnWebApplication;
import org.springframework.boot.autoconfigure.jdbc.DataSourceAutoConfiguration;
import org.springframework.boot.autoconfigure.mail.MailSenderAutoConfiguration;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.mail.javamail.JavaMailSender;
import org.springframework.web.socket.config.annotation.EnableWebSocket;
import org.springframework.web.socket.config.annotation.WebSocketConfigurer;
import org.springframework.web.socket.config.annotation.WebSocketHandlerRegistry;

import javax.sql.DataSource;
import java.time.Clock;
import java.time.ZoneId;
import java.util.EnumSet;

/**
 * Auto-configuration for Cadence.
 *
 * <p>Wires JDBC stores over the application's {@link DataSource}, a shared
 * {@link ConnectionRegistry} and the {@link Cadence} runtime from {@link CadenceProperties}.
 * Any store, the registry or the runtime itself can be replaced by declaring a bean of the
 * same type. Optional collaborators are picked up when present: a {@link MetricsExporter},
 * an {@link EmailSender} with a {@link RecipientDirectory}, a {@link PushSender}, and any
 * number of {@link GeneratedEventListener} beans.
 *
 * <p>With {@code cadence.dispatch.email-from} set and a {@link JavaMailSender} available,
 * email is sent through {@link SpringMailEmailSender}. With {@code cadence.websocket.enabled}
 * the registry is exposed as a WebSocket endpoint at {@code cadence.websocket.path}.
 *
 * @see CadenceProperties
 * @see CadenceMicrometerAutoConfiguration
 */
@AutoConfiguration(after = {DataSourceAutoConfiguration.class, MailSenderAutoConfiguration.class})
@ConditionalOnClass({Cadence.class, JdbcDefinitionStore.class})
@ConditionalOnBean(DataSource.class)
@EnableConfigurationProperties(CadenceProperties.class)
public class CadenceAutoConfiguration {

  @Bean
  @ConditionalOnMissingBean(ConnectionProvider.class)
  public DataSourceConnectionProvider cadenceConnectionProvider(DataSource dataSource) {
    return new DataSourceConnectionProvider(dataSource);
  }

  @Bean
  @ConditionalOnMissingBean
  public TableNames cadenceTableNames(CadenceProperties props) {
    return TableNames.withPrefix(props.getJdbc().getTablePrefix());
  }

  @Bean
  @ConditionalOnMissingBean
  @ConditionalOnProperty(prefix = "cadence.jdbc", name = "initialize-schema", havingValue = "true")
  public CadenceSchemaInitializer cadenceSchemaInitializer(ConnectionProvider connectionProvider,
      TableNames tables) {
    return new CadenceSchemaInitializer(connectionProvider, tables);
  }

  @Bean
  @ConditionalOnMissingBean(DefinitionStore.class)
  public JdbcDefinitionStore definitionStore(ConnectionProvider connectionProvider,
      TableNames tables) {
    return new JdbcDefinitionStore(connectionProvider, tables);
  }

  @Bean
  @ConditionalOnMissingBean(NotificationStore.class)
  public JdbcNotificationStore notificationStore(ConnectionProvider connectionProvider,
      TableNames tables) {
    return new JdbcNotificationStore(connectionProvider, tables, JsonCodec.getDefault());
  }

  @Bean
  @ConditionalOnMissingBean(PreferenceStore.class)
  public JdbcPreferenceStore preferenceStore(ConnectionProvider connectionProvider,
      TableNames tables) {
    return new JdbcPreferenceStore(connectionProvider, tables);
  }

  @Bean
  @ConditionalOnMissingBean(DeviceTokenStore.class)
  public JdbcDeviceTokenStore deviceTokenStore(ConnectionProvider connectionProvider,
      TableNames tables) {
    return new JdbcDeviceTokenStore(connectionProvider, tables, Clock.systemUTC());
  }

  @Bean(destroyMethod = "close")
  @ConditionalOnMissingBean
  public ConnectionRegistry connectionRegistry(CadenceProperties props,
      ObjectProvider<MetricsExporter> metricsProvider) {
    ConnectionRegistry.Builder builder = ConnectionRegistry.builder()
        .sendWorkerCount(props.getRegistry().getSendWorkerCount())
        .sendTimeout(props.getRegistry().getSendTimeout());
    MetricsExporter metrics = metricsProvider.getIfAvailable();
    if (metrics != null) {
      builder.metrics(metrics);
    }
    return builder.build();
  }

  @Bean(destroyMethod = "close")
  @ConditionalOnMissingBean
  public Cadence cadence(CadenceProperties props,
      DefinitionStore definitionStore,
      NotificationStore notificationStore,
      PreferenceStore preferenceStore,
      DeviceTokenStore deviceTokenStore,
      ConnectionRegistry connectionRegistry,
      ObjectProvider<CadenceSchemaInitializer> schemaInitializer,
      ObjectProvider<MetricsExporter> metricsProvider,
      ObjectProvider<EmailSender> emailSenderProvider,
      ObjectProvider<RecipientDirectory> recipientDirectoryProvider,
      ObjectProvider<PushSender> pushSenderProvider,
      ObjectProvider<GeneratedEventListener> listenerProvider) {

    // Tables must exist before the first tick.
    schemaInitializer.getIfAvailable();

    CadenceProperties.Scheduler scheduler = props.getScheduler();
    CadenceProperties.Defaults defaults = props.getDefaults();
    Cadence.Builder builder = Cadence.builder()
        .definitionStore(definitionStore)
        .notificationStore(notificationStore)
        .preferenceStore(preferenceStore)
        .deviceTokenStore(deviceTokenStore)
        .connectionRegistry(connectionRegistry)
        .zone(ZoneId.of(scheduler.getZone()))
        .preferenceDefaults(new PreferenceDefaults(
            defaults.getChannels() == null ? EnumSet.noneOf(Channel.class)
                : defaults.getChannels(),
            defaults.getMinPriority()))
        .tickInterval(scheduler.getTickInterval())
        .batchSize(scheduler.getBatchSize())
        .workerCount(scheduler.getWorkerCount())
        .listenerWorkerCount(scheduler.getListenerWorkerCount())
        .definitionTimeout(scheduler.getDefinitionTimeout())
        .inFlightLease(scheduler.getInFlightLease())
        .drainTimeoutMs(scheduler.getDrainTimeoutMs())
        .announceGeneratedEvents(scheduler.isAnnounceGeneratedEvents())
        .broadcastTicks(scheduler.isBroadcastTicks())
        .channelWorkerCount(props.getDispatch().getChannelWorkerCount())
        .channelSendTimeout(props.getDispatch().getSendTimeout());
    MetricsExporter metrics = metricsProvider.getIfAvailable();
    if (metrics != null) {
      builder.metrics(metrics);
    }
    emailSenderProvider.ifAvailable(builder::emailSender);
    recipientDirectoryProvider.ifAvailable(builder::recipientDirectory);
    pushSenderProvider.ifAvailable(builder::pushSender);
    listenerProvider.orderedStream().forEach(builder::listener);

    Cadence cadence = builder.build();
    if (scheduler.isAutoStart()) {
      cadence.start();
    }
    return cadence;
  }

  @Bean
  @ConditionalOnMissingBean
  public DefinitionService definitionService(Cadence cadence) {
    return cadence.definitions();
  }

  @Bean
  @ConditionalOnMissingBean
  public NotificationService notificationService(Cadence cadence) {
    return cadence.notifications();
  }

  @Bean
  @ConditionalOnMissingBean
  public PreferenceService preferenceService(Cadence cadence) {
    return cadence.preferences();
  }

  @Bean
  @ConditionalOnMissingBean
  public Alerts alerts(Cadence cadence) {
    return cadence.alerts();
  }

  @Configuration(proxyBeanMethods = false)
  @ConditionalOnClass(name = "org.springframework.mail.javamail.JavaMailSender")
  @ConditionalOnBean(type = "org.springframework.mail.javamail.JavaMailSender")
  @ConditionalOnProperty(prefix = "cadence.dispatch", name = "email-from")
  static class MailConfiguration {

    @Bean
    @ConditionalOnMissingBean(EmailSender.class)
    SpringMailEmailSender springMailEmailSender(JavaMailSender mailSender,
        CadenceProperties props) {
      return new SpringMailEmailSender(mailSender, props.getDispatch().getEmailFrom());
    }
  }

  @Configuration(proxyBeanMethods = false)
  @ConditionalOnClass(name = "org.springframework.web.socket.WebSocketHandler")
  @ConditionalOnProperty(prefix = "cadence.websocket", name = "enabled", havingValue = "true")
  static class WebSocketConfiguration {

    @Bean
    @ConditionalOnMissingBean
    CadenceWebSocketHandler cadenceWebSocketHandler(ConnectionRegistry connectionRegistry) {
      return new CadenceWebSocketHandler(connectionRegistry);
    }

    @Configuration(proxyBeanMethods = false)
    @ConditionalOnWebApplication(type = ConditionalOnWebApplication.Type.SERVLET)
    @EnableWebSocket
    static class EndpointConfiguration implements WebSocketConfigurer {
      private final CadenceWebSocketHandler handler;
      private final CadenceProperties props;

      EndpointConfiguration(CadenceWebSocketHandler handler, CadenceProperties props) {
        this.handler = handler;
        this.props = props;
      }

      @Override
      public void registerWebSocketHandlers(WebSocketHandlerRegistry registry) {
        registry.addHandler(handler, props.getWebsocket().getPath())
            .setAllowedOrigins(props.getWebsocket().getAllowedOrigins());
      }
    }
  }
}
