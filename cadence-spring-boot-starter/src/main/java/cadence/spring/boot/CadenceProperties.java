package cadence.spring.boot;

import cadence.model.Channel;
import cadence.model.NotificationPriority;
import org.springframework.boot.context.properties.ConfigurationProperties;

import java.time.Duration;
import java.util.EnumSet;
import java.util.Set;

/**
 * Configuration properties for Cadence.
 *
 * @see CadenceAutoConfiguration
 */
@ConfigurationProperties(prefix = "cadence")
public class CadenceProperties {

    private final Scheduler scheduler = new Scheduler();
    private final Dispatch dispatch = new Dispatch();
    private final Registry registry = new Registry();
    private final Defaults defaults = new Defaults();
    private final Metrics metrics = new Metrics();
    private final Jdbc jdbc = new Jdbc();
    private final Websocket websocket = new Websocket();

    public Scheduler getScheduler() {
        return scheduler;
    }

    public Dispatch getDispatch() {
        return dispatch;
    }

    public Registry getRegistry() {
        return registry;
    }

    public Defaults getDefaults() {
        return defaults;
    }

    public Metrics getMetrics() {
        return metrics;
    }

    public Jdbc getJdbc() {
        return jdbc;
    }

    public Websocket getWebsocket() {
        return websocket;
    }

    public static class Scheduler {
        /**
         * Whether the tick schedule starts with the application context.
         */
        private boolean autoStart = true;
        private Duration tickInterval = Duration.ofHours(1);
        private int batchSize = 100;
        private int workerCount = 4;
        private int listenerWorkerCount = 1;
        private Duration definitionTimeout = Duration.ofSeconds(30);
        /**
         * How long a definition stays claimed by a worker before another tick may take it
         * over. Zero never expires.
         */
        private Duration inFlightLease = Duration.ZERO;
        private long drainTimeoutMs = 5000;
        /**
         * Time zone used to interpret calendar dates in recurrence arithmetic.
         */
        private String zone = "UTC";
        private boolean announceGeneratedEvents = true;
        private boolean broadcastTicks = true;

        public boolean isAutoStart() {
            return autoStart;
        }

        public void setAutoStart(boolean autoStart) {
            this.autoStart = autoStart;
        }

        public Duration getTickInterval() {
            return tickInterval;
        }

        public void setTickInterval(Duration tickInterval) {
            this.tickInterval = tickInterval;
        }

        public int getBatchSize() {
            return batchSize;
        }

        public void setBatchSize(int batchSize) {
            this.batchSize = batchSize;
        }

        public int getWorkerCount() {
            return workerCount;
        }

        public void setWorkerCount(int workerCount) {
            this.workerCount = workerCount;
        }

        public int getListenerWorkerCount() {
            return listenerWorkerCount;
        }

        public void setListenerWorkerCount(int listenerWorkerCount) {
            this.listenerWorkerCount = listenerWorkerCount;
        }

        public Duration getDefinitionTimeout() {
            return definitionTimeout;
        }

        public void setDefinitionTimeout(Duration definitionTimeout) {
            this.definitionTimeout = definitionTimeout;
        }

        public Duration getInFlightLease() {
            return inFlightLease;
        }

        public void setInFlightLease(Duration inFlightLease) {
            this.inFlightLease = inFlightLease;
        }

        public long getDrainTimeoutMs() {
            return drainTimeoutMs;
        }

        public void setDrainTimeoutMs(long drainTimeoutMs) {
            this.drainTimeoutMs = drainTimeoutMs;
        }

        public String getZone() {
            return zone;
        }

        public void setZone(String zone) {
            this.zone = zone;
        }

        public boolean isAnnounceGeneratedEvents() {
            return announceGeneratedEvents;
        }

        public void setAnnounceGeneratedEvents(boolean announceGeneratedEvents) {
            this.announceGeneratedEvents = announceGeneratedEvents;
        }

        public boolean isBroadcastTicks() {
            return broadcastTicks;
        }

        public void setBroadcastTicks(boolean broadcastTicks) {
            this.broadcastTicks = broadcastTicks;
        }
    }

    public static class Dispatch {
        private int channelWorkerCount = 4;
        private Duration sendTimeout = Duration.ofSeconds(10);
        /**
         * Sender address for the email channel. Spring Mail delivery is enabled only when set.
         */
        private String emailFrom;

        public String getEmailFrom() {
            return emailFrom;
        }

        public void setEmailFrom(String emailFrom) {
            this.emailFrom = emailFrom;
        }

        public int getChannelWorkerCount() {
            return channelWorkerCount;
        }

        public void setChannelWorkerCount(int channelWorkerCount) {
            this.channelWorkerCount = channelWorkerCount;
        }

        public Duration getSendTimeout() {
            return sendTimeout;
        }

        public void setSendTimeout(Duration sendTimeout) {
            this.sendTimeout = sendTimeout;
        }
    }

    public static class Registry {
        private int sendWorkerCount = 8;
        private Duration sendTimeout = Duration.ofSeconds(10);

        public int getSendWorkerCount() {
            return sendWorkerCount;
        }

        public void setSendWorkerCount(int sendWorkerCount) {
            this.sendWorkerCount = sendWorkerCount;
        }

        public Duration getSendTimeout() {
            return sendTimeout;
        }

        public void setSendTimeout(Duration sendTimeout) {
            this.sendTimeout = sendTimeout;
        }
    }

    /**
     * Preference applied to owners who never configured a notification type.
     */
    public static class Defaults {
        private Set<Channel> channels = EnumSet.allOf(Channel.class);
        private NotificationPriority minPriority = NotificationPriority.LOW;

        public Set<Channel> getChannels() {
            return channels;
        }

        public void setChannels(Set<Channel> channels) {
            this.channels = channels;
        }

        public NotificationPriority getMinPriority() {
            return minPriority;
        }

        public void setMinPriority(NotificationPriority minPriority) {
            this.minPriority = minPriority;
        }
    }

    public static class Metrics {
        private boolean enabled = true;
        private String namePrefix = "cadence";

        public boolean isEnabled() {
            return enabled;
        }

        public void setEnabled(boolean enabled) {
            this.enabled = enabled;
        }

        public String getNamePrefix() {
            return namePrefix;
        }

        public void setNamePrefix(String namePrefix) {
            this.namePrefix = namePrefix;
        }
    }

    public static class Jdbc {
        private String tablePrefix = "cadence_";
        /**
         * Whether to create the Cadence tables on startup if they are missing.
         */
        private boolean initializeSchema = false;

        public String getTablePrefix() {
            return tablePrefix;
        }

        public void setTablePrefix(String tablePrefix) {
            this.tablePrefix = tablePrefix;
        }

        public boolean isInitializeSchema() {
            return initializeSchema;
        }

        public void setInitializeSchema(boolean initializeSchema) {
            this.initializeSchema = initializeSchema;
        }
    }

    public static class Websocket {
        private boolean enabled = false;
        private String path = "/ws/notifications";
        private String[] allowedOrigins = new String[0];

        public boolean isEnabled() {
            return enabled;
        }

        public void setEnabled(boolean enabled) {
            this.enabled = enabled;
        }

        public String getPath() {
            return path;
        }

        public void setPath(String path) {
            this.path = path;
        }

        public String[] getAllowedOrigins() {
            return allowedOrigins;
        }

        public void setAllowedOrigins(String[] allowedOrigins) {
            this.allowedOrigins = allowedOrigins;
        }
    }
}
