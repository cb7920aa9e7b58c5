package cadence.spi;

import cadence.model.Channel;

/**
 * Observability hook for exporting scheduler, dispatcher and registry counters and gauges
 * to a metrics backend.
 *
 * <p>The {@link #NOOP} instance discards all metrics silently. Implement this interface
 * to bridge into Micrometer, Prometheus, or other monitoring systems.
 */
public interface MetricsExporter {

    /**
     * No-op instance that discards all metrics.
     */
    MetricsExporter NOOP = new Noop();

    /**
     * Increments the count of completed ticks.
     */
    void incrementTicks();

    /**
     * Increments the count of ticks that could not list due definitions.
     */
    void incrementTickFatal();

    /**
     * Increments the count of generated ledger events.
     */
    void incrementEventsGenerated();

    /**
     * Increments the count of claims lost to another worker or overlapping tick.
     */
    void incrementClaimsSkipped();

    /**
     * Increments the count of definitions that failed or timed out within a tick.
     */
    void incrementDefinitionsFailed();

    /**
     * Records the wall-clock duration of the last tick.
     *
     * @param durationMs duration in milliseconds (always non-negative)
     */
    void recordTickDurationMs(long durationMs);

    /**
     * Increments the count of persisted notifications.
     */
    void incrementNotificationsCreated();

    /**
     * Increments the count of notifications persisted but not delivered because of the
     * owner's minimum priority.
     */
    default void incrementNotificationsSuppressed() {
    }

    /**
     * Increments the count of successful deliveries on a channel.
     */
    void incrementChannelDelivered(Channel channel);

    /**
     * Increments the count of failed or timed-out deliveries on a channel.
     */
    void incrementChannelFailed(Channel channel);

    /**
     * Increments the count of live connections removed after a failed send.
     */
    default void incrementConnectionsPruned(int count) {
    }

    /**
     * Records the number of currently registered live connections.
     */
    default void recordLiveConnections(int count) {
    }

    /**
     * Default no-op implementation that discards all metrics.
     */
    final class Noop implements MetricsExporter {
        @Override
        public void incrementTicks() {
        }

        @Override
        public void incrementTickFatal() {
        }

        @Override
        public void incrementEventsGenerated() {
        }

        @Override
        public void incrementClaimsSkipped() {
        }

        @Override
        public void incrementDefinitionsFailed() {
        }

        @Override
        public void recordTickDurationMs(long durationMs) {
        }

        @Override
        public void incrementNotificationsCreated() {
        }

        @Override
        public void incrementChannelDelivered(Channel channel) {
        }

        @Override
        public void incrementChannelFailed(Channel channel) {
        }
    }
}
