/**
 * Service Provider Interfaces for pluggable persistence, delivery channels and metrics.
 *
 * <p>Store interfaces are connection-agnostic; the {@code cadence-jdbc} module provides
 * JDBC implementations and {@link cadence.memory} provides in-process ones. Channel
 * adapters ({@link cadence.spi.EmailSender}, {@link cadence.spi.PushSender}) are wrapped by
 * the dispatcher's channel senders.
 */
package cadence.spi;
