package cadence.live;

import cadence.spi.MetricsExporter;
import cadence.util.JsonCodec;
import cadence.util.TimeLimitedExecutor;

import java.time.Clock;
import java.time.Duration;
import java.util.ArrayList;
import java.util.Collections;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;
import java.util.concurrent.CancellationException;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.Future;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Tracks the live connections of each owner and fans messages out to them.
 *
 * <p>Connections are kept in per-owner concurrent sets, so registration, removal and sends
 * may run concurrently from any thread. A connection that is closed, throws on send, or does
 * not complete within the send timeout is removed ("pruned") and never retried; an owner whose
 * last connection goes away is dropped from the map.
 *
 * <p>Sends run on a bounded pool, one task per connection. With {@code sendWorkerCount(0)}
 * they run inline on the caller and the timeout is not enforced.
 *
 * <p>The registry never closes connections. {@link #close()} stops the send pool and drops
 * all references; the transports stay responsible for their own connections.
 *
 * <h2>Usage</h2>
 * <pre>{@code
 * ConnectionRegistry registry = ConnectionRegistry.builder()
 *     .sendTimeout(Duration.ofSeconds(5))
 *     .build();
 * registry.register("user-1", connection);
 * registry.sendToOwner("user-1", "NOTIFICATION", payload);
 * }</pre>
 */
public final class ConnectionRegistry implements AutoCloseable {
  private static final Logger logger = Logger.getLogger(ConnectionRegistry.class.getName());

  private final Map<String, Set<LiveConnection>> connections = new ConcurrentHashMap<>();
  private final TimeLimitedExecutor sendPool;
  private final MetricsExporter metrics;
  private final JsonCodec jsonCodec;
  private final Clock clock;
  private final AtomicBoolean closed = new AtomicBoolean(false);

  private ConnectionRegistry(Builder builder) {
    this.metrics = builder.metrics != null ? builder.metrics : MetricsExporter.NOOP;
    this.jsonCodec = builder.jsonCodec != null ? builder.jsonCodec : JsonCodec.getDefault();
    this.clock = builder.clock != null ? builder.clock : Clock.systemUTC();
    Objects.requireNonNull(builder.sendTimeout, "sendTimeout");
    if (builder.sendTimeout.isNegative() || builder.sendTimeout.isZero()) {
      throw new IllegalArgumentException("sendTimeout must be positive");
    }
    if (builder.sendWorkerCount < 0) {
      throw new IllegalArgumentException("sendWorkerCount must be >= 0");
    }
    this.sendPool = builder.sendWorkerCount > 0
        ? new TimeLimitedExecutor("cadence-live-send-", builder.sendWorkerCount, builder.sendTimeout)
        : null;
  }

  public static Builder builder() {
    return new Builder();
  }

  /**
   * Adds {@code connection} to the owner's set. Registering the same connection twice
   * has no further effect.
   *
   * @throws IllegalStateException if the registry has been closed
   */
  public void register(String ownerId, LiveConnection connection) {
    Objects.requireNonNull(ownerId, "ownerId");
    Objects.requireNonNull(connection, "connection");
    if (closed.get()) {
      throw new IllegalStateException("ConnectionRegistry is closed");
    }
    connections.compute(ownerId, (key, set) -> {
      Set<LiveConnection> target = set != null ? set : ConcurrentHashMap.newKeySet();
      target.add(connection);
      return target;
    });
    metrics.recordLiveConnections(connectionCount());
  }

  /** Removes {@code connection}; does nothing if it is not registered. */
  public void unregister(String ownerId, LiveConnection connection) {
    if (remove(ownerId, connection)) {
      metrics.recordLiveConnections(connectionCount());
    }
  }

  /** Sends a pre-encoded message to every connection of {@code ownerId}. */
  public SendOutcome sendToOwner(String ownerId, String message) {
    Objects.requireNonNull(ownerId, "ownerId");
    Objects.requireNonNull(message, "message");
    Set<LiveConnection> owned = connections.get(ownerId);
    if (owned == null || owned.isEmpty()) {
      return SendOutcome.NONE;
    }
    List<Target> targets = new ArrayList<>();
    for (LiveConnection connection : owned) {
      targets.add(new Target(ownerId, connection));
    }
    return deliver(targets, message);
  }

  /** Wraps {@code data} in a {@link WireMessage} of {@code type} and sends it to the owner. */
  public SendOutcome sendToOwner(String ownerId, String type, Object data) {
    return sendToOwner(ownerId, encode(type, data));
  }

  /** Sends a pre-encoded message to every registered connection. */
  public SendOutcome broadcast(String message) {
    Objects.requireNonNull(message, "message");
    List<Target> targets = new ArrayList<>();
    for (Map.Entry<String, Set<LiveConnection>> entry : connections.entrySet()) {
      for (LiveConnection connection : entry.getValue()) {
        targets.add(new Target(entry.getKey(), connection));
      }
    }
    if (targets.isEmpty()) {
      return SendOutcome.NONE;
    }
    return deliver(targets, message);
  }

  public SendOutcome broadcast(String type, Object data) {
    return broadcast(encode(type, data));
  }

  public int connectionCount() {
    int total = 0;
    for (Set<LiveConnection> set : connections.values()) {
      total += set.size();
    }
    return total;
  }

  public int connectionCount(String ownerId) {
    Set<LiveConnection> set = connections.get(ownerId);
    return set == null ? 0 : set.size();
  }

  /** Snapshot of the owners that currently have at least one connection. */
  public Set<String> owners() {
    return Collections.unmodifiableSet(new HashSet<>(connections.keySet()));
  }

  private String encode(String type, Object data) {
    return jsonCodec.toJson(new WireMessage(type, data, clock.instant()).toMap());
  }

  private SendOutcome deliver(List<Target> targets, String message) {
    if (closed.get()) {
      return SendOutcome.NONE;
    }
    List<Target> dead = new ArrayList<>();
    int delivered = 0;
    if (sendPool == null) {
      for (Target target : targets) {
        if (sendInline(target, message)) {
          delivered++;
        } else {
          dead.add(target);
        }
      }
    } else {
      List<Future<?>> futures = new ArrayList<>(targets.size());
      for (Target target : targets) {
        if (!target.connection.isOpen()) {
          futures.add(null);
          continue;
        }
        try {
          futures.add(sendPool.submit(() -> {
            target.connection.send(message);
            return null;
          }));
        } catch (RejectedExecutionException e) {
          return SendOutcome.NONE;
        }
      }
      for (int i = 0; i < targets.size(); i++) {
        if (awaitSend(targets.get(i), futures.get(i))) {
          delivered++;
        } else {
          dead.add(targets.get(i));
        }
      }
    }
    int pruned = 0;
    for (Target target : dead) {
      if (remove(target.ownerId, target.connection)) {
        pruned++;
      }
    }
    if (pruned > 0) {
      metrics.incrementConnectionsPruned(pruned);
      metrics.recordLiveConnections(connectionCount());
    }
    return new SendOutcome(delivered, pruned);
  }

  private boolean sendInline(Target target, String message) {
    if (!target.connection.isOpen()) {
      logger.log(Level.FINE, "Pruning closed connection " + target.connection.id());
      return false;
    }
    try {
      target.connection.send(message);
      return true;
    } catch (Exception e) {
      logger.log(Level.WARNING, "Send failed on connection " + target.connection.id()
          + " of owner " + target.ownerId + "; pruning", e);
      return false;
    }
  }

  private boolean awaitSend(Target target, Future<?> future) {
    if (future == null) {
      logger.log(Level.FINE, "Pruning closed connection " + target.connection.id());
      return false;
    }
    try {
      future.get();
      return true;
    } catch (CancellationException e) {
      logger.log(Level.WARNING, "Send timed out on connection " + target.connection.id()
          + " of owner " + target.ownerId + "; pruning");
      return false;
    } catch (ExecutionException e) {
      logger.log(Level.WARNING, "Send failed on connection " + target.connection.id()
          + " of owner " + target.ownerId + "; pruning", e.getCause());
      return false;
    } catch (InterruptedException e) {
      Thread.currentThread().interrupt();
      future.cancel(true);
      return false;
    }
  }

  private boolean remove(String ownerId, LiveConnection connection) {
    if (ownerId == null || connection == null) {
      return false;
    }
    boolean[] removed = new boolean[1];
    connections.computeIfPresent(ownerId, (key, set) -> {
      removed[0] = set.remove(connection);
      return set.isEmpty() ? null : set;
    });
    return removed[0];
  }

  /**
   * Stops the send pool and forgets every connection without closing it.
   */
  @Override
  public void close() {
    if (!closed.compareAndSet(false, true)) {
      return;
    }
    if (sendPool != null) {
      sendPool.close();
    }
    connections.clear();
    metrics.recordLiveConnections(0);
  }

  private static final class Target {
    private final String ownerId;
    private final LiveConnection connection;

    private Target(String ownerId, LiveConnection connection) {
      this.ownerId = ownerId;
      this.connection = connection;
    }
  }

  /** Builder for {@link ConnectionRegistry}. */
  public static final class Builder {
    private int sendWorkerCount = 8;
    private Duration sendTimeout = Duration.ofSeconds(10);
    private MetricsExporter metrics;
    private JsonCodec jsonCodec;
    private Clock clock;

    private Builder() {}

    /**
     * Number of threads sending to connections. Defaults to {@code 8}; {@code 0} sends inline
     * on the calling thread without a timeout.
     */
    public Builder sendWorkerCount(int sendWorkerCount) {
      this.sendWorkerCount = sendWorkerCount;
      return this;
    }

    /** Maximum time one send may run before its connection is pruned. Defaults to 10 seconds. */
    public Builder sendTimeout(Duration sendTimeout) {
      this.sendTimeout = sendTimeout;
      return this;
    }

    public Builder metrics(MetricsExporter metrics) {
      this.metrics = metrics;
      return this;
    }

    public Builder jsonCodec(JsonCodec jsonCodec) {
      this.jsonCodec = jsonCodec;
      return this;
    }

    /** Clock stamping {@link WireMessage} timestamps. Defaults to the UTC system clock. */
    public Builder clock(Clock clock) {
      this.clock = clock;
      return this;
    }

    /**
     * @throws IllegalArgumentException if {@code sendWorkerCount < 0} or the send timeout is
     *     not positive
     */
    public ConnectionRegistry build() {
      return new ConnectionRegistry(this);
    }
  }
}
