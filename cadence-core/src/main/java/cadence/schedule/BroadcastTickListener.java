package cadence.schedule;

import cadence.live.ConnectionRegistry;
import cadence.live.SendOutcome;

import java.time.Instant;
import java.util.Objects;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Tells every live client that recurring transactions were processed, so open views can
 * refresh. Sends {@code {"type":"RECURRING_TRANSACTIONS_PROCESSED"}} after each tick that
 * generated at least one event.
 */
public final class BroadcastTickListener implements TickListener {
  private static final Logger logger = Logger.getLogger(BroadcastTickListener.class.getName());

  public static final String MESSAGE = "{\"type\":\"RECURRING_TRANSACTIONS_PROCESSED\"}";

  private final ConnectionRegistry registry;

  public BroadcastTickListener(ConnectionRegistry registry) {
    this.registry = Objects.requireNonNull(registry, "registry");
  }

  @Override
  public void onTick(Instant now, TickReport report) {
    if (report.generated() == 0) {
      return;
    }
    SendOutcome outcome = registry.broadcast(MESSAGE);
    logger.log(Level.FINE, () -> "Broadcast tick summary to " + outcome.delivered() + " connections");
  }
}
