package cadence.schedule;

import java.time.Instant;

/** Receives the report of every completed tick on the ticking thread. */
@FunctionalInterface
public interface TickListener {
  void onTick(Instant now, TickReport report);
}
