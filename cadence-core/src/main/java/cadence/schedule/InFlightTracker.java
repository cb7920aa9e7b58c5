package cadence.schedule;

/**
 * In-process guard against two overlapping ticks working on the same definition.
 * The store claim remains the authority across processes.
 */
public interface InFlightTracker {
  boolean tryAcquire(String definitionId);

  void release(String definitionId);
}
