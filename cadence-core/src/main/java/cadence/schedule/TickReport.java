package cadence.schedule;

import java.util.List;

/**
 * Outcome of one {@link ScheduleProcessor#tick} run.
 *
 * @param generated events generated, catch-up occurrences included
 * @param skipped   claims lost to another processor or to an overlapping tick
 * @param failed    ids of definitions abandoned for this tick (errors and timeouts)
 */
public record TickReport(int generated, int skipped, List<String> failed) {

  public static final TickReport EMPTY = new TickReport(0, 0, List.of());

  public TickReport {
    failed = failed == null ? List.of() : List.copyOf(failed);
  }

  public boolean hasFailures() {
    return !failed.isEmpty();
  }
}
