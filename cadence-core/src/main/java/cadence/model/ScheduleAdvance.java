package cadence.model;

import java.time.Instant;
import java.util.Objects;

/**
 * New schedule fields written by a successful claim.
 *
 * @param lastGeneratedAt due instant of the occurrence just generated
 * @param nextDueAt       following due instant
 * @param active          {@code false} when {@code nextDueAt} passed the definition's end date
 */
public record ScheduleAdvance(Instant lastGeneratedAt, Instant nextDueAt, boolean active) {

  public ScheduleAdvance {
    Objects.requireNonNull(lastGeneratedAt, "lastGeneratedAt");
    Objects.requireNonNull(nextDueAt, "nextDueAt");
  }
}
