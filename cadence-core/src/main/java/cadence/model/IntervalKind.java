package cadence.model;

import java.util.Locale;

/**
 * Repetition cadence of a {@link RecurringDefinition}.
 *
 * @see cadence.recurrence.RecurrenceCalculator
 */
public enum IntervalKind {
  DAILY,
  WEEKLY,
  BIWEEKLY,
  MONTHLY,
  QUARTERLY,
  YEARLY;

  /**
   * Parses a stored or configured interval name, ignoring case.
   *
   * @param value the interval name, e.g. {@code "monthly"}
   * @return the matching interval
   * @throws IllegalArgumentException if the name is unknown
   */
  public static IntervalKind parse(String value) {
    if (value == null) {
      throw new IllegalArgumentException("interval must not be null");
    }
    return valueOf(value.trim().toUpperCase(Locale.ROOT));
  }
}
