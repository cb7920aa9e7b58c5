package cadence.recurrence;

import cadence.model.IntervalKind;

import java.time.DateTimeException;
import java.time.Instant;
import java.time.LocalDate;
import java.time.LocalDateTime;
import java.time.YearMonth;
import java.time.ZoneId;
import java.time.ZoneOffset;
import java.util.Objects;

/**
 * Calendar arithmetic for recurring schedules.
 *
 * <p>All computations happen in a fixed {@link ZoneId} and preserve the time of day.
 * Day-based intervals add whole days. Month-based intervals move the month (or year) and
 * clamp the day to the length of the target month, so January 31st is followed by
 * February 28th (29th in leap years).
 *
 * <p>The anchored overloads clamp a fixed anchor day instead of the current day. A schedule
 * that starts on the 31st therefore returns to the 31st after a short month:
 * {@code Jan 31 -> Feb 29 -> Mar 31 -> Apr 30}.
 *
 * <p>Every result is strictly after its input; anything else throws
 * {@link RecurrenceException}. This class is immutable and thread-safe.
 */
public final class RecurrenceCalculator {

  /** Calculator evaluating calendar rules in UTC. */
  public static final RecurrenceCalculator UTC = new RecurrenceCalculator(ZoneOffset.UTC);

  private final ZoneId zone;

  public RecurrenceCalculator(ZoneId zone) {
    this.zone = Objects.requireNonNull(zone, "zone");
  }

  public ZoneId zone() {
    return zone;
  }

  /**
   * Returns the occurrence following {@code from}, anchored on {@code from}'s own day.
   * Quarterly applies the monthly rule three times, so clamping compounds
   * ({@code Nov 30 -> Dec 30 -> Jan 30 -> Feb 28}).
   */
  public Instant next(Instant from, IntervalKind interval) {
    Objects.requireNonNull(from, "from");
    Objects.requireNonNull(interval, "interval");
    if (interval == IntervalKind.QUARTERLY) {
      Instant current = from;
      for (int i = 0; i < 3; i++) {
        current = next(current, IntervalKind.MONTHLY, anchorDayOf(current));
      }
      return current;
    }
    return next(from, interval, anchorDayOf(from));
  }

  /**
   * Returns the occurrence following {@code from} for a schedule anchored on
   * {@code anchorDay} (1..31). Day-based intervals ignore the anchor.
   *
   * @throws RecurrenceException if the anchor is out of range, the arithmetic overflows,
   *                             or the result would not be strictly after {@code from}
   */
  public Instant next(Instant from, IntervalKind interval, int anchorDay) {
    Objects.requireNonNull(from, "from");
    Objects.requireNonNull(interval, "interval");
    if (anchorDay < 1 || anchorDay > 31) {
      throw new RecurrenceException("anchorDay must be in 1..31: " + anchorDay);
    }
    Instant result;
    try {
      LocalDateTime local = LocalDateTime.ofInstant(from, zone);
      LocalDateTime advanced;
      switch (interval) {
        case DAILY:
          advanced = local.plusDays(1);
          break;
        case WEEKLY:
          advanced = local.plusDays(7);
          break;
        case BIWEEKLY:
          advanced = local.plusDays(14);
          break;
        case MONTHLY:
          advanced = local.with(clampedDate(YearMonth.from(local).plusMonths(1), anchorDay));
          break;
        case QUARTERLY:
          advanced = local.with(clampedDate(YearMonth.from(local).plusMonths(3), anchorDay));
          break;
        case YEARLY:
          advanced = local.with(clampedDate(YearMonth.from(local).plusYears(1), anchorDay));
          break;
        default:
          throw new RecurrenceException("Unsupported interval: " + interval);
      }
      result = advanced.atZone(zone).toInstant();
    } catch (DateTimeException | ArithmeticException e) {
      throw new RecurrenceException(
          "Cannot compute " + interval + " occurrence after " + from, e);
    }
    if (!result.isAfter(from)) {
      throw new RecurrenceException(
          interval + " occurrence after " + from + " is not later: " + result);
    }
    return result;
  }

  /**
   * Walks the schedule starting at {@code start} and returns the first occurrence that is
   * not before {@code threshold}. Returns {@code start} when it already qualifies.
   */
  public Instant firstOnOrAfter(Instant start, IntervalKind interval, Instant threshold) {
    Objects.requireNonNull(threshold, "threshold");
    int anchor = anchorDayOf(start);
    Instant current = start;
    while (current.isBefore(threshold)) {
      current = next(current, interval, anchor);
    }
    return current;
  }

  /**
   * Walks the schedule starting at {@code start} and returns the first occurrence strictly
   * after {@code threshold}.
   */
  public Instant firstAfter(Instant start, IntervalKind interval, Instant threshold) {
    Objects.requireNonNull(threshold, "threshold");
    int anchor = anchorDayOf(start);
    Instant current = start;
    while (!current.isAfter(threshold)) {
      current = next(current, interval, anchor);
    }
    return current;
  }

  /**
   * Day-of-month of {@code instant} in this calculator's zone.
   *
   * @throws RecurrenceException if {@code instant} cannot be represented in the zone
   */
  public int anchorDayOf(Instant instant) {
    Objects.requireNonNull(instant, "instant");
    try {
      return LocalDateTime.ofInstant(instant, zone).getDayOfMonth();
    } catch (DateTimeException e) {
      throw new RecurrenceException("Instant out of supported range: " + instant, e);
    }
  }

  private static LocalDate clampedDate(YearMonth month, int anchorDay) {
    return month.atDay(Math.min(anchorDay, month.lengthOfMonth()));
  }
}
