package cadence.recurrence;

import cadence.ValidationException;

/**
 * Thrown when a recurrence cannot produce a strictly later occurrence, for example
 * because the calendar arithmetic overflowed or the anchor day is out of range.
 */
public class RecurrenceException extends ValidationException {

  public RecurrenceException(String message) {
    super(message);
  }

  public RecurrenceException(String message, Throwable cause) {
    super(message, cause);
  }
}
