package cadence;

/**
 * Thrown when user-supplied definition data is rejected: non-positive amount, missing
 * fields, inverted date range, or a schedule that does not advance.
 *
 * <p>This is the only failure that reaches a definition's owner; it is raised at create
 * or update time and never from background processing.
 */
public class ValidationException extends RuntimeException {

  public ValidationException(String message) {
    super(message);
  }

  public ValidationException(String message, Throwable cause) {
    super(message, cause);
  }
}
