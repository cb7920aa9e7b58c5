package cadence.schedule;

/**
 * Thrown by {@link ScheduleProcessor#tick} when due definitions cannot be listed at all.
 * The scheduled loop logs it and tries again on the next tick.
 */
public class SchedulerFatalException extends RuntimeException {

  public SchedulerFatalException(String message, Throwable cause) {
    super(message, cause);
  }
}
