package cadence.live;

/**
 * Result of a registry send.
 *
 * @param delivered connections that accepted the message
 * @param pruned    connections removed because they were closed, failed, or timed out
 */
public record SendOutcome(int delivered, int pruned) {

  public static final SendOutcome NONE = new SendOutcome(0, 0);

  public SendOutcome plus(SendOutcome other) {
    return new SendOutcome(delivered + other.delivered, pruned + other.pruned);
  }
}
