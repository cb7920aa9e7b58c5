package cadence.schedule;

/**
 * Thrown when a definition id is unknown or belongs to another owner.
 */
public class DefinitionNotFoundException extends RuntimeException {

  public DefinitionNotFoundException(String definitionId) {
    super("Recurring definition not found: " + definitionId);
  }
}
