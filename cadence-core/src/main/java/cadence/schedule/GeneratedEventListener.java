package cadence.schedule;

import cadence.model.GeneratedEvent;
import cadence.model.RecurringDefinition;

/**
 * Callback for each event the processor generates. Invoked after the claim committed, on
 * the processor's listener executor; a failure is logged and does not affect the claim.
 */
@FunctionalInterface
public interface GeneratedEventListener {

  /**
   * @param definition the definition after the advance
   * @param event      the event just recorded
   */
  void onGenerated(RecurringDefinition definition, GeneratedEvent event) throws Exception;
}
