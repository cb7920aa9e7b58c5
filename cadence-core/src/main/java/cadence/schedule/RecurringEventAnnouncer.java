package cadence.schedule;

import cadence.model.GeneratedEvent;
import cadence.model.RecurringDefinition;
import cadence.notify.Alerts;

import java.util.Objects;

/**
 * Announces every generated event to its owner as a low-priority
 * {@code RECURRING_TRANSACTION} notification.
 */
public final class RecurringEventAnnouncer implements GeneratedEventListener {
  private final Alerts alerts;

  public RecurringEventAnnouncer(Alerts alerts) {
    this.alerts = Objects.requireNonNull(alerts, "alerts");
  }

  @Override
  public void onGenerated(RecurringDefinition definition, GeneratedEvent event) {
    alerts.recurringTransactionProcessed(event);
  }
}
