package cadence.notify;

import cadence.model.GeneratedEvent;
import cadence.model.Notification;
import cadence.model.NotificationPriority;
import cadence.model.NotificationType;

import java.math.BigDecimal;
import java.math.RoundingMode;
import java.util.LinkedHashMap;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;

/**
 * Ready-made notifications for the common finance events, announced through a
 * {@link NotificationDispatcher}.
 */
public final class Alerts {
  /** Budget usage, in percent, from which a budget alert is {@code HIGH}. */
  public static final BigDecimal BUDGET_HIGH_THRESHOLD = BigDecimal.valueOf(90);

  private static final BigDecimal HUNDRED = BigDecimal.valueOf(100);
  private static final int[] SAVINGS_MILESTONES = {25, 50, 75, 100};

  private final NotificationDispatcher dispatcher;

  public Alerts(NotificationDispatcher dispatcher) {
    this.dispatcher = Objects.requireNonNull(dispatcher, "dispatcher");
  }

  /**
   * Announces how much of a category budget has been spent: {@code HIGH} from 90 % on,
   * {@code MEDIUM} below.
   */
  public Notification budgetAlert(String ownerId, String category, BigDecimal spent,
      BigDecimal budget) {
    requirePositive(budget, "budget");
    BigDecimal percentage = percentage(spent, budget);
    NotificationPriority priority = percentage.compareTo(BUDGET_HIGH_THRESHOLD) >= 0
        ? NotificationPriority.HIGH : NotificationPriority.MEDIUM;
    Map<String, String> data = new LinkedHashMap<>();
    data.put("category", category);
    data.put("spent", money(spent));
    data.put("budget", money(budget));
    data.put("percentage", percentage.setScale(1, RoundingMode.HALF_UP).toPlainString());
    return dispatcher.announce(ownerId, NotificationType.BUDGET_ALERT, priority,
        NotificationContent.of("Budget Alert: " + category,
            "You've spent " + percentage.setScale(1, RoundingMode.HALF_UP).toPlainString()
                + "% of your " + category + " budget ($" + money(spent) + " of $"
                + money(budget) + ")",
            data));
  }

  /**
   * Announces a savings milestone when progress sits exactly on 25, 50, 75 or 100 percent.
   *
   * @return the notification, or empty when the progress is not a milestone
   */
  public Optional<Notification> savingsMilestone(String ownerId, String goalName,
      BigDecimal currentAmount, BigDecimal targetAmount) {
    requirePositive(targetAmount, "targetAmount");
    BigDecimal percentage = percentage(currentAmount, targetAmount);
    Integer milestone = null;
    for (int candidate : SAVINGS_MILESTONES) {
      if (percentage.compareTo(BigDecimal.valueOf(candidate)) == 0) {
        milestone = candidate;
        break;
      }
    }
    if (milestone == null) {
      return Optional.empty();
    }
    Map<String, String> data = new LinkedHashMap<>();
    data.put("goalName", goalName);
    data.put("currentAmount", money(currentAmount));
    data.put("targetAmount", money(targetAmount));
    data.put("percentage", String.valueOf(milestone));
    return Optional.of(dispatcher.announce(ownerId, NotificationType.SAVINGS_GOAL,
        NotificationPriority.MEDIUM,
        NotificationContent.of("Savings Goal Milestone: " + goalName,
            "Congratulations! You've reached " + milestone + "% of your savings goal for "
                + goalName + "!",
            data)));
  }

  /** Announces a financial-health metric crossing its threshold, always {@code HIGH}. */
  public Notification financialHealthAlert(String ownerId, String metric, BigDecimal value,
      BigDecimal threshold, String message) {
    Map<String, String> data = new LinkedHashMap<>();
    data.put("metric", metric);
    data.put("value", value.toPlainString());
    data.put("threshold", threshold.toPlainString());
    return dispatcher.announce(ownerId, NotificationType.FINANCIAL_HEALTH,
        NotificationPriority.HIGH,
        NotificationContent.of("Financial Health Alert: " + metric, message, data));
  }

  /**
   * Announces a generated recurring transaction, always {@code LOW}. The payload carries the
   * event id, its source definition and the occurrence instant so clients can link back to
   * the ledger entry.
   */
  public Notification recurringTransactionProcessed(GeneratedEvent event) {
    Objects.requireNonNull(event, "event");
    String kindName = event.kind().name().toLowerCase(Locale.ROOT);
    String label = event.description() != null && !event.description().isBlank()
        ? event.description() : event.category();
    if (label == null || label.isBlank()) {
      label = "recurring entry";
    }
    Map<String, String> data = new LinkedHashMap<>();
    data.put("eventId", event.id());
    if (event.sourceDefinitionId() != null) {
      data.put("definitionId", event.sourceDefinitionId());
    }
    data.put("occurredAt", event.occurredAt().toString());
    data.put("type", kindName);
    data.put("amount", money(event.amount()));
    data.put("description", label);
    return dispatcher.announce(event.ownerId(), NotificationType.RECURRING_TRANSACTION,
        NotificationPriority.LOW,
        NotificationContent.of("Recurring Transaction Processed",
            "A " + kindName + " of $" + money(event.amount()) + " for " + label + " has been processed",
            data));
  }

  private static BigDecimal percentage(BigDecimal part, BigDecimal whole) {
    return part.multiply(HUNDRED).divide(whole, 4, RoundingMode.HALF_UP);
  }

  private static String money(BigDecimal amount) {
    return amount.setScale(2, RoundingMode.HALF_UP).toPlainString();
  }

  private static void requirePositive(BigDecimal value, String name) {
    Objects.requireNonNull(value, name);
    if (value.signum() <= 0) {
      throw new IllegalArgumentException(name + " must be > 0");
    }
  }
}
