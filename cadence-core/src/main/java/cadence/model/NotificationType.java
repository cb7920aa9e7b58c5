package cadence.model;

import java.util.Locale;

/** Category of a notification; preferences are kept per owner and type. */
public enum NotificationType {
  TRANSACTION,
  RECURRING_TRANSACTION,
  BUDGET_ALERT,
  SAVINGS_GOAL,
  FINANCIAL_HEALTH;

  public String wireName() {
    return name().toLowerCase(Locale.ROOT);
  }

  public static NotificationType parse(String value) {
    if (value == null) {
      throw new IllegalArgumentException("type must not be null");
    }
    return valueOf(value.trim().toUpperCase(Locale.ROOT));
  }
}
