package cadence.model;

import java.util.Locale;

/** Direction of money for a recurring definition and the events it generates. */
public enum EntryKind {
  INCOME,
  EXPENSE;

  public String wireName() {
    return name().toLowerCase(Locale.ROOT);
  }

  public static EntryKind parse(String value) {
    if (value == null) {
      throw new IllegalArgumentException("kind must not be null");
    }
    return valueOf(value.trim().toUpperCase(Locale.ROOT));
  }
}
