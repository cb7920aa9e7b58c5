package cadence.jdbc;

import java.util.Objects;

/**
 * Table names used by the JDBC stores, derived from a validated prefix.
 */
public final class TableNames {
  public static final String DEFAULT_PREFIX = "cadence_";
  private static final String PREFIX_PATTERN = "[a-zA-Z_][a-zA-Z0-9_]*";

  public static final TableNames DEFAULT = new TableNames(DEFAULT_PREFIX);

  private final String prefix;

  private TableNames(String prefix) {
    this.prefix = prefix;
  }

  /**
   * @throws IllegalArgumentException if {@code prefix} is not a plain SQL identifier
   */
  public static TableNames withPrefix(String prefix) {
    return new TableNames(validate(prefix));
  }

  public static String validate(String prefix) {
    Objects.requireNonNull(prefix, "prefix");
    if (!prefix.matches(PREFIX_PATTERN)) {
      throw new IllegalArgumentException("Invalid table prefix: " + prefix);
    }
    return prefix;
  }

  public String prefix() {
    return prefix;
  }

  public String definitions() {
    return prefix + "recurring_definition";
  }

  public String events() {
    return prefix + "generated_event";
  }

  public String notifications() {
    return prefix + "notification";
  }

  public String preferences() {
    return prefix + "notification_preference";
  }

  public String deviceTokens() {
    return prefix + "device_token";
  }
}
