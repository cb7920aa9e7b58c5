package cadence.model;

import java.math.BigDecimal;
import java.time.Instant;
import java.util.Objects;

/**
 * A user-defined recurring income or expense.
 *
 * <p>The schedule fields ({@code lastGeneratedAt}, {@code nextDueAt}, {@code active}) are
 * mutated only by the {@linkplain cadence.schedule.ScheduleProcessor processor} through an
 * atomic claim, or by an explicit user update through
 * {@link cadence.schedule.DefinitionService}. After every successful advance
 * {@code nextDueAt == next(lastGeneratedAt, interval, anchorDay)} holds, where the anchor day
 * is the day-of-month of {@code startDate}.
 *
 * <p>Instances are immutable; use {@link #toBuilder()} to derive modified copies.
 */
public record RecurringDefinition(
    String id,
    String ownerId,
    BigDecimal amount,
    EntryKind kind,
    String category,
    String description,
    IntervalKind interval,
    Instant startDate,
    Instant endDate,
    Instant lastGeneratedAt,
    Instant nextDueAt,
    boolean active,
    Instant createdAt,
    Instant updatedAt
) {

  public RecurringDefinition {
    Objects.requireNonNull(id, "id");
    Objects.requireNonNull(ownerId, "ownerId");
    Objects.requireNonNull(amount, "amount");
    Objects.requireNonNull(kind, "kind");
    Objects.requireNonNull(interval, "interval");
    Objects.requireNonNull(startDate, "startDate");
    Objects.requireNonNull(nextDueAt, "nextDueAt");
  }

  /**
   * Returns whether this definition is due at {@code now}: active, {@code nextDueAt <= now},
   * and not past its end date.
   */
  public boolean isDueAt(Instant now) {
    return active
        && !nextDueAt.isAfter(now)
        && (endDate == null || !endDate.isBefore(nextDueAt));
  }

  /**
   * Returns a copy with the schedule fields replaced by {@code advance}.
   */
  public RecurringDefinition advancedBy(ScheduleAdvance advance, Instant updatedAt) {
    return toBuilder()
        .lastGeneratedAt(advance.lastGeneratedAt())
        .nextDueAt(advance.nextDueAt())
        .active(advance.active())
        .updatedAt(updatedAt)
        .build();
  }

  public Builder toBuilder() {
    return new Builder()
        .id(id)
        .ownerId(ownerId)
        .amount(amount)
        .kind(kind)
        .category(category)
        .description(description)
        .interval(interval)
        .startDate(startDate)
        .endDate(endDate)
        .lastGeneratedAt(lastGeneratedAt)
        .nextDueAt(nextDueAt)
        .active(active)
        .createdAt(createdAt)
        .updatedAt(updatedAt);
  }

  public static Builder builder() {
    return new Builder();
  }

  /** Builder for {@link RecurringDefinition}. {@code active} defaults to {@code true}. */
  public static final class Builder {
    private String id;
    private String ownerId;
    private BigDecimal amount;
    private EntryKind kind;
    private String category;
    private String description;
    private IntervalKind interval;
    private Instant startDate;
    private Instant endDate;
    private Instant lastGeneratedAt;
    private Instant nextDueAt;
    private boolean active = true;
    private Instant createdAt;
    private Instant updatedAt;

    private Builder() {
    }

    public Builder id(String id) {
      this.id = id;
      return this;
    }

    public Builder ownerId(String ownerId) {
      this.ownerId = ownerId;
      return this;
    }

    public Builder amount(BigDecimal amount) {
      this.amount = amount;
      return this;
    }

    public Builder kind(EntryKind kind) {
      this.kind = kind;
      return this;
    }

    public Builder category(String category) {
      this.category = category;
      return this;
    }

    public Builder description(String description) {
      this.description = description;
      return this;
    }

    public Builder interval(IntervalKind interval) {
      this.interval = interval;
      return this;
    }

    public Builder startDate(Instant startDate) {
      this.startDate = startDate;
      return this;
    }

    public Builder endDate(Instant endDate) {
      this.endDate = endDate;
      return this;
    }

    public Builder lastGeneratedAt(Instant lastGeneratedAt) {
      this.lastGeneratedAt = lastGeneratedAt;
      return this;
    }

    public Builder nextDueAt(Instant nextDueAt) {
      this.nextDueAt = nextDueAt;
      return this;
    }

    public Builder active(boolean active) {
      this.active = active;
      return this;
    }

    public Builder createdAt(Instant createdAt) {
      this.createdAt = createdAt;
      return this;
    }

    public Builder updatedAt(Instant updatedAt) {
      this.updatedAt = updatedAt;
      return this;
    }

    public RecurringDefinition build() {
      return new RecurringDefinition(id, ownerId, amount, kind, category, description,
          interval, startDate, endDate, lastGeneratedAt, nextDueAt, active, createdAt, updatedAt);
    }
  }
}
