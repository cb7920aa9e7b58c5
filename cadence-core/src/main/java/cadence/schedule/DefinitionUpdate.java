package cadence.schedule;

import cadence.model.IntervalKind;

import java.math.BigDecimal;
import java.time.Instant;

/**
 * Partial user update for {@link DefinitionService#update}. {@code null} fields are left
 * unchanged; use {@link Builder#clearEndDate()} to remove an end date.
 */
public final class DefinitionUpdate {
  private final BigDecimal amount;
  private final String category;
  private final String description;
  private final IntervalKind interval;
  private final Instant startDate;
  private final Instant endDate;
  private final boolean clearEndDate;

  private DefinitionUpdate(Builder builder) {
    this.amount = builder.amount;
    this.category = builder.category;
    this.description = builder.description;
    this.interval = builder.interval;
    this.startDate = builder.startDate;
    this.endDate = builder.endDate;
    this.clearEndDate = builder.clearEndDate;
  }

  public static Builder builder() {
    return new Builder();
  }

  public BigDecimal amount() {
    return amount;
  }

  public String category() {
    return category;
  }

  public String description() {
    return description;
  }

  public IntervalKind interval() {
    return interval;
  }

  public Instant startDate() {
    return startDate;
  }

  public Instant endDate() {
    return endDate;
  }

  public boolean clearEndDate() {
    return clearEndDate;
  }

  public static final class Builder {
    private BigDecimal amount;
    private String category;
    private String description;
    private IntervalKind interval;
    private Instant startDate;
    private Instant endDate;
    private boolean clearEndDate;

    private Builder() {
    }

    public Builder amount(BigDecimal amount) {
      this.amount = amount;
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
      this.clearEndDate = false;
      return this;
    }

    public Builder clearEndDate() {
      this.endDate = null;
      this.clearEndDate = true;
      return this;
    }

    public DefinitionUpdate build() {
      return new DefinitionUpdate(this);
    }
  }
}
