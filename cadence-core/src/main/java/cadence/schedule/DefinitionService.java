package cadence.schedule;

import cadence.ValidationException;
import cadence.model.GeneratedEvent;
import cadence.model.IntervalKind;
import cadence.model.RecurringDefinition;
import cadence.recurrence.RecurrenceCalculator;
import cadence.spi.DefinitionStore;
import cadence.spi.StoreException;

import java.math.BigDecimal;
import java.time.Clock;
import java.time.Instant;
import java.util.List;
import java.util.Objects;
import java.util.UUID;
import java.util.function.Supplier;
import java.util.function.UnaryOperator;

/**
 * User-facing management of recurring definitions.
 *
 * <p>A new definition is first due on its start date. Changing the interval or the start date
 * recomputes {@code nextDueAt} by walking the new schedule from the start date to the first
 * occurrence after the last generated one, so no generated occurrence is produced twice.
 * Setting an end date before the next due date deactivates the definition.
 *
 * <p>Updates are conditional on the stored {@code nextDueAt}; a concurrent advance by the
 * {@link ScheduleProcessor} makes the service re-read and re-apply the update.
 */
public final class DefinitionService {
  private static final int MAX_UPDATE_ATTEMPTS = 3;

  private final DefinitionStore store;
  private final RecurrenceCalculator calculator;
  private final Clock clock;
  private final Supplier<String> idGenerator;

  public DefinitionService(DefinitionStore store, RecurrenceCalculator calculator, Clock clock) {
    this(store, calculator, clock, () -> UUID.randomUUID().toString());
  }

  public DefinitionService(DefinitionStore store, RecurrenceCalculator calculator, Clock clock,
      Supplier<String> idGenerator) {
    this.store = Objects.requireNonNull(store, "store");
    this.calculator = Objects.requireNonNull(calculator, "calculator");
    this.clock = Objects.requireNonNull(clock, "clock");
    this.idGenerator = Objects.requireNonNull(idGenerator, "idGenerator");
  }

  /**
   * Validates and stores a new definition, due first at its start date.
   *
   * @throws ValidationException if the input is invalid
   */
  public RecurringDefinition create(NewDefinition input) {
    Objects.requireNonNull(input, "input");
    requireText(input.ownerId(), "ownerId");
    if (input.kind() == null) {
      throw new ValidationException("kind is required");
    }
    validate(input.amount(), input.category(), input.interval(), input.startDate(), input.endDate());

    Instant now = clock.instant();
    RecurringDefinition definition = RecurringDefinition.builder()
        .id(idGenerator.get())
        .ownerId(input.ownerId())
        .amount(input.amount())
        .kind(input.kind())
        .category(input.category())
        .description(input.description())
        .interval(input.interval())
        .startDate(input.startDate())
        .endDate(input.endDate())
        .lastGeneratedAt(null)
        .nextDueAt(input.startDate())
        .active(true)
        .createdAt(now)
        .updatedAt(now)
        .build();
    store.create(definition);
    return definition;
  }

  /**
   * Applies a partial update to the owner's definition.
   *
   * @throws DefinitionNotFoundException if the id is unknown or owned by someone else
   * @throws ValidationException         if the resulting definition is invalid
   */
  public RecurringDefinition update(String definitionId, String ownerId, DefinitionUpdate update) {
    Objects.requireNonNull(update, "update");
    return modify(definitionId, ownerId, current -> applyUpdate(current, update));
  }

  /** Stops further generation. Deactivating twice is a no-op. */
  public RecurringDefinition deactivate(String definitionId, String ownerId) {
    return modify(definitionId, ownerId, current -> current.toBuilder()
        .active(false)
        .updatedAt(clock.instant())
        .build());
  }

  /**
   * @throws DefinitionNotFoundException if the id is unknown or owned by someone else
   */
  public RecurringDefinition get(String definitionId, String ownerId) {
    Objects.requireNonNull(definitionId, "definitionId");
    Objects.requireNonNull(ownerId, "ownerId");
    return store.findById(definitionId)
        .filter(d -> d.ownerId().equals(ownerId))
        .orElseThrow(() -> new DefinitionNotFoundException(definitionId));
  }

  public List<RecurringDefinition> listActive(String ownerId) {
    Objects.requireNonNull(ownerId, "ownerId");
    return store.listByOwner(ownerId, true);
  }

  /** Events generated from {@code definitionId}, oldest first. */
  public List<GeneratedEvent> history(String definitionId) {
    Objects.requireNonNull(definitionId, "definitionId");
    return store.eventsFor(definitionId);
  }

  private RecurringDefinition modify(String definitionId, String ownerId,
      UnaryOperator<RecurringDefinition> change) {
    for (int attempt = 0; attempt < MAX_UPDATE_ATTEMPTS; attempt++) {
      RecurringDefinition current = get(definitionId, ownerId);
      RecurringDefinition changed = change.apply(current);
      if (store.update(changed, current.nextDueAt()) == 1) {
        return changed;
      }
    }
    throw new StoreException("Definition " + definitionId + " kept changing; update abandoned after "
        + MAX_UPDATE_ATTEMPTS + " attempts");
  }

  private RecurringDefinition applyUpdate(RecurringDefinition current, DefinitionUpdate update) {
    BigDecimal amount = update.amount() != null ? update.amount() : current.amount();
    String category = update.category() != null ? update.category() : current.category();
    String description = update.description() != null ? update.description() : current.description();
    IntervalKind interval = update.interval() != null ? update.interval() : current.interval();
    Instant startDate = update.startDate() != null ? update.startDate() : current.startDate();
    Instant endDate = update.clearEndDate() ? null
        : update.endDate() != null ? update.endDate() : current.endDate();
    validate(amount, category, interval, startDate, endDate);

    Instant nextDueAt = current.nextDueAt();
    boolean rescheduled = interval != current.interval() || !startDate.equals(current.startDate());
    if (rescheduled) {
      nextDueAt = current.lastGeneratedAt() == null
          ? startDate
          : calculator.firstAfter(startDate, interval, current.lastGeneratedAt());
    }
    boolean active = current.active() && (endDate == null || !nextDueAt.isAfter(endDate));

    return current.toBuilder()
        .amount(amount)
        .category(category)
        .description(description)
        .interval(interval)
        .startDate(startDate)
        .endDate(endDate)
        .nextDueAt(nextDueAt)
        .active(active)
        .updatedAt(clock.instant())
        .build();
  }

  private static void validate(BigDecimal amount, String category, IntervalKind interval,
      Instant startDate, Instant endDate) {
    if (amount == null || amount.signum() <= 0) {
      throw new ValidationException("amount must be > 0");
    }
    requireText(category, "category");
    if (interval == null) {
      throw new ValidationException("interval is required");
    }
    if (startDate == null) {
      throw new ValidationException("startDate is required");
    }
    if (endDate != null && endDate.isBefore(startDate)) {
      throw new ValidationException("endDate must not be before startDate");
    }
  }

  private static void requireText(String value, String name) {
    if (value == null || value.isBlank()) {
      throw new ValidationException(name + " must not be blank");
    }
  }
}
