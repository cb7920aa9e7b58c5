package cadence.model;

import java.math.BigDecimal;
import java.time.Instant;
import java.util.Objects;

/**
 * A ledger transaction produced from a {@link RecurringDefinition}.
 *
 * <p>{@code sourceDefinitionId} is an id lookup only; historical events never hold the
 * definition itself, so a definition can be removed without touching its events.
 *
 * @param occurredAt the due instant the event was generated for, not the tick time
 */
public record GeneratedEvent(
    String id,
    String ownerId,
    BigDecimal amount,
    EntryKind kind,
    String category,
    String description,
    Instant occurredAt,
    String sourceDefinitionId,
    Instant createdAt
) {

  public GeneratedEvent {
    Objects.requireNonNull(id, "id");
    Objects.requireNonNull(ownerId, "ownerId");
    Objects.requireNonNull(amount, "amount");
    Objects.requireNonNull(kind, "kind");
    Objects.requireNonNull(occurredAt, "occurredAt");
  }

  /**
   * Creates the event for the occurrence of {@code definition} due at {@code occurredAt}.
   */
  public static GeneratedEvent occurrenceOf(RecurringDefinition definition, String id,
      Instant occurredAt, Instant createdAt) {
    return new GeneratedEvent(id, definition.ownerId(), definition.amount(), definition.kind(),
        definition.category(), definition.description(), occurredAt, definition.id(), createdAt);
  }
}
