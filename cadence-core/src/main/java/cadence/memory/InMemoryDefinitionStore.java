package cadence.memory;

import cadence.model.GeneratedEvent;
import cadence.model.RecurringDefinition;
import cadence.model.ScheduleAdvance;
import cadence.spi.DefinitionStore;
import cadence.spi.StoreException;

import java.time.Instant;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * {@link DefinitionStore} held in memory. Every operation locks the store, which makes
 * {@link #tryClaim} atomic with respect to all other operations.
 */
public final class InMemoryDefinitionStore implements DefinitionStore {
  private final Map<String, RecurringDefinition> definitions = new LinkedHashMap<>();
  private final List<GeneratedEvent> events = new ArrayList<>();

  @Override
  public synchronized List<RecurringDefinition> listDue(Instant now, Instant afterDue,
      String afterId, int limit) {
    List<RecurringDefinition> due = new ArrayList<>();
    for (RecurringDefinition definition : definitions.values()) {
      if (definition.isDueAt(now) && isAfter(definition, afterDue, afterId)) {
        due.add(definition);
      }
    }
    due.sort(Comparator.comparing(RecurringDefinition::nextDueAt)
        .thenComparing(RecurringDefinition::id));
    return due.size() > limit ? new ArrayList<>(due.subList(0, limit)) : due;
  }

  private static boolean isAfter(RecurringDefinition definition, Instant afterDue, String afterId) {
    if (afterDue == null) {
      return true;
    }
    int cmp = definition.nextDueAt().compareTo(afterDue);
    return cmp > 0 || (cmp == 0 && afterId != null && definition.id().compareTo(afterId) > 0);
  }

  @Override
  public synchronized boolean tryClaim(String definitionId, Instant expectedNextDue,
      ScheduleAdvance advance, GeneratedEvent event) {
    RecurringDefinition current = definitions.get(definitionId);
    if (current == null || !current.active() || !current.nextDueAt().equals(expectedNextDue)) {
      return false;
    }
    Instant endDate = current.endDate();
    if (endDate != null && endDate.isBefore(expectedNextDue)) {
      return false;
    }
    boolean active = endDate == null || !advance.nextDueAt().isAfter(endDate);
    ScheduleAdvance stored = new ScheduleAdvance(advance.lastGeneratedAt(), advance.nextDueAt(), active);
    definitions.put(definitionId, current.advancedBy(stored, event.createdAt()));
    events.add(event);
    return true;
  }

  @Override
  public synchronized void create(RecurringDefinition definition) {
    if (definitions.containsKey(definition.id())) {
      throw new StoreException("Duplicate definition id: " + definition.id());
    }
    definitions.put(definition.id(), definition);
  }

  @Override
  public synchronized int update(RecurringDefinition definition, Instant expectedNextDue) {
    RecurringDefinition current = definitions.get(definition.id());
    if (current == null || !current.nextDueAt().equals(expectedNextDue)) {
      return 0;
    }
    definitions.put(definition.id(), definition);
    return 1;
  }

  @Override
  public synchronized Optional<RecurringDefinition> findById(String definitionId) {
    return Optional.ofNullable(definitions.get(definitionId));
  }

  @Override
  public synchronized List<RecurringDefinition> listByOwner(String ownerId, boolean activeOnly) {
    List<RecurringDefinition> result = new ArrayList<>();
    for (RecurringDefinition definition : definitions.values()) {
      if (definition.ownerId().equals(ownerId) && (!activeOnly || definition.active())) {
        result.add(definition);
      }
    }
    return result;
  }

  @Override
  public synchronized List<GeneratedEvent> eventsFor(String definitionId) {
    List<GeneratedEvent> result = new ArrayList<>();
    for (GeneratedEvent event : events) {
      if (definitionId.equals(event.sourceDefinitionId())) {
        result.add(event);
      }
    }
    result.sort(Comparator.comparing(GeneratedEvent::occurredAt));
    return result;
  }

  /** All recorded events in insertion order. */
  public synchronized List<GeneratedEvent> allEvents() {
    return new ArrayList<>(events);
  }
}
