package cadence.spi;

import cadence.model.GeneratedEvent;
import cadence.model.RecurringDefinition;
import cadence.model.ScheduleAdvance;

import java.time.Instant;
import java.util.List;
import java.util.Optional;

/**
 * Persistence contract for recurring definitions and the events generated from them.
 *
 * <p>The only schedule mutation available to the processor is {@link #tryClaim}, a
 * conditional update that succeeds for exactly one caller per due window. Implementations
 * must make it safe across threads and processes.
 *
 * @see cadence.memory.InMemoryDefinitionStore
 */
public interface DefinitionStore {

    /**
     * Lists definitions due at {@code now}: {@code active}, {@code nextDueAt <= now} and
     * ({@code endDate} unset or {@code endDate >= nextDueAt}), ordered by {@code nextDueAt}
     * then {@code id}.
     *
     * <p>When {@code afterDue} is set, only definitions ordered strictly after
     * ({@code afterDue}, {@code afterId}) are returned, so a caller can page past definitions
     * that stay due because they failed.
     *
     * @param now      the tick instant
     * @param afterDue {@code nextDueAt} of the last definition already seen, or {@code null}
     *                 to start from the oldest due
     * @param afterId  id of the last definition already seen; ignored when {@code afterDue}
     *                 is {@code null}
     * @param limit    maximum number of definitions to return
     * @return due definitions, oldest due first
     * @throws StoreException if the store cannot be queried
     */
    List<RecurringDefinition> listDue(Instant now, Instant afterDue, String afterId, int limit);

    /**
     * Lists the first {@code limit} definitions due at {@code now}.
     *
     * @see #listDue(Instant, Instant, String, int)
     */
    default List<RecurringDefinition> listDue(Instant now, int limit) {
        return listDue(now, null, null, limit);
    }

    /**
     * Atomically advances a definition and records the generated event.
     *
     * <p>The update applies only if the stored definition is still active, its
     * {@code nextDueAt} still equals {@code expectedNextDue} and its stored {@code endDate},
     * if any, is not before {@code expectedNextDue}. The stored {@code active} flag is
     * recomputed from the stored {@code endDate} and {@code advance.nextDueAt()}, so an end
     * date changed after the definition was read is honored. When it applies, {@code event} is inserted in the same atomic
     * unit; when it does not, nothing is written.
     *
     * @param definitionId    the definition to advance
     * @param expectedNextDue the {@code nextDueAt} value read before claiming
     * @param advance         new schedule fields
     * @param event           the event generated for {@code expectedNextDue}
     * @return {@code true} if this caller won the claim, {@code false} on a conflict
     * @throws StoreException if the store fails
     */
    boolean tryClaim(String definitionId, Instant expectedNextDue, ScheduleAdvance advance,
            GeneratedEvent event);

    /**
     * Inserts a new definition.
     *
     * @throws StoreException if the store fails or the id already exists
     */
    void create(RecurringDefinition definition);

    /**
     * Replaces all fields of an existing definition (user update), provided its stored
     * {@code nextDueAt} still equals {@code expectedNextDue}. The condition keeps a user
     * update from overwriting an advance made by a concurrent claim.
     *
     * @return the number of rows updated (0 or 1)
     */
    int update(RecurringDefinition definition, Instant expectedNextDue);

    Optional<RecurringDefinition> findById(String definitionId);

    /**
     * Lists an owner's definitions, oldest first.
     *
     * @param activeOnly whether to skip deactivated definitions
     */
    List<RecurringDefinition> listByOwner(String ownerId, boolean activeOnly);

    /**
     * Returns events whose {@code sourceDefinitionId} is {@code definitionId}, ordered by
     * {@code occurredAt}.
     */
    List<GeneratedEvent> eventsFor(String definitionId);
}
