package cadence.schedule;

import cadence.model.EntryKind;
import cadence.model.IntervalKind;

import java.math.BigDecimal;
import java.time.Instant;

/**
 * User input for {@link DefinitionService#create}. Validated by the service.
 *
 * @param endDate optional last instant an occurrence may fall on
 */
public record NewDefinition(
    String ownerId,
    BigDecimal amount,
    EntryKind kind,
    String category,
    String description,
    IntervalKind interval,
    Instant startDate,
    Instant endDate
) {
}
