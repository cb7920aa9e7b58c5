package cadence.jdbc;

import cadence.model.EntryKind;
import cadence.model.GeneratedEvent;
import cadence.model.IntervalKind;
import cadence.model.RecurringDefinition;
import cadence.model.ScheduleAdvance;
import cadence.spi.DefinitionStore;

import java.time.Instant;
import java.util.List;
import java.util.Optional;

/**
 * {@link DefinitionStore} over two tables: definitions and generated events.
 *
 * <p>{@link #tryClaim} advances the definition with an {@code UPDATE ... WHERE id=? AND
 * next_due_at=?} and inserts the event in the same transaction, so concurrent processors on
 * any number of nodes generate each occurrence once. A unique key on
 * {@code (source_definition_id, occurred_at)} backs this up.
 */
public final class JdbcDefinitionStore extends AbstractJdbcStore implements DefinitionStore {

  private static final String DEFINITION_COLUMNS = "id, owner_id, amount, kind, category, "
      + "description, interval_kind, start_date, end_date, last_generated_at, next_due_at, "
      + "active, created_at, updated_at";

  private static final String EVENT_COLUMNS = "id, owner_id, amount, kind, category, "
      + "description, occurred_at, source_definition_id, created_at";

  private static final JdbcTemplate.RowMapper<RecurringDefinition> DEFINITION_ROW_MAPPER =
      rs -> RecurringDefinition.builder()
          .id(rs.getString("id"))
          .ownerId(rs.getString("owner_id"))
          .amount(rs.getBigDecimal("amount"))
          .kind(EntryKind.valueOf(rs.getString("kind")))
          .category(rs.getString("category"))
          .description(rs.getString("description"))
          .interval(IntervalKind.valueOf(rs.getString("interval_kind")))
          .startDate(JdbcTemplate.instant(rs, "start_date"))
          .endDate(JdbcTemplate.instant(rs, "end_date"))
          .lastGeneratedAt(JdbcTemplate.instant(rs, "last_generated_at"))
          .nextDueAt(JdbcTemplate.instant(rs, "next_due_at"))
          .active(rs.getBoolean("active"))
          .createdAt(JdbcTemplate.instant(rs, "created_at"))
          .updatedAt(JdbcTemplate.instant(rs, "updated_at"))
          .build();

  private static final JdbcTemplate.RowMapper<GeneratedEvent> EVENT_ROW_MAPPER =
      rs -> new GeneratedEvent(
          rs.getString("id"),
          rs.getString("owner_id"),
          rs.getBigDecimal("amount"),
          EntryKind.valueOf(rs.getString("kind")),
          rs.getString("category"),
          rs.getString("description"),
          JdbcTemplate.instant(rs, "occurred_at"),
          rs.getString("source_definition_id"),
          JdbcTemplate.instant(rs, "created_at"));

  public JdbcDefinitionStore(ConnectionProvider connectionProvider) {
    this(connectionProvider, TableNames.DEFAULT);
  }

  public JdbcDefinitionStore(ConnectionProvider connectionProvider, TableNames tables) {
    super(connectionProvider, tables);
  }

  @Override
  public List<RecurringDefinition> listDue(Instant now, Instant afterDue, String afterId,
      int limit) {
    String where = " WHERE active=? AND next_due_at<=? AND (end_date IS NULL OR end_date>=next_due_at)";
    if (afterDue == null) {
      String sql = "SELECT " + DEFINITION_COLUMNS + " FROM " + tables().definitions() + where
          + " ORDER BY next_due_at, id LIMIT ?";
      return withConnection("list due definitions",
          conn -> JdbcTemplate.query(conn, sql, DEFINITION_ROW_MAPPER, true, now, limit));
    }
    String sql = "SELECT " + DEFINITION_COLUMNS + " FROM " + tables().definitions() + where
        + " AND (next_due_at>? OR (next_due_at=? AND id>?))"
        + " ORDER BY next_due_at, id LIMIT ?";
    String lastId = afterId != null ? afterId : "";
    return withConnection("list due definitions after " + afterDue,
        conn -> JdbcTemplate.query(conn, sql, DEFINITION_ROW_MAPPER,
            true, now, afterDue, afterDue, lastId, limit));
  }

  @Override
  public boolean tryClaim(String definitionId, Instant expectedNextDue, ScheduleAdvance advance,
      GeneratedEvent event) {
    String advanceSql = "UPDATE " + tables().definitions()
        + " SET last_generated_at=?, next_due_at=?,"
        + " active=(end_date IS NULL OR end_date>=?), updated_at=?"
        + " WHERE id=? AND next_due_at=? AND active=? AND (end_date IS NULL OR end_date>=?)";
    String insertSql = "INSERT INTO " + tables().events() + " (" + EVENT_COLUMNS + ")"
        + " VALUES (?,?,?,?,?,?,?,?,?)";
    return inTransaction("claim definition " + definitionId, tx -> {
      int advanced = JdbcTemplate.update(tx.connection(), advanceSql,
          advance.lastGeneratedAt(), advance.nextDueAt(), advance.nextDueAt(), event.createdAt(),
          definitionId, expectedNextDue, true, expectedNextDue);
      if (advanced == 0) {
        tx.rollback();
        return false;
      }
      JdbcTemplate.update(tx.connection(), insertSql,
          event.id(), event.ownerId(), event.amount(), event.kind(), event.category(),
          event.description(), event.occurredAt(), event.sourceDefinitionId(), event.createdAt());
      return true;
    });
  }

  @Override
  public void create(RecurringDefinition definition) {
    String sql = "INSERT INTO " + tables().definitions() + " (" + DEFINITION_COLUMNS + ")"
        + " VALUES (?,?,?,?,?,?,?,?,?,?,?,?,?,?)";
    withConnection("create definition " + definition.id(), conn -> JdbcTemplate.update(conn, sql,
        definition.id(), definition.ownerId(), definition.amount(), definition.kind(),
        definition.category(), definition.description(), definition.interval(),
        definition.startDate(), definition.endDate(), definition.lastGeneratedAt(),
        definition.nextDueAt(), definition.active(), definition.createdAt(),
        definition.updatedAt()));
  }

  @Override
  public int update(RecurringDefinition definition, Instant expectedNextDue) {
    String sql = "UPDATE " + tables().definitions()
        + " SET amount=?, category=?, description=?, interval_kind=?, start_date=?, end_date=?,"
        + " last_generated_at=?, next_due_at=?, active=?, updated_at=?"
        + " WHERE id=? AND next_due_at=?";
    return withConnection("update definition " + definition.id(), conn -> JdbcTemplate.update(conn, sql,
        definition.amount(), definition.category(), definition.description(),
        definition.interval(), definition.startDate(), definition.endDate(),
        definition.lastGeneratedAt(), definition.nextDueAt(), definition.active(),
        definition.updatedAt(), definition.id(), expectedNextDue));
  }

  @Override
  public Optional<RecurringDefinition> findById(String definitionId) {
    String sql = "SELECT " + DEFINITION_COLUMNS + " FROM " + tables().definitions() + " WHERE id=?";
    return withConnection("find definition " + definitionId,
        conn -> JdbcTemplate.queryOne(conn, sql, DEFINITION_ROW_MAPPER, definitionId));
  }

  @Override
  public List<RecurringDefinition> listByOwner(String ownerId, boolean activeOnly) {
    String sql = "SELECT " + DEFINITION_COLUMNS + " FROM " + tables().definitions()
        + " WHERE owner_id=?" + (activeOnly ? " AND active=?" : "")
        + " ORDER BY created_at, id";
    return withConnection("list definitions of " + ownerId, conn -> activeOnly
        ? JdbcTemplate.query(conn, sql, DEFINITION_ROW_MAPPER, ownerId, true)
        : JdbcTemplate.query(conn, sql, DEFINITION_ROW_MAPPER, ownerId));
  }

  @Override
  public List<GeneratedEvent> eventsFor(String definitionId) {
    String sql = "SELECT " + EVENT_COLUMNS + " FROM " + tables().events()
        + " WHERE source_definition_id=? ORDER BY occurred_at";
    return withConnection("list events of " + definitionId,
        conn -> JdbcTemplate.query(conn, sql, EVENT_ROW_MAPPER, definitionId));
  }
}
