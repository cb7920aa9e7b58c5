package cadence.jdbc;

import cadence.model.EntryKind;
import cadence.spi.StoreException;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.math.BigDecimal;
import java.sql.Connection;
import java.sql.SQLException;
import java.time.Instant;
import java.util.List;
import java.util.Optional;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

class JdbcTemplateTest {
  private DataSourceConnectionProvider provider;

  @BeforeEach
  void setup() throws SQLException {
    provider = H2Database.create();
    try (Connection conn = provider.getConnection()) {
      JdbcTemplate.update(conn, "CREATE TABLE sample (id VARCHAR(32) PRIMARY KEY, kind VARCHAR(16),"
          + " amount DECIMAL(19,4), flag BOOLEAN, seen_at TIMESTAMP)");
    }
  }

  @Test
  void bindsEnumsDecimalsBooleansAndInstants() throws SQLException {
    Instant at = Instant.parse("2024-03-31T10:15:30Z");
    try (Connection conn = provider.getConnection()) {
      assertEquals(1, JdbcTemplate.update(conn, "INSERT INTO sample VALUES (?,?,?,?,?)",
          "a", EntryKind.INCOME, new BigDecimal("12.5"), true, at));
      assertEquals(1, JdbcTemplate.update(conn, "INSERT INTO sample VALUES (?,?,?,?,?)",
          "b", null, BigDecimal.ONE, false, null));

      List<String> kinds = JdbcTemplate.query(conn, "SELECT kind FROM sample WHERE flag=? ORDER BY id",
          rs -> rs.getString("kind"), true);
      assertEquals(List.of("INCOME"), kinds);

      Instant read = JdbcTemplate.queryOne(conn, "SELECT seen_at FROM sample WHERE id=?",
          rs -> JdbcTemplate.instant(rs, "seen_at"), "a").orElseThrow();
      assertEquals(at, read);
      assertNull(JdbcTemplate.query(conn, "SELECT seen_at FROM sample WHERE id=?",
          rs -> JdbcTemplate.instant(rs, "seen_at"), "b").get(0));
    }
  }

  @Test
  void queryOneDistinguishesNoneAndMany() throws SQLException {
    try (Connection conn = provider.getConnection()) {
      JdbcTemplate.update(conn, "INSERT INTO sample (id, flag) VALUES (?,?)", "a", true);
      JdbcTemplate.update(conn, "INSERT INTO sample (id, flag) VALUES (?,?)", "b", true);

      Optional<String> none = JdbcTemplate.queryOne(conn, "SELECT id FROM sample WHERE id=?",
          rs -> rs.getString(1), "zzz");
      assertFalse(none.isPresent());
      assertThrows(StoreException.class, () -> JdbcTemplate.queryOne(conn,
          "SELECT id FROM sample WHERE flag=?", rs -> rs.getString(1), true));
    }
  }

  @Test
  void sqlErrorsBecomeStoreExceptions() throws SQLException {
    try (Connection conn = provider.getConnection()) {
      StoreException e = assertThrows(StoreException.class,
          () -> JdbcTemplate.update(conn, "INSERT INTO missing_table VALUES (?)", "x"));
      assertTrue(e.getCause() instanceof SQLException);
      assertThrows(StoreException.class,
          () -> JdbcTemplate.query(conn, "SELECT nope FROM sample", rs -> rs.getString(1)));
    }
  }

  @Test
  void transactionRollsBackUnlessCommitted() throws SQLException {
    JdbcTransactionManager txManager = new JdbcTransactionManager(provider);
    try (JdbcTransactionManager.Transaction tx = txManager.begin()) {
      JdbcTemplate.update(tx.connection(), "INSERT INTO sample (id) VALUES (?)", "rolled-back");
    }
    try (JdbcTransactionManager.Transaction tx = txManager.begin()) {
      JdbcTemplate.update(tx.connection(), "INSERT INTO sample (id) VALUES (?)", "kept");
      tx.commit();
    }

    try (Connection conn = provider.getConnection()) {
      assertEquals(List.of("kept"),
          JdbcTemplate.query(conn, "SELECT id FROM sample", rs -> rs.getString(1)));
      assertTrue(conn.getAutoCommit());
    }
  }
}
