package cadence.jdbc;

import cadence.spi.StoreException;

import java.io.IOException;
import java.io.InputStream;
import java.nio.charset.StandardCharsets;
import java.sql.Connection;
import java.sql.SQLException;
import java.sql.Statement;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Creates the Cadence tables from the bundled {@code cadence/schema.sql}. Statements use
 * {@code IF NOT EXISTS}, so running it against an initialized database is a no-op.
 */
public final class JdbcSchema {
  private static final Logger logger = Logger.getLogger(JdbcSchema.class.getName());

  public static final String RESOURCE = "cadence/schema.sql";
  private static final String PREFIX_PLACEHOLDER = "{prefix}";

  private JdbcSchema() {}

  public static void create(ConnectionProvider connectionProvider, TableNames tables) {
    Objects.requireNonNull(connectionProvider, "connectionProvider");
    Objects.requireNonNull(tables, "tables");
    List<String> statements = statements(tables);
    try (Connection conn = connectionProvider.getConnection();
         Statement stmt = conn.createStatement()) {
      for (String sql : statements) {
        stmt.execute(sql);
      }
    } catch (SQLException e) {
      throw new StoreException("Failed to create schema with prefix " + tables.prefix(), e);
    }
    logger.log(Level.INFO, "Cadence schema ready (" + statements.size() + " statements, prefix "
        + tables.prefix() + ")");
  }

  /** The bundled DDL split into statements, with the table prefix applied. */
  static List<String> statements(TableNames tables) {
    String script = load().replace(PREFIX_PLACEHOLDER, tables.prefix());
    List<String> statements = new ArrayList<>();
    for (String chunk : script.split(";")) {
      StringBuilder sql = new StringBuilder();
      for (String line : chunk.split("\n")) {
        String trimmed = line.trim();
        if (!trimmed.isEmpty() && !trimmed.startsWith("--")) {
          sql.append(line).append('\n');
        }
      }
      if (sql.length() > 0) {
        statements.add(sql.toString().trim());
      }
    }
    return statements;
  }

  private static String load() {
    try (InputStream in = JdbcSchema.class.getClassLoader().getResourceAsStream(RESOURCE)) {
      if (in == null) {
        throw new IllegalStateException("Missing classpath resource " + RESOURCE);
      }
      return new String(in.readAllBytes(), StandardCharsets.UTF_8);
    } catch (IOException e) {
      throw new IllegalStateException("Failed to read " + RESOURCE, e);
    }
  }
}
