package cadence.spring.boot;

import cadence.jdbc.ConnectionProvider;
import cadence.jdbc.JdbcSchema;
import cadence.jdbc.TableNames;
import org.springframework.beans.factory.InitializingBean;

import java.util.logging.Logger;

/**
 * Applies the bundled Cadence DDL when {@code cadence.jdbc.initialize-schema} is enabled.
 * Statements are idempotent, so restarting against an initialized database is safe.
 */
public class CadenceSchemaInitializer implements InitializingBean {
  private static final Logger logger = Logger.getLogger(CadenceSchemaInitializer.class.getName());

  private final ConnectionProvider connectionProvider;
  private final TableNames tables;

  public CadenceSchemaInitializer(ConnectionProvider connectionProvider, TableNames tables) {
    this.connectionProvider = connectionProvider;
    this.tables = tables;
  }

  @Override
  public void afterPropertiesSet() {
    JdbcSchema.create(connectionProvider, tables);
    logger.info("Initialized Cadence schema with table prefix " + tables.prefix());
  }
}
