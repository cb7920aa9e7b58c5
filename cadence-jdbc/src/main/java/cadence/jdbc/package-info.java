/**
 * JDBC implementations of the Cadence store SPIs.
 *
 * <p>The stores share {@link cadence.jdbc.JdbcTemplate} for statement execution and
 * {@link cadence.jdbc.TableNames} for the configurable table prefix. The bundled DDL is
 * applied with {@link cadence.jdbc.JdbcSchema}. The SQL sticks to what H2, MySQL and
 * PostgreSQL share.
 *
 * @see cadence.jdbc.JdbcDefinitionStore
 * @see cadence.jdbc.JdbcNotificationStore
 * @see cadence.jdbc.JdbcPreferenceStore
 * @see cadence.jdbc.JdbcDeviceTokenStore
 */
package cadence.jdbc;
