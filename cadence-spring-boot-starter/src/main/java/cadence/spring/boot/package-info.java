/**
 * Spring Boot auto-configuration for Cadence.
 *
 * <p>Adding the starter to an application with a {@code DataSource} yields a running
 * {@link cadence.Cadence} runtime configured from {@code cadence.*} properties.
 *
 * @see cadence.spring.boot.CadenceAutoConfiguration
 * @see cadence.spring.boot.CadenceProperties
 */
package cadence.spring.boot;
