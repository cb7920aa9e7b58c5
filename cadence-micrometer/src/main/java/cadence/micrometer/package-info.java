/**
 * Micrometer integration for Cadence metrics.
 *
 * @see cadence.micrometer.MicrometerMetricsExporter
 */
package cadence.micrometer;
