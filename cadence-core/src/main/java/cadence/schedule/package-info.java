/**
 * Recurring definitions: user management, and the processor that turns due definitions into
 * generated events.
 */
package cadence.schedule;
