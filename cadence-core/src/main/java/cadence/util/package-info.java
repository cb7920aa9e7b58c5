/**
 * Small shared helpers: daemon thread naming, time-limited worker pools and the JSON codec
 * used for wire messages.
 */
package cadence.util;
