/**
 * Recurrence date algebra: computing the next due instant of a schedule.
 */
package cadence.recurrence;
