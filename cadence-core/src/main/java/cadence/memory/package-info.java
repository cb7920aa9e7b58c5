/**
 * In-memory store implementations for tests and single-process use.
 */
package cadence.memory;
