/**
 * Immutable domain types: recurring definitions, generated ledger events, notifications,
 * preferences and device tokens, plus the enums that classify them.
 */
package cadence.model;
