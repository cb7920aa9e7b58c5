/**
 * Cadence turns recurring income and expense definitions into ledger events and delivers
 * the resulting notifications over live connections, email and push.
 *
 * <p>{@link cadence.Cadence} wires the runtime; the building blocks live in
 * {@code cadence.schedule}, {@code cadence.notify} and {@code cadence.live}, with persistence
 * and delivery contracts in {@code cadence.spi}.
 */
package cadence;
