/**
 * Registry of live client connections and the wire envelope written to them.
 */
package cadence.live;
