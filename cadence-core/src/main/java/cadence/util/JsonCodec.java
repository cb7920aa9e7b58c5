package cadence.util;

import java.util.Map;

/**
 * JSON encoding for wire messages and notification payloads.
 *
 * <p>The default implementation ({@link DefaultJsonCodec}) has no dependencies. It writes
 * nested maps, lists, strings, numbers, booleans and {@link java.time.temporal.TemporalAccessor}
 * values, and reads flat objects whose values are scalars. Applications with Jackson or Gson on
 * the classpath can implement this interface to delegate to their preferred library.
 *
 * @see #getDefault()
 */
public interface JsonCodec {

    static JsonCodec getDefault() {
        return DefaultJsonCodec.INSTANCE;
    }

    /**
     * Encodes a value as JSON. Maps become objects (keys must be non-null), iterables and
     * arrays become arrays, temporals are written as ISO-8601 strings and any other
     * non-scalar is written via {@code toString()}.
     *
     * @param value value to encode, may be {@code null}
     * @return JSON text, never {@code null}
     */
    String toJson(Object value);

    /**
     * Parses a JSON object into a string map. Scalar values (strings, numbers, booleans) are
     * kept as their textual form; {@code null} values are dropped. Returns an empty map for
     * {@code null}, blank or {@code "null"} input.
     *
     * @throws IllegalArgumentException if the input is not a flat JSON object
     */
    Map<String, String> parseObject(String json);
}
