package cadence.live;

import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;

/**
 * Envelope written to live connections: {@code {"type": ..., "data": ..., "timestamp": ...}}.
 *
 * @param data payload encoded as a JSON value; {@code null} omits the field
 */
public record WireMessage(String type, Object data, Instant timestamp) {

  public WireMessage {
    Objects.requireNonNull(type, "type");
    Objects.requireNonNull(timestamp, "timestamp");
  }

  /** Returns the envelope as an ordered map ready for JSON encoding. */
  public Map<String, Object> toMap() {
    Map<String, Object> map = new LinkedHashMap<>();
    map.put("type", type);
    if (data != null) {
      map.put("data", data);
    }
    map.put("timestamp", timestamp.toString());
    return map;
  }
}
