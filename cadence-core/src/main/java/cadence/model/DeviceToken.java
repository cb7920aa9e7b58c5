package cadence.model;

import java.time.Instant;
import java.util.Objects;

/**
 * A push-notification device registration.
 *
 * @param lastError message from the push failure that deactivated the token, if any
 */
public record DeviceToken(
    String ownerId,
    String token,
    boolean active,
    String lastError,
    Instant updatedAt
) {

  public DeviceToken {
    Objects.requireNonNull(ownerId, "ownerId");
    Objects.requireNonNull(token, "token");
  }
}
