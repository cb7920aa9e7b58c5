package cadence.memory;

import cadence.model.DeviceToken;
import cadence.spi.DeviceTokenStore;

import java.time.Clock;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;

/** {@link DeviceTokenStore} held in memory, keyed by token. */
public final class InMemoryDeviceTokenStore implements DeviceTokenStore {
  private final Map<String, DeviceToken> tokens = new LinkedHashMap<>();
  private final Clock clock;

  public InMemoryDeviceTokenStore() {
    this(Clock.systemUTC());
  }

  public InMemoryDeviceTokenStore(Clock clock) {
    this.clock = Objects.requireNonNull(clock, "clock");
  }

  @Override
  public synchronized List<String> activeTokens(String ownerId) {
    List<String> result = new ArrayList<>();
    for (DeviceToken token : tokens.values()) {
      if (token.active() && token.ownerId().equals(ownerId)) {
        result.add(token.token());
      }
    }
    return result;
  }

  @Override
  public synchronized void register(String ownerId, String token) {
    tokens.put(token, new DeviceToken(ownerId, token, true, null, clock.instant()));
  }

  @Override
  public synchronized void unregister(String ownerId, String token) {
    DeviceToken existing = tokens.get(token);
    if (existing != null && existing.ownerId().equals(ownerId)) {
      tokens.remove(token);
    }
  }

  @Override
  public synchronized void deactivate(String token, String error) {
    DeviceToken existing = tokens.get(token);
    if (existing != null) {
      tokens.put(token, new DeviceToken(existing.ownerId(), token, false, error, clock.instant()));
    }
  }

  public synchronized Optional<DeviceToken> find(String token) {
    return Optional.ofNullable(tokens.get(token));
  }
}
