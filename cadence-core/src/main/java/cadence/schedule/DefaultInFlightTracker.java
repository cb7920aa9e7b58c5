package cadence.schedule;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.Map;
import java.util.Objects;
import java.util.concurrent.ConcurrentHashMap;

/**
 * {@link ConcurrentHashMap}-based tracker with an optional lease.
 *
 * <p>Without a lease a definition stays tracked until released. With one, an entry older
 * than the lease can be taken over, so a worker stuck past its timeout does not block the
 * definition forever.
 *
 * <p>This class is thread-safe.
 */
public final class DefaultInFlightTracker implements InFlightTracker {
    private final Map<String, Instant> inflight = new ConcurrentHashMap<>();
    private final Duration lease;
    private final Clock clock;

    public DefaultInFlightTracker() {
        this(Duration.ZERO, Clock.systemUTC());
    }

    /**
     * @param lease how long an acquisition is honoured; {@link Duration#ZERO} for no expiry
     */
    public DefaultInFlightTracker(Duration lease, Clock clock) {
        this.lease = Objects.requireNonNull(lease, "lease");
        this.clock = Objects.requireNonNull(clock, "clock");
        if (lease.isNegative()) {
            throw new IllegalArgumentException("lease must be >= 0");
        }
    }

    @Override
    public boolean tryAcquire(String definitionId) {
        Instant now = clock.instant();
        Instant existing = inflight.putIfAbsent(definitionId, now);
        if (existing == null) {
            return true;
        }
        if (!lease.isZero() && existing.plus(lease).isBefore(now)) {
            return inflight.replace(definitionId, existing, now);
        }
        return false;
    }

    @Override
    public void release(String definitionId) {
        inflight.remove(definitionId);
    }

    int size() {
        return inflight.size();
    }
}
