package com.streamanalytics.core.bus;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;
import java.util.UUID;

/**
 * Bounded record of recently seen event ids.
 *
 * <p>
 * Ids are kept in insertion order and forgotten when either bound is hit:
 * more than {@code maxEntries} ids, or an id older than {@code horizon}.
 * An id forgotten this way would be accepted again.
 * </p>
 *
 * <h3>Thread Safety</h3>
 * <p>
 * All access is serialised on an internal lock that is not shared with any
 * other bus structure.
 * </p>
 *
 * @since 1.0.0
 */
public final class DeduplicationWindow {

    private final int maxEntries;
    private final Duration horizon;
    private final Clock clock;
    private final Object lock = new Object();
    private final LinkedHashMap<UUID, Instant> seen = new LinkedHashMap<>();

    public DeduplicationWindow(int maxEntries, Duration horizon, Clock clock) {
        if (maxEntries < 1) {
            throw new IllegalArgumentException("maxEntries must be >= 1, got: " + maxEntries);
        }
        this.maxEntries = maxEntries;
        this.horizon = Objects.requireNonNull(horizon, "horizon must not be null");
        this.clock = Objects.requireNonNull(clock, "clock must not be null");
    }

    /**
     * Record an id.
     *
     * @return {@code true} if the id was not already present
     */
    public boolean markSeen(UUID id) {
        Objects.requireNonNull(id, "id must not be null");
        Instant now = clock.instant();
        synchronized (lock) {
            expire(now);
            if (seen.containsKey(id)) {
                return false;
            }
            seen.put(id, now);
            if (seen.size() > maxEntries) {
                Iterator<UUID> eldest = seen.keySet().iterator();
                eldest.next();
                eldest.remove();
            }
            return true;
        }
    }

    public int size() {
        synchronized (lock) {
            return seen.size();
        }
    }

    private void expire(Instant now) {
        Instant cutoff = now.minus(horizon);
        Iterator<Map.Entry<UUID, Instant>> it = seen.entrySet().iterator();
        while (it.hasNext()) {
            if (it.next().getValue().isBefore(cutoff)) {
                it.remove();
            } else {
                break;
            }
        }
    }
}
