package io.fwaas.orchestrator.infra;

import io.fwaas.orchestrator.domain.DeletionLedger;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;

/**
 * Bounded in-memory ledger of confirmed deletions.
 * <p>
 * Entries expire after {@code ttl} and the oldest are evicted beyond {@code capacity}. The ledger
 * does not survive a restart and is not shared between orchestrator instances; a confirmation
 * that arrives after eviction finds the firewall already gone, which reconciliation treats as
 * unknown.
 */
public final class InMemoryDeletionLedger implements DeletionLedger {

    private final Duration ttl;
    private final int capacity;
    private final Clock clock;
    private final LinkedHashMap<String, Instant> confirmed = new LinkedHashMap<>(64, 0.75f, false);

    public InMemoryDeletionLedger(Duration ttl, int capacity) {
        this(ttl, capacity, Clock.systemUTC());
    }

    public InMemoryDeletionLedger(Duration ttl, int capacity, Clock clock) {
        this.ttl = Objects.requireNonNull(ttl, "ttl");
        this.clock = Objects.requireNonNull(clock, "clock");
        if (ttl.isNegative() || ttl.isZero()) {
            throw new IllegalArgumentException("ttl must be positive");
        }
        if (capacity <= 0) {
            throw new IllegalArgumentException("capacity must be positive");
        }
        this.capacity = capacity;
    }

    @Override
    public synchronized boolean isConfirmed(String firewallId) {
        if (firewallId == null) {
            return false;
        }
        prune(clock.instant());
        return confirmed.containsKey(firewallId);
    }

    @Override
    public synchronized void markConfirmed(String firewallId) {
        Objects.requireNonNull(firewallId, "firewallId");
        Instant now = clock.instant();
        confirmed.remove(firewallId);
        confirmed.put(firewallId, now);
        prune(now);
    }

    synchronized int size() {
        return confirmed.size();
    }

    private void prune(Instant now) {
        Iterator<Map.Entry<String, Instant>> iterator = confirmed.entrySet().iterator();
        while (iterator.hasNext()) {
            Map.Entry<String, Instant> entry = iterator.next();
            if (Duration.between(entry.getValue(), now).compareTo(ttl) > 0) {
                iterator.remove();
            } else {
                break;
            }
        }
        while (confirmed.size() > capacity) {
            Iterator<String> keys = confirmed.keySet().iterator();
            keys.next();
            keys.remove();
        }
    }
}
