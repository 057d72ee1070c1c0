package net.luminalib.support.ai;

import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;

/**
 * Process-local single-flight guard with rerun coalescing.
 *
 * <p>At most one flight per key is active. A request arriving while a flight is active
 * does not start a second one; it only raises the flight's rerun flag, so any number of
 * overlapping requests collapses into a single follow-up run. All transitions go through
 * {@link ConcurrentHashMap#compute} and are atomic per key.</p>
 *
 * <p>Multiple application instances would need a shared lock (for example a Postgres
 * advisory lock keyed by book id) in place of this map.</p>
 *
 * @param <K> flight key type
 */
public final class SingleFlightGuard<K> {

    /**
     * Result of {@link #tryAcquire(Object)}.
     */
    public enum Admission {
        /** The caller owns a new flight and must eventually call {@link #release} or {@link #abandon}. */
        STARTED,
        /** A flight was already active; a rerun was requested from its owner. */
        COALESCED
    }

    // value: rerun requested
    private final ConcurrentMap<K, Boolean> flights = new ConcurrentHashMap<>();

    public Admission tryAcquire(K key) {
        Admission[] admission = new Admission[1];
        flights.compute(key, (ignored, rerunRequested) -> {
            if (rerunRequested == null) {
                admission[0] = Admission.STARTED;
                return Boolean.FALSE;
            }
            admission[0] = Admission.COALESCED;
            return Boolean.TRUE;
        });
        return admission[0];
    }

    /**
     * Ends the owner's current run.
     *
     * @return true when a rerun was requested; the flight then stays held (with the flag
     *         cleared) and the owner must run once more before releasing again
     */
    public boolean release(K key) {
        boolean[] rerun = new boolean[1];
        flights.computeIfPresent(key, (ignored, rerunRequested) -> {
            if (rerunRequested) {
                rerun[0] = true;
                return Boolean.FALSE;
            }
            return null;
        });
        return rerun[0];
    }

    /**
     * Drops the flight without honoring a pending rerun request.
     */
    public void abandon(K key) {
        flights.remove(key);
    }

    public boolean isInFlight(K key) {
        return flights.containsKey(key);
    }

    public int activeFlights() {
        return flights.size();
    }
}
