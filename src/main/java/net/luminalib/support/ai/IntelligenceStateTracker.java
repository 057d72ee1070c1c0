package net.luminalib.support.ai;

import com.github.benmanes.caffeine.cache.Cache;
import com.github.benmanes.caffeine.cache.Caffeine;
import java.time.Clock;
import java.time.Instant;
import java.util.UUID;
import net.luminalib.config.IntelligenceProperties;
import net.luminalib.domain.ai.IntelligenceKind;
import net.luminalib.domain.ai.IntelligenceState;
import net.luminalib.domain.ai.IntelligenceStatus;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Component;

/**
 * Bounded in-memory record of the latest intelligence state per book and kind.
 *
 * <p>Entries evicted from the cache read back as {@link IntelligenceState#IDLE}; the
 * persisted summary and consensus remain the source of truth.</p>
 */
@Component
public class IntelligenceStateTracker {

    private final Cache<StateKey, IntelligenceStatus> states;
    private final Clock clock;

    @Autowired
    public IntelligenceStateTracker(IntelligenceProperties properties) {
        this(properties.getStateCacheSize(), Clock.systemUTC());
    }

    public IntelligenceStateTracker(long maximumSize, Clock clock) {
        this.states = Caffeine.newBuilder()
            .maximumSize(maximumSize)
            .recordStats()
            .build();
        this.clock = clock;
    }

    public IntelligenceStatus status(UUID bookId, IntelligenceKind kind) {
        IntelligenceStatus status = states.getIfPresent(new StateKey(bookId, kind));
        return status != null ? status : IntelligenceStatus.idle(bookId, kind);
    }

    public void markInFlight(UUID bookId, IntelligenceKind kind) {
        put(bookId, kind, IntelligenceState.IN_FLIGHT, null);
    }

    public void markReady(UUID bookId, IntelligenceKind kind) {
        put(bookId, kind, IntelligenceState.READY, null);
    }

    public void markFailed(UUID bookId, IntelligenceKind kind, String error) {
        put(bookId, kind, IntelligenceState.FAILED, error);
    }

    /**
     * Forgets the recorded state so the pair reads back as idle.
     */
    public void reset(UUID bookId, IntelligenceKind kind) {
        states.invalidate(new StateKey(bookId, kind));
    }

    private void put(UUID bookId, IntelligenceKind kind, IntelligenceState state, String error) {
        Instant now = clock.instant();
        states.put(new StateKey(bookId, kind), new IntelligenceStatus(bookId, kind, state, now, error));
    }

    private record StateKey(UUID bookId, IntelligenceKind kind) {
    }
}
