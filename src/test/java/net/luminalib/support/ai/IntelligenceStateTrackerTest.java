package net.luminalib.support.ai;

import static org.assertj.core.api.Assertions.assertThat;

import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.UUID;
import net.luminalib.domain.ai.IntelligenceKind;
import net.luminalib.domain.ai.IntelligenceState;
import net.luminalib.domain.ai.IntelligenceStatus;
import org.junit.jupiter.api.Test;

class IntelligenceStateTrackerTest {

    private static final Instant NOW = Instant.parse("2025-03-01T10:00:00Z");

    private final IntelligenceStateTracker tracker =
        new IntelligenceStateTracker(100, Clock.fixed(NOW, ZoneOffset.UTC));

    @Test
    void should_ReportIdle_When_NothingRecorded() {
        UUID bookId = UUID.randomUUID();

        IntelligenceStatus status = tracker.status(bookId, IntelligenceKind.SUMMARY);

        assertThat(status.state()).isEqualTo(IntelligenceState.IDLE);
        assertThat(status.updatedAt()).isNull();
    }

    @Test
    void should_TrackKindsSeparately() {
        UUID bookId = UUID.randomUUID();

        tracker.markInFlight(bookId, IntelligenceKind.SUMMARY);
        tracker.markFailed(bookId, IntelligenceKind.CONSENSUS, "HTTP 503 server error");

        assertThat(tracker.status(bookId, IntelligenceKind.SUMMARY).state()).isEqualTo(IntelligenceState.IN_FLIGHT);
        IntelligenceStatus consensus = tracker.status(bookId, IntelligenceKind.CONSENSUS);
        assertThat(consensus.state()).isEqualTo(IntelligenceState.FAILED);
        assertThat(consensus.lastError()).isEqualTo("HTTP 503 server error");
        assertThat(consensus.updatedAt()).isEqualTo(NOW);
    }

    @Test
    void should_ClearError_When_MarkedReadyAfterFailure() {
        UUID bookId = UUID.randomUUID();
        tracker.markFailed(bookId, IntelligenceKind.SUMMARY, "timeout");

        tracker.markReady(bookId, IntelligenceKind.SUMMARY);

        IntelligenceStatus status = tracker.status(bookId, IntelligenceKind.SUMMARY);
        assertThat(status.state()).isEqualTo(IntelligenceState.READY);
        assertThat(status.lastError()).isNull();
    }

    @Test
    void should_ReadBackIdle_When_Reset() {
        UUID bookId = UUID.randomUUID();
        tracker.markReady(bookId, IntelligenceKind.CONSENSUS);

        tracker.reset(bookId, IntelligenceKind.CONSENSUS);

        assertThat(tracker.status(bookId, IntelligenceKind.CONSENSUS).state()).isEqualTo(IntelligenceState.IDLE);
    }
}
