package net.luminalib.domain.ai;

import jakarta.annotation.Nullable;
import java.time.Instant;
import java.util.UUID;

/**
 * Current state of a derived field together with the last failure, if any.
 */
public record IntelligenceStatus(
    UUID bookId,
    IntelligenceKind kind,
    IntelligenceState state,
    @Nullable Instant updatedAt,
    @Nullable String lastError
) {

    public static IntelligenceStatus idle(UUID bookId, IntelligenceKind kind) {
        return new IntelligenceStatus(bookId, kind, IntelligenceState.IDLE, null, null);
    }
}
