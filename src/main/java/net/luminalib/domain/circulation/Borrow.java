package net.luminalib.domain.circulation;

import jakarta.annotation.Nullable;
import java.time.Instant;
import java.util.UUID;

/**
 * Borrow record; {@code returnedAt == null} marks an active borrow.
 */
public record Borrow(
    UUID id,
    UUID userId,
    UUID bookId,
    Instant borrowedAt,
    @Nullable Instant returnedAt
) {

    public boolean isActive() {
        return returnedAt == null;
    }

    public Borrow returned(Instant at) {
        return new Borrow(id, userId, bookId, borrowedAt, at);
    }
}
