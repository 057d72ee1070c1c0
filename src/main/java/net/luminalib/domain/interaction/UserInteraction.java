package net.luminalib.domain.interaction;

import jakarta.annotation.Nullable;
import java.time.Instant;
import java.util.UUID;

/**
 * Append-only interaction log entry.
 *
 * @param rating review rating for {@link InteractionType#REVIEW} entries, otherwise null
 */
public record UserInteraction(
    UUID id,
    UUID userId,
    UUID bookId,
    InteractionType type,
    @Nullable Double rating,
    Instant createdAt
) {

    public static UserInteraction of(UUID userId, UUID bookId, InteractionType type, @Nullable Double rating) {
        return new UserInteraction(UUID.randomUUID(), userId, bookId, type, rating, Instant.now());
    }

    public boolean isRated() {
        return rating != null;
    }
}
