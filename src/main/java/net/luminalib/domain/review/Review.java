package net.luminalib.domain.review;

import java.time.Instant;
import java.util.UUID;

/**
 * Immutable reader review.
 */
public record Review(
    UUID id,
    UUID userId,
    UUID bookId,
    int rating,
    String text,
    Instant createdAt
) {

    public static final int MIN_RATING = 1;
    public static final int MAX_RATING = 5;

    public Review {
        if (rating < MIN_RATING || rating > MAX_RATING) {
            throw new IllegalArgumentException("rating must be between 1 and 5 but was " + rating);
        }
        text = text == null ? "" : text;
    }
}
