package net.luminalib.domain.review;

import jakarta.annotation.Nullable;

/**
 * Aggregate rating statistics for a book.
 *
 * @param totalReviews number of stored reviews
 * @param averageRating mean rating, null when there are no reviews
 */
public record ReviewStats(long totalReviews, @Nullable Double averageRating) {

    public static ReviewStats empty() {
        return new ReviewStats(0L, null);
    }
}
