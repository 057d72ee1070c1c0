package net.luminalib.controller.dto;

import java.time.Instant;
import java.util.UUID;
import net.luminalib.domain.review.Review;

public record ReviewDto(UUID id, UUID userId, UUID bookId, int rating, String text, Instant createdAt) {

    public static ReviewDto from(Review review) {
        return new ReviewDto(review.id(), review.userId(), review.bookId(), review.rating(), review.text(),
            review.createdAt());
    }
}
