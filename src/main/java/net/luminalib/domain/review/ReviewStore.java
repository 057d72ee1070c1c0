package net.luminalib.domain.review;

import java.util.List;
import java.util.UUID;

/**
 * Port to stored reviews.
 */
public interface ReviewStore {

    /**
     * Returns reviews for a book, oldest first.
     */
    List<Review> findByBookId(UUID bookId);

    Review save(Review review);

    boolean existsByUserAndBook(UUID userId, UUID bookId);

    ReviewStats statsForBook(UUID bookId);
}
