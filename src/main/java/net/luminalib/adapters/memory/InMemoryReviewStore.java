package net.luminalib.adapters.memory;

import java.util.Comparator;
import java.util.List;
import java.util.UUID;
import java.util.concurrent.CopyOnWriteArrayList;
import net.luminalib.domain.review.Review;
import net.luminalib.domain.review.ReviewStats;
import net.luminalib.domain.review.ReviewStore;

public class InMemoryReviewStore implements ReviewStore {

    private final List<Review> reviews = new CopyOnWriteArrayList<>();

    @Override
    public List<Review> findByBookId(UUID bookId) {
        return reviews.stream()
            .filter(review -> review.bookId().equals(bookId))
            .sorted(Comparator.comparing(Review::createdAt))
            .toList();
    }

    @Override
    public Review save(Review review) {
        reviews.add(review);
        return review;
    }

    @Override
    public boolean existsByUserAndBook(UUID userId, UUID bookId) {
        return reviews.stream().anyMatch(review -> review.userId().equals(userId) && review.bookId().equals(bookId));
    }

    @Override
    public ReviewStats statsForBook(UUID bookId) {
        List<Review> forBook = findByBookId(bookId);
        if (forBook.isEmpty()) {
            return ReviewStats.empty();
        }
        double average = forBook.stream().mapToInt(Review::rating).average().orElse(0.0);
        return new ReviewStats(forBook.size(), average);
    }
}
