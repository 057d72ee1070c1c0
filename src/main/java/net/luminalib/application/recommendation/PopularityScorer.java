package net.luminalib.application.recommendation;

import java.time.Instant;
import java.util.Comparator;
import java.util.List;
import java.util.Map;
import java.util.UUID;
import net.luminalib.domain.catalog.Book;
import net.luminalib.domain.interaction.UserInteraction;
import org.springframework.stereotype.Component;

/**
 * Cold-start ranking by library-wide popularity with a recency fallback.
 *
 * <p>Order: distinct readers descending, average rating descending, newest first, then
 * book id. Scores are distinct readers relative to the most-read candidate, so books
 * nobody has touched yet score 0 and are ranked purely by recency.</p>
 */
@Component
public class PopularityScorer {

    static final String POPULAR_REASON = "Popular with readers in the library";
    static final String RECENT_REASON = "Recently added to the catalog";

    public List<ScoredCandidate> rank(List<Book> candidates, Map<UUID, List<UserInteraction>> interactionsByBook) {
        List<Popularity> popularity = candidates.stream()
            .map(book -> Popularity.of(book, interactionsByBook.getOrDefault(book.id(), List.of())))
            .sorted(Comparator.comparingLong(Popularity::readers).reversed()
                .thenComparing(Comparator.comparingDouble(Popularity::averageRating).reversed())
                .thenComparing(Popularity::createdAt, Comparator.reverseOrder())
                .thenComparing(entry -> entry.book().id().toString()))
            .toList();

        long maxReaders = popularity.stream().mapToLong(Popularity::readers).max().orElse(0L);
        return popularity.stream()
            .map(entry -> entry.readers() > 0
                ? new ScoredCandidate(entry.book(), (double) entry.readers() / maxReaders, POPULAR_REASON)
                : new ScoredCandidate(entry.book(), 0.0, RECENT_REASON))
            .toList();
    }

    private record Popularity(Book book, long readers, double averageRating, Instant createdAt) {

        static Popularity of(Book book, List<UserInteraction> interactions) {
            long readers = interactions.stream().map(UserInteraction::userId).distinct().count();
            double averageRating = interactions.stream()
                .filter(UserInteraction::isRated)
                .mapToDouble(UserInteraction::rating)
                .average()
                .orElse(0.0);
            Instant createdAt = book.createdAt() != null ? book.createdAt() : Instant.EPOCH;
            return new Popularity(book, readers, averageRating, createdAt);
        }
    }
}
