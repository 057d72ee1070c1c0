package net.luminalib.application.recommendation;

import java.util.Comparator;
import net.luminalib.domain.catalog.Book;
import net.luminalib.domain.recommendation.RecommendationResult;

/**
 * Value object tracking a candidate book with its blended score and the reason shown to
 * the reader.
 *
 * @param book the candidate
 * @param score blended score in [0, 1]
 * @param reason human readable explanation of the dominating signal
 */
public record ScoredCandidate(Book book, double score, String reason) {

    /**
     * Score descending, then book id string ascending.
     */
    public static final Comparator<ScoredCandidate> RANKING = Comparator
        .comparingDouble(ScoredCandidate::score).reversed()
        .thenComparing(candidate -> candidate.book().id().toString());

    public RecommendationResult toResult() {
        return new RecommendationResult(book.id(), score, reason);
    }
}
