package net.luminalib.application.recommendation;

import java.util.HashMap;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.OptionalDouble;
import java.util.Set;
import java.util.UUID;
import java.util.stream.Collectors;
import net.luminalib.domain.interaction.UserInteraction;
import org.springframework.stereotype.Component;

/**
 * User-user neighbourhood scoring over the interaction log.
 *
 * <p>A neighbour's weight is the cosine overlap of the two interacted book sets,
 * {@code |A ∩ B| / sqrt(|A| * |B|)}. Each book a neighbour touched and the reader did not
 * accumulates {@code weight * affinity}, where affinity is the neighbour's mean rating
 * divided by 5, or {@value #UNRATED_AFFINITY} when the neighbour never rated it. Raw sums
 * are divided by the largest one, so the best candidate scores exactly 1.</p>
 */
@Component
public class CollaborativeScorer {

    static final double UNRATED_AFFINITY = 0.6;
    private static final double MAX_RATING = 5.0;

    /**
     * @param readerBooks books the reader has interacted with
     * @param neighbourHistories full interaction histories of other readers, keyed by user id
     * @return normalized scores for books outside {@code readerBooks}; empty when the reader
     *         has no history or no neighbour overlaps
     */
    public Map<UUID, Double> score(Set<UUID> readerBooks, Map<UUID, List<UserInteraction>> neighbourHistories) {
        if (readerBooks.isEmpty()) {
            return Map.of();
        }

        Map<UUID, Double> raw = new HashMap<>();
        for (List<UserInteraction> history : neighbourHistories.values()) {
            Set<UUID> neighbourBooks = history.stream().map(UserInteraction::bookId).collect(Collectors.toSet());
            double weight = cosineOverlap(readerBooks, neighbourBooks);
            if (weight <= 0.0) {
                continue;
            }
            Map<UUID, List<UserInteraction>> byBook = history.stream()
                .collect(Collectors.groupingBy(UserInteraction::bookId));
            byBook.forEach((bookId, interactions) -> {
                if (!readerBooks.contains(bookId)) {
                    raw.merge(bookId, weight * affinity(interactions), Double::sum);
                }
            });
        }

        double max = raw.values().stream().mapToDouble(Double::doubleValue).max().orElse(0.0);
        if (max <= 0.0) {
            return Map.of();
        }
        Map<UUID, Double> normalized = new HashMap<>();
        raw.forEach((bookId, value) -> normalized.put(bookId, value / max));
        return normalized;
    }

    static double cosineOverlap(Set<UUID> left, Set<UUID> right) {
        if (left.isEmpty() || right.isEmpty()) {
            return 0.0;
        }
        Set<UUID> intersection = new HashSet<>(left);
        intersection.retainAll(right);
        return intersection.size() / Math.sqrt((double) left.size() * right.size());
    }

    static double affinity(List<UserInteraction> interactions) {
        OptionalDouble meanRating = interactions.stream()
            .filter(UserInteraction::isRated)
            .mapToDouble(UserInteraction::rating)
            .average();
        return meanRating.isPresent() ? meanRating.getAsDouble() / MAX_RATING : UNRATED_AFFINITY;
    }
}
