package net.luminalib.application.recommendation;

import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;
import java.util.HashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.UUID;
import java.util.stream.Collectors;
import lombok.extern.slf4j.Slf4j;
import net.luminalib.config.IntelligenceProperties;
import net.luminalib.domain.catalog.Book;
import net.luminalib.domain.catalog.CatalogStore;
import net.luminalib.domain.interaction.InteractionLog;
import net.luminalib.domain.interaction.UserInteraction;
import net.luminalib.domain.preference.PreferenceStore;
import net.luminalib.domain.preference.UserPreference;
import net.luminalib.domain.recommendation.RecommendationResult;
import org.springframework.dao.DataAccessException;
import org.springframework.stereotype.Service;
import reactor.core.publisher.Mono;
import reactor.core.scheduler.Schedulers;

/**
 * Blends collaborative and content signals into a ranked recommendation list.
 *
 * <p>{@code score = alpha * collaborative + (1 - alpha) * content}. Books the reader has
 * already interacted with are never recommended. When nothing scores above zero (no
 * history and no preferences, typically) the list falls back to library-wide popularity
 * and then recency, so a non-empty catalog never yields an empty answer.</p>
 */
@Service
@Slf4j
public class HybridRecommender {

    static final int DEFAULT_LIMIT = 10;
    static final int MAX_LIMIT = 50;
    static final String COLLABORATIVE_REASON = "Similar readers also enjoyed this";

    private final CatalogStore catalogStore;
    private final InteractionLog interactionLog;
    private final PreferenceStore preferenceStore;
    private final ContentScorer contentScorer;
    private final CollaborativeScorer collaborativeScorer;
    private final PopularityScorer popularityScorer;
    private final double alpha;
    private final MeterRegistry meterRegistry;
    private final Timer recommendationTimer;

    public HybridRecommender(CatalogStore catalogStore,
                             InteractionLog interactionLog,
                             PreferenceStore preferenceStore,
                             ContentScorer contentScorer,
                             CollaborativeScorer collaborativeScorer,
                             PopularityScorer popularityScorer,
                             IntelligenceProperties properties,
                             MeterRegistry meterRegistry) {
        this.catalogStore = catalogStore;
        this.interactionLog = interactionLog;
        this.preferenceStore = preferenceStore;
        this.contentScorer = contentScorer;
        this.collaborativeScorer = collaborativeScorer;
        this.popularityScorer = popularityScorer;
        this.alpha = properties.getRecommendationAlpha();
        this.meterRegistry = meterRegistry;
        this.recommendationTimer = meterRegistry.timer("luminalib.recommendations");
    }

    /**
     * Produces up to {@code limit} recommendations for a reader.
     *
     * @param userId reader to recommend for
     * @param limit maximum results; non-positive means {@value #DEFAULT_LIMIT}, values above
     *              {@value #MAX_LIMIT} are capped
     * @return Mono emitting the ranked list, empty only when there are no candidates; errors
     *         with {@link RecommendationUnavailableException} when data access fails
     */
    public Mono<List<RecommendationResult>> recommend(UUID userId, int limit) {
        if (userId == null) {
            return Mono.error(new IllegalArgumentException("userId is required"));
        }
        int effectiveLimit = effectiveLimit(limit);
        return Mono.defer(() -> {
                Timer.Sample sample = Timer.start(meterRegistry);
                return Mono.fromCallable(() -> rank(userId, effectiveLimit))
                    .subscribeOn(Schedulers.boundedElastic())
                    .doFinally(signal -> sample.stop(recommendationTimer));
            })
            .onErrorMap(DataAccessException.class, dataAccessException -> {
                log.error("Recommendation data access failed for user {}", userId, dataAccessException);
                return new RecommendationUnavailableException(
                    "Recommendations are temporarily unavailable", dataAccessException);
            });
    }

    static int effectiveLimit(int requested) {
        if (requested <= 0) {
            return DEFAULT_LIMIT;
        }
        return Math.min(requested, MAX_LIMIT);
    }

    List<RecommendationResult> rank(UUID userId, int limit) {
        List<UserInteraction> history = interactionLog.findByUserId(userId);
        Set<UUID> readerBooks = history.stream().map(UserInteraction::bookId).collect(Collectors.toSet());
        UserPreference preference = preferenceStore.findByUserId(userId).orElseGet(() -> UserPreference.none(userId));

        List<Book> candidates = catalogStore.findAll().stream()
            .filter(book -> !readerBooks.contains(book.id()))
            .toList();
        if (candidates.isEmpty()) {
            log.debug("No recommendation candidates for user {}", userId);
            return List.of();
        }

        Map<UUID, Double> collaborative = readerBooks.isEmpty()
            ? Map.of()
            : collaborativeScorer.score(readerBooks, neighbourHistories(userId, readerBooks));

        List<RecommendationResult> ranked = candidates.stream()
            .map(book -> blend(book, preference, collaborative.getOrDefault(book.id(), 0.0)))
            .filter(candidate -> candidate.score() > 0.0)
            .sorted(ScoredCandidate.RANKING)
            .limit(limit)
            .map(ScoredCandidate::toResult)
            .toList();
        if (!ranked.isEmpty()) {
            log.debug("Ranked {} personalized recommendations for user {} (history={}, alpha={})",
                ranked.size(), userId, readerBooks.size(), alpha);
            return ranked;
        }

        log.debug("Falling back to popularity ranking for user {}", userId);
        return popularityScorer.rank(candidates, interactionsByBook(candidates)).stream()
            .limit(limit)
            .map(ScoredCandidate::toResult)
            .toList();
    }

    private ScoredCandidate blend(Book book, UserPreference preference, double collaborativeScore) {
        ContentScorer.ContentMatch match = contentScorer.score(preference, book);
        double collaborativePart = alpha * collaborativeScore;
        double contentPart = (1.0 - alpha) * match.score();
        return new ScoredCandidate(book, collaborativePart + contentPart,
            reason(book, match, collaborativePart, contentPart));
    }

    private static String reason(Book book, ContentScorer.ContentMatch match, double collaborativePart, double contentPart) {
        if (collaborativePart > 0.0 && collaborativePart >= contentPart) {
            return COLLABORATIVE_REASON;
        }
        if (match.authorMatch() && (ContentScorer.AUTHOR_WEIGHT >= match.genreContribution() || match.matchedGenres().isEmpty())) {
            return "Matches your favorite author " + book.author();
        }
        if (!match.matchedGenres().isEmpty()) {
            return "Matches your favorite genres: " + String.join(", ", match.matchedGenres());
        }
        return COLLABORATIVE_REASON;
    }

    private Map<UUID, List<UserInteraction>> neighbourHistories(UUID userId, Set<UUID> readerBooks) {
        Set<UUID> neighbours = new LinkedHashSet<>();
        for (UUID bookId : readerBooks) {
            for (UserInteraction interaction : interactionLog.findByBookId(bookId)) {
                if (!userId.equals(interaction.userId())) {
                    neighbours.add(interaction.userId());
                }
            }
        }
        Map<UUID, List<UserInteraction>> histories = new HashMap<>();
        for (UUID neighbour : neighbours) {
            histories.put(neighbour, interactionLog.findByUserId(neighbour));
        }
        return histories;
    }

    private Map<UUID, List<UserInteraction>> interactionsByBook(List<Book> books) {
        Map<UUID, List<UserInteraction>> byBook = new HashMap<>();
        for (Book book : books) {
            byBook.put(book.id(), interactionLog.findByBookId(book.id()));
        }
        return byBook;
    }
}
