package net.luminalib.application.recommendation;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.within;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.when;

import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import java.util.List;
import java.util.Set;
import java.util.UUID;
import net.luminalib.adapters.memory.InMemoryCatalogStore;
import net.luminalib.adapters.memory.InMemoryInteractionLog;
import net.luminalib.adapters.memory.InMemoryPreferenceStore;
import net.luminalib.config.IntelligenceProperties;
import net.luminalib.domain.catalog.Book;
import net.luminalib.domain.interaction.InteractionLog;
import net.luminalib.domain.preference.UserPreference;
import net.luminalib.domain.recommendation.RecommendationResult;
import net.luminalib.testutil.LibraryTestData;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.dao.DataAccessResourceFailureException;
import reactor.test.StepVerifier;

class HybridRecommenderTest {

    private InMemoryCatalogStore catalogStore;
    private InMemoryInteractionLog interactionLog;
    private InMemoryPreferenceStore preferenceStore;
    private SimpleMeterRegistry meterRegistry;

    private final UUID reader = UUID.randomUUID();
    private final UUID neighbour = UUID.randomUUID();

    private Book dune;
    private Book foundation;
    private Book hyperion;
    private Book emma;

    @BeforeEach
    void setUp() {
        catalogStore = new InMemoryCatalogStore();
        interactionLog = new InMemoryInteractionLog();
        preferenceStore = new InMemoryPreferenceStore();
        meterRegistry = new SimpleMeterRegistry();

        dune = catalogStore.register(LibraryTestData.book("Dune", "Frank Herbert", "Science Fiction"));
        foundation = catalogStore.register(LibraryTestData.book("Foundation", "Isaac Asimov", "Science Fiction"));
        hyperion = catalogStore.register(LibraryTestData.book("Hyperion", "Dan Simmons", "Science Fiction"));
        emma = catalogStore.register(LibraryTestData.book("Emma", "Jane Austen", "Classics", "Romance"));
    }

    @Test
    void should_FallBackToPopularity_When_ReaderIsNew() {
        interactionLog.record(LibraryTestData.borrow(neighbour, hyperion.id()));

        StepVerifier.create(recommender(0.6).recommend(reader, 10))
            .assertNext(results -> {
                assertThat(results).hasSize(4);
                assertThat(results.get(0).bookId()).isEqualTo(hyperion.id());
                assertThat(results.get(0).reason()).isEqualTo(PopularityScorer.POPULAR_REASON);
            })
            .verifyComplete();
    }

    @Test
    void should_ExcludeBooksReaderAlreadyInteractedWith() {
        interactionLog.record(LibraryTestData.borrow(reader, dune.id()));
        interactionLog.record(LibraryTestData.borrow(neighbour, dune.id()));
        interactionLog.record(LibraryTestData.rated(neighbour, foundation.id(), 5.0));

        List<RecommendationResult> results = recommender(0.6).rank(reader, 10);

        assertThat(results).extracting(RecommendationResult::bookId).doesNotContain(dune.id());
        assertThat(results.get(0).bookId()).isEqualTo(foundation.id());
        assertThat(results.get(0).reason()).isEqualTo(HybridRecommender.COLLABORATIVE_REASON);
    }

    @Test
    void should_UseOnlyContent_When_AlphaIsZero() {
        interactionLog.record(LibraryTestData.borrow(reader, dune.id()));
        interactionLog.record(LibraryTestData.borrow(neighbour, dune.id()));
        interactionLog.record(LibraryTestData.rated(neighbour, foundation.id(), 5.0));
        preferenceStore.upsert(new UserPreference(reader, Set.of("Classics"), Set.of()));

        List<RecommendationResult> results = recommender(0.0).rank(reader, 10);

        assertThat(results).extracting(RecommendationResult::bookId).containsExactly(emma.id());
        assertThat(results.get(0).score()).isCloseTo(0.35, within(1e-9));
        assertThat(results.get(0).reason()).isEqualTo("Matches your favorite genres: Classics");
    }

    @Test
    void should_UseOnlyCollaborative_When_AlphaIsOne() {
        interactionLog.record(LibraryTestData.borrow(reader, dune.id()));
        interactionLog.record(LibraryTestData.borrow(neighbour, dune.id()));
        interactionLog.record(LibraryTestData.rated(neighbour, foundation.id(), 5.0));
        preferenceStore.upsert(new UserPreference(reader, Set.of("Classics"), Set.of()));

        List<RecommendationResult> results = recommender(1.0).rank(reader, 10);

        assertThat(results).extracting(RecommendationResult::bookId).containsExactly(foundation.id());
        assertThat(results.get(0).score()).isEqualTo(1.0);
    }

    @Test
    void should_ExplainAuthorMatch_When_AuthorDominates() {
        preferenceStore.upsert(new UserPreference(reader, Set.of(), Set.of("Dan Simmons")));

        List<RecommendationResult> results = recommender(0.6).rank(reader, 10);

        assertThat(results).hasSize(1);
        assertThat(results.get(0).reason()).isEqualTo("Matches your favorite author Dan Simmons");
    }

    @Test
    void should_ReturnIdenticalRanking_When_StateUnchanged() {
        preferenceStore.upsert(new UserPreference(reader, Set.of("Science Fiction"), Set.of()));
        HybridRecommender recommender = recommender(0.6);

        List<RecommendationResult> first = recommender.rank(reader, 10);
        List<RecommendationResult> second = recommender.rank(reader, 10);

        assertThat(first).isEqualTo(second);
        // equal scores break ties by book id
        List<String> ids = first.stream().map(result -> result.bookId().toString()).toList();
        assertThat(ids).isSorted();
    }

    @Test
    void should_RespectLimit() {
        StepVerifier.create(recommender(0.6).recommend(reader, 2))
            .assertNext(results -> assertThat(results).hasSize(2))
            .verifyComplete();
        assertThat(HybridRecommender.effectiveLimit(0)).isEqualTo(HybridRecommender.DEFAULT_LIMIT);
        assertThat(HybridRecommender.effectiveLimit(-3)).isEqualTo(HybridRecommender.DEFAULT_LIMIT);
        assertThat(HybridRecommender.effectiveLimit(500)).isEqualTo(HybridRecommender.MAX_LIMIT);
    }

    @Test
    void should_ReturnEmpty_When_ReaderTouchedEveryBook() {
        for (Book book : List.of(dune, foundation, hyperion, emma)) {
            interactionLog.record(LibraryTestData.borrow(reader, book.id()));
        }

        StepVerifier.create(recommender(0.6).recommend(reader, 10))
            .assertNext(results -> assertThat(results).isEmpty())
            .verifyComplete();
    }

    @Test
    void should_SignalUnavailable_When_StoreFails() {
        InteractionLog failingLog = mock(InteractionLog.class);
        when(failingLog.findByUserId(any())).thenThrow(new DataAccessResourceFailureException("connection refused"));
        HybridRecommender recommender = new HybridRecommender(catalogStore, failingLog, preferenceStore,
            new ContentScorer(), new CollaborativeScorer(), new PopularityScorer(), properties(0.6), meterRegistry);

        StepVerifier.create(recommender.recommend(reader, 10))
            .expectError(RecommendationUnavailableException.class)
            .verify();
    }

    @Test
    void should_RejectMissingUserId() {
        StepVerifier.create(recommender(0.6).recommend(null, 10))
            .expectError(IllegalArgumentException.class)
            .verify();
    }

    private HybridRecommender recommender(double alpha) {
        return new HybridRecommender(catalogStore, interactionLog, preferenceStore,
            new ContentScorer(), new CollaborativeScorer(), new PopularityScorer(), properties(alpha), meterRegistry);
    }

    private static IntelligenceProperties properties(double alpha) {
        IntelligenceProperties properties = new IntelligenceProperties();
        properties.setRecommendationAlpha(alpha);
        return properties;
    }
}
