package net.luminalib.application.ai;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

import net.luminalib.adapters.memory.InMemoryCatalogStore;
import net.luminalib.adapters.memory.InMemoryReviewStore;
import net.luminalib.application.ai.ReviewConsensusService.ConsensusOutcome;
import net.luminalib.application.ai.ReviewConsensusService.ConsensusResult;
import net.luminalib.domain.catalog.Book;
import net.luminalib.support.prompt.RenderedPrompt;
import net.luminalib.support.retry.GuardedGenerationClient;
import net.luminalib.testutil.LibraryTestData;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.mockito.ArgumentCaptor;

class ReviewConsensusServiceTest {

    private InMemoryCatalogStore catalogStore;
    private InMemoryReviewStore reviewStore;
    private GuardedGenerationClient generationClient;
    private ReviewConsensusService service;

    @BeforeEach
    void setUp() {
        catalogStore = new InMemoryCatalogStore();
        reviewStore = new InMemoryReviewStore();
        generationClient = mock(GuardedGenerationClient.class);
        service = new ReviewConsensusService(catalogStore, reviewStore, generationClient);
    }

    @Test
    void should_CommitAndIncrementVersion_When_VersionUnchanged() {
        Book book = catalogStore.register(LibraryTestData.book("Dune", "Frank Herbert"));
        reviewStore.save(LibraryTestData.review(book.id(), 5, "Masterpiece"));
        when(generationClient.generate(any(RenderedPrompt.class))).thenReturn("Readers love it.");

        ConsensusResult result = service.regenerate(book.id());

        assertThat(result).isEqualTo(new ConsensusResult(ConsensusOutcome.COMMITTED, 1));
        Book stored = catalogStore.findById(book.id()).orElseThrow();
        assertThat(stored.reviewConsensus()).isEqualTo("Readers love it.");
        assertThat(stored.consensusVersion()).isEqualTo(1);
    }

    @Test
    void should_DiscardResult_When_VersionMovedDuringGeneration() {
        Book book = catalogStore.register(LibraryTestData.book("Dune", "Frank Herbert"));
        reviewStore.save(LibraryTestData.review(book.id(), 3, "Fine"));
        when(generationClient.generate(any(RenderedPrompt.class))).thenAnswer(invocation -> {
            // a concurrent run commits first
            catalogStore.compareAndSwapConsensus(book.id(), 0, "Newer consensus");
            return "Stale consensus";
        });

        ConsensusResult result = service.regenerate(book.id());

        assertThat(result.outcome()).isEqualTo(ConsensusOutcome.CONFLICT);
        Book stored = catalogStore.findById(book.id()).orElseThrow();
        assertThat(stored.reviewConsensus()).isEqualTo("Newer consensus");
        assertThat(stored.consensusVersion()).isEqualTo(1);
    }

    @Test
    void should_SkipProvider_When_BookHasNoReviews() {
        Book book = catalogStore.register(LibraryTestData.book("Dune", "Frank Herbert"));

        ConsensusResult result = service.regenerate(book.id());

        assertThat(result).isEqualTo(new ConsensusResult(ConsensusOutcome.NO_REVIEWS, 0));
        verify(generationClient, never()).generate(any(RenderedPrompt.class));
    }

    @Test
    void should_IncludePreviousConsensus_When_OneExists() {
        Book book = catalogStore.register(LibraryTestData.withConsensus(
            LibraryTestData.book("Dune", "Frank Herbert"), "Earlier readers were divided.", 4));
        reviewStore.save(LibraryTestData.review(book.id(), 4, "Great world building"));
        when(generationClient.generate(any(RenderedPrompt.class))).thenReturn("Now mostly positive.");

        ConsensusResult result = service.regenerate(book.id());

        ArgumentCaptor<RenderedPrompt> prompt = ArgumentCaptor.forClass(RenderedPrompt.class);
        verify(generationClient).generate(prompt.capture());
        assertThat(prompt.getValue().userMessage())
            .contains("Earlier readers were divided.")
            .contains("[Rating: 4/5]\nGreat world building");
        assertThat(result.version()).isEqualTo(5);
    }

    @Test
    void should_KeepStoredConsensus_When_GenerationFails() {
        Book book = catalogStore.register(LibraryTestData.withConsensus(
            LibraryTestData.book("Dune", "Frank Herbert"), "Kept", 2));
        reviewStore.save(LibraryTestData.review(book.id(), 1, "Dull"));
        when(generationClient.generate(any(RenderedPrompt.class))).thenThrow(GenerationFailedException.terminal(
            GenerationFailedException.ErrorCode.UPSTREAM_REJECTED, "HTTP 400"));

        assertThatThrownBy(() -> service.regenerate(book.id())).isInstanceOf(GenerationFailedException.class);
        Book stored = catalogStore.findById(book.id()).orElseThrow();
        assertThat(stored.reviewConsensus()).isEqualTo("Kept");
        assertThat(stored.consensusVersion()).isEqualTo(2);
    }
}
