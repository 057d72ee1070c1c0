package net.luminalib.application.ai;

import java.util.List;
import java.util.UUID;
import net.luminalib.domain.catalog.Book;
import net.luminalib.domain.catalog.BookNotFoundException;
import net.luminalib.domain.catalog.CatalogStore;
import net.luminalib.domain.review.Review;
import net.luminalib.domain.review.ReviewStore;
import net.luminalib.support.prompt.PromptTemplates;
import net.luminalib.support.prompt.RenderedPrompt;
import net.luminalib.support.retry.GuardedGenerationClient;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

/**
 * Regenerates the review consensus of a book with optimistic versioning.
 *
 * <p>The consensus version is read before the provider call and the result is only
 * committed when that version is still current. No lock is held while the model runs.</p>
 */
@Service
public class ReviewConsensusService {

    private static final Logger log = LoggerFactory.getLogger(ReviewConsensusService.class);

    private final CatalogStore catalogStore;
    private final ReviewStore reviewStore;
    private final GuardedGenerationClient generationClient;

    public ReviewConsensusService(CatalogStore catalogStore,
                                  ReviewStore reviewStore,
                                  GuardedGenerationClient generationClient) {
        this.catalogStore = catalogStore;
        this.reviewStore = reviewStore;
        this.generationClient = generationClient;
    }

    /**
     * Runs one regeneration.
     *
     * @throws BookNotFoundException when the book is unknown
     * @throws GenerationFailedException when generation failed after the retry budget;
     *         the stored consensus is left untouched
     */
    public ConsensusResult regenerate(UUID bookId) {
        Book snapshot = catalogStore.findById(bookId).orElseThrow(() -> new BookNotFoundException(bookId));
        int observedVersion = snapshot.consensusVersion();

        List<Review> reviews = reviewStore.findByBookId(bookId);
        if (reviews.isEmpty()) {
            log.debug("No reviews for book {}; consensus left unchanged", bookId);
            return new ConsensusResult(ConsensusOutcome.NO_REVIEWS, observedVersion);
        }

        RenderedPrompt prompt = PromptTemplates.renderReviewConsensus(reviews, snapshot.reviewConsensus());
        log.info("Generating consensus for book {} from {} reviews at version {} (fingerprint={})",
            bookId, reviews.size(), observedVersion, prompt.fingerprint());

        String consensus = generationClient.generate(prompt);
        if (catalogStore.compareAndSwapConsensus(bookId, observedVersion, consensus)) {
            int committedVersion = observedVersion + 1;
            log.info("Committed consensus for book {} at version {}", bookId, committedVersion);
            return new ConsensusResult(ConsensusOutcome.COMMITTED, committedVersion);
        }
        log.info("Consensus for book {} moved past version {} during generation; discarding result",
            bookId, observedVersion);
        return new ConsensusResult(ConsensusOutcome.CONFLICT, observedVersion);
    }

    public enum ConsensusOutcome {
        COMMITTED,
        CONFLICT,
        NO_REVIEWS
    }

    /**
     * @param version committed version for {@link ConsensusOutcome#COMMITTED}, otherwise the
     *                version observed before generation
     */
    public record ConsensusResult(ConsensusOutcome outcome, int version) {
    }
}
