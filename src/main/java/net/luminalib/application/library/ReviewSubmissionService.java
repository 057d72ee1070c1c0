package net.luminalib.application.library;

import java.time.Clock;
import java.time.Instant;
import java.util.UUID;
import net.luminalib.application.event.ReviewActivityEvent;
import net.luminalib.config.IntelligenceProperties;
import net.luminalib.config.IntelligenceProperties.ReviewPolicy;
import net.luminalib.domain.catalog.BookNotFoundException;
import net.luminalib.domain.catalog.CatalogStore;
import net.luminalib.domain.circulation.BorrowStore;
import net.luminalib.domain.interaction.InteractionLog;
import net.luminalib.domain.interaction.InteractionType;
import net.luminalib.domain.interaction.UserInteraction;
import net.luminalib.domain.review.Review;
import net.luminalib.domain.review.ReviewStore;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.context.ApplicationEventPublisher;
import org.springframework.stereotype.Service;

/**
 * Accepts reader reviews and announces them so the review consensus can be refreshed.
 *
 * <p>A reader must have borrowed the book at least once. Whether a second review of the
 * same book is accepted depends on {@link ReviewPolicy}.</p>
 */
@Service
public class ReviewSubmissionService {

    private static final Logger log = LoggerFactory.getLogger(ReviewSubmissionService.class);

    private final CatalogStore catalogStore;
    private final BorrowStore borrowStore;
    private final ReviewStore reviewStore;
    private final InteractionLog interactionLog;
    private final ApplicationEventPublisher eventPublisher;
    private final ReviewPolicy reviewPolicy;
    private final Clock clock;

    @Autowired
    public ReviewSubmissionService(CatalogStore catalogStore,
                                   BorrowStore borrowStore,
                                   ReviewStore reviewStore,
                                   InteractionLog interactionLog,
                                   ApplicationEventPublisher eventPublisher,
                                   IntelligenceProperties properties) {
        this(catalogStore, borrowStore, reviewStore, interactionLog, eventPublisher,
            properties.getReviewPolicy(), Clock.systemUTC());
    }

    ReviewSubmissionService(CatalogStore catalogStore,
                            BorrowStore borrowStore,
                            ReviewStore reviewStore,
                            InteractionLog interactionLog,
                            ApplicationEventPublisher eventPublisher,
                            ReviewPolicy reviewPolicy,
                            Clock clock) {
        this.catalogStore = catalogStore;
        this.borrowStore = borrowStore;
        this.reviewStore = reviewStore;
        this.interactionLog = interactionLog;
        this.eventPublisher = eventPublisher;
        this.reviewPolicy = reviewPolicy;
        this.clock = clock;
    }

    /**
     * @throws IllegalArgumentException when the rating is outside 1..5
     * @throws BookNotFoundException when the book is unknown
     * @throws ReviewNotAllowedException when the reader never borrowed the book, or already
     *         reviewed it under {@link ReviewPolicy#ONE_PER_READER}
     */
    public Review submitReview(UUID userId, UUID bookId, int rating, String text) {
        BorrowService.requireIds(userId, bookId);
        if (rating < Review.MIN_RATING || rating > Review.MAX_RATING) {
            throw new IllegalArgumentException("rating must be between 1 and 5 but was " + rating);
        }
        catalogStore.findById(bookId).orElseThrow(() -> new BookNotFoundException(bookId));

        if (!borrowStore.hasBorrowed(userId, bookId)) {
            throw new ReviewNotAllowedException(userId, bookId, "You must borrow this book before reviewing it");
        }
        if (reviewPolicy == ReviewPolicy.ONE_PER_READER && reviewStore.existsByUserAndBook(userId, bookId)) {
            throw new ReviewNotAllowedException(userId, bookId, "You have already reviewed this book");
        }

        Instant now = clock.instant();
        Review saved = reviewStore.save(new Review(UUID.randomUUID(), userId, bookId, rating, text, now));
        interactionLog.record(new UserInteraction(
            UUID.randomUUID(), userId, bookId, InteractionType.REVIEW, (double) rating, now));
        log.info("User {} reviewed book {} (rating={})", userId, bookId, rating);

        eventPublisher.publishEvent(new ReviewActivityEvent(bookId, userId, rating));
        return saved;
    }
}
