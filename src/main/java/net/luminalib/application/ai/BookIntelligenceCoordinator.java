package net.luminalib.application.ai;

import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import java.util.Locale;
import java.util.UUID;
import net.luminalib.domain.ai.BookAnalysis;
import net.luminalib.domain.ai.IntelligenceKind;
import net.luminalib.domain.catalog.Book;
import net.luminalib.domain.catalog.BookNotFoundException;
import net.luminalib.domain.catalog.CatalogStore;
import net.luminalib.domain.review.ReviewStats;
import net.luminalib.domain.review.ReviewStore;
import net.luminalib.support.ai.IntelligenceQueueCapacityExceededException;
import net.luminalib.support.ai.IntelligenceStateTracker;
import net.luminalib.support.ai.IntelligenceWorkQueue;
import net.luminalib.support.ai.SingleFlightGuard;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

/**
 * Schedules summary and consensus generation per book.
 *
 * <p>Triggers return immediately. Work for one (book, kind) pair never runs twice in
 * parallel: triggers arriving during a run coalesce into a single follow-up run. A
 * consensus run that loses its compare-and-swap is retried once inside the same flight.
 * Failures are logged, counted and exposed through {@link IntelligenceStateTracker}; they
 * never reach the caller.</p>
 */
@Service
public class BookIntelligenceCoordinator {

    private static final Logger log = LoggerFactory.getLogger(BookIntelligenceCoordinator.class);
    private static final String RUNS_METRIC = "luminalib.intelligence.runs";
    private static final int SUMMARY_PRIORITY = 0;
    private static final int CONSENSUS_PRIORITY = 1;

    private final IntelligenceWorkQueue workQueue;
    private final BookSummaryService summaryService;
    private final ReviewConsensusService consensusService;
    private final IntelligenceStateTracker stateTracker;
    private final CatalogStore catalogStore;
    private final ReviewStore reviewStore;
    private final MeterRegistry meterRegistry;
    private final SingleFlightGuard<FlightKey> flights = new SingleFlightGuard<>();

    public BookIntelligenceCoordinator(IntelligenceWorkQueue workQueue,
                                       BookSummaryService summaryService,
                                       ReviewConsensusService consensusService,
                                       IntelligenceStateTracker stateTracker,
                                       CatalogStore catalogStore,
                                       ReviewStore reviewStore,
                                       MeterRegistry meterRegistry) {
        this.workQueue = workQueue;
        this.summaryService = summaryService;
        this.consensusService = consensusService;
        this.stateTracker = stateTracker;
        this.catalogStore = catalogStore;
        this.reviewStore = reviewStore;
        this.meterRegistry = meterRegistry;
    }

    /**
     * Requests a summary for the book. No-op at run time when a summary already exists.
     *
     * @throws BookNotFoundException when the book is unknown
     */
    public TriggerDisposition triggerSummary(UUID bookId) {
        requireBook(bookId);
        return trigger(new FlightKey(bookId, IntelligenceKind.SUMMARY));
    }

    /**
     * Requests a consensus regeneration for the book.
     *
     * @throws BookNotFoundException when the book is unknown
     */
    public TriggerDisposition triggerConsensus(UUID bookId) {
        requireBook(bookId);
        return trigger(new FlightKey(bookId, IntelligenceKind.CONSENSUS));
    }

    /**
     * Returns the derived fields, rating statistics and intelligence states of a book.
     */
    public BookAnalysis analysis(UUID bookId) {
        Book book = requireBook(bookId);
        ReviewStats stats = reviewStore.statsForBook(bookId);
        return new BookAnalysis(
            bookId,
            book.summary(),
            book.reviewConsensus(),
            book.consensusVersion(),
            stats.totalReviews(),
            stats.averageRating(),
            stateTracker.status(bookId, IntelligenceKind.SUMMARY),
            stateTracker.status(bookId, IntelligenceKind.CONSENSUS)
        );
    }

    public IntelligenceWorkQueue.QueueSnapshot queueSnapshot() {
        return workQueue.snapshot();
    }

    private TriggerDisposition trigger(FlightKey key) {
        if (flights.tryAcquire(key) == SingleFlightGuard.Admission.COALESCED) {
            log.debug("{} for book {} already in flight; rerun requested", key.kind(), key.bookId());
            return TriggerDisposition.COALESCED;
        }

        stateTracker.markInFlight(key.bookId(), key.kind());
        int priority = key.kind() == IntelligenceKind.CONSENSUS ? CONSENSUS_PRIORITY : SUMMARY_PRIORITY;
        while (true) {
            try {
                workQueue.enqueue(priority, () -> {
                    runFlight(key);
                    return null;
                }).whenComplete((ignored, throwable) -> {
                    if (throwable != null) {
                        log.error("{} flight for book {} terminated unexpectedly", key.kind(), key.bookId(), throwable);
                    }
                });
                return TriggerDisposition.SCHEDULED;
            } catch (IntelligenceQueueCapacityExceededException queueOverflowException) {
                stateTracker.markFailed(key.bookId(), key.kind(), queueOverflowException.getMessage());
                if (flights.release(key)) {
                    // a trigger coalesced into this flight before the enqueue failed; it is owed a run
                    log.debug("Retrying enqueue of {} for book {} on behalf of a coalesced trigger",
                        key.kind(), key.bookId());
                    stateTracker.markInFlight(key.bookId(), key.kind());
                    continue;
                }
                count(key.kind(), "rejected");
                log.warn("{} trigger for book {} dropped because the queue cap was reached (pending={}, max={})",
                    key.kind(),
                    key.bookId(),
                    queueOverflowException.currentPending(),
                    queueOverflowException.maxPending());
                return TriggerDisposition.REJECTED;
            }
        }
    }

    private void runFlight(FlightKey key) {
        try {
            boolean conflictRetryUsed = false;
            while (true) {
                boolean conflict = runOnce(key);
                if (conflict && !conflictRetryUsed) {
                    conflictRetryUsed = true;
                    log.info("Re-running consensus for book {} after a version conflict", key.bookId());
                    continue;
                }
                if (!flights.release(key)) {
                    return;
                }
                log.debug("Running coalesced {} rerun for book {}", key.kind(), key.bookId());
            }
        } catch (RuntimeException | Error fatal) {
            // the flight must not outlive its worker
            flights.abandon(key);
            stateTracker.markFailed(key.bookId(), key.kind(), fatal.toString());
            count(key.kind(), "failed");
            throw fatal;
        }
    }

    /**
     * @return true when a consensus run lost its compare-and-swap
     */
    private boolean runOnce(FlightKey key) {
        UUID bookId = key.bookId();
        stateTracker.markInFlight(bookId, key.kind());
        try {
            if (key.kind() == IntelligenceKind.SUMMARY) {
                BookSummaryService.SummaryOutcome outcome = summaryService.generateIfAbsent(bookId);
                stateTracker.markReady(bookId, IntelligenceKind.SUMMARY);
                count(IntelligenceKind.SUMMARY, outcome.name());
                return false;
            }

            ReviewConsensusService.ConsensusResult result = consensusService.regenerate(bookId);
            count(IntelligenceKind.CONSENSUS, result.outcome().name());
            switch (result.outcome()) {
                case COMMITTED -> stateTracker.markReady(bookId, IntelligenceKind.CONSENSUS);
                case NO_REVIEWS -> stateTracker.reset(bookId, IntelligenceKind.CONSENSUS);
                case CONFLICT -> {
                    // a newer consensus was committed by another run
                    stateTracker.markReady(bookId, IntelligenceKind.CONSENSUS);
                    return true;
                }
            }
            return false;
        } catch (GenerationFailedException generationFailure) {
            stateTracker.markFailed(bookId, key.kind(), generationFailure.getMessage());
            count(key.kind(), "failed");
            log.error("{} generation failed for book {} (code={}, retryable={})",
                key.kind(), bookId, generationFailure.errorCode(), generationFailure.isRetryable(), generationFailure);
            return false;
        } catch (RuntimeException unexpectedFailure) {
            stateTracker.markFailed(bookId, key.kind(), unexpectedFailure.getMessage());
            count(key.kind(), "failed");
            log.error("{} run failed for book {}", key.kind(), bookId, unexpectedFailure);
            return false;
        }
    }

    private Book requireBook(UUID bookId) {
        if (bookId == null) {
            throw new IllegalArgumentException("bookId is required");
        }
        return catalogStore.findById(bookId).orElseThrow(() -> new BookNotFoundException(bookId));
    }

    private void count(IntelligenceKind kind, String outcome) {
        Counter.builder(RUNS_METRIC)
            .tag("kind", kind.name().toLowerCase(Locale.ROOT))
            .tag("outcome", outcome.toLowerCase(Locale.ROOT))
            .register(meterRegistry)
            .increment();
    }

    public enum TriggerDisposition {
        SCHEDULED,
        COALESCED,
        REJECTED
    }

    private record FlightKey(UUID bookId, IntelligenceKind kind) {
    }
}
