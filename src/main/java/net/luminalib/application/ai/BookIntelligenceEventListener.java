package net.luminalib.application.ai;

import net.luminalib.application.event.BookIngestedEvent;
import net.luminalib.application.event.ReviewActivityEvent;
import net.luminalib.domain.catalog.BookNotFoundException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.context.event.EventListener;
import org.springframework.stereotype.Component;

/**
 * Turns catalog and review activity into intelligence triggers.
 */
@Component
public class BookIntelligenceEventListener {

    private static final Logger log = LoggerFactory.getLogger(BookIntelligenceEventListener.class);

    private final BookIntelligenceCoordinator coordinator;

    public BookIntelligenceEventListener(BookIntelligenceCoordinator coordinator) {
        this.coordinator = coordinator;
    }

    @EventListener
    public void handleBookIngested(BookIngestedEvent event) {
        if (event == null || event.bookId() == null) {
            log.warn("Skipping summary trigger: missing bookId in BookIngestedEvent");
            return;
        }
        try {
            coordinator.triggerSummary(event.bookId());
        } catch (BookNotFoundException missingBook) {
            log.warn("Skipping summary trigger for unknown book {}", event.bookId());
        }
    }

    @EventListener
    public void handleReviewActivity(ReviewActivityEvent event) {
        if (event == null || event.bookId() == null) {
            log.warn("Skipping consensus trigger: missing bookId in ReviewActivityEvent");
            return;
        }
        try {
            coordinator.triggerConsensus(event.bookId());
        } catch (BookNotFoundException missingBook) {
            log.warn("Skipping consensus trigger for unknown book {}", event.bookId());
        }
    }
}
