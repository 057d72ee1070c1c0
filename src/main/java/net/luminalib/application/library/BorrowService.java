package net.luminalib.application.library;

import java.time.Clock;
import java.time.Instant;
import java.util.UUID;
import net.luminalib.domain.catalog.BookNotFoundException;
import net.luminalib.domain.catalog.CatalogStore;
import net.luminalib.domain.circulation.Borrow;
import net.luminalib.domain.circulation.BorrowConflictException;
import net.luminalib.domain.circulation.BorrowStore;
import net.luminalib.domain.interaction.InteractionLog;
import net.luminalib.domain.interaction.InteractionType;
import net.luminalib.domain.interaction.UserInteraction;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Service;

/**
 * Borrow and return workflows. Each successful call appends to the interaction log.
 */
@Service
public class BorrowService {

    private static final Logger log = LoggerFactory.getLogger(BorrowService.class);

    private final CatalogStore catalogStore;
    private final BorrowStore borrowStore;
    private final InteractionLog interactionLog;
    private final Clock clock;

    @Autowired
    public BorrowService(CatalogStore catalogStore, BorrowStore borrowStore, InteractionLog interactionLog) {
        this(catalogStore, borrowStore, interactionLog, Clock.systemUTC());
    }

    BorrowService(CatalogStore catalogStore, BorrowStore borrowStore, InteractionLog interactionLog, Clock clock) {
        this.catalogStore = catalogStore;
        this.borrowStore = borrowStore;
        this.interactionLog = interactionLog;
        this.clock = clock;
    }

    /**
     * @throws BookNotFoundException when the book is unknown
     * @throws BorrowConflictException when the reader already holds an active borrow
     */
    public Borrow borrow(UUID userId, UUID bookId) {
        requireIds(userId, bookId);
        catalogStore.findById(bookId).orElseThrow(() -> new BookNotFoundException(bookId));
        if (borrowStore.findActive(userId, bookId).isPresent()) {
            throw new BorrowConflictException("Book %s is already borrowed by user %s".formatted(bookId, userId));
        }

        Instant now = clock.instant();
        Borrow saved = borrowStore.save(new Borrow(UUID.randomUUID(), userId, bookId, now, null));
        interactionLog.record(new UserInteraction(UUID.randomUUID(), userId, bookId, InteractionType.BORROW, null, now));
        log.info("User {} borrowed book {}", userId, bookId);
        return saved;
    }

    /**
     * @throws BorrowConflictException when the reader has no active borrow of the book
     */
    public Borrow returnBook(UUID userId, UUID bookId) {
        requireIds(userId, bookId);
        Borrow active = borrowStore.findActive(userId, bookId)
            .orElseThrow(() -> new BorrowConflictException(
                "No active borrow of book %s for user %s".formatted(bookId, userId)));

        Instant now = clock.instant();
        Borrow returned = borrowStore.markReturned(active.id(), now)
            .orElseThrow(() -> new BorrowConflictException("Borrow %s was already returned".formatted(active.id())));
        interactionLog.record(new UserInteraction(UUID.randomUUID(), userId, bookId, InteractionType.RETURN, null, now));
        log.info("User {} returned book {}", userId, bookId);
        return returned;
    }

    static void requireIds(UUID userId, UUID bookId) {
        if (userId == null) {
            throw new IllegalArgumentException("userId is required");
        }
        if (bookId == null) {
            throw new IllegalArgumentException("bookId is required");
        }
    }
}
