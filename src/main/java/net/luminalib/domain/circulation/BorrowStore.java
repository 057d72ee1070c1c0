package net.luminalib.domain.circulation;

import java.time.Instant;
import java.util.Optional;
import java.util.UUID;

/**
 * Port to borrow records. At most one active borrow exists per (user, book).
 */
public interface BorrowStore {

    Optional<Borrow> findActive(UUID userId, UUID bookId);

    /**
     * Returns true when the user has ever borrowed the book, active or returned.
     */
    boolean hasBorrowed(UUID userId, UUID bookId);

    Borrow save(Borrow borrow);

    /**
     * Closes an active borrow.
     *
     * @return the closed borrow, empty when it was not active
     */
    Optional<Borrow> markReturned(UUID borrowId, Instant returnedAt);
}
