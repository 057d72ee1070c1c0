package net.luminalib.adapters.memory;

import java.time.Instant;
import java.util.Optional;
import java.util.UUID;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;
import net.luminalib.domain.circulation.Borrow;
import net.luminalib.domain.circulation.BorrowConflictException;
import net.luminalib.domain.circulation.BorrowStore;

public class InMemoryBorrowStore implements BorrowStore {

    private final ConcurrentMap<UUID, Borrow> borrows = new ConcurrentHashMap<>();

    @Override
    public Optional<Borrow> findActive(UUID userId, UUID bookId) {
        return borrows.values().stream()
            .filter(borrow -> borrow.isActive() && borrow.userId().equals(userId) && borrow.bookId().equals(bookId))
            .findFirst();
    }

    @Override
    public boolean hasBorrowed(UUID userId, UUID bookId) {
        return borrows.values().stream()
            .anyMatch(borrow -> borrow.userId().equals(userId) && borrow.bookId().equals(bookId));
    }

    /**
     * @throws BorrowConflictException when an active borrow of the same book already exists
     */
    @Override
    public synchronized Borrow save(Borrow borrow) {
        if (borrow.isActive() && findActive(borrow.userId(), borrow.bookId()).isPresent()) {
            throw new BorrowConflictException(
                "Book %s is already borrowed by user %s".formatted(borrow.bookId(), borrow.userId()));
        }
        borrows.put(borrow.id(), borrow);
        return borrow;
    }

    @Override
    public Optional<Borrow> markReturned(UUID borrowId, Instant returnedAt) {
        Borrow[] closed = new Borrow[1];
        borrows.computeIfPresent(borrowId, (id, current) -> {
            if (!current.isActive()) {
                return current;
            }
            closed[0] = current.returned(returnedAt);
            return closed[0];
        });
        return Optional.ofNullable(closed[0]);
    }
}
