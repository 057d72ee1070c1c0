package net.luminalib.adapters.persistence;

import java.sql.ResultSet;
import java.sql.SQLException;
import java.sql.Timestamp;
import java.time.Instant;
import java.util.List;
import java.util.Optional;
import java.util.UUID;
import net.luminalib.domain.circulation.Borrow;
import net.luminalib.domain.circulation.BorrowConflictException;
import net.luminalib.domain.circulation.BorrowStore;
import org.springframework.dao.DuplicateKeyException;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.transaction.annotation.Transactional;

/**
 * Postgres adapter for the {@code borrows} table. A partial unique index keeps at most
 * one open borrow per reader and book.
 */
public class BorrowRepository implements BorrowStore {

    private static final String SELECT_COLUMNS = "SELECT id, user_id, book_id, borrowed_at, returned_at FROM borrows ";

    private final JdbcTemplate jdbcTemplate;

    public BorrowRepository(JdbcTemplate jdbcTemplate) {
        this.jdbcTemplate = jdbcTemplate;
    }

    @Override
    @Transactional(readOnly = true)
    public Optional<Borrow> findActive(UUID userId, UUID bookId) {
        List<Borrow> rows = jdbcTemplate.query(
            SELECT_COLUMNS + "WHERE user_id = ? AND book_id = ? AND returned_at IS NULL",
            BorrowRepository::mapBorrow,
            userId,
            bookId
        );
        return rows.isEmpty() ? Optional.empty() : Optional.of(rows.get(0));
    }

    @Override
    @Transactional(readOnly = true)
    public boolean hasBorrowed(UUID userId, UUID bookId) {
        Boolean exists = jdbcTemplate.queryForObject(
            "SELECT EXISTS (SELECT 1 FROM borrows WHERE user_id = ? AND book_id = ?)",
            Boolean.class,
            userId,
            bookId
        );
        return Boolean.TRUE.equals(exists);
    }

    @Override
    @Transactional
    public Borrow save(Borrow borrow) {
        try {
            jdbcTemplate.update(
                "INSERT INTO borrows (id, user_id, book_id, borrowed_at, returned_at) VALUES (?, ?, ?, ?, ?)",
                borrow.id(),
                borrow.userId(),
                borrow.bookId(),
                Timestamp.from(borrow.borrowedAt()),
                borrow.returnedAt() != null ? Timestamp.from(borrow.returnedAt()) : null
            );
        } catch (DuplicateKeyException duplicateActiveBorrow) {
            throw new BorrowConflictException(
                "Book %s is already borrowed by user %s".formatted(borrow.bookId(), borrow.userId()));
        }
        return borrow;
    }

    @Override
    @Transactional
    public Optional<Borrow> markReturned(UUID borrowId, Instant returnedAt) {
        int updated = jdbcTemplate.update(
            "UPDATE borrows SET returned_at = ? WHERE id = ? AND returned_at IS NULL",
            Timestamp.from(returnedAt),
            borrowId
        );
        if (updated == 0) {
            return Optional.empty();
        }
        List<Borrow> rows = jdbcTemplate.query(SELECT_COLUMNS + "WHERE id = ?", BorrowRepository::mapBorrow, borrowId);
        return rows.isEmpty() ? Optional.empty() : Optional.of(rows.get(0));
    }

    private static Borrow mapBorrow(ResultSet rs, int rowNum) throws SQLException {
        Timestamp returnedAt = rs.getTimestamp("returned_at");
        return new Borrow(
            rs.getObject("id", UUID.class),
            rs.getObject("user_id", UUID.class),
            rs.getObject("book_id", UUID.class),
            rs.getTimestamp("borrowed_at").toInstant(),
            returnedAt != null ? returnedAt.toInstant() : null
        );
    }
}
