package net.luminalib.adapters.persistence;

import java.sql.ResultSet;
import java.sql.SQLException;
import java.sql.Timestamp;
import java.time.Instant;
import java.util.List;
import java.util.Optional;
import java.util.UUID;
import net.luminalib.domain.catalog.Book;
import net.luminalib.domain.catalog.CatalogStore;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.transaction.annotation.Transactional;
import tools.jackson.databind.ObjectMapper;

/**
 * Postgres adapter for the {@code books} table.
 *
 * <p>Derived fields are written with conditional single-statement updates: the summary
 * only fills an empty column and the consensus swap is guarded by the expected version.</p>
 */
public class BookCatalogRepository implements CatalogStore {

    private static final Logger log = LoggerFactory.getLogger(BookCatalogRepository.class);

    private static final String SELECT_COLUMNS = """
        SELECT id, title, author, isbn, genres, summary, review_consensus, consensus_version,
               created_at, content_path
        FROM books
        """;

    private final JdbcTemplate jdbcTemplate;
    private final JsonColumns jsonColumns;

    public BookCatalogRepository(JdbcTemplate jdbcTemplate, ObjectMapper objectMapper) {
        this.jdbcTemplate = jdbcTemplate;
        this.jsonColumns = new JsonColumns(objectMapper);
    }

    @Override
    @Transactional(readOnly = true)
    public Optional<Book> findById(UUID bookId) {
        if (bookId == null) {
            throw new IllegalArgumentException("bookId is required");
        }
        List<Book> rows = jdbcTemplate.query(SELECT_COLUMNS + "WHERE id = ?", this::mapBook, bookId);
        return rows.isEmpty() ? Optional.empty() : Optional.of(rows.get(0));
    }

    @Override
    @Transactional(readOnly = true)
    public List<Book> findAll() {
        return jdbcTemplate.query(SELECT_COLUMNS + "ORDER BY created_at, id", this::mapBook);
    }

    @Override
    @Transactional
    public Book register(Book book) {
        if (book == null) {
            throw new IllegalArgumentException("book is required");
        }
        jdbcTemplate.update(
            """
            INSERT INTO books
              (id, title, author, isbn, genres, summary, review_consensus, consensus_version, created_at, content_path)
            VALUES (?, ?, ?, ?, CAST(? AS jsonb), ?, ?, ?, ?, ?)
            """,
            book.id(),
            book.title(),
            book.author(),
            book.isbn(),
            jsonColumns.write(book.genres()),
            book.summary(),
            book.reviewConsensus(),
            book.consensusVersion(),
            Timestamp.from(book.createdAt() != null ? book.createdAt() : Instant.now()),
            book.contentPath()
        );
        return findById(book.id())
            .orElseThrow(() -> new IllegalStateException("Inserted book could not be reloaded: " + book.id()));
    }

    @Override
    @Transactional
    public boolean updateSummaryIfAbsent(UUID bookId, String summary) {
        if (bookId == null) {
            throw new IllegalArgumentException("bookId is required");
        }
        int updated = jdbcTemplate.update(
            "UPDATE books SET summary = ? WHERE id = ? AND (summary IS NULL OR summary = '')",
            summary,
            bookId
        );
        return updated == 1;
    }

    @Override
    @Transactional
    public boolean compareAndSwapConsensus(UUID bookId, int expectedVersion, String consensus) {
        if (bookId == null) {
            throw new IllegalArgumentException("bookId is required");
        }
        int updated = jdbcTemplate.update(
            """
            UPDATE books
            SET review_consensus = ?, consensus_version = consensus_version + 1
            WHERE id = ? AND consensus_version = ?
            """,
            consensus,
            bookId,
            expectedVersion
        );
        if (updated == 0) {
            log.debug("Consensus swap rejected for book {} at expected version {}", bookId, expectedVersion);
        }
        return updated == 1;
    }

    private Book mapBook(ResultSet rs, int rowNum) throws SQLException {
        Timestamp createdAt = rs.getTimestamp("created_at");
        return new Book(
            rs.getObject("id", UUID.class),
            rs.getString("title"),
            rs.getString("author"),
            rs.getString("isbn"),
            jsonColumns.readSet(rs.getString("genres")),
            rs.getString("summary"),
            rs.getString("review_consensus"),
            rs.getInt("consensus_version"),
            createdAt != null ? createdAt.toInstant() : Instant.EPOCH,
            rs.getString("content_path")
        );
    }
}
