package net.luminalib.adapters.persistence;

import java.sql.ResultSet;
import java.sql.SQLException;
import java.sql.Timestamp;
import java.util.List;
import java.util.UUID;
import net.luminalib.domain.review.Review;
import net.luminalib.domain.review.ReviewStats;
import net.luminalib.domain.review.ReviewStore;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.transaction.annotation.Transactional;

/**
 * Postgres adapter for the {@code reviews} table.
 */
public class ReviewRepository implements ReviewStore {

    private final JdbcTemplate jdbcTemplate;

    public ReviewRepository(JdbcTemplate jdbcTemplate) {
        this.jdbcTemplate = jdbcTemplate;
    }

    @Override
    @Transactional(readOnly = true)
    public List<Review> findByBookId(UUID bookId) {
        if (bookId == null) {
            throw new IllegalArgumentException("bookId is required");
        }
        return jdbcTemplate.query(
            """
            SELECT id, user_id, book_id, rating, review_text, created_at
            FROM reviews
            WHERE book_id = ?
            ORDER BY created_at, id
            """,
            ReviewRepository::mapReview,
            bookId
        );
    }

    @Override
    @Transactional
    public Review save(Review review) {
        jdbcTemplate.update(
            "INSERT INTO reviews (id, user_id, book_id, rating, review_text, created_at) VALUES (?, ?, ?, ?, ?, ?)",
            review.id(),
            review.userId(),
            review.bookId(),
            review.rating(),
            review.text(),
            Timestamp.from(review.createdAt())
        );
        return review;
    }

    @Override
    @Transactional(readOnly = true)
    public boolean existsByUserAndBook(UUID userId, UUID bookId) {
        Boolean exists = jdbcTemplate.queryForObject(
            "SELECT EXISTS (SELECT 1 FROM reviews WHERE user_id = ? AND book_id = ?)",
            Boolean.class,
            userId,
            bookId
        );
        return Boolean.TRUE.equals(exists);
    }

    @Override
    @Transactional(readOnly = true)
    public ReviewStats statsForBook(UUID bookId) {
        return jdbcTemplate.query(
            "SELECT COUNT(*) AS total, AVG(rating) AS average FROM reviews WHERE book_id = ?",
            rs -> {
                if (!rs.next()) {
                    return ReviewStats.empty();
                }
                long total = rs.getLong("total");
                double average = rs.getDouble("average");
                return total == 0 ? ReviewStats.empty() : new ReviewStats(total, average);
            },
            bookId
        );
    }

    private static Review mapReview(ResultSet rs, int rowNum) throws SQLException {
        return new Review(
            rs.getObject("id", UUID.class),
            rs.getObject("user_id", UUID.class),
            rs.getObject("book_id", UUID.class),
            rs.getInt("rating"),
            rs.getString("review_text"),
            rs.getTimestamp("created_at").toInstant()
        );
    }
}
