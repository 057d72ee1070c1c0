package net.luminalib.adapters.persistence;

import java.sql.ResultSet;
import java.sql.SQLException;
import java.sql.Timestamp;
import java.util.List;
import java.util.UUID;
import net.luminalib.domain.interaction.InteractionLog;
import net.luminalib.domain.interaction.InteractionType;
import net.luminalib.domain.interaction.UserInteraction;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.transaction.annotation.Transactional;

/**
 * Append-only Postgres adapter for {@code user_interactions}.
 */
public class InteractionLogRepository implements InteractionLog {

    private static final String SELECT_COLUMNS =
        "SELECT id, user_id, book_id, interaction_type, rating, created_at FROM user_interactions ";

    private final JdbcTemplate jdbcTemplate;

    public InteractionLogRepository(JdbcTemplate jdbcTemplate) {
        this.jdbcTemplate = jdbcTemplate;
    }

    @Override
    @Transactional(readOnly = true)
    public List<UserInteraction> findByUserId(UUID userId) {
        return jdbcTemplate.query(
            SELECT_COLUMNS + "WHERE user_id = ? ORDER BY created_at, id",
            InteractionLogRepository::mapInteraction,
            userId
        );
    }

    @Override
    @Transactional(readOnly = true)
    public List<UserInteraction> findByBookId(UUID bookId) {
        return jdbcTemplate.query(
            SELECT_COLUMNS + "WHERE book_id = ? ORDER BY created_at, id",
            InteractionLogRepository::mapInteraction,
            bookId
        );
    }

    @Override
    @Transactional
    public void record(UserInteraction interaction) {
        jdbcTemplate.update(
            """
            INSERT INTO user_interactions (id, user_id, book_id, interaction_type, rating, created_at)
            VALUES (?, ?, ?, ?, ?, ?)
            """,
            interaction.id(),
            interaction.userId(),
            interaction.bookId(),
            interaction.type().name(),
            interaction.rating(),
            Timestamp.from(interaction.createdAt())
        );
    }

    private static UserInteraction mapInteraction(ResultSet rs, int rowNum) throws SQLException {
        double rating = rs.getDouble("rating");
        boolean rated = !rs.wasNull();
        return new UserInteraction(
            rs.getObject("id", UUID.class),
            rs.getObject("user_id", UUID.class),
            rs.getObject("book_id", UUID.class),
            InteractionType.valueOf(rs.getString("interaction_type")),
            rated ? rating : null,
            rs.getTimestamp("created_at").toInstant()
        );
    }
}
