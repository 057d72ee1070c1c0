package net.luminalib.adapters.persistence;

import java.util.Optional;
import java.util.UUID;
import net.luminalib.domain.preference.PreferenceStore;
import net.luminalib.domain.preference.UserPreference;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.transaction.annotation.Transactional;
import tools.jackson.databind.ObjectMapper;

/**
 * Postgres adapter for {@code user_preferences}; one row per reader.
 */
public class PreferenceRepository implements PreferenceStore {

    private final JdbcTemplate jdbcTemplate;
    private final JsonColumns jsonColumns;

    public PreferenceRepository(JdbcTemplate jdbcTemplate, ObjectMapper objectMapper) {
        this.jdbcTemplate = jdbcTemplate;
        this.jsonColumns = new JsonColumns(objectMapper);
    }

    @Override
    @Transactional(readOnly = true)
    public Optional<UserPreference> findByUserId(UUID userId) {
        return jdbcTemplate.query(
            "SELECT favorite_genres, favorite_authors FROM user_preferences WHERE user_id = ?",
            rs -> rs.next()
                ? Optional.of(new UserPreference(
                    userId,
                    jsonColumns.readSet(rs.getString("favorite_genres")),
                    jsonColumns.readSet(rs.getString("favorite_authors"))))
                : Optional.<UserPreference>empty(),
            userId
        );
    }

    @Override
    @Transactional
    public UserPreference upsert(UserPreference preference) {
        jdbcTemplate.update(
            """
            INSERT INTO user_preferences (user_id, favorite_genres, favorite_authors, updated_at)
            VALUES (?, CAST(? AS jsonb), CAST(? AS jsonb), NOW())
            ON CONFLICT (user_id) DO UPDATE
              SET favorite_genres = EXCLUDED.favorite_genres,
                  favorite_authors = EXCLUDED.favorite_authors,
                  updated_at = NOW()
            """,
            preference.userId(),
            jsonColumns.write(preference.favoriteGenres()),
            jsonColumns.write(preference.favoriteAuthors())
        );
        return preference;
    }
}
