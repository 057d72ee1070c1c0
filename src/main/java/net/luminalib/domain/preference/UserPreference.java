package net.luminalib.domain.preference;

import java.util.Set;
import java.util.UUID;

/**
 * Explicit reader preferences used by content scoring.
 */
public record UserPreference(UUID userId, Set<String> favoriteGenres, Set<String> favoriteAuthors) {

    public UserPreference {
        favoriteGenres = favoriteGenres == null ? Set.of() : Set.copyOf(favoriteGenres);
        favoriteAuthors = favoriteAuthors == null ? Set.of() : Set.copyOf(favoriteAuthors);
    }

    public static UserPreference none(UUID userId) {
        return new UserPreference(userId, Set.of(), Set.of());
    }

    public boolean isEmpty() {
        return favoriteGenres.isEmpty() && favoriteAuthors.isEmpty();
    }
}
