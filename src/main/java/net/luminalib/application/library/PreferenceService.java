package net.luminalib.application.library;

import java.util.Collection;
import java.util.LinkedHashSet;
import java.util.Locale;
import java.util.Set;
import java.util.UUID;
import net.luminalib.domain.preference.PreferenceStore;
import net.luminalib.domain.preference.UserPreference;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;
import org.springframework.util.StringUtils;

/**
 * Upserts explicit reader preferences.
 */
@Service
public class PreferenceService {

    private static final Logger log = LoggerFactory.getLogger(PreferenceService.class);

    private final PreferenceStore preferenceStore;

    public PreferenceService(PreferenceStore preferenceStore) {
        this.preferenceStore = preferenceStore;
    }

    public UserPreference preferencesFor(UUID userId) {
        return preferenceStore.findByUserId(userId).orElseGet(() -> UserPreference.none(userId));
    }

    /**
     * Replaces the reader's favorite genres and authors. Blank entries are dropped and
     * duplicates collapse, ignoring case.
     */
    public UserPreference updatePreferences(UUID userId, Collection<String> genres, Collection<String> authors) {
        if (userId == null) {
            throw new IllegalArgumentException("userId is required");
        }
        UserPreference saved = preferenceStore.upsert(new UserPreference(userId, clean(genres), clean(authors)));
        log.info("Updated preferences for user {} ({} genres, {} authors)",
            userId, saved.favoriteGenres().size(), saved.favoriteAuthors().size());
        return saved;
    }

    static Set<String> clean(Collection<String> values) {
        Set<String> seen = new LinkedHashSet<>();
        Set<String> cleaned = new LinkedHashSet<>();
        if (values == null) {
            return cleaned;
        }
        for (String value : values) {
            if (!StringUtils.hasText(value)) {
                continue;
            }
            String trimmed = value.trim();
            if (seen.add(trimmed.toLowerCase(Locale.ROOT))) {
                cleaned.add(trimmed);
            }
        }
        return cleaned;
    }
}
