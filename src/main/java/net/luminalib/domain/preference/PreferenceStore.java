package net.luminalib.domain.preference;

import java.util.Optional;
import java.util.UUID;

/**
 * Port to per-user explicit preferences.
 */
public interface PreferenceStore {

    Optional<UserPreference> findByUserId(UUID userId);

    UserPreference upsert(UserPreference preference);
}
