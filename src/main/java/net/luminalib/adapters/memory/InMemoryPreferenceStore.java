package net.luminalib.adapters.memory;

import java.util.Optional;
import java.util.UUID;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;
import net.luminalib.domain.preference.PreferenceStore;
import net.luminalib.domain.preference.UserPreference;

public class InMemoryPreferenceStore implements PreferenceStore {

    private final ConcurrentMap<UUID, UserPreference> preferences = new ConcurrentHashMap<>();

    @Override
    public Optional<UserPreference> findByUserId(UUID userId) {
        return Optional.ofNullable(preferences.get(userId));
    }

    @Override
    public UserPreference upsert(UserPreference preference) {
        preferences.put(preference.userId(), preference);
        return preference;
    }
}
