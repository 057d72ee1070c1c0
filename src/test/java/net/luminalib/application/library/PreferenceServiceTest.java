package net.luminalib.application.library;

import static org.assertj.core.api.Assertions.assertThat;

import java.util.Arrays;
import java.util.List;
import java.util.UUID;
import net.luminalib.adapters.memory.InMemoryPreferenceStore;
import net.luminalib.domain.preference.UserPreference;
import org.junit.jupiter.api.Test;

class PreferenceServiceTest {

    private final PreferenceService service = new PreferenceService(new InMemoryPreferenceStore());

    @Test
    void should_ReturnEmptyPreferences_When_NoneStored() {
        UUID userId = UUID.randomUUID();

        assertThat(service.preferencesFor(userId).isEmpty()).isTrue();
    }

    @Test
    void should_CleanAndReplacePreferences() {
        UUID userId = UUID.randomUUID();
        service.updatePreferences(userId, List.of("Poetry"), List.of());

        UserPreference saved = service.updatePreferences(userId,
            Arrays.asList(" Fantasy ", "fantasy", "", null, "History"), List.of("Ursula K. Le Guin"));

        assertThat(saved.favoriteGenres()).containsExactlyInAnyOrder("Fantasy", "History");
        assertThat(service.preferencesFor(userId)).isEqualTo(saved);
    }

    @Test
    void should_TreatNullListsAsEmpty() {
        assertThat(PreferenceService.clean(null)).isEmpty();
    }
}
