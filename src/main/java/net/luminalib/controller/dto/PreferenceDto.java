package net.luminalib.controller.dto;

import java.util.List;
import java.util.UUID;
import net.luminalib.domain.preference.UserPreference;

public record PreferenceDto(UUID userId, List<String> favoriteGenres, List<String> favoriteAuthors) {

    public static PreferenceDto from(UserPreference preference) {
        return new PreferenceDto(
            preference.userId(),
            preference.favoriteGenres().stream().sorted(String.CASE_INSENSITIVE_ORDER).toList(),
            preference.favoriteAuthors().stream().sorted(String.CASE_INSENSITIVE_ORDER).toList()
        );
    }
}
