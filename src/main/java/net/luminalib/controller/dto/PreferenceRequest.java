package net.luminalib.controller.dto;

import java.util.List;

public record PreferenceRequest(List<String> favoriteGenres, List<String> favoriteAuthors) {
}
