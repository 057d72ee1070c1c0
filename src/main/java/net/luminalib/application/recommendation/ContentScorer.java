package net.luminalib.application.recommendation;

import java.util.List;
import java.util.Locale;
import java.util.Set;
import java.util.stream.Collectors;
import net.luminalib.domain.catalog.Book;
import net.luminalib.domain.preference.UserPreference;
import org.springframework.stereotype.Component;

/**
 * Content-based scoring of a candidate book against explicit reader preferences.
 *
 * <p>{@code score = 0.7 * matchingGenres / bookGenres + 0.3 * authorMatch}, compared
 * case-insensitively. Books without genre tags contribute only through the author term.</p>
 */
@Component
public class ContentScorer {

    static final double GENRE_WEIGHT = 0.7;
    static final double AUTHOR_WEIGHT = 0.3;

    public ContentMatch score(UserPreference preference, Book book) {
        if (preference == null || preference.isEmpty()) {
            return ContentMatch.NONE;
        }

        Set<String> favoriteGenres = normalize(preference.favoriteGenres());
        List<String> matchedGenres = book.genres().stream()
            .filter(genre -> favoriteGenres.contains(normalize(genre)))
            .sorted(String.CASE_INSENSITIVE_ORDER)
            .toList();
        double genreFraction = book.genres().isEmpty()
            ? 0.0
            : (double) matchedGenres.size() / book.genres().size();

        boolean authorMatch = book.author() != null
            && normalize(preference.favoriteAuthors()).contains(normalize(book.author()));

        double score = GENRE_WEIGHT * genreFraction + (authorMatch ? AUTHOR_WEIGHT : 0.0);
        return new ContentMatch(score, GENRE_WEIGHT * genreFraction, authorMatch, matchedGenres);
    }

    private static Set<String> normalize(Set<String> values) {
        return values.stream().map(ContentScorer::normalize).collect(Collectors.toSet());
    }

    private static String normalize(String value) {
        return value == null ? "" : value.trim().toLowerCase(Locale.ROOT);
    }

    /**
     * @param score content score in [0, 1]
     * @param genreContribution weighted genre part of the score
     * @param authorMatch whether the book's author is a favorite
     * @param matchedGenres the book's genres that matched, sorted
     */
    public record ContentMatch(double score, double genreContribution, boolean authorMatch, List<String> matchedGenres) {

        static final ContentMatch NONE = new ContentMatch(0.0, 0.0, false, List.of());

        public ContentMatch {
            matchedGenres = List.copyOf(matchedGenres);
        }
    }
}
