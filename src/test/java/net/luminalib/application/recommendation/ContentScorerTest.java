package net.luminalib.application.recommendation;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.within;

import java.util.Set;
import java.util.UUID;
import net.luminalib.domain.catalog.Book;
import net.luminalib.domain.preference.UserPreference;
import net.luminalib.testutil.LibraryTestData;
import org.junit.jupiter.api.Test;

class ContentScorerTest {

    private final ContentScorer scorer = new ContentScorer();
    private final UUID userId = UUID.randomUUID();

    @Test
    void should_WeightGenreFractionAndAuthor() {
        UserPreference preference = new UserPreference(userId, Set.of("fantasy"), Set.of("Ursula K. Le Guin"));
        Book book = LibraryTestData.book("Earthsea", "Ursula K. Le Guin", "Fantasy", "Coming of Age");

        ContentScorer.ContentMatch match = scorer.score(preference, book);

        assertThat(match.score()).isCloseTo(0.7 * 0.5 + 0.3, within(1e-9));
        assertThat(match.authorMatch()).isTrue();
        assertThat(match.matchedGenres()).containsExactly("Fantasy");
    }

    @Test
    void should_ScoreOnlyAuthor_When_BookHasNoGenres() {
        UserPreference preference = new UserPreference(userId, Set.of("Mystery"), Set.of("agatha christie"));
        Book book = LibraryTestData.book("Poirot", "Agatha Christie");

        assertThat(scorer.score(preference, book).score()).isCloseTo(0.3, within(1e-9));
    }

    @Test
    void should_ScoreZero_When_PreferencesEmpty() {
        Book book = LibraryTestData.book("Dune", "Frank Herbert", "Science Fiction");

        assertThat(scorer.score(UserPreference.none(userId), book).score()).isZero();
    }

    @Test
    void should_ReachOne_When_AllGenresAndAuthorMatch() {
        UserPreference preference = new UserPreference(userId, Set.of("Horror", "Gothic"), Set.of("Mary Shelley"));
        Book book = LibraryTestData.book("Frankenstein", "Mary Shelley", "horror", "gothic");

        assertThat(scorer.score(preference, book).score()).isCloseTo(1.0, within(1e-9));
    }
}
