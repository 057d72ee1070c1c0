package net.luminalib.application.library;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.Mockito.verify;

import java.time.Clock;
import java.time.ZoneOffset;
import java.util.List;
import net.luminalib.adapters.memory.InMemoryCatalogStore;
import net.luminalib.application.event.BookIngestedEvent;
import net.luminalib.domain.catalog.Book;
import net.luminalib.testutil.LibraryTestData;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.context.ApplicationEventPublisher;

@ExtendWith(MockitoExtension.class)
class BookIngestionServiceTest {

    @Mock
    private ApplicationEventPublisher eventPublisher;

    private InMemoryCatalogStore catalogStore;
    private BookIngestionService service;

    @BeforeEach
    void setUp() {
        catalogStore = new InMemoryCatalogStore();
        service = new BookIngestionService(catalogStore, eventPublisher,
            Clock.fixed(LibraryTestData.BASE_TIME, ZoneOffset.UTC));
    }

    @Test
    void should_RegisterBookAndAnnounceIt() {
        Book book = service.ingest(" Dune ", "Frank Herbert", "9780441013593",
            List.of("Science Fiction", "science fiction"), "dune.txt");

        assertThat(book.title()).isEqualTo("Dune");
        assertThat(book.genres()).containsExactly("Science Fiction");
        assertThat(book.consensusVersion()).isZero();
        assertThat(book.createdAt()).isEqualTo(LibraryTestData.BASE_TIME);
        assertThat(catalogStore.findById(book.id())).contains(book);
        verify(eventPublisher).publishEvent(new BookIngestedEvent(book.id()));
    }

    @Test
    void should_RequireTitleAndAuthor() {
        assertThatThrownBy(() -> service.ingest(" ", "Author", null, List.of(), null))
            .isInstanceOf(IllegalArgumentException.class)
            .hasMessageContaining("title");
        assertThatThrownBy(() -> service.ingest("Title", null, null, List.of(), null))
            .isInstanceOf(IllegalArgumentException.class)
            .hasMessageContaining("author");
    }
}
