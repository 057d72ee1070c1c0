package net.luminalib.application.library;

import java.time.Clock;
import java.util.Collection;
import java.util.UUID;
import net.luminalib.application.event.BookIngestedEvent;
import net.luminalib.domain.catalog.Book;
import net.luminalib.domain.catalog.CatalogStore;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.context.ApplicationEventPublisher;
import org.springframework.stereotype.Service;
import org.springframework.util.StringUtils;

/**
 * Registers an uploaded book in the catalog and announces it for summary generation.
 */
@Service
public class BookIngestionService {

    private static final Logger log = LoggerFactory.getLogger(BookIngestionService.class);

    private final CatalogStore catalogStore;
    private final ApplicationEventPublisher eventPublisher;
    private final Clock clock;

    @Autowired
    public BookIngestionService(CatalogStore catalogStore, ApplicationEventPublisher eventPublisher) {
        this(catalogStore, eventPublisher, Clock.systemUTC());
    }

    BookIngestionService(CatalogStore catalogStore, ApplicationEventPublisher eventPublisher, Clock clock) {
        this.catalogStore = catalogStore;
        this.eventPublisher = eventPublisher;
        this.clock = clock;
    }

    public Book ingest(String title, String author, String isbn, Collection<String> genres, String contentPath) {
        if (!StringUtils.hasText(title)) {
            throw new IllegalArgumentException("title is required");
        }
        if (!StringUtils.hasText(author)) {
            throw new IllegalArgumentException("author is required");
        }
        Book book = catalogStore.register(new Book(
            UUID.randomUUID(),
            title.trim(),
            author.trim(),
            StringUtils.hasText(isbn) ? isbn.trim() : null,
            PreferenceService.clean(genres),
            null,
            null,
            0,
            clock.instant(),
            StringUtils.hasText(contentPath) ? contentPath.trim() : null
        ));
        log.info("Registered book {} '{}' by {}", book.id(), book.title(), book.author());
        eventPublisher.publishEvent(new BookIngestedEvent(book.id()));
        return book;
    }
}
