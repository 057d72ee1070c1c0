package net.luminalib.adapters.memory;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Optional;
import java.util.UUID;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;
import net.luminalib.domain.catalog.Book;
import net.luminalib.domain.catalog.CatalogStore;

/**
 * Non-persistent catalog used when no datasource is configured.
 *
 * <p>Conditional writes go through {@link ConcurrentHashMap#computeIfPresent}, which is
 * atomic per book like the single-statement updates of the Postgres adapter.</p>
 */
public class InMemoryCatalogStore implements CatalogStore {

    private static final Comparator<Book> CATALOG_ORDER = Comparator
        .comparing(Book::createdAt, Comparator.nullsFirst(Comparator.naturalOrder()))
        .thenComparing(book -> book.id().toString());

    private final ConcurrentMap<UUID, Book> books = new ConcurrentHashMap<>();

    @Override
    public Optional<Book> findById(UUID bookId) {
        if (bookId == null) {
            throw new IllegalArgumentException("bookId is required");
        }
        return Optional.ofNullable(books.get(bookId));
    }

    @Override
    public List<Book> findAll() {
        List<Book> all = new ArrayList<>(books.values());
        all.sort(CATALOG_ORDER);
        return all;
    }

    @Override
    public Book register(Book book) {
        if (book == null) {
            throw new IllegalArgumentException("book is required");
        }
        if (books.putIfAbsent(book.id(), book) != null) {
            throw new IllegalStateException("Book already registered: " + book.id());
        }
        return book;
    }

    @Override
    public boolean updateSummaryIfAbsent(UUID bookId, String summary) {
        boolean[] updated = new boolean[1];
        books.computeIfPresent(bookId, (id, current) -> {
            if (current.hasSummary()) {
                return current;
            }
            updated[0] = true;
            return new Book(id, current.title(), current.author(), current.isbn(), current.genres(), summary,
                current.reviewConsensus(), current.consensusVersion(), current.createdAt(), current.contentPath());
        });
        return updated[0];
    }

    @Override
    public boolean compareAndSwapConsensus(UUID bookId, int expectedVersion, String consensus) {
        boolean[] swapped = new boolean[1];
        books.computeIfPresent(bookId, (id, current) -> {
            if (current.consensusVersion() != expectedVersion) {
                return current;
            }
            swapped[0] = true;
            return new Book(id, current.title(), current.author(), current.isbn(), current.genres(),
                current.summary(), consensus, expectedVersion + 1, current.createdAt(), current.contentPath());
        });
        return swapped[0];
    }
}
