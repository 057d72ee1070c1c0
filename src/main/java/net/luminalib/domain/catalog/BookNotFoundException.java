package net.luminalib.domain.catalog;

import java.util.UUID;

/**
 * Raised when an operation references a book the catalog does not contain.
 */
public class BookNotFoundException extends RuntimeException {

    private final UUID bookId;

    public BookNotFoundException(UUID bookId) {
        super("Book not found: " + bookId);
        this.bookId = bookId;
    }

    public UUID getBookId() {
        return bookId;
    }
}
