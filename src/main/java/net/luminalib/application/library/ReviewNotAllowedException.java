package net.luminalib.application.library;

import java.util.UUID;

/**
 * Raised when a reader may not review a book: never borrowed it, or already reviewed it
 * under the one-review-per-reader policy.
 */
public class ReviewNotAllowedException extends RuntimeException {

    private final UUID userId;
    private final UUID bookId;

    public ReviewNotAllowedException(UUID userId, UUID bookId, String message) {
        super(message);
        this.userId = userId;
        this.bookId = bookId;
    }

    public UUID getUserId() {
        return userId;
    }

    public UUID getBookId() {
        return bookId;
    }
}
