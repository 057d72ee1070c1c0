package net.luminalib.application.event;

import java.util.UUID;

/**
 * Published after a review has been stored for a book.
 */
public record ReviewActivityEvent(UUID bookId, UUID userId, int rating) {
}
