package net.luminalib.application.event;

import java.util.UUID;

/**
 * Published after a book and its uploaded content have been stored.
 */
public record BookIngestedEvent(UUID bookId) {
}
