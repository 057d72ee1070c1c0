package net.luminalib.controller.dto;

import java.util.UUID;

/**
 * Body of borrow and return calls; the caller identifies the reader explicitly.
 */
public record ReaderRequest(UUID userId) {
}
