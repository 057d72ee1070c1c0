package net.luminalib.controller.dto;

import java.util.UUID;

/**
 * Acknowledgement of an intelligence trigger. {@code disposition} is one of
 * {@code SCHEDULED}, {@code COALESCED} or {@code REJECTED}.
 */
public record IntelligenceTriggerDto(UUID bookId, String kind, String disposition) {
}
