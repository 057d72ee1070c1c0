package net.luminalib.domain.recommendation;

import java.util.UUID;

/**
 * One ranked recommendation with a human-readable explanation.
 */
public record RecommendationResult(UUID bookId, double score, String reason) {
}
