package net.luminalib.domain.ai;

import jakarta.annotation.Nullable;
import java.util.UUID;

/**
 * Read model combining the derived fields of a book with its rating statistics.
 */
public record BookAnalysis(
    UUID bookId,
    @Nullable String summary,
    @Nullable String reviewConsensus,
    int consensusVersion,
    long totalReviews,
    @Nullable Double averageRating,
    IntelligenceStatus summaryStatus,
    IntelligenceStatus consensusStatus
) {
}
