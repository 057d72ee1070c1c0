package net.luminalib.controller.dto;

import jakarta.annotation.Nullable;
import java.time.Instant;
import java.util.UUID;
import net.luminalib.domain.ai.BookAnalysis;
import net.luminalib.domain.ai.IntelligenceStatus;

/**
 * API projection of the analysis view of a book.
 */
public record BookAnalysisDto(
    UUID bookId,
    @Nullable String summary,
    @Nullable String reviewConsensus,
    int consensusVersion,
    long totalReviews,
    @Nullable Double averageRating,
    StatusDto summaryStatus,
    StatusDto consensusStatus
) {

    public static BookAnalysisDto from(BookAnalysis analysis) {
        return new BookAnalysisDto(
            analysis.bookId(),
            analysis.summary(),
            analysis.reviewConsensus(),
            analysis.consensusVersion(),
            analysis.totalReviews(),
            analysis.averageRating() != null ? Math.round(analysis.averageRating() * 100.0) / 100.0 : null,
            StatusDto.from(analysis.summaryStatus()),
            StatusDto.from(analysis.consensusStatus())
        );
    }

    public record StatusDto(String state, @Nullable Instant updatedAt, @Nullable String lastError) {

        static StatusDto from(IntelligenceStatus status) {
            return new StatusDto(status.state().name(), status.updatedAt(), status.lastError());
        }
    }
}
