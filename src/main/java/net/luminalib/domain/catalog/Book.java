package net.luminalib.domain.catalog;

import jakarta.annotation.Nullable;
import java.time.Instant;
import java.util.Set;
import java.util.UUID;

/**
 * Catalog entry for a single book.
 *
 * <p>{@code summary}, {@code reviewConsensus} and {@code consensusVersion} are derived
 * fields written only by the book intelligence pipeline.</p>
 */
public record Book(
    UUID id,
    String title,
    String author,
    @Nullable String isbn,
    Set<String> genres,
    @Nullable String summary,
    @Nullable String reviewConsensus,
    int consensusVersion,
    Instant createdAt,
    @Nullable String contentPath
) {

    public Book {
        if (id == null) {
            throw new IllegalArgumentException("id is required");
        }
        genres = genres == null ? Set.of() : Set.copyOf(genres);
        if (consensusVersion < 0) {
            throw new IllegalArgumentException("consensusVersion must be non-negative");
        }
    }

    public boolean hasSummary() {
        return summary != null && !summary.isBlank();
    }

    public boolean hasReviewConsensus() {
        return reviewConsensus != null && !reviewConsensus.isBlank();
    }
}
