package net.luminalib.controller.dto;

import jakarta.annotation.Nullable;
import java.time.Instant;
import java.util.List;
import java.util.UUID;
import net.luminalib.domain.catalog.Book;

public record BookDto(
    UUID id,
    String title,
    String author,
    @Nullable String isbn,
    List<String> genres,
    @Nullable String summary,
    @Nullable String reviewConsensus,
    int consensusVersion,
    Instant createdAt
) {

    public static BookDto from(Book book) {
        return new BookDto(
            book.id(),
            book.title(),
            book.author(),
            book.isbn(),
            book.genres().stream().sorted(String.CASE_INSENSITIVE_ORDER).toList(),
            book.summary(),
            book.reviewConsensus(),
            book.consensusVersion(),
            book.createdAt()
        );
    }
}
