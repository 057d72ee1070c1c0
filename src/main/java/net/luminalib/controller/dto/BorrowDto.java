package net.luminalib.controller.dto;

import jakarta.annotation.Nullable;
import java.time.Instant;
import java.util.UUID;
import net.luminalib.domain.circulation.Borrow;

public record BorrowDto(UUID id, UUID userId, UUID bookId, Instant borrowedAt, @Nullable Instant returnedAt) {

    public static BorrowDto from(Borrow borrow) {
        return new BorrowDto(borrow.id(), borrow.userId(), borrow.bookId(), borrow.borrowedAt(), borrow.returnedAt());
    }
}
