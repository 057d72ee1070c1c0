package net.luminalib.domain.circulation;

/**
 * Raised when a borrow or return contradicts the active-borrow invariant.
 */
public class BorrowConflictException extends RuntimeException {

    public BorrowConflictException(String message) {
        super(message);
    }
}
