package net.luminalib.domain.catalog;

import java.util.List;
import java.util.Optional;
import java.util.UUID;

/**
 * Port to the book catalog owned by the storage collaborator.
 */
public interface CatalogStore {

    Optional<Book> findById(UUID bookId);

    /**
     * Returns every catalog entry. Recommendation candidates are drawn from this list.
     */
    List<Book> findAll();

    Book register(Book book);

    /**
     * Writes the summary only when the book has none yet.
     *
     * @return true when this call stored the summary
     */
    boolean updateSummaryIfAbsent(UUID bookId, String summary);

    /**
     * Atomically replaces the review consensus and increments {@code consensus_version}
     * when the stored version still equals {@code expectedVersion}.
     *
     * @return true when the swap was applied
     */
    boolean compareAndSwapConsensus(UUID bookId, int expectedVersion, String consensus);
}
