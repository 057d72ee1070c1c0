package net.luminalib.domain.catalog;

import java.util.Optional;

/**
 * Read-side port to the uploaded book text held by the storage collaborator.
 */
@FunctionalInterface
public interface BookContentReader {

    /**
     * Loads the extracted text of the uploaded book file.
     *
     * @param book catalog entry whose content is requested
     * @return text when the storage layer holds readable content for the book
     */
    Optional<String> readText(Book book);
}
