package net.luminalib.application.ai;

import java.util.UUID;
import net.luminalib.domain.catalog.Book;
import net.luminalib.domain.catalog.BookContentReader;
import net.luminalib.domain.catalog.BookNotFoundException;
import net.luminalib.domain.catalog.CatalogStore;
import net.luminalib.support.prompt.PromptTemplates;
import net.luminalib.support.prompt.RenderedPrompt;
import net.luminalib.support.retry.GuardedGenerationClient;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;
import org.springframework.util.StringUtils;

/**
 * Generates the one-time book summary from the uploaded text.
 *
 * <p>Idempotent: a book that already has a summary is never sent to the provider, and the
 * write only lands when the summary column is still empty.</p>
 */
@Service
public class BookSummaryService {

    private static final Logger log = LoggerFactory.getLogger(BookSummaryService.class);

    private final CatalogStore catalogStore;
    private final BookContentReader contentReader;
    private final GuardedGenerationClient generationClient;

    public BookSummaryService(CatalogStore catalogStore,
                              BookContentReader contentReader,
                              GuardedGenerationClient generationClient) {
        this.catalogStore = catalogStore;
        this.contentReader = contentReader;
        this.generationClient = generationClient;
    }

    /**
     * Generates and stores a summary unless one already exists.
     *
     * @throws BookNotFoundException when the book is unknown
     * @throws GenerationFailedException when the content is missing or generation failed
     */
    public SummaryOutcome generateIfAbsent(UUID bookId) {
        Book book = catalogStore.findById(bookId).orElseThrow(() -> new BookNotFoundException(bookId));
        if (book.hasSummary()) {
            log.debug("Summary already present for book {}; skipping generation", bookId);
            return SummaryOutcome.ALREADY_PRESENT;
        }

        String content = contentReader.readText(book)
            .filter(StringUtils::hasText)
            .orElseThrow(() -> GenerationFailedException.terminal(
                GenerationFailedException.ErrorCode.MISSING_CONTENT,
                "No readable content stored for book " + bookId
            ));

        RenderedPrompt prompt = PromptTemplates.renderBookSummary(content);
        log.info("Generating summary for book {} (template={}@{}, ~{} input tokens, fingerprint={})",
            bookId, prompt.templateName(), prompt.templateVersion(), prompt.estimatedInputTokens(),
            prompt.fingerprint());

        String summary = generationClient.generate(prompt);
        if (catalogStore.updateSummaryIfAbsent(bookId, summary)) {
            log.info("Stored summary for book {} ({} chars)", bookId, summary.length());
            return SummaryOutcome.GENERATED;
        }
        log.info("Summary for book {} was written concurrently; discarding generated text", bookId);
        return SummaryOutcome.ALREADY_PRESENT;
    }

    public enum SummaryOutcome {
        GENERATED,
        ALREADY_PRESENT
    }
}
