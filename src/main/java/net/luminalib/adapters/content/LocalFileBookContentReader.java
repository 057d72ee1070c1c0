package net.luminalib.adapters.content;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.Optional;
import net.luminalib.config.IntelligenceProperties;
import net.luminalib.domain.catalog.Book;
import net.luminalib.domain.catalog.BookContentReader;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Component;
import org.springframework.util.StringUtils;

/**
 * Reads uploaded book text from the local upload directory.
 *
 * <p>Content paths resolve against {@code app.intelligence.content-root}; paths escaping
 * that root are refused.</p>
 */
@Component
public class LocalFileBookContentReader implements BookContentReader {

    private static final Logger log = LoggerFactory.getLogger(LocalFileBookContentReader.class);

    private final Path contentRoot;

    @Autowired
    public LocalFileBookContentReader(IntelligenceProperties properties) {
        this(Paths.get(properties.getContentRoot()));
    }

    public LocalFileBookContentReader(Path contentRoot) {
        this.contentRoot = contentRoot.toAbsolutePath().normalize();
    }

    @Override
    public Optional<String> readText(Book book) {
        if (book == null || !StringUtils.hasText(book.contentPath())) {
            return Optional.empty();
        }

        Path resolved = contentRoot.resolve(book.contentPath()).normalize();
        if (!resolved.startsWith(contentRoot)) {
            log.warn("Refusing content path outside the content root for book {}: {}", book.id(), book.contentPath());
            return Optional.empty();
        }
        if (!Files.isRegularFile(resolved)) {
            log.warn("Content file missing for book {}: {}", book.id(), resolved);
            return Optional.empty();
        }

        try {
            return Optional.of(Files.readString(resolved, StandardCharsets.UTF_8));
        } catch (IOException ioException) {
            log.error("Failed reading content for book {} from {}", book.id(), resolved, ioException);
            return Optional.empty();
        }
    }
}
