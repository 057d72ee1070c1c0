package net.luminalib.controller;

import net.luminalib.application.library.BookIngestionService;
import net.luminalib.controller.dto.BookDto;
import net.luminalib.controller.dto.BookRegistrationRequest;
import net.luminalib.domain.catalog.Book;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

/**
 * Catalog registration endpoint used by the upload pipeline.
 */
@RestController
@RequestMapping("/api/books")
public class BookCatalogController {

    private final BookIngestionService ingestionService;

    public BookCatalogController(BookIngestionService ingestionService) {
        this.ingestionService = ingestionService;
    }

    @PostMapping
    public ResponseEntity<BookDto> register(@RequestBody BookRegistrationRequest request) {
        Book book = ingestionService.ingest(
            request.title(), request.author(), request.isbn(), request.genres(), request.contentPath());
        return ResponseEntity.status(HttpStatus.CREATED).body(BookDto.from(book));
    }
}
