package net.luminalib.controller;

import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.isNull;
import static org.mockito.Mockito.when;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.post;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

import java.util.List;
import net.luminalib.application.library.BookIngestionService;
import net.luminalib.controller.support.ApiExceptionHandler;
import net.luminalib.domain.catalog.Book;
import net.luminalib.testutil.LibraryTestData;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.http.MediaType;
import org.springframework.test.web.servlet.MockMvc;
import org.springframework.test.web.servlet.setup.MockMvcBuilders;

@ExtendWith(MockitoExtension.class)
class BookCatalogControllerTest {

    @Mock
    private BookIngestionService ingestionService;

    private MockMvc mockMvc;

    @BeforeEach
    void setUp() {
        mockMvc = MockMvcBuilders.standaloneSetup(new BookCatalogController(ingestionService))
            .setControllerAdvice(new ApiExceptionHandler())
            .build();
    }

    @Test
    void should_Return201_When_BookRegistered() throws Exception {
        Book book = LibraryTestData.book("Dune", "Frank Herbert", "Science Fiction");
        when(ingestionService.ingest("Dune", "Frank Herbert", null, List.of("Science Fiction"), "dune.txt"))
            .thenReturn(book);

        mockMvc.perform(post("/api/books")
                .contentType(MediaType.APPLICATION_JSON)
                .content("{\"title\":\"Dune\",\"author\":\"Frank Herbert\",\"genres\":[\"Science Fiction\"],\"contentPath\":\"dune.txt\"}"))
            .andExpect(status().isCreated())
            .andExpect(jsonPath("$.id").value(book.id().toString()))
            .andExpect(jsonPath("$.consensusVersion").value(0));
    }

    @Test
    void should_Return400_When_TitleMissing() throws Exception {
        when(ingestionService.ingest(isNull(), anyString(), isNull(), any(), isNull()))
            .thenThrow(new IllegalArgumentException("title is required"));

        mockMvc.perform(post("/api/books")
                .contentType(MediaType.APPLICATION_JSON)
                .content("{\"author\":\"Frank Herbert\"}"))
            .andExpect(status().isBadRequest())
            .andExpect(jsonPath("$.message").value("title is required"));
    }
}
