package net.luminalib.controller;

import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyInt;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.mockito.Mockito.when;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.asyncDispatch;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.post;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.put;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

import java.time.Instant;
import java.util.List;
import java.util.Set;
import java.util.UUID;
import net.luminalib.application.library.BorrowService;
import net.luminalib.application.library.PreferenceService;
import net.luminalib.application.library.ReviewNotAllowedException;
import net.luminalib.application.library.ReviewSubmissionService;
import net.luminalib.application.recommendation.HybridRecommender;
import net.luminalib.application.recommendation.RecommendationUnavailableException;
import net.luminalib.controller.support.ApiExceptionHandler;
import net.luminalib.domain.circulation.Borrow;
import net.luminalib.domain.circulation.BorrowConflictException;
import net.luminalib.domain.preference.UserPreference;
import net.luminalib.domain.recommendation.RecommendationResult;
import net.luminalib.domain.review.Review;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.http.MediaType;
import org.springframework.test.web.servlet.MockMvc;
import org.springframework.test.web.servlet.MvcResult;
import org.springframework.test.web.servlet.ResultActions;
import org.springframework.test.web.servlet.request.MockHttpServletRequestBuilder;
import org.springframework.test.web.servlet.setup.MockMvcBuilders;
import reactor.core.publisher.Mono;

@ExtendWith(MockitoExtension.class)
class ReaderActivityControllerTest {

    private static final Instant NOW = Instant.parse("2025-01-01T00:00:00Z");

    @Mock
    private HybridRecommender recommender;

    @Mock
    private PreferenceService preferenceService;

    @Mock
    private BorrowService borrowService;

    @Mock
    private ReviewSubmissionService reviewSubmissionService;

    private MockMvc mockMvc;
    private final UUID userId = UUID.randomUUID();
    private final UUID bookId = UUID.randomUUID();

    @BeforeEach
    void setUp() {
        ReaderActivityController controller =
            new ReaderActivityController(recommender, preferenceService, borrowService, reviewSubmissionService);
        mockMvc = MockMvcBuilders.standaloneSetup(controller)
            .setControllerAdvice(new ApiExceptionHandler())
            .build();
    }

    @Test
    void should_ReturnRankedRecommendations() throws Exception {
        when(recommender.recommend(userId, 5)).thenReturn(Mono.just(List.of(
            new RecommendationResult(bookId, 0.876543, "Similar readers also enjoyed this"))));

        performAsync(get("/api/recommendations").param("userId", userId.toString()).param("limit", "5"))
            .andExpect(status().isOk())
            .andExpect(jsonPath("$[0].bookId").value(bookId.toString()))
            .andExpect(jsonPath("$[0].score").value(0.8765))
            .andExpect(jsonPath("$[0].reason").value("Similar readers also enjoyed this"));
    }

    @Test
    void should_UseDefaultLimit_When_NoneGiven() throws Exception {
        when(recommender.recommend(userId, 10)).thenReturn(Mono.just(List.of()));

        performAsync(get("/api/recommendations").param("userId", userId.toString()))
            .andExpect(status().isOk())
            .andExpect(jsonPath("$").isEmpty());
    }

    @Test
    void should_Return503_When_RecommendationsUnavailable() throws Exception {
        when(recommender.recommend(eq(userId), anyInt())).thenReturn(Mono.error(
            new RecommendationUnavailableException("Recommendations are temporarily unavailable", null)));

        performAsync(get("/api/recommendations").param("userId", userId.toString()))
            .andExpect(status().isServiceUnavailable())
            .andExpect(jsonPath("$.error").value("Recommendations unavailable"));
    }

    @Test
    void should_Return400_When_UserIdMissing() throws Exception {
        mockMvc.perform(get("/api/recommendations"))
            .andExpect(status().isBadRequest());
        verifyNoInteractions(recommender);
    }

    @Test
    void should_UpdatePreferences() throws Exception {
        when(preferenceService.updatePreferences(eq(userId), any(), any()))
            .thenReturn(new UserPreference(userId, Set.of("History", "Fantasy"), Set.of("Ursula K. Le Guin")));

        mockMvc.perform(put("/api/users/{userId}/preferences", userId)
                .contentType(MediaType.APPLICATION_JSON)
                .content("{\"favoriteGenres\":[\"Fantasy\",\"History\"],\"favoriteAuthors\":[\"Ursula K. Le Guin\"]}"))
            .andExpect(status().isOk())
            .andExpect(jsonPath("$.favoriteGenres[0]").value("Fantasy"))
            .andExpect(jsonPath("$.favoriteGenres[1]").value("History"));
        verify(preferenceService).updatePreferences(userId, List.of("Fantasy", "History"), List.of("Ursula K. Le Guin"));
    }

    @Test
    void should_CreateBorrow() throws Exception {
        when(borrowService.borrow(userId, bookId)).thenReturn(new Borrow(UUID.randomUUID(), userId, bookId, NOW, null));

        mockMvc.perform(post("/api/books/{bookId}/borrows", bookId)
                .contentType(MediaType.APPLICATION_JSON)
                .content("{\"userId\":\"" + userId + "\"}"))
            .andExpect(status().isCreated())
            .andExpect(jsonPath("$.bookId").value(bookId.toString()));
    }

    @Test
    void should_Return409_When_BorrowConflicts() throws Exception {
        when(borrowService.borrow(userId, bookId)).thenThrow(new BorrowConflictException("already borrowed"));

        mockMvc.perform(post("/api/books/{bookId}/borrows", bookId)
                .contentType(MediaType.APPLICATION_JSON)
                .content("{\"userId\":\"" + userId + "\"}"))
            .andExpect(status().isConflict());
    }

    @Test
    void should_ReturnBook() throws Exception {
        when(borrowService.returnBook(userId, bookId))
            .thenReturn(new Borrow(UUID.randomUUID(), userId, bookId, NOW, NOW.plusSeconds(3600)));

        mockMvc.perform(post("/api/books/{bookId}/returns", bookId)
                .contentType(MediaType.APPLICATION_JSON)
                .content("{\"userId\":\"" + userId + "\"}"))
            .andExpect(status().isOk())
            .andExpect(jsonPath("$.returnedAt").exists());
    }

    @Test
    void should_CreateReview() throws Exception {
        when(reviewSubmissionService.submitReview(userId, bookId, 4, "Vivid"))
            .thenReturn(new Review(UUID.randomUUID(), userId, bookId, 4, "Vivid", NOW));

        mockMvc.perform(post("/api/books/{bookId}/reviews", bookId)
                .contentType(MediaType.APPLICATION_JSON)
                .content("{\"userId\":\"" + userId + "\",\"rating\":4,\"text\":\"Vivid\"}"))
            .andExpect(status().isCreated())
            .andExpect(jsonPath("$.rating").value(4));
    }

    @Test
    void should_Return403_When_ReaderNeverBorrowed() throws Exception {
        when(reviewSubmissionService.submitReview(eq(userId), eq(bookId), anyInt(), anyString()))
            .thenThrow(new ReviewNotAllowedException(userId, bookId, "You must borrow this book before reviewing it"));

        mockMvc.perform(post("/api/books/{bookId}/reviews", bookId)
                .contentType(MediaType.APPLICATION_JSON)
                .content("{\"userId\":\"" + userId + "\",\"rating\":4,\"text\":\"Vivid\"}"))
            .andExpect(status().isForbidden())
            .andExpect(jsonPath("$.message").value("You must borrow this book before reviewing it"));
    }

    @Test
    void should_Return400_When_RatingMissing() throws Exception {
        mockMvc.perform(post("/api/books/{bookId}/reviews", bookId)
                .contentType(MediaType.APPLICATION_JSON)
                .content("{\"userId\":\"" + userId + "\",\"text\":\"No rating\"}"))
            .andExpect(status().isBadRequest());
        verifyNoInteractions(reviewSubmissionService);
    }

    private ResultActions performAsync(MockHttpServletRequestBuilder request) throws Exception {
        ResultActions initial = mockMvc.perform(request);
        MvcResult mvcResult = initial.andReturn();
        if (mvcResult.getRequest().isAsyncStarted()) {
            return mockMvc.perform(asyncDispatch(mvcResult));
        }
        return initial;
    }
}
