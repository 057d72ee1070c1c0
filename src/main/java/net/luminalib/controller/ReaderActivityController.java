package net.luminalib.controller;

import java.util.List;
import java.util.UUID;
import net.luminalib.application.library.BorrowService;
import net.luminalib.application.library.PreferenceService;
import net.luminalib.application.library.ReviewSubmissionService;
import net.luminalib.application.recommendation.HybridRecommender;
import net.luminalib.controller.dto.BorrowDto;
import net.luminalib.controller.dto.PreferenceDto;
import net.luminalib.controller.dto.PreferenceRequest;
import net.luminalib.controller.dto.ReaderRequest;
import net.luminalib.controller.dto.RecommendationDto;
import net.luminalib.controller.dto.ReviewDto;
import net.luminalib.controller.dto.ReviewRequest;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.PutMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;
import reactor.core.publisher.Mono;

/**
 * Reader-facing endpoints: recommendations, preferences, borrowing and reviews.
 *
 * <p>Authentication is handled upstream; the reader id is passed explicitly.</p>
 */
@RestController
@RequestMapping("/api")
public class ReaderActivityController {

    private final HybridRecommender recommender;
    private final PreferenceService preferenceService;
    private final BorrowService borrowService;
    private final ReviewSubmissionService reviewSubmissionService;

    public ReaderActivityController(HybridRecommender recommender,
                                    PreferenceService preferenceService,
                                    BorrowService borrowService,
                                    ReviewSubmissionService reviewSubmissionService) {
        this.recommender = recommender;
        this.preferenceService = preferenceService;
        this.borrowService = borrowService;
        this.reviewSubmissionService = reviewSubmissionService;
    }

    @GetMapping("/recommendations")
    public Mono<ResponseEntity<List<RecommendationDto>>> recommendations(
            @RequestParam UUID userId,
            @RequestParam(name = "limit", defaultValue = "10") int limit) {
        return recommender.recommend(userId, limit)
            .map(results -> ResponseEntity.ok(results.stream().map(RecommendationDto::from).toList()));
    }

    @PutMapping("/users/{userId}/preferences")
    public ResponseEntity<PreferenceDto> updatePreferences(@PathVariable UUID userId,
                                                           @RequestBody PreferenceRequest request) {
        return ResponseEntity.ok(PreferenceDto.from(
            preferenceService.updatePreferences(userId, request.favoriteGenres(), request.favoriteAuthors())));
    }

    @PostMapping("/books/{bookId}/borrows")
    public ResponseEntity<BorrowDto> borrow(@PathVariable UUID bookId, @RequestBody ReaderRequest request) {
        return ResponseEntity.status(HttpStatus.CREATED)
            .body(BorrowDto.from(borrowService.borrow(request.userId(), bookId)));
    }

    @PostMapping("/books/{bookId}/returns")
    public ResponseEntity<BorrowDto> returnBook(@PathVariable UUID bookId, @RequestBody ReaderRequest request) {
        return ResponseEntity.ok(BorrowDto.from(borrowService.returnBook(request.userId(), bookId)));
    }

    @PostMapping("/books/{bookId}/reviews")
    public ResponseEntity<ReviewDto> submitReview(@PathVariable UUID bookId, @RequestBody ReviewRequest request) {
        if (request.rating() == null) {
            throw new IllegalArgumentException("rating is required");
        }
        return ResponseEntity.status(HttpStatus.CREATED).body(ReviewDto.from(
            reviewSubmissionService.submitReview(request.userId(), bookId, request.rating(), request.text())));
    }
}
