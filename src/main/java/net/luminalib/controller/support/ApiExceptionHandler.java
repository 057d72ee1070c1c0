package net.luminalib.controller.support;

import java.util.LinkedHashMap;
import java.util.Map;
import net.luminalib.application.library.ReviewNotAllowedException;
import net.luminalib.application.recommendation.RecommendationUnavailableException;
import net.luminalib.domain.catalog.BookNotFoundException;
import net.luminalib.domain.circulation.BorrowConflictException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.http.converter.HttpMessageNotReadableException;
import org.springframework.web.bind.MissingServletRequestParameterException;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;
import org.springframework.web.method.annotation.MethodArgumentTypeMismatchException;

/**
 * Maps domain failures to HTTP statuses with the shared {@code {"error", "message"}} body.
 */
@RestControllerAdvice
public class ApiExceptionHandler {

    private static final Logger log = LoggerFactory.getLogger(ApiExceptionHandler.class);

    @ExceptionHandler(BookNotFoundException.class)
    public ResponseEntity<Map<String, String>> handleBookNotFound(BookNotFoundException exception) {
        return errorResponse(HttpStatus.NOT_FOUND, "Book not found", exception.getMessage());
    }

    @ExceptionHandler(ReviewNotAllowedException.class)
    public ResponseEntity<Map<String, String>> handleReviewNotAllowed(ReviewNotAllowedException exception) {
        return errorResponse(HttpStatus.FORBIDDEN, "Review not allowed", exception.getMessage());
    }

    @ExceptionHandler(BorrowConflictException.class)
    public ResponseEntity<Map<String, String>> handleBorrowConflict(BorrowConflictException exception) {
        return errorResponse(HttpStatus.CONFLICT, "Borrow conflict", exception.getMessage());
    }

    @ExceptionHandler(RecommendationUnavailableException.class)
    public ResponseEntity<Map<String, String>> handleRecommendationUnavailable(RecommendationUnavailableException exception) {
        log.warn("Recommendations unavailable: {}", exception.getMessage());
        return errorResponse(HttpStatus.SERVICE_UNAVAILABLE, "Recommendations unavailable", exception.getMessage());
    }

    @ExceptionHandler({
        IllegalArgumentException.class,
        MethodArgumentTypeMismatchException.class,
        MissingServletRequestParameterException.class,
        HttpMessageNotReadableException.class
    })
    public ResponseEntity<Map<String, String>> handleBadRequest(Exception exception) {
        return errorResponse(HttpStatus.BAD_REQUEST, "Invalid request", exception.getMessage());
    }

    private static ResponseEntity<Map<String, String>> errorResponse(HttpStatus status, String error, String detail) {
        Map<String, String> body = new LinkedHashMap<>();
        body.put("error", error);
        if (detail != null && !detail.isBlank()) {
            body.put("message", detail);
        }
        return ResponseEntity.status(status).body(body);
    }
}
