package net.luminalib.application.recommendation;

/**
 * Raised when recommendations cannot be computed because the backing stores failed.
 */
public class RecommendationUnavailableException extends RuntimeException {

    public RecommendationUnavailableException(String message, Throwable cause) {
        super(message, cause);
    }
}
