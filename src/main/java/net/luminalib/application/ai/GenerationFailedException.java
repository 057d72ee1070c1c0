package net.luminalib.application.ai;

import com.openai.errors.OpenAIException;
import com.openai.errors.OpenAIIoException;
import com.openai.errors.OpenAIServiceException;
import java.util.Objects;

/**
 * Single failure contract for every generation provider.
 *
 * <p>{@link #isRetryable()} tells the intelligence pipeline whether another attempt may
 * succeed: network errors, timeouts, rate limits, 5xx responses and empty replies are retryable, while
 * other 4xx responses, authentication problems and missing configuration are not.</p>
 */
public class GenerationFailedException extends RuntimeException {

    /**
     * Canonical failure categories emitted by generation providers.
     */
    public enum ErrorCode {
        UPSTREAM_UNAVAILABLE,
        UPSTREAM_REJECTED,
        TIMEOUT,
        EMPTY_RESPONSE,
        NOT_CONFIGURED,
        MISSING_CONTENT
    }

    private final ErrorCode errorCode;
    private final boolean retryable;

    public GenerationFailedException(ErrorCode errorCode, boolean retryable, String message) {
        this(errorCode, retryable, message, null);
    }

    public GenerationFailedException(ErrorCode errorCode, boolean retryable, String message, Throwable cause) {
        super(message, cause);
        this.errorCode = Objects.requireNonNull(errorCode, "errorCode must not be null");
        this.retryable = retryable;
    }

    public static GenerationFailedException retryable(ErrorCode errorCode, String message, Throwable cause) {
        return new GenerationFailedException(errorCode, true, message, cause);
    }

    public static GenerationFailedException terminal(ErrorCode errorCode, String message) {
        return new GenerationFailedException(errorCode, false, message, null);
    }

    /**
     * Classifies an HTTP status returned by an upstream model server.
     */
    public static boolean isRetryableStatus(int status) {
        return status == 408 || status == 429 || status >= 500;
    }

    /**
     * Returns the canonical classification for this failure.
     */
    public ErrorCode errorCode() {
        return errorCode;
    }

    public boolean isRetryable() {
        return retryable;
    }

    /**
     * Formats an OpenAI SDK exception into a concise description with HTTP status
     * code and human-readable explanation when available.
     */
    public static String describeApiError(OpenAIException ex) {
        if (ex instanceof OpenAIServiceException serviceException) {
            int status = serviceException.statusCode();
            String explanation = switch (status) {
                case 400 -> "bad request";
                case 401 -> "unauthorized, check API key";
                case 403 -> "access denied";
                case 404 -> "not found, check base URL and model name";
                case 422 -> "unprocessable request";
                case 429 -> "rate limited";
                case 500, 502, 503 -> "server error";
                default -> "unexpected status";
            };
            return "HTTP %d %s".formatted(status, explanation);
        }
        if (ex instanceof OpenAIIoException) {
            return "network error: " + ex.getMessage();
        }
        return ex.getMessage() != null ? ex.getMessage() : ex.getClass().getSimpleName();
    }
}
