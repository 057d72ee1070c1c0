package net.luminalib.application.ai;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;
import jakarta.annotation.Nullable;
import java.time.Duration;
import java.util.List;
import java.util.Map;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.MediaType;
import org.springframework.util.StringUtils;
import org.springframework.web.reactive.function.client.WebClient;
import org.springframework.web.reactive.function.client.WebClientRequestException;
import org.springframework.web.reactive.function.client.WebClientResponseException;

/**
 * Generation provider for a self-hosted Ollama-style inference server.
 *
 * <p>Posts a non-streaming request to {@code /api/chat} and reads {@code message.content}
 * from the reply.</p>
 */
public class LocalInferenceGenerationProvider implements GenerationProvider {

    private static final Logger log = LoggerFactory.getLogger(LocalInferenceGenerationProvider.class);
    private static final String CHAT_PATH = "/api/chat";

    private final WebClient webClient;
    private final String model;
    private final Duration requestTimeout;

    public LocalInferenceGenerationProvider(WebClient webClient, String model, Duration requestTimeout) {
        this.webClient = webClient;
        this.model = model;
        this.requestTimeout = requestTimeout;
    }

    @Override
    public String generate(String systemMessage, String userMessage, int maxOutputTokens) {
        ChatRequest request = new ChatRequest(
            model,
            List.of(new ChatMessage("system", systemMessage), new ChatMessage("user", userMessage)),
            false,
            Map.<String, Object>of("num_predict", maxOutputTokens)
        );

        ChatResponse response;
        try {
            response = webClient.post()
                .uri(CHAT_PATH)
                .contentType(MediaType.APPLICATION_JSON)
                .bodyValue(request)
                .retrieve()
                .bodyToMono(ChatResponse.class)
                .block(requestTimeout);
        } catch (WebClientResponseException responseException) {
            int status = responseException.getStatusCode().value();
            boolean retryable = GenerationFailedException.isRetryableStatus(status);
            log.warn("Local inference call failed (model={}, status={}, retryable={})", model, status, retryable);
            throw new GenerationFailedException(
                retryable
                    ? GenerationFailedException.ErrorCode.UPSTREAM_UNAVAILABLE
                    : GenerationFailedException.ErrorCode.UPSTREAM_REJECTED,
                retryable,
                "Local inference failed (%s): HTTP %d".formatted(model, status),
                responseException
            );
        } catch (WebClientRequestException requestException) {
            log.warn("Local inference server unreachable (model={}): {}", model, requestException.getMessage());
            throw GenerationFailedException.retryable(
                GenerationFailedException.ErrorCode.UPSTREAM_UNAVAILABLE,
                "Local inference server unreachable: " + requestException.getMessage(),
                requestException
            );
        } catch (IllegalStateException timeoutException) {
            // block(Duration) signals an elapsed timeout with IllegalStateException
            throw GenerationFailedException.retryable(
                GenerationFailedException.ErrorCode.TIMEOUT,
                "Local inference timed out after " + requestTimeout,
                timeoutException
            );
        }

        String content = response == null || response.message() == null ? null : response.message().content();
        if (!StringUtils.hasText(content)) {
            throw GenerationFailedException.retryable(
                GenerationFailedException.ErrorCode.EMPTY_RESPONSE,
                "Local inference returned an empty message",
                null
            );
        }
        return content.trim();
    }

    @Override
    public String providerName() {
        return "local";
    }

    record ChatRequest(
        String model,
        List<ChatMessage> messages,
        boolean stream,
        Map<String, Object> options
    ) {
    }

    @JsonIgnoreProperties(ignoreUnknown = true)
    record ChatMessage(String role, String content) {
    }

    @JsonIgnoreProperties(ignoreUnknown = true)
    record ChatResponse(@Nullable ChatMessage message, @JsonProperty("done") boolean done) {
    }
}
