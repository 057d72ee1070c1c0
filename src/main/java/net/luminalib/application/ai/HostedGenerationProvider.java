package net.luminalib.application.ai;

import com.openai.client.OpenAIClient;
import com.openai.client.okhttp.OpenAIOkHttpClient;
import com.openai.core.RequestOptions;
import com.openai.core.Timeout;
import com.openai.errors.OpenAIException;
import com.openai.errors.OpenAIIoException;
import com.openai.errors.OpenAIServiceException;
import com.openai.models.ChatModel;
import com.openai.models.chat.completions.ChatCompletion;
import com.openai.models.chat.completions.ChatCompletionCreateParams;
import com.openai.models.chat.completions.ChatCompletionMessageParam;
import com.openai.models.chat.completions.ChatCompletionSystemMessageParam;
import com.openai.models.chat.completions.ChatCompletionUserMessageParam;
import jakarta.annotation.Nullable;
import java.time.Duration;
import java.util.List;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.util.StringUtils;

/**
 * Generation provider backed by an OpenAI-compatible hosted chat completion API.
 *
 * <p>The SDK's own retries are disabled so that the intelligence pipeline owns the retry
 * budget. Service errors are classified by HTTP status: 408, 429 and 5xx are retryable,
 * any other 4xx is terminal.</p>
 */
public class HostedGenerationProvider implements GenerationProvider {

    private static final Logger log = LoggerFactory.getLogger(HostedGenerationProvider.class);
    private static final String API_KEY_SENTINEL = "not-configured";
    private static final double SAMPLING_TEMPERATURE = 0.7;

    @Nullable
    private final OpenAIClient openAiClient;
    private final String model;
    private final Duration requestTimeout;

    public HostedGenerationProvider(String apiKey, String baseUrl, String model, Duration requestTimeout) {
        this.model = StringUtils.hasText(model) ? model.trim() : "gpt-4o-mini";
        this.requestTimeout = requestTimeout;
        if (StringUtils.hasText(apiKey) && !API_KEY_SENTINEL.equals(apiKey.trim())) {
            String resolvedBaseUrl = normalizeBaseUrl(baseUrl);
            this.openAiClient = OpenAIOkHttpClient.builder()
                .apiKey(apiKey.trim())
                .baseUrl(resolvedBaseUrl)
                .maxRetries(0)
                .build();
            log.info("Hosted generation provider configured (model={}, baseUrl={})", this.model, resolvedBaseUrl);
        } else {
            this.openAiClient = null;
            log.warn("Hosted generation provider is disabled: no API key configured");
        }
    }

    HostedGenerationProvider(@Nullable OpenAIClient openAiClient, String model, Duration requestTimeout) {
        this.openAiClient = openAiClient;
        this.model = model;
        this.requestTimeout = requestTimeout;
    }

    @Override
    public String generate(String systemMessage, String userMessage, int maxOutputTokens) {
        if (openAiClient == null) {
            throw GenerationFailedException.terminal(
                GenerationFailedException.ErrorCode.NOT_CONFIGURED,
                "Hosted generation provider is not configured"
            );
        }

        ChatCompletionCreateParams params = ChatCompletionCreateParams.builder()
            .model(ChatModel.of(model))
            .messages(List.of(
                ChatCompletionMessageParam.ofSystem(ChatCompletionSystemMessageParam.builder().content(systemMessage).build()),
                ChatCompletionMessageParam.ofUser(ChatCompletionUserMessageParam.builder().content(userMessage).build())
            ))
            .maxCompletionTokens((long) maxOutputTokens)
            .temperature(SAMPLING_TEMPERATURE)
            .build();

        RequestOptions options = RequestOptions.builder()
            .timeout(Timeout.builder()
                .request(requestTimeout)
                .read(requestTimeout)
                .build())
            .build();

        try {
            ChatCompletion completion = openAiClient.chat().completions().create(params, options);
            if (completion.choices().isEmpty()) {
                throw GenerationFailedException.retryable(
                    GenerationFailedException.ErrorCode.EMPTY_RESPONSE,
                    "Hosted completion contained no choices",
                    null
                );
            }
            String response = completion.choices().get(0).message().content().orElse("");
            if (!StringUtils.hasText(response)) {
                throw GenerationFailedException.retryable(
                    GenerationFailedException.ErrorCode.EMPTY_RESPONSE,
                    "Hosted completion was empty",
                    null
                );
            }
            return response.trim();
        } catch (OpenAIServiceException serviceException) {
            String detail = GenerationFailedException.describeApiError(serviceException);
            boolean retryable = GenerationFailedException.isRetryableStatus(serviceException.statusCode());
            log.warn("Hosted generation call failed (model={}, retryable={}): {}", model, retryable, detail);
            throw classified(retryable
                    ? GenerationFailedException.ErrorCode.UPSTREAM_UNAVAILABLE
                    : GenerationFailedException.ErrorCode.UPSTREAM_REJECTED,
                retryable, detail, serviceException);
        } catch (OpenAIIoException ioException) {
            String detail = GenerationFailedException.describeApiError(ioException);
            log.warn("Hosted generation call failed (model={}): {}", model, detail);
            throw classified(GenerationFailedException.ErrorCode.UPSTREAM_UNAVAILABLE, true, detail, ioException);
        } catch (OpenAIException openAiException) {
            String detail = GenerationFailedException.describeApiError(openAiException);
            log.error("Hosted generation call failed (model={}): {}", model, detail);
            throw classified(GenerationFailedException.ErrorCode.UPSTREAM_REJECTED, false, detail, openAiException);
        }
    }

    @Override
    public String providerName() {
        return "hosted";
    }

    @Override
    public boolean isAvailable() {
        return openAiClient != null;
    }

    /**
     * Trims trailing slashes and guarantees a trailing {@code /v1} segment.
     */
    static String normalizeBaseUrl(@Nullable String rawUrl) {
        if (rawUrl == null || rawUrl.isBlank()) {
            return "https://api.openai.com/v1";
        }
        String normalized = rawUrl.trim();
        while (normalized.endsWith("/")) {
            normalized = normalized.substring(0, normalized.length() - 1);
        }
        return normalized.endsWith("/v1") ? normalized : normalized + "/v1";
    }

    private GenerationFailedException classified(GenerationFailedException.ErrorCode code,
                                                 boolean retryable,
                                                 String detail,
                                                 Throwable cause) {
        return new GenerationFailedException(
            code,
            retryable,
            "Hosted generation failed (%s): %s".formatted(model, detail),
            cause
        );
    }
}
