package net.luminalib.support.retry;

import io.github.resilience4j.core.IntervalFunction;
import io.github.resilience4j.retry.Retry;
import io.github.resilience4j.retry.RetryConfig;
import io.github.resilience4j.timelimiter.TimeLimiter;
import io.github.resilience4j.timelimiter.TimeLimiterConfig;
import jakarta.annotation.PreDestroy;
import java.time.Duration;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.TimeoutException;
import java.util.concurrent.atomic.AtomicInteger;
import net.luminalib.application.ai.GenerationFailedException;
import net.luminalib.application.ai.GenerationProvider;
import net.luminalib.config.IntelligenceProperties;
import net.luminalib.support.prompt.RenderedPrompt;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Component;

/**
 * Wraps the configured {@link GenerationProvider} with a per-call timeout and bounded
 * exponential-backoff retry.
 *
 * <p>Only failures flagged {@link GenerationFailedException#isRetryable() retryable}
 * are retried. A call exceeding the timeout is abandoned and counts as a retryable
 * failure. After the last attempt the final failure propagates unchanged.</p>
 */
@Component
public class GuardedGenerationClient {

    private static final Logger log = LoggerFactory.getLogger(GuardedGenerationClient.class);
    private static final double BACKOFF_MULTIPLIER = 2.0;

    private final GenerationProvider provider;
    private final Retry retry;
    private final TimeLimiter timeLimiter;
    private final Duration timeout;
    private final ExecutorService callExecutor;

    @Autowired
    public GuardedGenerationClient(GenerationProvider provider, IntelligenceProperties properties) {
        this(provider, properties.getRetryMaxAttempts(), properties.getRetryInitialBackoff(),
            properties.getGenerationTimeout());
    }

    public GuardedGenerationClient(GenerationProvider provider,
                                   int maxAttempts,
                                   Duration initialBackoff,
                                   Duration timeout) {
        if (maxAttempts < 1) {
            throw new IllegalArgumentException("maxAttempts must be at least 1 but was " + maxAttempts);
        }
        this.provider = provider;
        this.timeout = timeout;

        RetryConfig retryConfig = RetryConfig.custom()
            .maxAttempts(maxAttempts)
            .intervalFunction(IntervalFunction.ofExponentialBackoff(
                Math.max(1L, initialBackoff.toMillis()), BACKOFF_MULTIPLIER))
            .retryOnException(GuardedGenerationClient::isRetryable)
            .build();
        this.retry = Retry.of("generation-" + provider.providerName(), retryConfig);
        this.retry.getEventPublisher().onRetry(event -> log.warn(
            "Generation attempt {}/{} failed on provider {} (will retry in {}ms): {}",
            event.getNumberOfRetryAttempts(),
            maxAttempts,
            provider.providerName(),
            event.getWaitInterval().toMillis(),
            event.getLastThrowable() != null ? event.getLastThrowable().getMessage() : "unknown"
        ));

        this.timeLimiter = TimeLimiter.of(TimeLimiterConfig.custom()
            .timeoutDuration(timeout)
            .cancelRunningFuture(true)
            .build());
        this.callExecutor = Executors.newCachedThreadPool(daemonThreadFactory());
    }

    /**
     * Generates text for a rendered prompt, honoring the timeout and retry budget.
     *
     * @throws GenerationFailedException when every permitted attempt failed, or on the first
     *         non-retryable failure
     */
    public String generate(RenderedPrompt prompt) {
        return retry.executeSupplier(() -> attemptOnce(prompt));
    }

    public String providerName() {
        return provider.providerName();
    }

    private String attemptOnce(RenderedPrompt prompt) {
        try {
            return timeLimiter.executeFutureSupplier(() -> callExecutor.submit(() ->
                provider.generate(prompt.systemMessage(), prompt.userMessage(), prompt.maxOutputTokens())
            ));
        } catch (TimeoutException timeoutException) {
            throw GenerationFailedException.retryable(
                GenerationFailedException.ErrorCode.TIMEOUT,
                "Generation timed out after %dms (template=%s)".formatted(timeout.toMillis(), prompt.templateName()),
                timeoutException
            );
        } catch (GenerationFailedException generationFailure) {
            throw generationFailure;
        } catch (InterruptedException interruptedException) {
            Thread.currentThread().interrupt();
            throw GenerationFailedException.terminal(
                GenerationFailedException.ErrorCode.UPSTREAM_UNAVAILABLE,
                "Interrupted while waiting for generation"
            );
        } catch (ExecutionException executionException) {
            throw unwrap(executionException.getCause() != null ? executionException.getCause() : executionException);
        } catch (Exception unexpected) {
            throw unwrap(unexpected);
        }
    }

    private static GenerationFailedException unwrap(Throwable failure) {
        if (failure instanceof GenerationFailedException generationFailure) {
            return generationFailure;
        }
        return new GenerationFailedException(
            GenerationFailedException.ErrorCode.UPSTREAM_REJECTED,
            false,
            "Generation provider failed unexpectedly: " + failure.getMessage(),
            failure
        );
    }

    private static boolean isRetryable(Throwable failure) {
        return failure instanceof GenerationFailedException generationFailure && generationFailure.isRetryable();
    }

    private static ThreadFactory daemonThreadFactory() {
        AtomicInteger sequence = new AtomicInteger();
        return runnable -> {
            Thread thread = new Thread(runnable, "generation-call-" + sequence.incrementAndGet());
            thread.setDaemon(true);
            return thread;
        };
    }

    @PreDestroy
    void shutdown() {
        callExecutor.shutdownNow();
    }
}
