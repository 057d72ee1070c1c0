package net.luminalib.application.ai;

import java.time.Duration;
import java.util.Locale;
import java.util.regex.Matcher;
import java.util.regex.Pattern;
import net.luminalib.support.prompt.TokenBudget;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Deterministic provider for development and tests.
 *
 * <p>Responses are templated from simple statistics of the user message: word count for
 * summary prompts, review count and average rating for consensus prompts. A configurable
 * sleep simulates model latency so timeout handling can be exercised.</p>
 */
public class MockGenerationProvider implements GenerationProvider {

    private static final Logger log = LoggerFactory.getLogger(MockGenerationProvider.class);
    private static final Pattern RATING_MARKER = Pattern.compile("\\[Rating: (\\d)/5]");

    private final Duration latency;

    public MockGenerationProvider(Duration latency) {
        this.latency = latency == null || latency.isNegative() ? Duration.ZERO : latency;
    }

    @Override
    public String generate(String systemMessage, String userMessage, int maxOutputTokens) {
        simulateLatency();
        String user = userMessage == null ? "" : userMessage;

        Matcher matcher = RATING_MARKER.matcher(user);
        int count = 0;
        int total = 0;
        while (matcher.find()) {
            count += 1;
            total += Integer.parseInt(matcher.group(1));
        }
        if (count > 0) {
            return consensus(count, (double) total / count);
        }
        return summary(user);
    }

    @Override
    public String providerName() {
        return "mock";
    }

    private String summary(String text) {
        String trimmed = text.trim();
        int words = trimmed.isEmpty() ? 0 : trimmed.split("\\s+").length;
        int tokens = TokenBudget.estimateTokens(text);
        log.info("Mock provider generating summary ({} words, {} estimated tokens)", words, tokens);
        return """
            This book contains approximately %d words (estimated %d tokens). It develops its themes \
            through well-structured prose, building from foundational ideas toward more complex conclusions.

            The author shows a firm command of the subject and balances narrative with analysis.

            Recommended for casual readers looking for an accessible introduction and for readers who want \
            a thorough reference.""".formatted(words, tokens);
    }

    private String consensus(int count, double average) {
        String sentiment;
        if (average >= 4.0) {
            sentiment = "overwhelmingly positive";
        } else if (average >= 3.0) {
            sentiment = "generally positive with some reservations";
        } else if (average >= 2.0) {
            sentiment = "mixed, with both praise and criticism";
        } else {
            sentiment = "predominantly critical";
        }
        log.info("Mock provider generating consensus ({} reviews, avg={})", count, "%.1f".formatted(average));
        return """
            Based on %d reader reviews with an average rating of %s/5, the overall sentiment is %s.

            Reviewers often mention the depth of the content and the quality of the writing, while some \
            find certain sections demanding.

            Best suited to readers with a genuine interest in the subject.""".formatted(
                count, String.format(Locale.ROOT, "%.1f", average), sentiment);
    }

    private void simulateLatency() {
        if (latency.isZero()) {
            return;
        }
        try {
            Thread.sleep(latency.toMillis());
        } catch (InterruptedException interruptedException) {
            Thread.currentThread().interrupt();
            throw GenerationFailedException.retryable(
                GenerationFailedException.ErrorCode.TIMEOUT,
                "Mock generation interrupted",
                interruptedException
            );
        }
    }
}
