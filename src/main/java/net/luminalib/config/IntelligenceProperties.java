package net.luminalib.config;

import jakarta.annotation.PostConstruct;
import java.time.Duration;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;
import org.springframework.util.Assert;

/**
 * Strongly typed configuration for book intelligence and recommendations.
 */
@Component
@ConfigurationProperties(prefix = "app.intelligence")
public class IntelligenceProperties {

    /**
     * Generation backend selected at startup.
     */
    public enum ProviderType {
        MOCK,
        LOCAL,
        HOSTED
    }

    /**
     * Whether one reader may review the same book more than once.
     */
    public enum ReviewPolicy {
        ALLOW_REPEAT,
        ONE_PER_READER
    }

    private ProviderType generationProvider = ProviderType.MOCK;

    /**
     * Model identifier passed to local or hosted providers.
     */
    private String generationModel = "llama3";

    /**
     * Weight of the collaborative signal in the blended recommendation score.
     */
    private double recommendationAlpha = 0.6;

    /**
     * Upper bound for a single provider call; longer calls count as retryable failures.
     */
    private Duration generationTimeout = Duration.ofSeconds(120);

    private int retryMaxAttempts = 3;

    /**
     * First retry delay; each further attempt doubles it.
     */
    private Duration retryInitialBackoff = Duration.ofSeconds(2);

    /**
     * Concurrent generation tasks across all books.
     */
    private int maxParallel = 2;

    /**
     * Pending generation tasks accepted before triggers are dropped.
     */
    private int maxPending = 10_000;

    /**
     * Artificial latency of the mock provider.
     */
    private Duration mockLatency = Duration.ofMillis(300);

    private ReviewPolicy reviewPolicy = ReviewPolicy.ALLOW_REPEAT;

    /**
     * Maximum number of (book, kind) states kept in memory.
     */
    private long stateCacheSize = 50_000L;

    private String hostedBaseUrl = "https://api.openai.com/v1";

    private String hostedApiKey = "";

    private String localBaseUrl = "http://localhost:11434";

    /**
     * Root directory that relative book content paths resolve against.
     */
    private String contentRoot = "./uploads";

    @PostConstruct
    void validate() {
        Assert.isTrue(recommendationAlpha >= 0.0 && recommendationAlpha <= 1.0,
                "app.intelligence.recommendation-alpha must be within [0, 1]");
        Assert.isTrue(retryMaxAttempts >= 1, "app.intelligence.retry-max-attempts must be at least 1");
        Assert.isTrue(!generationTimeout.isNegative() && !generationTimeout.isZero(),
                "app.intelligence.generation-timeout must be positive");
        Assert.isTrue(!retryInitialBackoff.isNegative(), "app.intelligence.retry-initial-backoff must be non-negative");
        Assert.isTrue(stateCacheSize > 0, "app.intelligence.state-cache-size must be positive");
    }

    public ProviderType getGenerationProvider() {
        return generationProvider;
    }

    public void setGenerationProvider(ProviderType generationProvider) {
        this.generationProvider = generationProvider != null ? generationProvider : ProviderType.MOCK;
    }

    public String getGenerationModel() {
        return generationModel;
    }

    public void setGenerationModel(String generationModel) {
        this.generationModel = generationModel;
    }

    public double getRecommendationAlpha() {
        return recommendationAlpha;
    }

    public void setRecommendationAlpha(double recommendationAlpha) {
        this.recommendationAlpha = recommendationAlpha;
    }

    public Duration getGenerationTimeout() {
        return generationTimeout;
    }

    public void setGenerationTimeout(Duration generationTimeout) {
        this.generationTimeout = generationTimeout != null ? generationTimeout : Duration.ofSeconds(120);
    }

    public int getRetryMaxAttempts() {
        return retryMaxAttempts;
    }

    public void setRetryMaxAttempts(int retryMaxAttempts) {
        this.retryMaxAttempts = retryMaxAttempts;
    }

    public Duration getRetryInitialBackoff() {
        return retryInitialBackoff;
    }

    public void setRetryInitialBackoff(Duration retryInitialBackoff) {
        this.retryInitialBackoff = retryInitialBackoff != null ? retryInitialBackoff : Duration.ofSeconds(2);
    }

    public int getMaxParallel() {
        return maxParallel;
    }

    public void setMaxParallel(int maxParallel) {
        this.maxParallel = maxParallel;
    }

    public int getMaxPending() {
        return maxPending;
    }

    public void setMaxPending(int maxPending) {
        this.maxPending = maxPending;
    }

    public Duration getMockLatency() {
        return mockLatency;
    }

    public void setMockLatency(Duration mockLatency) {
        this.mockLatency = mockLatency != null ? mockLatency : Duration.ZERO;
    }

    public ReviewPolicy getReviewPolicy() {
        return reviewPolicy;
    }

    public void setReviewPolicy(ReviewPolicy reviewPolicy) {
        this.reviewPolicy = reviewPolicy != null ? reviewPolicy : ReviewPolicy.ALLOW_REPEAT;
    }

    public long getStateCacheSize() {
        return stateCacheSize;
    }

    public void setStateCacheSize(long stateCacheSize) {
        this.stateCacheSize = stateCacheSize;
    }

    public String getHostedBaseUrl() {
        return hostedBaseUrl;
    }

    public void setHostedBaseUrl(String hostedBaseUrl) {
        this.hostedBaseUrl = hostedBaseUrl;
    }

    public String getHostedApiKey() {
        return hostedApiKey;
    }

    public void setHostedApiKey(String hostedApiKey) {
        this.hostedApiKey = hostedApiKey;
    }

    public String getLocalBaseUrl() {
        return localBaseUrl;
    }

    public void setLocalBaseUrl(String localBaseUrl) {
        this.localBaseUrl = localBaseUrl;
    }

    public String getContentRoot() {
        return contentRoot;
    }

    public void setContentRoot(String contentRoot) {
        this.contentRoot = contentRoot;
    }
}
