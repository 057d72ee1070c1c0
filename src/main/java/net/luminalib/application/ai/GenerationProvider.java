package net.luminalib.application.ai;

/**
 * Text generation capability shared by the mock, local-inference and hosted backends.
 *
 * <p>Implementations perform exactly one upstream call per invocation. Retry and timeout
 * policy belongs to callers.</p>
 */
public interface GenerationProvider {

    /**
     * Generates text for a system/user message pair.
     *
     * @param systemMessage persona and constraints
     * @param userMessage rendered user prompt
     * @param maxOutputTokens output cap requested from the model
     * @return generated text, never blank
     * @throws GenerationFailedException when the upstream call fails
     */
    String generate(String systemMessage, String userMessage, int maxOutputTokens);

    /**
     * Short provider label used in logs and metrics.
     */
    String providerName();

    /**
     * Indicates whether the provider is configured well enough to attempt calls.
     */
    default boolean isAvailable() {
        return true;
    }
}
