package net.luminalib.support.prompt;

import java.nio.charset.StandardCharsets;
import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;
import java.util.HexFormat;

/**
 * Provider-agnostic system/user message pair produced from a {@link PromptTemplate}.
 */
public record RenderedPrompt(
    String templateName,
    String templateVersion,
    String systemMessage,
    String userMessage,
    int maxOutputTokens
) {

    /**
     * SHA-256 of both messages, used to correlate log lines for one prompt.
     */
    public String fingerprint() {
        try {
            MessageDigest digest = MessageDigest.getInstance("SHA-256");
            digest.update(systemMessage.getBytes(StandardCharsets.UTF_8));
            digest.update((byte) 0);
            digest.update(userMessage.getBytes(StandardCharsets.UTF_8));
            return HexFormat.of().formatHex(digest.digest());
        } catch (NoSuchAlgorithmException exception) {
            throw new IllegalStateException("SHA-256 unavailable", exception);
        }
    }

    public int estimatedInputTokens() {
        return TokenBudget.estimateTokens(systemMessage) + TokenBudget.estimateTokens(userMessage);
    }
}
