package net.luminalib.support.prompt;

/**
 * Approximate token accounting for prompt inputs.
 *
 * <p>Uses a fixed ratio of four characters per token instead of a model tokenizer. The
 * estimate is intentionally rough; it only has to keep rendered prompts safely inside a
 * model context window.</p>
 */
public final class TokenBudget {

    public static final int CHARS_PER_TOKEN = 4;
    public static final String TRUNCATION_MARKER = "\n\n[Content truncated for processing]";

    /** Sentence boundaries are only honoured when they keep at least this share of the window. */
    private static final double SENTENCE_BOUNDARY_THRESHOLD = 0.8;

    private TokenBudget() {
    }

    /**
     * Estimates the token count of {@code text}.
     */
    public static int estimateTokens(String text) {
        if (text == null || text.isEmpty()) {
            return 0;
        }
        return text.length() / CHARS_PER_TOKEN;
    }

    /**
     * Truncates {@code text} to roughly {@code maxTokens} tokens.
     *
     * <p>Text within budget is returned unchanged. Otherwise it is cut to
     * {@code maxTokens * 4} characters and, when the last sentence terminator in that
     * window lies beyond 80% of it, cut again just after the terminator. The visible
     * {@link #TRUNCATION_MARKER} is appended to every truncated result.</p>
     */
    public static String truncateToTokens(String text, int maxTokens) {
        if (text == null) {
            return "";
        }
        if (maxTokens <= 0) {
            throw new IllegalArgumentException("maxTokens must be positive but was " + maxTokens);
        }
        int maxChars = maxTokens * CHARS_PER_TOKEN;
        if (text.length() <= maxChars) {
            return text;
        }

        String truncated = text.substring(0, maxChars);
        int boundary = lastSentenceTerminator(truncated);
        if (boundary > maxChars * SENTENCE_BOUNDARY_THRESHOLD) {
            truncated = truncated.substring(0, boundary + 1);
        }
        return truncated + TRUNCATION_MARKER;
    }

    private static int lastSentenceTerminator(String text) {
        for (int index = text.length() - 1; index >= 0; index--) {
            char current = text.charAt(index);
            if (current == '.' || current == '!' || current == '?') {
                return index;
            }
        }
        return -1;
    }
}
