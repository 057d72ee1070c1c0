package net.luminalib.support.prompt;

import java.util.HashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Named, versioned prompt definition with {@code {placeholder}} variables.
 *
 * <p>Rendering is pure: the same inputs always produce the same messages and no I/O
 * happens here. Substitution is a single pass, so braces inside supplied values are
 * copied verbatim.</p>
 *
 * @param name unique identifier used in logs and the registry
 * @param version template revision for traceability
 * @param systemMessage persona and constraints sent as the system message
 * @param userTemplate user message with placeholders
 * @param maxOutputTokens output cap requested from the provider
 * @param inputTokenCap budget applied to the truncated input field
 * @param tags descriptive labels
 */
public record PromptTemplate(
    String name,
    String version,
    String systemMessage,
    String userTemplate,
    int maxOutputTokens,
    int inputTokenCap,
    List<String> tags
) {

    private static final Pattern PLACEHOLDER = Pattern.compile("\\{([A-Za-z_][A-Za-z0-9_]*)}");

    public PromptTemplate {
        if (name == null || name.isBlank()) {
            throw new IllegalArgumentException("name is required");
        }
        if (maxOutputTokens <= 0 || inputTokenCap <= 0) {
            throw new IllegalArgumentException("token caps must be positive for template " + name);
        }
        tags = tags == null ? List.of() : List.copyOf(tags);
    }

    /**
     * Returns the placeholder names referenced by the user template, in order of appearance.
     */
    public Set<String> placeholders() {
        Set<String> names = new LinkedHashSet<>();
        Matcher matcher = PLACEHOLDER.matcher(userTemplate);
        while (matcher.find()) {
            names.add(matcher.group(1));
        }
        return names;
    }

    /**
     * Renders the template without truncation.
     *
     * @throws MissingPlaceholderException when a referenced placeholder has no value
     */
    public RenderedPrompt render(Map<String, String> inputs) {
        Matcher matcher = PLACEHOLDER.matcher(userTemplate);
        StringBuilder user = new StringBuilder(userTemplate.length());
        while (matcher.find()) {
            String key = matcher.group(1);
            String value = inputs == null ? null : inputs.get(key);
            if (value == null) {
                throw new MissingPlaceholderException(name, key);
            }
            matcher.appendReplacement(user, Matcher.quoteReplacement(value));
        }
        matcher.appendTail(user);
        return new RenderedPrompt(name, version, systemMessage, user.toString(), maxOutputTokens);
    }

    /**
     * Renders the template after truncating {@code contentKey} to {@link #inputTokenCap()}.
     */
    public RenderedPrompt renderWithTruncation(String contentKey, Map<String, String> inputs) {
        Map<String, String> bounded = new HashMap<>(inputs == null ? Map.of() : inputs);
        String content = bounded.get(contentKey);
        if (content != null) {
            bounded.put(contentKey, TokenBudget.truncateToTokens(content, inputTokenCap));
        }
        return render(bounded);
    }
}
