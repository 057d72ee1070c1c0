package net.luminalib.support.prompt;

/**
 * Raised when a prompt template references a placeholder the caller did not supply.
 *
 * <p>This is a programming error in the calling code and is never retried.</p>
 */
public class MissingPlaceholderException extends IllegalArgumentException {

    private final String templateName;
    private final String placeholder;

    public MissingPlaceholderException(String templateName, String placeholder) {
        super("Prompt template '%s' requires placeholder '%s'".formatted(templateName, placeholder));
        this.templateName = templateName;
        this.placeholder = placeholder;
    }

    public String getTemplateName() {
        return templateName;
    }

    public String getPlaceholder() {
        return placeholder;
    }
}
