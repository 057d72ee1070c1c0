package net.luminalib.domain.interaction;

/**
 * Kinds of reader activity recorded in the interaction log.
 */
public enum InteractionType {
    BORROW,
    REVIEW,
    RETURN
}
