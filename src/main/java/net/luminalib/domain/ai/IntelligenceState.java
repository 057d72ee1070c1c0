package net.luminalib.domain.ai;

/**
 * Lifecycle of one derived field for one book.
 *
 * <p>{@code IDLE} means no attempt has been made since the process started, which keeps an
 * absent summary after repeated failures ({@code FAILED}) distinguishable from one that was
 * never requested.</p>
 */
public enum IntelligenceState {
    IDLE,
    IN_FLIGHT,
    READY,
    FAILED
}
