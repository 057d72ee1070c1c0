package net.luminalib.support.ai;

/**
 * Raised when a generation trigger arrives while the pending cap is already reached.
 */
public final class IntelligenceQueueCapacityExceededException extends IllegalStateException {

    private final int maxPending;
    private final int currentPending;

    public IntelligenceQueueCapacityExceededException(int maxPending, int currentPending) {
        super("Intelligence queue pending limit reached (pending=%d, max=%d)".formatted(currentPending, maxPending));
        this.maxPending = maxPending;
        this.currentPending = currentPending;
    }

    public int maxPending() {
        return maxPending;
    }

    public int currentPending() {
        return currentPending;
    }
}
