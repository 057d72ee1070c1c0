package net.luminalib.domain.ai;

/**
 * Derived book fields maintained by the intelligence pipeline.
 */
public enum IntelligenceKind {
    SUMMARY,
    CONSENSUS
}
