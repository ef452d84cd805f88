package io.binana.domain.order;

/**
 * How orders of a run are submitted.
 */
public enum SubmissionMode {
    TEST,   // Validated by the exchange, never executed
    LIVE    // Real order
}
