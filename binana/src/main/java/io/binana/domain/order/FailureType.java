package io.binana.domain.order;

/**
 * Classified cause of a failed order submission.
 */
public enum FailureType {
    EXCHANGE_REJECTED,
    TIMEOUT,
    NETWORK,
    UNEXPECTED
}
