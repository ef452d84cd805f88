package io.binana.service.report;

/**
 * Overall outcome of a batch.
 */
public enum BatchStatus {
    NO_ORDERS,      // Nothing was submitted (nothing to buy, or everything rejected)
    ALL_SUCCEEDED,
    PARTIAL,        // Some submitted orders failed
    ALL_FAILED
}
