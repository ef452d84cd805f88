package io.binana.domain.order;

/**
 * Fate of one order in a batch.
 */
public enum OrderOutcome {
    SUCCESS,    // Accepted by the exchange
    REJECTED,   // Failed a trading rule, never sent
    FAILED      // Sent, but the remote call failed
}
