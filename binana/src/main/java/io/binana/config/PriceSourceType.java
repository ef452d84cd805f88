package io.binana.config;

/**
 * Where order prices come from.
 */
public enum PriceSourceType {
    /** Mean of the best bids. */
    ORDER_BOOK,
    /** Polynomial extrapolation of recent trades. */
    FORECAST
}
