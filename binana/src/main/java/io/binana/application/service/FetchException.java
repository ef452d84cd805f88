package io.binana.application.service;

/**
 * A lookup required before ordering (balances, price, trading rule) failed.
 * Fatal for the run: no order is placed.
 */
public class FetchException extends RuntimeException {

    private final String symbol;

    public FetchException(String symbol, String message) {
        super(format(symbol, message));
        this.symbol = symbol;
    }

    public FetchException(String symbol, String message, Throwable cause) {
        super(format(symbol, message), cause);
        this.symbol = symbol;
    }

    /**
     * Symbol whose lookup failed, or null for account-wide lookups.
     */
    public String getSymbol() {
        return symbol;
    }

    private static String format(String symbol, String message) {
        return symbol == null
            ? String.format("Fetch failed: %s", message)
            : String.format("Fetch failed for %s: %s", symbol, message);
    }
}
