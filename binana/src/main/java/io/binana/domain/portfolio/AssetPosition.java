package io.binana.domain.portfolio;

import java.math.BigDecimal;
import java.math.RoundingMode;

/**
 * Holding of one asset for the current run.
 *
 * Values are integer cents. {@code amountToInvest} is filled in by the balancer
 * and stays 0 for assets that are not bought this cycle.
 */
public record AssetPosition(
    String symbol,
    BigDecimal quantity,
    long valueCents,
    long amountToInvest
) {
    public AssetPosition {
        if (symbol == null || symbol.isBlank()) {
            throw new IllegalArgumentException("Symbol cannot be null or empty");
        }
        if (quantity == null) {
            quantity = BigDecimal.ZERO;
        }
        if (valueCents < 0) {
            throw new IllegalArgumentException("Value cannot be negative: " + symbol);
        }
        if (amountToInvest < 0) {
            throw new IllegalArgumentException("Amount to invest cannot be negative: " + symbol);
        }
    }

    /**
     * Position valued at the given unit price. The value is truncated to whole cents.
     */
    public static AssetPosition held(String symbol, BigDecimal quantity, BigDecimal price) {
        return new AssetPosition(symbol, quantity, toCents(quantity.multiply(price)), 0L);
    }

    /**
     * Asset that is targeted but not held yet.
     */
    public static AssetPosition empty(String symbol) {
        return new AssetPosition(symbol, BigDecimal.ZERO, 0L, 0L);
    }

    public AssetPosition withAmountToInvest(long cents) {
        return new AssetPosition(symbol, quantity, valueCents, cents);
    }

    public boolean isBuying() {
        return amountToInvest > 0;
    }

    /**
     * Value after this cycle's purchase, in cents.
     */
    public long valueAfterInvestment() {
        return valueCents + amountToInvest;
    }

    public static long toCents(BigDecimal dollars) {
        return dollars.movePointRight(2).setScale(0, RoundingMode.DOWN).longValueExact();
    }

    public static BigDecimal toDollars(long cents) {
        return BigDecimal.valueOf(cents, 2);
    }
}
