package io.binana.domain.order;

import java.math.BigDecimal;

/**
 * Exchange constraints for orders on one symbol.
 *
 * A zero tick or step size means the axis is not rounded. A null maximum means no upper bound.
 */
public record TradingRule(
    String symbol,
    BigDecimal tickSize,
    BigDecimal minPrice,
    BigDecimal maxPrice,
    BigDecimal stepSize,
    BigDecimal minQty,
    BigDecimal maxQty,
    BigDecimal minNotional
) {
    public TradingRule {
        if (symbol == null || symbol.isBlank()) {
            throw new IllegalArgumentException("Symbol cannot be null or empty");
        }
        tickSize = orZero(tickSize);
        minPrice = orZero(minPrice);
        stepSize = orZero(stepSize);
        minQty = orZero(minQty);
        minNotional = orZero(minNotional);
    }

    /**
     * Rule with no bounds and no rounding.
     */
    public static TradingRule unrestricted(String symbol) {
        return new TradingRule(symbol, null, null, null, null, null, null, null);
    }

    public boolean hasMaxPrice() {
        return maxPrice != null;
    }

    public boolean hasMaxQty() {
        return maxQty != null;
    }

    private static BigDecimal orZero(BigDecimal value) {
        return value != null ? value : BigDecimal.ZERO;
    }
}
