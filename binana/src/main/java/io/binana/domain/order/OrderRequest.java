package io.binana.domain.order;

import java.math.BigDecimal;

/**
 * Buy order that passed its trading rule, with price and quantity already on the exchange grid.
 */
public record OrderRequest(
    String symbol,
    BigDecimal quantity,
    BigDecimal price
) {
    public OrderRequest {
        if (symbol == null || symbol.isBlank()) {
            throw new IllegalArgumentException("Symbol cannot be null or empty");
        }
        if (quantity == null || quantity.signum() <= 0) {
            throw new IllegalArgumentException("Quantity must be positive");
        }
        if (price == null || price.signum() <= 0) {
            throw new IllegalArgumentException("Price must be positive");
        }
    }

    public BigDecimal notional() {
        return price.multiply(quantity);
    }
}
