package io.binana.domain.portfolio;

import java.math.BigDecimal;

/**
 * Balance of one asset on the exchange account.
 */
public record AccountBalance(
    String asset,
    BigDecimal free,
    BigDecimal locked
) {
    public AccountBalance {
        if (asset == null || asset.isBlank()) {
            throw new IllegalArgumentException("Asset cannot be null or empty");
        }
        free = free != null ? free : BigDecimal.ZERO;
        locked = locked != null ? locked : BigDecimal.ZERO;
    }

    /**
     * Shares held: free + locked.
     */
    public BigDecimal total() {
        return free.add(locked);
    }
}
