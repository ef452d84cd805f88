package io.binana.application.port.output;

import java.math.BigDecimal;
import java.util.concurrent.CompletableFuture;

/**
 * Price used to size and limit-price buy orders.
 */
public interface PriceSource {

    /**
     * Unit price of the asset in the quote currency. Always positive.
     *
     * @param symbol Asset symbol (e.g. "BTC")
     */
    CompletableFuture<BigDecimal> getPrice(String symbol);

    /**
     * Short name for logs ("ORDER_BOOK", "FORECAST").
     */
    String getName();
}
