package io.binana.infrastructure.price;

import io.binana.application.port.output.ExchangeClient;
import io.binana.application.port.output.PriceSource;
import io.binana.application.service.FetchException;

import java.math.BigDecimal;
import java.math.RoundingMode;
import java.util.List;
import java.util.concurrent.CompletableFuture;

/**
 * Price = mean of the best bid prices in the order book.
 * The quote asset itself is worth exactly 1.
 */
public final class OrderBookPriceSource implements PriceSource {

    static final int DEPTH = 15;
    private static final int SCALE = 8;

    private final ExchangeClient exchangeClient;
    private final String quoteAsset;

    public OrderBookPriceSource(ExchangeClient exchangeClient, String quoteAsset) {
        this.exchangeClient = exchangeClient;
        this.quoteAsset = quoteAsset;
    }

    @Override
    public CompletableFuture<BigDecimal> getPrice(String symbol) {
        if (symbol.equals(quoteAsset)) {
            return CompletableFuture.completedFuture(BigDecimal.ONE);
        }
        return exchangeClient.getBidPrices(symbol, DEPTH)
            .thenApply(bids -> averageBid(symbol, bids));
    }

    @Override
    public String getName() {
        return "ORDER_BOOK";
    }

    static BigDecimal averageBid(String symbol, List<BigDecimal> bids) {
        if (bids == null || bids.isEmpty()) {
            throw new FetchException(symbol, "order book has no bids");
        }
        BigDecimal sum = BigDecimal.ZERO;
        for (BigDecimal bid : bids) {
            sum = sum.add(bid);
        }
        return sum.divide(BigDecimal.valueOf(bids.size()), SCALE, RoundingMode.HALF_UP);
    }
}
