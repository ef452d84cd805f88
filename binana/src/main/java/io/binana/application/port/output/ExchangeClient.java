package io.binana.application.port.output;

import com.fasterxml.jackson.databind.JsonNode;
import io.binana.domain.order.OrderRequest;
import io.binana.domain.order.SubmissionMode;
import io.binana.domain.order.TradingRule;
import io.binana.domain.portfolio.AccountBalance;

import java.math.BigDecimal;
import java.util.List;
import java.util.concurrent.CompletableFuture;

/**
 * Exchange operations needed by a rebalancing run.
 *
 * Symbols are asset symbols (e.g. "BTC"); implementations pair them with the quote asset.
 * All calls are asynchronous and may be issued concurrently on one client instance.
 * Failures complete the future exceptionally.
 */
public interface ExchangeClient {

    /**
     * Balances of every asset on the account, including zero balances.
     */
    CompletableFuture<List<AccountBalance>> getBalances();

    /**
     * Best bid prices, highest first.
     *
     * @param symbol Asset symbol
     * @param limit Number of levels
     */
    CompletableFuture<List<BigDecimal>> getBidPrices(String symbol, int limit);

    /**
     * Prices of the most recent aggregate trades, oldest first.
     *
     * @param symbol Asset symbol
     * @param limit Number of trades
     */
    CompletableFuture<List<BigDecimal>> getRecentTradePrices(String symbol, int limit);

    /**
     * Trading constraints for the symbol's market.
     */
    CompletableFuture<TradingRule> getTradingRule(String symbol);

    /**
     * Submit a limit buy order.
     *
     * @param request Order on the exchange price/quantity grid
     * @param mode TEST for a validation-only order, LIVE for a real one
     * @return Raw exchange response
     */
    CompletableFuture<JsonNode> submitOrder(OrderRequest request, SubmissionMode mode);

    /**
     * Exchange identifier used in logs and metrics.
     */
    String getExchangeCode();
}
