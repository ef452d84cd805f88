package io.binana.infrastructure.exchange;

import com.fasterxml.jackson.databind.JsonNode;
import io.binana.domain.order.TradingRule;

import java.math.BigDecimal;

/**
 * Translates a Binance symbol info node (tagged filter list) into a TradingRule.
 *
 * Filters used:
 * - PRICE_FILTER: tickSize, minPrice, maxPrice
 * - LOT_SIZE: stepSize, minQty, maxQty
 * - MIN_NOTIONAL or NOTIONAL: minNotional
 *
 * Binance disables a maximum by sending 0, which becomes "no upper bound".
 * A missing filter leaves its fields unrestricted.
 */
public final class BinanceFilterTranslator {

    public static TradingRule translate(String symbol, JsonNode symbolInfo) {
        JsonNode filters = symbolInfo.path("filters");
        if (!filters.isArray() || filters.isEmpty()) {
            return TradingRule.unrestricted(symbol);
        }

        BigDecimal tickSize = null;
        BigDecimal minPrice = null;
        BigDecimal maxPrice = null;
        BigDecimal stepSize = null;
        BigDecimal minQty = null;
        BigDecimal maxQty = null;
        BigDecimal minNotional = null;

        for (JsonNode filter : filters) {
            String filterType = filter.path("filterType").asText();
            switch (filterType) {
                case "PRICE_FILTER" -> {
                    tickSize = decimal(filter, "tickSize");
                    minPrice = decimal(filter, "minPrice");
                    maxPrice = upperBound(decimal(filter, "maxPrice"));
                }
                case "LOT_SIZE" -> {
                    stepSize = decimal(filter, "stepSize");
                    minQty = decimal(filter, "minQty");
                    maxQty = upperBound(decimal(filter, "maxQty"));
                }
                case "MIN_NOTIONAL", "NOTIONAL" -> {
                    if (minNotional == null) {
                        minNotional = decimal(filter, "minNotional");
                    }
                }
                default -> {
                    // other filters do not constrain a single limit buy
                }
            }
        }

        return new TradingRule(symbol, tickSize, minPrice, maxPrice, stepSize, minQty, maxQty, minNotional);
    }

    private static BigDecimal decimal(JsonNode node, String field) {
        JsonNode value = node.get(field);
        if (value == null || value.isNull() || value.asText().isBlank()) {
            return null;
        }
        return new BigDecimal(value.asText());
    }

    private static BigDecimal upperBound(BigDecimal value) {
        return value == null || value.signum() == 0 ? null : value;
    }

    private BinanceFilterTranslator() {}
}
