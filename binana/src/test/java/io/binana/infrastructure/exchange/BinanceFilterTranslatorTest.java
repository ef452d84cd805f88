package io.binana.infrastructure.exchange;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import io.binana.domain.order.TradingRule;
import org.junit.jupiter.api.Test;

import java.math.BigDecimal;

import static org.junit.jupiter.api.Assertions.*;

class BinanceFilterTranslatorTest {

    private final ObjectMapper mapper = new ObjectMapper();

    @Test
    void testLegacyMinNotionalFilter() throws Exception {
        JsonNode info = mapper.readTree("""
            {"symbol": "ADAUSD", "filters": [
              {"filterType": "PRICE_FILTER", "minPrice": "0.00010000", "maxPrice": "0.00000000", "tickSize": "0.00010000"},
              {"filterType": "LOT_SIZE", "minQty": "0.10000000", "maxQty": "9000000.00000000", "stepSize": "0.10000000"},
              {"filterType": "MIN_NOTIONAL", "minNotional": "10.00000000"}
            ]}
            """);

        TradingRule rule = BinanceFilterTranslator.translate("ADA", info);

        assertFalse(rule.hasMaxPrice(), "maxPrice 0 means unbounded");
        assertTrue(rule.hasMaxQty());
        assertEquals(0, new BigDecimal("9000000").compareTo(rule.maxQty()));
        assertEquals(0, new BigDecimal("0.1").compareTo(rule.stepSize()));
        assertEquals(0, new BigDecimal("10").compareTo(rule.minNotional()));
    }

    @Test
    void testMissingFiltersAreUnrestricted() throws Exception {
        JsonNode info = mapper.readTree("""
            {"symbol": "SOLUSD", "filters": [{"filterType": "MAX_NUM_ORDERS", "maxNumOrders": 200}]}
            """);

        TradingRule rule = BinanceFilterTranslator.translate("SOL", info);

        assertEquals(0, rule.tickSize().signum());
        assertEquals(0, rule.minQty().signum());
        assertEquals(0, rule.minNotional().signum());
        assertFalse(rule.hasMaxPrice());
        assertFalse(rule.hasMaxQty());
    }

    @Test
    void testNoFilterListGivesUnrestrictedRule() throws Exception {
        JsonNode info = mapper.readTree("""
            {"symbol": "DOTUSD"}
            """);

        assertEquals(TradingRule.unrestricted("DOT"), BinanceFilterTranslator.translate("DOT", info));
    }
}
