package io.binana.infrastructure.exchange;

import com.fasterxml.jackson.databind.JsonNode;
import io.binana.application.port.output.ExchangeException;
import io.binana.domain.order.OrderRequest;
import io.binana.domain.order.SubmissionMode;
import io.binana.domain.order.TradingRule;
import io.binana.domain.portfolio.AccountBalance;
import okhttp3.mockwebserver.MockResponse;
import okhttp3.mockwebserver.MockWebServer;
import okhttp3.mockwebserver.RecordedRequest;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.io.IOException;
import java.math.BigDecimal;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.List;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.TimeUnit;

import static org.junit.jupiter.api.Assertions.*;

class BinanceExchangeClientTest {

    private static final String API_KEY = "test-api-key";
    private static final String API_SECRET = "test-api-secret";
    private static final long NOW = 1_700_000_000_000L;

    private MockWebServer server;
    private BinanceExchangeClient client;

    @BeforeEach
    void setUp() throws IOException {
        server = new MockWebServer();
        server.start();
        String baseUrl = server.url("/").toString();
        client = new BinanceExchangeClient(baseUrl, API_KEY, API_SECRET, "USD",
            Duration.ofSeconds(5), 5000L, Clock.fixed(Instant.ofEpochMilli(NOW), ZoneOffset.UTC));
    }

    @AfterEach
    void tearDown() throws IOException {
        server.shutdown();
    }

    private void enqueueJson(int status, String body) {
        server.enqueue(new MockResponse()
            .setResponseCode(status)
            .setHeader("Content-Type", "application/json")
            .setBody(body));
    }

    private RecordedRequest takeRequest() throws InterruptedException {
        RecordedRequest request = server.takeRequest(5, TimeUnit.SECONDS);
        assertNotNull(request, "No request reached the server");
        return request;
    }

    @Test
    void testGetBalancesSendsSignedRequest() throws Exception {
        enqueueJson(200, """
            {"balances": [
              {"asset": "USD", "free": "110.50", "locked": "0.00"},
              {"asset": "BTC", "free": "0.001", "locked": "0.0005"}
            ]}
            """);

        List<AccountBalance> balances = client.getBalances().get(5, TimeUnit.SECONDS);

        assertEquals(2, balances.size());
        assertEquals(new BigDecimal("110.50"), balances.get(0).free());
        assertEquals(new BigDecimal("0.0015"), balances.get(1).total());

        RecordedRequest request = takeRequest();
        assertEquals("GET", request.getMethod());
        assertEquals("/api/v3/account", request.getRequestUrl().encodedPath());
        assertEquals(API_KEY, request.getHeader("X-MBX-APIKEY"));
        assertEquals(String.valueOf(NOW), request.getRequestUrl().queryParameter("timestamp"));
        assertEquals("5000", request.getRequestUrl().queryParameter("recvWindow"));

        String expected = new BinanceRequestSigner(API_SECRET, 5000L, Clock.systemUTC())
            .hmacSha256Hex("timestamp=" + NOW + "&recvWindow=5000");
        assertEquals(expected, request.getRequestUrl().queryParameter("signature"));
    }

    @Test
    void testTestModeOrderGoesToTestEndpoint() throws Exception {
        enqueueJson(200, "{}");
        OrderRequest order = new OrderRequest("BTC", new BigDecimal("0.00125"), new BigDecimal("40000.00"));

        JsonNode response = client.submitOrder(order, SubmissionMode.TEST).get(5, TimeUnit.SECONDS);

        assertTrue(response.isObject());
        RecordedRequest request = takeRequest();
        assertEquals("POST", request.getMethod());
        assertEquals("/api/v3/order/test", request.getRequestUrl().encodedPath());
        assertEquals("BTCUSD", request.getRequestUrl().queryParameter("symbol"));
        assertEquals("BUY", request.getRequestUrl().queryParameter("side"));
        assertEquals("LIMIT", request.getRequestUrl().queryParameter("type"));
        assertEquals("GTC", request.getRequestUrl().queryParameter("timeInForce"));
        assertEquals("0.00125", request.getRequestUrl().queryParameter("quantity"));
        assertEquals("40000.00", request.getRequestUrl().queryParameter("price"));
        assertNotNull(request.getRequestUrl().queryParameter("signature"));
    }

    @Test
    void testLiveModeOrderGoesToOrderEndpoint() throws Exception {
        enqueueJson(200, "{\"orderId\": 42, \"status\": \"NEW\"}");
        OrderRequest order = new OrderRequest("ETH", new BigDecimal("0.0125"), new BigDecimal("2000.00"));

        JsonNode response = client.submitOrder(order, SubmissionMode.LIVE).get(5, TimeUnit.SECONDS);

        assertEquals(42, response.path("orderId").asInt());
        assertEquals("/api/v3/order", takeRequest().getRequestUrl().encodedPath());
    }

    @Test
    void testErrorPayloadBecomesExchangeException() {
        enqueueJson(400, "{\"code\": -1013, \"msg\": \"Filter failure: NOTIONAL\"}");
        OrderRequest order = new OrderRequest("BTC", new BigDecimal("0.0001"), new BigDecimal("40000"));

        ExecutionException e = assertThrows(ExecutionException.class,
            () -> client.submitOrder(order, SubmissionMode.TEST).get(5, TimeUnit.SECONDS));

        ExchangeException cause = assertInstanceOf(ExchangeException.class, e.getCause());
        assertEquals(400, cause.getHttpStatus());
        assertEquals(-1013, cause.getErrorCode());
        assertTrue(cause.getMessage().contains("Filter failure: NOTIONAL"), cause.getMessage());
    }

    @Test
    void testNonJsonErrorBodyStillMapped() {
        server.enqueue(new MockResponse().setResponseCode(503).setBody("Service Unavailable"));

        ExecutionException e = assertThrows(ExecutionException.class,
            () -> client.getBalances().get(5, TimeUnit.SECONDS));

        ExchangeException cause = assertInstanceOf(ExchangeException.class, e.getCause());
        assertEquals(503, cause.getHttpStatus());
        assertEquals(0, cause.getErrorCode());
    }

    @Test
    void testGetTradingRuleTranslatesFilters() throws Exception {
        enqueueJson(200, """
            {"symbols": [{
              "symbol": "BTCUSD",
              "filters": [
                {"filterType": "PRICE_FILTER", "minPrice": "0.01000000", "maxPrice": "100000.00000000", "tickSize": "0.01000000"},
                {"filterType": "LOT_SIZE", "minQty": "0.00000100", "maxQty": "0.00000000", "stepSize": "0.00000100"},
                {"filterType": "NOTIONAL", "minNotional": "1.00000000", "applyMinToMarket": true}
              ]
            }]}
            """);

        TradingRule rule = client.getTradingRule("BTC").get(5, TimeUnit.SECONDS);

        assertEquals("BTC", rule.symbol());
        assertEquals(0, new BigDecimal("0.01").compareTo(rule.tickSize()));
        assertEquals(0, new BigDecimal("100000").compareTo(rule.maxPrice()));
        assertFalse(rule.hasMaxQty(), "maxQty 0 means unbounded");
        assertEquals(0, BigDecimal.ONE.compareTo(rule.minNotional()));
        assertEquals("BTCUSD", takeRequest().getRequestUrl().queryParameter("symbol"));
    }

    @Test
    void testUnlistedSymbolFails() {
        enqueueJson(200, "{\"symbols\": []}");

        ExecutionException e = assertThrows(ExecutionException.class,
            () -> client.getTradingRule("XYZ").get(5, TimeUnit.SECONDS));

        assertInstanceOf(ExchangeException.class, e.getCause());
    }

    @Test
    void testGetBidPricesReadsBidLevels() throws Exception {
        enqueueJson(200, """
            {"lastUpdateId": 1, "bids": [["30000.10", "0.5"], ["30000.00", "1.2"]], "asks": [["30001.00", "0.3"]]}
            """);

        List<BigDecimal> bids = client.getBidPrices("BTC", 15).get(5, TimeUnit.SECONDS);

        assertEquals(List.of(new BigDecimal("30000.10"), new BigDecimal("30000.00")), bids);
        RecordedRequest request = takeRequest();
        assertEquals("/api/v3/depth", request.getRequestUrl().encodedPath());
        assertEquals("15", request.getRequestUrl().queryParameter("limit"));
        assertNull(request.getHeader("X-MBX-APIKEY"), "Public endpoints are not signed");
    }

    @Test
    void testGetRecentTradePrices() throws Exception {
        enqueueJson(200, """
            [{"a": 1, "p": "2000.00", "q": "1"}, {"a": 2, "p": "2001.50", "q": "0.3"}]
            """);

        List<BigDecimal> prices = client.getRecentTradePrices("ETH", 50).get(5, TimeUnit.SECONDS);

        assertEquals(List.of(new BigDecimal("2000.00"), new BigDecimal("2001.50")), prices);
        assertEquals("/api/v3/aggTrades", takeRequest().getRequestUrl().encodedPath());
    }
}
