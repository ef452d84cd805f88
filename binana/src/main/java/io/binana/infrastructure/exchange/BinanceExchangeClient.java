package io.binana.infrastructure.exchange;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import io.binana.application.port.output.ExchangeClient;
import io.binana.application.port.output.ExchangeException;
import io.binana.domain.order.OrderRequest;
import io.binana.domain.order.SubmissionMode;
import io.binana.domain.order.TradingRule;
import io.binana.domain.portfolio.AccountBalance;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.math.BigDecimal;
import java.net.URI;
import java.net.URLEncoder;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.nio.charset.StandardCharsets;
import java.time.Clock;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;

/**
 * Binance.US spot REST client.
 *
 * Endpoints:
 * - GET  /api/v3/account        (signed) balances
 * - GET  /api/v3/depth          order book bids
 * - GET  /api/v3/aggTrades      recent aggregate trades
 * - GET  /api/v3/exchangeInfo   symbol filters
 * - POST /api/v3/order/test     (signed) validation-only order
 * - POST /api/v3/order          (signed) live order
 *
 * Markets are named asset + quote asset, e.g. BTC + USD = BTCUSD.
 * Non-2xx answers complete the future with an {@link ExchangeException} built from
 * the {"code": -1013, "msg": "..."} error payload.
 */
public class BinanceExchangeClient implements ExchangeClient {
    private static final Logger log = LoggerFactory.getLogger(BinanceExchangeClient.class);

    public static final String DEFAULT_BASE_URL = "https://api.binance.us";
    private static final String EXCHANGE_CODE = "BINANCE_US";
    private static final String API_KEY_HEADER = "X-MBX-APIKEY";

    private final ObjectMapper objectMapper = new ObjectMapper();
    private final HttpClient httpClient;
    private final String baseUrl;
    private final String apiKey;
    private final String quoteAsset;
    private final Duration requestTimeout;
    private final BinanceRequestSigner signer;

    /**
     * @param baseUrl REST root without trailing slash
     * @param apiKey API key sent in X-MBX-APIKEY
     * @param apiSecret Secret used to sign account and order requests
     * @param quoteAsset Quote currency of every market (e.g. "USD")
     * @param requestTimeout Per-request timeout
     * @param recvWindowMs Validity window of signed requests
     * @param clock Source of request timestamps
     */
    public BinanceExchangeClient(
        String baseUrl,
        String apiKey,
        String apiSecret,
        String quoteAsset,
        Duration requestTimeout,
        long recvWindowMs,
        Clock clock
    ) {
        this.baseUrl = stripTrailingSlash(baseUrl != null ? baseUrl : DEFAULT_BASE_URL);
        this.apiKey = apiKey;
        this.quoteAsset = quoteAsset;
        this.requestTimeout = requestTimeout;
        this.signer = new BinanceRequestSigner(apiSecret, recvWindowMs, clock);
        this.httpClient = HttpClient.newBuilder()
            .connectTimeout(requestTimeout)
            .build();
    }

    @Override
    public CompletableFuture<List<AccountBalance>> getBalances() {
        return signedGet("/api/v3/account", "").thenApply(body -> {
            List<AccountBalance> balances = new ArrayList<>();
            for (JsonNode b : body.path("balances")) {
                balances.add(new AccountBalance(
                    b.path("asset").asText(),
                    new BigDecimal(b.path("free").asText("0")),
                    new BigDecimal(b.path("locked").asText("0"))
                ));
            }
            log.debug("[BINANCE] Loaded {} balances", balances.size());
            return balances;
        });
    }

    @Override
    public CompletableFuture<List<BigDecimal>> getBidPrices(String symbol, int limit) {
        String query = "symbol=" + marketSymbol(symbol) + "&limit=" + limit;
        return publicGet("/api/v3/depth", query).thenApply(body -> {
            List<BigDecimal> bids = new ArrayList<>();
            for (JsonNode level : body.path("bids")) {
                // [price, quantity]
                bids.add(new BigDecimal(level.get(0).asText()));
            }
            return bids;
        });
    }

    @Override
    public CompletableFuture<List<BigDecimal>> getRecentTradePrices(String symbol, int limit) {
        String query = "symbol=" + marketSymbol(symbol) + "&limit=" + limit;
        return publicGet("/api/v3/aggTrades", query).thenApply(body -> {
            List<BigDecimal> prices = new ArrayList<>();
            for (JsonNode trade : body) {
                prices.add(new BigDecimal(trade.path("p").asText()));
            }
            return prices;
        });
    }

    @Override
    public CompletableFuture<TradingRule> getTradingRule(String symbol) {
        String market = marketSymbol(symbol);
        return publicGet("/api/v3/exchangeInfo", "symbol=" + market).thenApply(body -> {
            for (JsonNode info : body.path("symbols")) {
                if (market.equals(info.path("symbol").asText())) {
                    return BinanceFilterTranslator.translate(symbol, info);
                }
            }
            throw new ExchangeException(EXCHANGE_CODE, 200, 0, "Symbol " + market + " not listed");
        });
    }

    @Override
    public CompletableFuture<JsonNode> submitOrder(OrderRequest request, SubmissionMode mode) {
        String path = mode == SubmissionMode.LIVE ? "/api/v3/order" : "/api/v3/order/test";
        String params = "symbol=" + marketSymbol(request.symbol())
            + "&side=BUY"
            + "&type=LIMIT"
            + "&timeInForce=GTC"
            + "&quantity=" + encode(request.quantity().toPlainString())
            + "&price=" + encode(request.price().toPlainString());

        log.info("[BINANCE] {} order: {} {} @ {}", mode, request.quantity().toPlainString(),
            request.symbol(), request.price().toPlainString());

        HttpRequest httpRequest = HttpRequest.newBuilder()
            .uri(URI.create(baseUrl + path + "?" + signer.sign(params)))
            .header(API_KEY_HEADER, apiKey)
            .header("Accept", "application/json")
            .timeout(requestTimeout)
            .POST(HttpRequest.BodyPublishers.noBody())
            .build();
        return send(httpRequest);
    }

    @Override
    public String getExchangeCode() {
        return EXCHANGE_CODE;
    }

    String marketSymbol(String symbol) {
        return symbol + quoteAsset;
    }

    private CompletableFuture<JsonNode> publicGet(String path, String query) {
        HttpRequest request = HttpRequest.newBuilder()
            .uri(URI.create(baseUrl + path + (query.isEmpty() ? "" : "?" + query)))
            .header("Accept", "application/json")
            .timeout(requestTimeout)
            .GET()
            .build();
        return send(request);
    }

    private CompletableFuture<JsonNode> signedGet(String path, String params) {
        HttpRequest request = HttpRequest.newBuilder()
            .uri(URI.create(baseUrl + path + "?" + signer.sign(params)))
            .header(API_KEY_HEADER, apiKey)
            .header("Accept", "application/json")
            .timeout(requestTimeout)
            .GET()
            .build();
        return send(request);
    }

    private CompletableFuture<JsonNode> send(HttpRequest request) {
        return httpClient.sendAsync(request, HttpResponse.BodyHandlers.ofString())
            .thenApply(response -> {
                int status = response.statusCode();
                JsonNode body = parse(response.body(), status);
                if (status >= 400) {
                    int code = body.path("code").asInt(0);
                    String msg = body.path("msg").asText(response.body());
                    log.warn("[BINANCE] {} {} failed: HTTP {} code {} {}",
                        request.method(), request.uri().getPath(), status, code, msg);
                    throw new ExchangeException(EXCHANGE_CODE, status, code, msg);
                }
                return body;
            });
    }

    private JsonNode parse(String body, int status) {
        if (body == null || body.isBlank()) {
            return objectMapper.createObjectNode();
        }
        try {
            return objectMapper.readTree(body);
        } catch (JsonProcessingException e) {
            if (status >= 400) {
                // error pages are not always JSON
                return objectMapper.createObjectNode().put("msg", body);
            }
            throw new CompletionException(new IOException("Malformed response from exchange", e));
        }
    }

    private static String encode(String value) {
        return URLEncoder.encode(value, StandardCharsets.UTF_8);
    }

    private static String stripTrailingSlash(String url) {
        return url.endsWith("/") ? url.substring(0, url.length() - 1) : url;
    }
}
