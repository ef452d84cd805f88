package io.binana.config;

import io.binana.util.Env;

import java.math.BigDecimal;
import java.time.Duration;
import java.util.Locale;

/**
 * Runtime settings read from environment variables (or system properties).
 * Credentials are handled separately by SecretsManager.
 */
public record RebalancerConfig(
    String baseUrl,
    String quoteAsset,
    boolean testMode,
    boolean liveConfirmed,
    BigDecimal investmentAmount,   // dollars, cap on cash spent per run
    BigDecimal cashReserve,        // dollars always left in the quote balance
    PriceSourceType priceSource,
    String allocationFile,         // null = built-in allocation
    String secretsFile,            // null = environment only
    Duration httpTimeout,
    long recvWindowMs,
    String metricsFile             // null = no textfile export
) {
    public static final BigDecimal DEFAULT_INVESTMENT_AMOUNT = new BigDecimal("200");
    public static final BigDecimal DEFAULT_CASH_RESERVE = new BigDecimal("10");

    public static RebalancerConfig fromEnvironment() {
        String priceSource = Env.get("BINANA_PRICE_SOURCE", PriceSourceType.ORDER_BOOK.name());
        PriceSourceType priceSourceType;
        try {
            priceSourceType = PriceSourceType.valueOf(priceSource.trim().toUpperCase(Locale.ROOT));
        } catch (IllegalArgumentException e) {
            throw new IllegalStateException("Invalid BINANA_PRICE_SOURCE: " + priceSource
                + " (expected ORDER_BOOK or FORECAST)", e);
        }

        return new RebalancerConfig(
            Env.get("BINANA_BASE_URL", "https://api.binance.us"),
            Env.get("BINANA_QUOTE_ASSET", "USD"),
            Env.getBool("BINANA_TEST_MODE", true),
            Env.getBool("BINANA_LIVE_CONFIRMED", false),
            Env.getDecimal("BINANA_INVESTMENT_AMOUNT", DEFAULT_INVESTMENT_AMOUNT),
            Env.getDecimal("BINANA_CASH_RESERVE", DEFAULT_CASH_RESERVE),
            priceSourceType,
            Env.get("BINANA_ALLOCATION_FILE", null),
            Env.get("BINANA_SECRETS_FILE", null),
            Duration.ofSeconds(Env.getInt("BINANA_HTTP_TIMEOUT_SECONDS", 10)),
            Env.getInt("BINANA_RECV_WINDOW_MS", 5000),
            Env.get("BINANA_METRICS_FILE", null)
        );
    }
}
