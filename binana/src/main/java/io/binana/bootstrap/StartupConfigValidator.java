package io.binana.bootstrap;

import io.binana.config.RebalancerConfig;
import io.binana.domain.portfolio.AssetPosition;
import io.binana.security.SecretsManager;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.math.BigDecimal;

/**
 * Validates configuration before any exchange call.
 * Throws IllegalStateException if configuration is invalid; the run does not start.
 */
public final class StartupConfigValidator {
    private static final Logger log = LoggerFactory.getLogger(StartupConfigValidator.class);

    /** Largest recvWindow Binance accepts. */
    static final long MAX_RECV_WINDOW_MS = 60_000L;

    /**
     * @throws IllegalStateException if configuration is invalid
     */
    public static void validate(RebalancerConfig config, SecretsManager secrets) {
        log.info("[StartupConfigValidator] Running startup config validation...");

        if (!config.testMode()) {
            if (!config.liveConfirmed()) {
                throw new IllegalStateException(
                    "INVALID CONFIG: BINANA_TEST_MODE=false places real orders and requires BINANA_LIVE_CONFIRMED=true\n" +
                    "Either:\n" +
                    "  1. Confirm live trading: set BINANA_LIVE_CONFIRMED=true\n" +
                    "  2. Keep test orders: set BINANA_TEST_MODE=true"
                );
            }
            log.warn("[StartupConfigValidator] LIVE MODE: orders will be placed for real");
        } else {
            log.info("[StartupConfigValidator] Test mode: orders are validated by the exchange but not placed");
        }

        if (config.investmentAmount() == null || config.investmentAmount().signum() <= 0) {
            throw new IllegalStateException("INVALID CONFIG: BINANA_INVESTMENT_AMOUNT must be positive, got "
                + config.investmentAmount());
        }
        if (config.cashReserve() == null || config.cashReserve().signum() < 0) {
            throw new IllegalStateException("INVALID CONFIG: BINANA_CASH_RESERVE must be >= 0, got "
                + config.cashReserve());
        }
        requireCents("BINANA_INVESTMENT_AMOUNT", config.investmentAmount());
        requireCents("BINANA_CASH_RESERVE", config.cashReserve());
        if (config.quoteAsset() == null || config.quoteAsset().isBlank()) {
            throw new IllegalStateException("INVALID CONFIG: BINANA_QUOTE_ASSET cannot be empty");
        }
        if (config.baseUrl() == null || !(config.baseUrl().startsWith("https://") || config.baseUrl().startsWith("http://"))) {
            throw new IllegalStateException("INVALID CONFIG: BINANA_BASE_URL must be an http(s) URL, got "
                + config.baseUrl());
        }
        if (!config.baseUrl().startsWith("https://")) {
            log.warn("[StartupConfigValidator] BINANA_BASE_URL is not HTTPS: {}", config.baseUrl());
        }
        if (config.httpTimeout().isNegative() || config.httpTimeout().isZero()) {
            throw new IllegalStateException("INVALID CONFIG: BINANA_HTTP_TIMEOUT_SECONDS must be positive");
        }
        if (config.recvWindowMs() <= 0 || config.recvWindowMs() > MAX_RECV_WINDOW_MS) {
            throw new IllegalStateException("INVALID CONFIG: BINANA_RECV_WINDOW_MS must be in 1.."
                + MAX_RECV_WINDOW_MS + ", got " + config.recvWindowMs());
        }

        secrets.validateRequired(SecretsManager.API_KEY, SecretsManager.API_SECRET);
        log.info("[StartupConfigValidator] API key: {}", secrets.getMasked(SecretsManager.API_KEY));

        log.info("[StartupConfigValidator] Startup config validation passed");
    }

    /**
     * Amounts are handled in whole cents as a long.
     */
    private static void requireCents(String name, BigDecimal amount) {
        try {
            AssetPosition.toCents(amount);
        } catch (ArithmeticException e) {
            throw new IllegalStateException("INVALID CONFIG: " + name + " is too large, got "
                + amount.toPlainString(), e);
        }
    }

    private StartupConfigValidator() {
        // Utility class - no instantiation
    }
}
