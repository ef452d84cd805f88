package io.binana.application.service;

import io.binana.application.port.output.ExchangeClient;
import io.binana.application.port.output.PriceSource;
import io.binana.domain.allocation.AllocationSpec;
import io.binana.domain.order.SubmissionMode;
import io.binana.domain.order.TradingRule;
import io.binana.domain.portfolio.AccountBalance;
import io.binana.domain.portfolio.AssetPosition;
import io.binana.domain.run.RunContext;
import io.binana.infrastructure.metrics.RebalanceMetrics;
import io.binana.infrastructure.metrics.RebalanceMetrics.FetchKind;
import io.binana.service.balance.PortfolioBalancer;
import io.binana.service.report.BatchReport;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.math.BigDecimal;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;

/**
 * One complete rebalancing run against the exchange.
 *
 * Flow:
 * 1. Fetch phase: balances, a price per targeted symbol and a trading rule per targeted symbol,
 *    all issued concurrently. Any failure aborts the run before an order is placed.
 * 2. Investable cash = min(configured investment, quote balance - cash reserve), never negative.
 * 3. Held assets are valued at their price. Assets held outside the allocation are priced
 *    best effort and left out of the total when their price is unavailable.
 * 4. RebalanceService balances, validates and submits.
 */
public final class RebalanceRunner {
    private static final Logger log = LoggerFactory.getLogger(RebalanceRunner.class);

    private final ExchangeClient exchangeClient;
    private final PriceSource priceSource;
    private final PortfolioBalancer balancer;
    private final RebalanceService rebalanceService;
    private final RebalanceMetrics metrics;

    public RebalanceRunner(
        ExchangeClient exchangeClient,
        PriceSource priceSource,
        PortfolioBalancer balancer,
        RebalanceService rebalanceService,
        RebalanceMetrics metrics
    ) {
        this.exchangeClient = exchangeClient;
        this.priceSource = priceSource;
        this.balancer = balancer;
        this.rebalanceService = rebalanceService;
        this.metrics = metrics;
    }

    /**
     * Execute a run.
     *
     * @param spec Verified target allocation
     * @param settings Mode, investment cap, cash reserve and quote asset
     * @return Balanced positions and the batch report
     * @throws FetchException if a required lookup fails (no order is placed)
     */
    public RunOutcome run(AllocationSpec spec, RunSettings settings) {
        List<String> symbols = spec.listSymbols();
        log.info("[RebalanceRunner] Fetching balances, {} prices ({}) and {} trading rules from {}",
            symbols.size(), priceSource.getName(), symbols.size(), exchangeClient.getExchangeCode());

        CompletableFuture<List<AccountBalance>> balancesFuture =
            timed(FetchKind.BALANCES, null, exchangeClient.getBalances());

        Map<String, CompletableFuture<BigDecimal>> priceFutures = new LinkedHashMap<>();
        Map<String, CompletableFuture<TradingRule>> ruleFutures = new LinkedHashMap<>();
        for (String symbol : symbols) {
            priceFutures.put(symbol, timed(FetchKind.PRICE, symbol, fetchPrice(symbol)));
            ruleFutures.put(symbol, timed(FetchKind.TRADING_RULE, symbol, fetchRule(symbol)));
        }

        List<CompletableFuture<?>> all = new ArrayList<>();
        all.add(balancesFuture);
        all.addAll(priceFutures.values());
        all.addAll(ruleFutures.values());
        await(all);

        List<AccountBalance> balances = balancesFuture.join();
        Map<String, BigDecimal> prices = collect(priceFutures);
        Map<String, TradingRule> rules = collect(ruleFutures);

        RunContext context = new RunContext(settings.mode(),
            investableCash(balances, settings), settings.quoteAsset());
        log.info("[RebalanceRunner] Investable cash: ${} ({} mode)",
            AssetPosition.toDollars(context.investableCash()).toPlainString(), context.mode());

        List<AssetPosition> positions = buildPositions(balances, prices, spec, context);

        List<AssetPosition> balanced = balancer.balance(positions, spec, context.investableCash());
        BatchReport report = rebalanceService.execute(balanced, context.mode(), prices, rules);
        return new RunOutcome(context, balanced, report);
    }

    /**
     * min(investment cap, quote balance - reserve), floored at 0. All in cents.
     */
    static long investableCash(List<AccountBalance> balances, RunSettings settings) {
        long quoteCents = 0L;
        for (AccountBalance balance : balances) {
            if (balance.asset().equals(settings.quoteAsset())) {
                quoteCents = AssetPosition.toCents(balance.total());
            }
        }
        long available = quoteCents - settings.cashReserve();
        return Math.max(0L, Math.min(settings.investmentAmount(), available));
    }

    private List<AssetPosition> buildPositions(List<AccountBalance> balances, Map<String, BigDecimal> prices,
                                               AllocationSpec spec, RunContext context) {
        List<AccountBalance> held = new ArrayList<>();
        Map<String, CompletableFuture<BigDecimal>> extraPrices = new LinkedHashMap<>();
        for (AccountBalance balance : balances) {
            if (balance.asset().equals(context.quoteAsset()) || balance.total().signum() <= 0) {
                continue;
            }
            held.add(balance);
            if (!spec.contains(balance.asset())) {
                extraPrices.put(balance.asset(), fetchOptionalPrice(balance.asset()));
            }
        }
        CompletableFuture.allOf(extraPrices.values().toArray(new CompletableFuture[0])).join();

        List<AssetPosition> positions = new ArrayList<>();
        for (AccountBalance balance : held) {
            BigDecimal price = prices.containsKey(balance.asset())
                ? prices.get(balance.asset())
                : extraPrices.get(balance.asset()).join();
            if (price == null) {
                log.warn("[RebalanceRunner] No price for {} (outside allocation), excluded from total value",
                    balance.asset());
                continue;
            }
            positions.add(AssetPosition.held(balance.asset(), balance.total(), price));
        }
        return positions;
    }

    private CompletableFuture<BigDecimal> fetchPrice(String symbol) {
        return priceSource.getPrice(symbol).thenApply(price -> {
            if (price == null || price.signum() <= 0) {
                throw new FetchException(symbol, "non-positive price " + price);
            }
            return price;
        });
    }

    private CompletableFuture<TradingRule> fetchRule(String symbol) {
        return exchangeClient.getTradingRule(symbol);
    }

    private CompletableFuture<BigDecimal> fetchOptionalPrice(String symbol) {
        return timed(FetchKind.PRICE, symbol, fetchPrice(symbol))
            .exceptionally(error -> {
                log.warn("[RebalanceRunner] Price lookup for {} failed: {}", symbol, unwrap(error).getMessage());
                return null;
            });
    }

    /**
     * Record latency and wrap any failure into a FetchException naming the symbol.
     */
    private <T> CompletableFuture<T> timed(FetchKind kind, String symbol, CompletableFuture<T> future) {
        Instant start = Instant.now();
        return future.handle((value, error) -> {
            Duration latency = Duration.between(start, Instant.now());
            metrics.recordFetch(kind, error == null, latency);
            if (error != null) {
                Throwable cause = unwrap(error);
                if (cause instanceof FetchException fetchException) {
                    throw fetchException;
                }
                throw new FetchException(symbol, kind.name().toLowerCase() + " lookup failed: " + cause.getMessage(), cause);
            }
            return value;
        });
    }

    private static void await(List<CompletableFuture<?>> futures) {
        try {
            CompletableFuture.allOf(futures.toArray(new CompletableFuture[0])).join();
        } catch (CompletionException e) {
            Throwable cause = unwrap(e);
            if (cause instanceof FetchException fetchException) {
                throw fetchException;
            }
            throw new FetchException(null, cause.getMessage(), cause);
        }
    }

    private static <T> Map<String, T> collect(Map<String, CompletableFuture<T>> futures) {
        Map<String, T> values = new LinkedHashMap<>();
        futures.forEach((symbol, future) -> values.put(symbol, future.join()));
        return values;
    }

    private static Throwable unwrap(Throwable error) {
        Throwable current = error;
        while (current instanceof CompletionException && current.getCause() != null) {
            current = current.getCause();
        }
        return current;
    }

    /**
     * Run settings from configuration. Amounts in cents.
     */
    public record RunSettings(
        SubmissionMode mode,
        long investmentAmount,
        long cashReserve,
        String quoteAsset
    ) {
        public RunSettings {
            if (mode == null) {
                throw new IllegalArgumentException("Submission mode cannot be null");
            }
            if (investmentAmount < 0 || cashReserve < 0) {
                throw new IllegalArgumentException("Investment amount and cash reserve must be >= 0");
            }
            if (quoteAsset == null || quoteAsset.isBlank()) {
                throw new IllegalArgumentException("Quote asset cannot be null or empty");
            }
        }
    }
}
