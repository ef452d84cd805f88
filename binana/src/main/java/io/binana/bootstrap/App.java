package io.binana.bootstrap;

import io.binana.application.port.output.ExchangeClient;
import io.binana.application.port.output.PriceSource;
import io.binana.application.service.FetchException;
import io.binana.application.service.RebalanceRunner;
import io.binana.application.service.RebalanceRunner.RunSettings;
import io.binana.application.service.RebalanceService;
import io.binana.application.service.RunOutcome;
import io.binana.config.AllocationLoader;
import io.binana.config.RebalancerConfig;
import io.binana.domain.allocation.AllocationSpec;
import io.binana.domain.allocation.InvalidAllocationException;
import io.binana.domain.order.SubmissionMode;
import io.binana.domain.portfolio.AssetPosition;
import io.binana.infrastructure.exchange.BinanceExchangeClient;
import io.binana.infrastructure.metrics.MetricsFileExporter;
import io.binana.infrastructure.metrics.PrometheusRebalanceMetrics;
import io.binana.infrastructure.price.OrderBookPriceSource;
import io.binana.infrastructure.price.PolynomialPriceForecaster;
import io.binana.security.SecretsManager;
import io.binana.service.balance.PortfolioBalancer;
import io.binana.service.execution.OrderExecutor;
import io.binana.service.report.ReportPrinter;
import io.binana.service.report.ResultAggregator;
import io.binana.service.validation.OrderValidator;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.Path;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;

/**
 * Entry point: one rebalancing run.
 *
 * Wiring:
 * - RebalancerConfig + SecretsManager, checked by StartupConfigValidator
 * - Binance.US REST client and the configured price source
 * - balancer, validator, executor, aggregator behind RebalanceService
 * - Prometheus metrics, optionally exported to a textfile
 *
 * Exit status is 1 on configuration, allocation or fetch errors and 0 otherwise,
 * including runs where some orders failed (those are in the report).
 */
public final class App {
    private static final Logger log = LoggerFactory.getLogger(App.class);

    public static void main(String[] args) {
        System.exit(run());
    }

    static int run() {
        Instant start = Instant.now();
        log.info("=== Binana rebalancer starting ===");

        RebalancerConfig config;
        SecretsManager secrets = new SecretsManager();
        AllocationSpec spec;
        RunSettings settings;
        try {
            config = RebalancerConfig.fromEnvironment();
            if (config.secretsFile() != null) {
                secrets.loadFromFile(Path.of(config.secretsFile()), SecretsManager.API_KEY, SecretsManager.API_SECRET);
            } else {
                secrets.loadFromEnvironment(SecretsManager.API_KEY, SecretsManager.API_SECRET);
            }
            StartupConfigValidator.validate(config, secrets);
            spec = new AllocationLoader().load(config.allocationFile() != null ? Path.of(config.allocationFile()) : null);
            settings = new RunSettings(
                config.testMode() ? SubmissionMode.TEST : SubmissionMode.LIVE,
                AssetPosition.toCents(config.investmentAmount()),
                AssetPosition.toCents(config.cashReserve()),
                config.quoteAsset()
            );
        } catch (IllegalStateException | IllegalArgumentException | InvalidAllocationException | IOException e) {
            log.error("STARTUP VALIDATION FAILED: {}", e.getMessage(), e);
            System.err.println("\n" + e.getMessage() + "\n");
            return 1;
        }

        PrometheusRebalanceMetrics metrics = new PrometheusRebalanceMetrics();

        ExchangeClient exchangeClient = new BinanceExchangeClient(
            config.baseUrl(),
            secrets.getRequired(SecretsManager.API_KEY),
            secrets.getRequired(SecretsManager.API_SECRET),
            config.quoteAsset(),
            config.httpTimeout(),
            config.recvWindowMs(),
            Clock.systemUTC()
        );
        PriceSource priceSource = switch (config.priceSource()) {
            case ORDER_BOOK -> new OrderBookPriceSource(exchangeClient, config.quoteAsset());
            case FORECAST -> new PolynomialPriceForecaster(exchangeClient, config.quoteAsset());
        };

        PortfolioBalancer balancer = new PortfolioBalancer();
        RebalanceService rebalanceService = new RebalanceService(
            balancer,
            new OrderValidator(),
            new OrderExecutor(exchangeClient, metrics),
            new ResultAggregator(),
            metrics
        );
        RebalanceRunner runner = new RebalanceRunner(exchangeClient, priceSource, balancer, rebalanceService, metrics);

        int exitCode = 0;
        try {
            RunOutcome outcome = runner.run(spec, settings);
            ReportPrinter printer = new ReportPrinter();
            printer.printReport(outcome.report());
            printer.printAllocation(spec, outcome.positions());
            if (outcome.context().isTest()) {
                log.info("TEST mode: orders were validated by the exchange, nothing was placed");
            }
        } catch (FetchException e) {
            log.error("Run aborted before ordering: {}", e.getMessage(), e);
            exitCode = 1;
        } catch (RuntimeException e) {
            log.error("Run failed", e);
            exitCode = 1;
        }

        exportMetrics(metrics, config.metricsFile());
        log.info("Runtime: {} ms", Duration.between(start, Instant.now()).toMillis());
        return exitCode;
    }

    private static void exportMetrics(PrometheusRebalanceMetrics metrics, String metricsFile) {
        log.info("Run metrics: {}", metrics.snapshot());
        if (metricsFile == null) {
            return;
        }
        try {
            new MetricsFileExporter(metrics.getRegistry()).write(Path.of(metricsFile));
            log.info("Metrics written to {}", metricsFile);
        } catch (IOException e) {
            log.warn("Failed to write metrics file {}: {}", metricsFile, e.getMessage());
        }
    }

    private App() {}
}
