package io.binana.application.service;

import io.binana.domain.allocation.AllocationSpec;
import io.binana.domain.order.OrderRequest;
import io.binana.domain.order.OrderResult;
import io.binana.domain.order.SubmissionMode;
import io.binana.domain.order.TradingRule;
import io.binana.domain.portfolio.AssetPosition;
import io.binana.infrastructure.metrics.RebalanceMetrics;
import io.binana.service.balance.PortfolioBalancer;
import io.binana.service.execution.OrderExecutor;
import io.binana.service.report.BatchReport;
import io.binana.service.report.ResultAggregator;
import io.binana.service.validation.OrderValidator;
import io.binana.service.validation.ValidationResult;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.math.BigDecimal;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;

/**
 * Rebalancing pipeline: balancer, validator, executor, aggregator.
 *
 * Flow:
 * 1. PortfolioBalancer splits the investable cash across assets below target
 * 2. OrderValidator rounds each buy onto the exchange grid and checks the trading rule
 * 3. Rejected buys are reported without contacting the exchange
 * 4. OrderExecutor submits the remaining orders concurrently
 * 5. ResultAggregator builds the report from rejected and executed results
 */
public final class RebalanceService {
    private static final Logger log = LoggerFactory.getLogger(RebalanceService.class);

    private final PortfolioBalancer balancer;
    private final OrderValidator validator;
    private final OrderExecutor executor;
    private final ResultAggregator aggregator;
    private final RebalanceMetrics metrics;

    public RebalanceService(
        PortfolioBalancer balancer,
        OrderValidator validator,
        OrderExecutor executor,
        ResultAggregator aggregator,
        RebalanceMetrics metrics
    ) {
        this.balancer = balancer;
        this.validator = validator;
        this.executor = executor;
        this.aggregator = aggregator;
        this.metrics = metrics;
    }

    /**
     * Rebalance toward {@code spec} with {@code investableCash} and submit the resulting buys.
     *
     * @param positions Current holdings valued in cents
     * @param spec Verified target allocation
     * @param investableCash Cash to spend, in cents
     * @param mode Submission mode for every order
     * @param prices Unit price per symbol that may be bought
     * @param rules Trading rule per symbol that may be bought
     * @return Report covering every asset that received cash
     * @throws FetchException if an asset receiving cash has no price or rule
     */
    public BatchReport rebalance(
        List<AssetPosition> positions,
        AllocationSpec spec,
        long investableCash,
        SubmissionMode mode,
        Map<String, BigDecimal> prices,
        Map<String, TradingRule> rules
    ) {
        List<AssetPosition> balanced = balancer.balance(positions, spec, investableCash);
        return execute(balanced, mode, prices, rules);
    }

    /**
     * Validate and submit the buys of already balanced positions.
     */
    public BatchReport execute(
        List<AssetPosition> balanced,
        SubmissionMode mode,
        Map<String, BigDecimal> prices,
        Map<String, TradingRule> rules
    ) {
        List<OrderResult> rejected = new ArrayList<>();
        List<OrderRequest> accepted = new ArrayList<>();

        for (AssetPosition position : balanced) {
            if (!position.isBuying()) {
                continue;
            }

            BigDecimal price = prices.get(position.symbol());
            if (price == null) {
                throw new FetchException(position.symbol(), "no price available");
            }
            TradingRule rule = rules.get(position.symbol());
            if (rule == null) {
                throw new FetchException(position.symbol(), "no trading rule available");
            }

            ValidationResult validation = validator.validate(position, price, rule);
            if (validation.passed()) {
                accepted.add(validation.order());
            } else {
                OrderResult rejection = validation.rejection();
                metrics.recordOrderRejected(rejection.symbol(), rejection.reason());
                rejected.add(rejection);
            }
        }

        if (accepted.isEmpty()) {
            log.info("[RebalanceService] No valid orders to submit ({} rejected)", rejected.size());
        }

        List<OrderResult> all = new ArrayList<>(rejected);
        all.addAll(executor.executeAll(accepted, mode));

        BatchReport report = aggregator.aggregate(all, mode);
        metrics.recordRun(report);

        log.info("[RebalanceService] Batch {}: {} submitted ({} success, {} failed), {} rejected, spent ${}",
            report.status(), report.submittedCount(), report.successCount(), report.failedCount(),
            report.rejectedCount(),
            report.totalNotionalSpent().toPlainString());
        return report;
    }
}
