package io.binana.infrastructure.metrics;

import io.binana.domain.order.FailureType;
import io.binana.service.report.BatchReport;

import java.time.Duration;
import java.util.Map;

/**
 * Metrics of a rebalancing run.
 *
 * Implementations can publish to Prometheus (textfile collector), logs, etc.
 *
 * Key metrics:
 * - Order outcomes per symbol (success / failed / rejected)
 * - Order submission latency
 * - Fetch latency and failures per lookup kind
 * - Totals of the last run
 */
public interface RebalanceMetrics {

    /**
     * Record an order accepted by the exchange.
     *
     * @param symbol Asset symbol
     * @param latency Submission latency
     */
    void recordOrderSuccess(String symbol, Duration latency);

    /**
     * Record an order whose remote call failed.
     *
     * @param symbol Asset symbol
     * @param failureType Classified cause
     * @param latency Time to failure
     */
    void recordOrderFailure(String symbol, FailureType failureType, Duration latency);

    /**
     * Record an order rejected by a trading rule before submission.
     *
     * @param symbol Asset symbol
     * @param reason Rejection reason
     */
    void recordOrderRejected(String symbol, String reason);

    /**
     * Record a remote lookup of the fetch phase.
     *
     * @param kind Lookup kind
     * @param success Whether the lookup succeeded
     * @param latency Lookup latency
     */
    void recordFetch(FetchKind kind, boolean success, Duration latency);

    /**
     * Record the totals of a finished batch.
     */
    void recordRun(BatchReport report);

    /**
     * Counters of this process, for logging.
     */
    Map<String, Object> snapshot();

    enum FetchKind {
        BALANCES,
        PRICE,
        TRADING_RULE
    }
}
