package io.binana.infrastructure.metrics;

import io.binana.domain.order.FailureType;
import io.binana.service.report.BatchReport;
import io.prometheus.client.CollectorRegistry;
import io.prometheus.client.Counter;
import io.prometheus.client.Gauge;
import io.prometheus.client.Histogram;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.concurrent.atomic.AtomicLong;

/**
 * Prometheus implementation of RebalanceMetrics.
 *
 * Key Metrics:
 * - binana_orders_total{symbol, outcome} - Order outcomes
 * - binana_order_failures_total{failure_type} - Failed submissions by cause
 * - binana_order_latency_seconds - Submission latency distribution
 * - binana_fetch_total{kind, status} - Fetch phase lookups
 * - binana_fetch_latency_seconds{kind} - Fetch latency distribution
 * - binana_last_run_* - Totals of the last batch
 *
 * Usage:
 * <pre>
 * PrometheusRebalanceMetrics metrics = new PrometheusRebalanceMetrics();
 * OrderExecutor executor = new OrderExecutor(exchangeClient, metrics);
 *
 * // at the end of the run
 * new MetricsFileExporter(metrics.getRegistry()).write(Path.of("/var/lib/node_exporter/binana.prom"));
 * </pre>
 */
public class PrometheusRebalanceMetrics implements RebalanceMetrics {
    private static final Logger log = LoggerFactory.getLogger(PrometheusRebalanceMetrics.class);

    private final CollectorRegistry registry;

    // Order metrics
    private final Counter orderCounter;
    private final Counter orderFailureCounter;
    private final Histogram orderLatency;

    // Fetch metrics
    private final Counter fetchCounter;
    private final Histogram fetchLatency;

    // Last run
    private final Gauge lastRunNotionalSpent;
    private final Gauge lastRunOrders;
    private final Gauge lastRunTimestamp;

    // In-memory totals for the log summary
    private final AtomicLong successfulOrders = new AtomicLong();
    private final AtomicLong failedOrders = new AtomicLong();
    private final AtomicLong rejectedOrders = new AtomicLong();
    private final AtomicLong fetchFailures = new AtomicLong();

    public PrometheusRebalanceMetrics() {
        this(CollectorRegistry.defaultRegistry);
    }

    public PrometheusRebalanceMetrics(CollectorRegistry registry) {
        this.registry = registry;

        this.orderCounter = Counter.build()
            .name("binana_orders_total")
            .help("Total number of orders by outcome")
            .labelNames("symbol", "outcome")
            .register(registry);

        this.orderFailureCounter = Counter.build()
            .name("binana_order_failures_total")
            .help("Total number of failed order submissions by cause")
            .labelNames("failure_type")
            .register(registry);

        this.orderLatency = Histogram.build()
            .name("binana_order_latency_seconds")
            .help("Order submission latency in seconds")
            .buckets(0.05, 0.1, 0.2, 0.5, 1.0, 2.0, 5.0, 10.0)
            .register(registry);

        this.fetchCounter = Counter.build()
            .name("binana_fetch_total")
            .help("Total number of fetch phase lookups")
            .labelNames("kind", "status")
            .register(registry);

        this.fetchLatency = Histogram.build()
            .name("binana_fetch_latency_seconds")
            .help("Fetch phase lookup latency in seconds")
            .labelNames("kind")
            .buckets(0.05, 0.1, 0.2, 0.5, 1.0, 2.0, 5.0)
            .register(registry);

        this.lastRunNotionalSpent = Gauge.build()
            .name("binana_last_run_notional_spent")
            .help("Quote currency spent on successful orders in the last run")
            .register(registry);

        this.lastRunOrders = Gauge.build()
            .name("binana_last_run_orders")
            .help("Orders of the last run by outcome")
            .labelNames("outcome")
            .register(registry);

        this.lastRunTimestamp = Gauge.build()
            .name("binana_last_run_timestamp_seconds")
            .help("Unix time the last run finished")
            .register(registry);
    }

    @Override
    public void recordOrderSuccess(String symbol, Duration latency) {
        orderCounter.labels(symbol, "success").inc();
        orderLatency.observe(latency.toMillis() / 1000.0);
        successfulOrders.incrementAndGet();
    }

    @Override
    public void recordOrderFailure(String symbol, FailureType failureType, Duration latency) {
        orderCounter.labels(symbol, "failed").inc();
        orderFailureCounter.labels(failureType.name()).inc();
        orderLatency.observe(latency.toMillis() / 1000.0);
        failedOrders.incrementAndGet();
    }

    @Override
    public void recordOrderRejected(String symbol, String reason) {
        orderCounter.labels(symbol, "rejected").inc();
        rejectedOrders.incrementAndGet();
        log.debug("[PrometheusRebalanceMetrics] Rejected {}: {}", symbol, reason);
    }

    @Override
    public void recordFetch(FetchKind kind, boolean success, Duration latency) {
        fetchCounter.labels(kind.name(), success ? "success" : "failure").inc();
        fetchLatency.labels(kind.name()).observe(latency.toMillis() / 1000.0);
        if (!success) {
            fetchFailures.incrementAndGet();
        }
    }

    @Override
    public void recordRun(BatchReport report) {
        lastRunNotionalSpent.set(report.totalNotionalSpent().doubleValue());
        lastRunOrders.labels("success").set(report.successCount());
        lastRunOrders.labels("failed").set(report.failedCount());
        lastRunOrders.labels("rejected").set(report.rejectedCount());
        lastRunTimestamp.set(Instant.now().getEpochSecond());
    }

    @Override
    public Map<String, Object> snapshot() {
        Map<String, Object> map = new LinkedHashMap<>();
        map.put("successfulOrders", successfulOrders.get());
        map.put("failedOrders", failedOrders.get());
        map.put("rejectedOrders", rejectedOrders.get());
        map.put("fetchFailures", fetchFailures.get());
        return map;
    }

    /**
     * Prometheus registry holding every binana collector.
     */
    public CollectorRegistry getRegistry() {
        return registry;
    }
}
