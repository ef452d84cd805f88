package io.binana.service.execution;

import com.fasterxml.jackson.databind.JsonNode;
import io.binana.application.port.output.ExchangeClient;
import io.binana.application.port.output.ExchangeException;
import io.binana.domain.order.FailureType;
import io.binana.domain.order.OrderRequest;
import io.binana.domain.order.OrderResult;
import io.binana.domain.order.SubmissionMode;
import io.binana.infrastructure.metrics.RebalanceMetrics;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.net.http.HttpTimeoutException;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.TimeoutException;

/**
 * Submits a batch of validated orders concurrently.
 *
 * Each order is an independent unit of work: a failing remote call becomes a FAILED result
 * for that order only and never aborts or alters its siblings. The executor waits for every
 * order to finish and returns one result per order, in submission order.
 * There are no retries and nothing is rolled back.
 */
public final class OrderExecutor {
    private static final Logger log = LoggerFactory.getLogger(OrderExecutor.class);

    private final ExchangeClient exchangeClient;
    private final RebalanceMetrics metrics;

    public OrderExecutor(ExchangeClient exchangeClient, RebalanceMetrics metrics) {
        this.exchangeClient = exchangeClient;
        this.metrics = metrics;
    }

    /**
     * Submit all orders and wait for every one of them.
     *
     * @param orders Orders that passed validation
     * @param mode Submission mode of the whole run
     * @return Exactly one result per order, same order as the input
     */
    public List<OrderResult> executeAll(List<OrderRequest> orders, SubmissionMode mode) {
        if (orders.isEmpty()) {
            return List.of();
        }

        log.info("[OrderExecutor] Submitting {} {} orders", orders.size(), mode);

        List<CompletableFuture<OrderResult>> futures = new ArrayList<>(orders.size());
        for (OrderRequest order : orders) {
            futures.add(submit(order, mode));
        }

        CompletableFuture.allOf(futures.toArray(new CompletableFuture[0])).join();

        List<OrderResult> results = new ArrayList<>(futures.size());
        int placed = 0;
        for (CompletableFuture<OrderResult> future : futures) {
            OrderResult result = future.join();
            if (result.isSuccess()) {
                placed++;
            }
            results.add(result);
        }
        log.info("[OrderExecutor] {} of {} orders accepted by the exchange", placed, results.size());
        return results;
    }

    /**
     * Submit one order. The returned future always completes normally.
     * Only a failure of the exchange call itself makes the result FAILED.
     */
    CompletableFuture<OrderResult> submit(OrderRequest order, SubmissionMode mode) {
        Instant start = Instant.now();
        CompletableFuture<JsonNode> attempt;
        try {
            attempt = exchangeClient.submitOrder(order, mode);
        } catch (RuntimeException e) {
            // client failed before handing back a future
            attempt = CompletableFuture.failedFuture(e);
        }
        return attempt.handle((response, error) -> error == null
            ? onSuccess(order, response, start)
            : onFailure(order, error, start));
    }

    private OrderResult onSuccess(OrderRequest order, JsonNode response, Instant start) {
        OrderResult result = OrderResult.success(order, response);
        try {
            metrics.recordOrderSuccess(order.symbol(), Duration.between(start, Instant.now()));
            log.info("[OrderExecutor] Ordered {} {} at ${} (Total: ${})",
                order.quantity().toPlainString(), order.symbol(),
                order.price().toPlainString(), order.notional().toPlainString());
        } catch (RuntimeException e) {
            // the exchange accepted the order, so it stays SUCCESS
            log.warn("[OrderExecutor] Bookkeeping for placed {} order failed: {}", order.symbol(), e.toString());
        }
        return result;
    }

    private OrderResult onFailure(OrderRequest order, Throwable error, Instant start) {
        Duration latency = Duration.between(start, Instant.now());
        Throwable cause = unwrap(error);
        FailureType type = classify(cause);
        String message = cause.getMessage() != null ? cause.getMessage() : cause.getClass().getSimpleName();

        metrics.recordOrderFailure(order.symbol(), type, latency);
        log.warn("[OrderExecutor] Order for {} failed ({}): {}", order.symbol(), type, message);
        return OrderResult.failed(order, type, message);
    }

    static FailureType classify(Throwable cause) {
        if (cause instanceof ExchangeException) {
            return FailureType.EXCHANGE_REJECTED;
        }
        if (cause instanceof HttpTimeoutException || cause instanceof TimeoutException) {
            return FailureType.TIMEOUT;
        }
        if (cause instanceof IOException) {
            return FailureType.NETWORK;
        }
        return FailureType.UNEXPECTED;
    }

    private static Throwable unwrap(Throwable error) {
        Throwable current = error;
        while ((current instanceof CompletionException || current instanceof ExecutionException)
            && current.getCause() != null) {
            current = current.getCause();
        }
        return current;
    }
}
