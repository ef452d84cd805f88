package io.binana.service.execution;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.JsonNodeFactory;
import io.binana.application.port.output.ExchangeClient;
import io.binana.application.port.output.ExchangeException;
import io.binana.domain.order.FailureType;
import io.binana.domain.order.OrderOutcome;
import io.binana.domain.order.OrderRequest;
import io.binana.domain.order.OrderResult;
import io.binana.domain.order.SubmissionMode;
import io.binana.infrastructure.metrics.RebalanceMetrics;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.io.IOException;
import java.math.BigDecimal;
import java.net.ConnectException;
import java.net.http.HttpTimeoutException;
import java.util.List;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.TimeUnit;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.*;

@ExtendWith(MockitoExtension.class)
class OrderExecutorTest {

    @Mock
    private ExchangeClient exchangeClient;
    @Mock
    private RebalanceMetrics metrics;

    private OrderExecutor executor;

    private final OrderRequest eth = new OrderRequest("ETH", new BigDecimal("0.01"), new BigDecimal("2000.00"));
    private final OrderRequest btc = new OrderRequest("BTC", new BigDecimal("0.001"), new BigDecimal("30000.00"));
    private final OrderRequest ada = new OrderRequest("ADA", new BigDecimal("50"), new BigDecimal("0.40"));

    @BeforeEach
    void setUp() {
        executor = new OrderExecutor(exchangeClient, metrics);
    }

    private static CompletableFuture<JsonNode> ok() {
        return CompletableFuture.completedFuture(JsonNodeFactory.instance.objectNode());
    }

    @Test
    @DisplayName("Second of three orders fails: the other two still succeed")
    void testOneFailureDoesNotAffectSiblings() {
        // Arrange
        when(exchangeClient.submitOrder(eq(eth), any())).thenReturn(ok());
        when(exchangeClient.submitOrder(eq(btc), any())).thenReturn(
            CompletableFuture.failedFuture(new ExchangeException("BINANCE_US", 400, -2010, "Account has insufficient balance")));
        when(exchangeClient.submitOrder(eq(ada), any())).thenReturn(ok());

        // Act
        List<OrderResult> results = executor.executeAll(List.of(eth, btc, ada), SubmissionMode.TEST);

        // Assert
        assertEquals(3, results.size());
        assertEquals(OrderOutcome.SUCCESS, results.get(0).outcome());
        assertEquals(OrderOutcome.FAILED, results.get(1).outcome());
        assertEquals(OrderOutcome.SUCCESS, results.get(2).outcome());
        assertEquals("BTC", results.get(1).symbol(), "Results keep submission order");
        assertTrue(results.get(1).reason().startsWith("EXCHANGE_REJECTED"), results.get(1).reason());
        assertNotNull(results.get(0).response());

        verify(metrics, times(2)).recordOrderSuccess(any(), any());
        verify(metrics).recordOrderFailure(eq("BTC"), eq(FailureType.EXCHANGE_REJECTED), any());
    }

    @Test
    void testResultCountMatchesOrderCount() {
        when(exchangeClient.submitOrder(any(), any())).thenReturn(
            CompletableFuture.failedFuture(new ConnectException("Connection refused")));

        List<OrderResult> results = executor.executeAll(List.of(eth, btc, ada), SubmissionMode.LIVE);

        long failed = results.stream().filter(r -> r.outcome() == OrderOutcome.FAILED).count();
        long success = results.stream().filter(OrderResult::isSuccess).count();
        assertEquals(3, results.size());
        assertEquals(3, failed);
        assertEquals(3, success + failed);
        verify(exchangeClient, times(3)).submitOrder(any(), eq(SubmissionMode.LIVE));
    }

    @Test
    void testSynchronousThrowBecomesFailedResult() {
        when(exchangeClient.submitOrder(any(), any())).thenThrow(new IllegalStateException("client closed"));

        List<OrderResult> results = executor.executeAll(List.of(eth), SubmissionMode.TEST);

        assertEquals(OrderOutcome.FAILED, results.get(0).outcome());
        assertEquals("UNEXPECTED: client closed", results.get(0).reason());
    }

    @Test
    void testEmptyBatchMakesNoCalls() {
        assertTrue(executor.executeAll(List.of(), SubmissionMode.TEST).isEmpty());
        verifyNoInteractions(exchangeClient, metrics);
    }

    @Test
    void testClassify() {
        assertEquals(FailureType.EXCHANGE_REJECTED,
            OrderExecutor.classify(new ExchangeException("X", 400, -1013, "Filter failure")));
        assertEquals(FailureType.TIMEOUT, OrderExecutor.classify(new HttpTimeoutException("request timed out")));
        assertEquals(FailureType.NETWORK, OrderExecutor.classify(new IOException("reset")));
        assertEquals(FailureType.UNEXPECTED, OrderExecutor.classify(new NullPointerException()));
    }

    @Test
    void testWrappedTimeoutIsClassifiedAsTimeout() {
        when(exchangeClient.submitOrder(any(), any())).thenReturn(
            CompletableFuture.failedFuture(new CompletionException(new HttpTimeoutException("request timed out"))));

        OrderResult result = executor.executeAll(List.of(eth), SubmissionMode.TEST).get(0);

        assertTrue(result.reason().startsWith("TIMEOUT"), result.reason());
    }

    @Test
    @DisplayName("Every order is submitted before any response arrives; results keep submission order")
    void testOrdersAreSubmittedConcurrently() throws Exception {
        // Arrange
        CompletableFuture<JsonNode> ethResponse = new CompletableFuture<>();
        CompletableFuture<JsonNode> btcResponse = new CompletableFuture<>();
        CompletableFuture<JsonNode> adaResponse = new CompletableFuture<>();
        when(exchangeClient.submitOrder(eq(eth), any())).thenReturn(ethResponse);
        when(exchangeClient.submitOrder(eq(btc), any())).thenReturn(btcResponse);
        when(exchangeClient.submitOrder(eq(ada), any())).thenReturn(adaResponse);

        // Act
        CompletableFuture<List<OrderResult>> batch =
            CompletableFuture.supplyAsync(() -> executor.executeAll(List.of(eth, btc, ada), SubmissionMode.TEST));

        // Assert: all three are in flight while none has completed
        verify(exchangeClient, timeout(2_000).times(3)).submitOrder(any(), eq(SubmissionMode.TEST));
        assertFalse(batch.isDone());

        adaResponse.complete(JsonNodeFactory.instance.objectNode());
        btcResponse.completeExceptionally(new HttpTimeoutException("request timed out"));
        assertFalse(batch.isDone(), "Still waiting for ETH");
        ethResponse.complete(JsonNodeFactory.instance.objectNode());

        List<OrderResult> results = batch.get(5, TimeUnit.SECONDS);
        assertEquals(List.of("ETH", "BTC", "ADA"), results.stream().map(OrderResult::symbol).toList());
        assertEquals(OrderOutcome.SUCCESS, results.get(0).outcome());
        assertEquals(OrderOutcome.FAILED, results.get(1).outcome());
        assertEquals(OrderOutcome.SUCCESS, results.get(2).outcome());
    }

    @Test
    @DisplayName("An accepted order stays SUCCESS when recording its metrics fails")
    void testBookkeepingFailureDoesNotFailPlacedOrder() {
        when(exchangeClient.submitOrder(any(), any())).thenReturn(ok());
        doThrow(new IllegalStateException("registry closed")).when(metrics).recordOrderSuccess(any(), any());

        OrderResult result = executor.executeAll(List.of(eth), SubmissionMode.LIVE).get(0);

        assertEquals(OrderOutcome.SUCCESS, result.outcome());
        assertNull(result.reason());
        verify(metrics, never()).recordOrderFailure(any(), any(), any());
    }
}
