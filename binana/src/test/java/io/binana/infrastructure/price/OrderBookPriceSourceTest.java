package io.binana.infrastructure.price;

import io.binana.application.port.output.ExchangeClient;
import io.binana.application.service.FetchException;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.math.BigDecimal;
import java.util.List;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.TimeUnit;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.Mockito.*;

@ExtendWith(MockitoExtension.class)
class OrderBookPriceSourceTest {

    @Mock
    private ExchangeClient exchangeClient;

    @Test
    void testMeanOfBestBids() throws Exception {
        when(exchangeClient.getBidPrices("BTC", 15)).thenReturn(CompletableFuture.completedFuture(
            List.of(new BigDecimal("30000.30"), new BigDecimal("30000.20"), new BigDecimal("29999.80"))));
        OrderBookPriceSource source = new OrderBookPriceSource(exchangeClient, "USD");

        BigDecimal price = source.getPrice("BTC").get(5, TimeUnit.SECONDS);

        assertEquals(0, new BigDecimal("30000.10").compareTo(price), "Got " + price);
    }

    @Test
    void testQuoteAssetIsWorthOne() throws Exception {
        OrderBookPriceSource source = new OrderBookPriceSource(exchangeClient, "USD");

        assertEquals(BigDecimal.ONE, source.getPrice("USD").get(5, TimeUnit.SECONDS));
        verifyNoInteractions(exchangeClient);
    }

    @Test
    void testEmptyBookFails() {
        assertThrows(FetchException.class, () -> OrderBookPriceSource.averageBid("BTC", List.of()));
    }
}
