package io.binana.infrastructure.exchange;

import org.junit.jupiter.api.Test;

import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;

import static org.junit.jupiter.api.Assertions.*;

class BinanceRequestSignerTest {

    private static final Clock CLOCK = Clock.fixed(Instant.ofEpochMilli(1499827319559L), ZoneOffset.UTC);

    @Test
    void testKnownSignature() {
        // example from the Binance API documentation
        BinanceRequestSigner signer = new BinanceRequestSigner(
            "NhqPtmdSJYdKjVHjA7PZj4Mge3R5YNiP1e3UZjInClVN65XAbvqqM6A7H5fATj0j", 5000L, CLOCK);

        String signature = signer.hmacSha256Hex(
            "symbol=LTCBTC&side=BUY&type=LIMIT&timeInForce=GTC&quantity=1&price=0.1&recvWindow=5000&timestamp=1499827319559");

        assertEquals("c8db56825ae71d6d79447849e617115f4a920fa2acdcab2b053c4b2838bd6b71", signature);
    }

    @Test
    void testSignAppendsTimestampWindowAndSignature() {
        BinanceRequestSigner signer = new BinanceRequestSigner("secret", 5000L, CLOCK);

        String signed = signer.sign("symbol=BTCUSD");

        String payload = "symbol=BTCUSD&timestamp=1499827319559&recvWindow=5000";
        assertEquals(payload + "&signature=" + signer.hmacSha256Hex(payload), signed);
    }

    @Test
    void testEmptyParameters() {
        BinanceRequestSigner signer = new BinanceRequestSigner("secret", 60000L, CLOCK);

        assertTrue(signer.sign("").startsWith("timestamp=1499827319559&recvWindow=60000&signature="));
    }

    @Test
    void testBlankSecretRejected() {
        assertThrows(IllegalArgumentException.class, () -> new BinanceRequestSigner("", 5000L, CLOCK));
    }
}
