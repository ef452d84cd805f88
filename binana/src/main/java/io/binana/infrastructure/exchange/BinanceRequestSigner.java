package io.binana.infrastructure.exchange;

import javax.crypto.Mac;
import javax.crypto.spec.SecretKeySpec;
import java.nio.charset.StandardCharsets;
import java.security.InvalidKeyException;
import java.security.NoSuchAlgorithmException;
import java.time.Clock;
import java.util.HexFormat;

/**
 * Signs Binance SIGNED endpoint parameters.
 *
 * The signature is HMAC-SHA256 of the full parameter string, keyed with the API secret,
 * hex encoded and appended as the last parameter:
 * <pre>
 * symbol=BTCUSD&amp;side=BUY&amp;...&amp;timestamp=1700000000000&amp;recvWindow=5000&amp;signature=3f1c...
 * </pre>
 */
public final class BinanceRequestSigner {

    private static final String ALGORITHM = "HmacSHA256";

    private final String secret;
    private final long recvWindowMs;
    private final Clock clock;

    public BinanceRequestSigner(String secret, long recvWindowMs, Clock clock) {
        if (secret == null || secret.isEmpty()) {
            throw new IllegalArgumentException("API secret cannot be null or empty");
        }
        this.secret = secret;
        this.recvWindowMs = recvWindowMs;
        this.clock = clock;
    }

    /**
     * Append timestamp, recvWindow and signature to the parameters.
     *
     * @param params URL-encoded parameters without a leading '?', may be empty
     * @return Signed parameter string
     */
    public String sign(String params) {
        StringBuilder query = new StringBuilder(params);
        if (query.length() > 0) {
            query.append('&');
        }
        query.append("timestamp=").append(clock.millis())
            .append("&recvWindow=").append(recvWindowMs);

        String payload = query.toString();
        return payload + "&signature=" + hmacSha256Hex(payload);
    }

    String hmacSha256Hex(String payload) {
        try {
            Mac mac = Mac.getInstance(ALGORITHM);
            mac.init(new SecretKeySpec(secret.getBytes(StandardCharsets.UTF_8), ALGORITHM));
            return HexFormat.of().formatHex(mac.doFinal(payload.getBytes(StandardCharsets.UTF_8)));
        } catch (NoSuchAlgorithmException | InvalidKeyException e) {
            throw new IllegalStateException("Failed to compute HMAC SHA-256", e);
        }
    }
}
