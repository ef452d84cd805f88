package io.binana.application.port.output;

/**
 * The exchange answered a request with an error payload.
 */
public class ExchangeException extends RuntimeException {

    private final String exchangeCode;
    private final int httpStatus;
    private final int errorCode;

    public ExchangeException(String exchangeCode, int httpStatus, int errorCode, String message) {
        super(String.format("[%s] HTTP %d, code %d: %s", exchangeCode, httpStatus, errorCode, message));
        this.exchangeCode = exchangeCode;
        this.httpStatus = httpStatus;
        this.errorCode = errorCode;
    }

    public String getExchangeCode() {
        return exchangeCode;
    }

    public int getHttpStatus() {
        return httpStatus;
    }

    /**
     * Exchange-specific error code (e.g. -2010 on Binance), 0 when the payload had none.
     */
    public int getErrorCode() {
        return errorCode;
    }
}
