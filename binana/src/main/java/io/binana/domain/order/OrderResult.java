package io.binana.domain.order;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.databind.JsonNode;

import java.math.BigDecimal;

/**
 * Outcome of one order, produced once and never changed.
 *
 * {@code reason} is set for REJECTED and FAILED results, {@code response} for SUCCESS.
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record OrderResult(
    String symbol,
    BigDecimal quantity,
    BigDecimal price,
    BigDecimal notional,
    OrderOutcome outcome,
    String reason,
    JsonNode response
) {
    public static OrderResult success(OrderRequest request, JsonNode response) {
        return new OrderResult(request.symbol(), request.quantity(), request.price(),
            request.notional(), OrderOutcome.SUCCESS, null, response);
    }

    public static OrderResult failed(OrderRequest request, FailureType type, String message) {
        return new OrderResult(request.symbol(), request.quantity(), request.price(),
            request.notional(), OrderOutcome.FAILED, type.name() + ": " + message, null);
    }

    public static OrderResult rejected(String symbol, BigDecimal quantity, BigDecimal price, String reason) {
        return new OrderResult(symbol, quantity, price, price.multiply(quantity),
            OrderOutcome.REJECTED, reason, null);
    }

    public boolean isSuccess() {
        return outcome == OrderOutcome.SUCCESS;
    }
}
