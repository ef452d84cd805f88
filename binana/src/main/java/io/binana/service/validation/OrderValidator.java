package io.binana.service.validation;

import io.binana.domain.order.OrderRequest;
import io.binana.domain.order.OrderResult;
import io.binana.domain.order.TradingRule;
import io.binana.domain.portfolio.AssetPosition;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.math.BigDecimal;
import java.math.RoundingMode;

/**
 * Turns a position's cash allocation into a limit order on the exchange grid
 * and checks it against the symbol's trading rule.
 *
 * Checks run in a fixed order and the first failing one is the only reason reported:
 * price min, price max, quantity min, quantity max, notional min.
 * A rejected order is returned as data and never reaches the exchange.
 */
public final class OrderValidator {
    private static final Logger log = LoggerFactory.getLogger(OrderValidator.class);

    static final String PRICE_BELOW_MIN = "price below minimum";
    static final String PRICE_ABOVE_MAX = "price above maximum";
    static final String QTY_BELOW_MIN = "quantity below minimum";
    static final String QTY_ABOVE_MAX = "quantity above maximum";
    static final String NOTIONAL_BELOW_MIN = "notional below minimum";

    private static final int QUANTITY_SCALE = 18;

    /**
     * Validate the order implied by {@code position.amountToInvest()} at {@code price}.
     *
     * @param position Position with a positive amount to invest
     * @param price Live unit price, positive
     * @param rule Trading rule of the symbol
     */
    public ValidationResult validate(AssetPosition position, BigDecimal price, TradingRule rule) {
        if (!position.isBuying()) {
            throw new IllegalArgumentException("Nothing to invest for " + position.symbol());
        }
        if (price == null || price.signum() <= 0) {
            throw new IllegalArgumentException("Price must be positive for " + position.symbol());
        }

        BigDecimal dollars = AssetPosition.toDollars(position.amountToInvest());
        BigDecimal rawQuantity = dollars.divide(price, QUANTITY_SCALE, RoundingMode.DOWN);

        BigDecimal quantity = StepRounding.roundDown(rawQuantity, rule.stepSize());
        BigDecimal limitPrice = StepRounding.roundDown(price, rule.tickSize());
        BigDecimal notional = limitPrice.multiply(quantity);

        String reason = firstViolation(limitPrice, quantity, notional, rule);
        if (reason != null) {
            log.warn("[OrderValidator] Could not submit {} order: {}", position.symbol(), reason);
            return ValidationResult.reject(
                OrderResult.rejected(position.symbol(), quantity, limitPrice, reason));
        }

        log.debug("[OrderValidator] {} qty={} price={} notional={}",
            position.symbol(), quantity.toPlainString(), limitPrice.toPlainString(), notional.toPlainString());
        return ValidationResult.pass(new OrderRequest(position.symbol(), quantity, limitPrice));
    }

    private static String firstViolation(BigDecimal price, BigDecimal quantity,
                                         BigDecimal notional, TradingRule rule) {
        if (price.compareTo(rule.minPrice()) < 0) {
            return describe(PRICE_BELOW_MIN, price, "<", rule.minPrice());
        }
        if (price.signum() == 0) {
            return describe(PRICE_BELOW_MIN, price, "<=", BigDecimal.ZERO);
        }
        if (rule.hasMaxPrice() && price.compareTo(rule.maxPrice()) > 0) {
            return describe(PRICE_ABOVE_MAX, price, ">", rule.maxPrice());
        }
        if (quantity.compareTo(rule.minQty()) < 0) {
            return describe(QTY_BELOW_MIN, quantity, "<", rule.minQty());
        }
        if (rule.hasMaxQty() && quantity.compareTo(rule.maxQty()) > 0) {
            return describe(QTY_ABOVE_MAX, quantity, ">", rule.maxQty());
        }
        if (notional.compareTo(rule.minNotional()) < 0) {
            return describe(NOTIONAL_BELOW_MIN, notional, "<", rule.minNotional());
        }
        // rules without minimums still never allow an empty order
        if (quantity.signum() == 0) {
            return describe(QTY_BELOW_MIN, quantity, "<=", BigDecimal.ZERO);
        }
        return null;
    }

    private static String describe(String reason, BigDecimal actual, String op, BigDecimal bound) {
        return String.format("%s (%s %s %s)", reason, actual.toPlainString(), op, bound.toPlainString());
    }
}
