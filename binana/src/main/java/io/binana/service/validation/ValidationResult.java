package io.binana.service.validation;

import io.binana.domain.order.OrderRequest;
import io.binana.domain.order.OrderResult;

/**
 * Result of checking one candidate order against its trading rule.
 * Exactly one of {@code order} and {@code rejection} is set.
 */
public record ValidationResult(
    boolean passed,
    OrderRequest order,
    OrderResult rejection
) {
    public static ValidationResult pass(OrderRequest order) {
        return new ValidationResult(true, order, null);
    }

    public static ValidationResult reject(OrderResult rejection) {
        return new ValidationResult(false, null, rejection);
    }
}
