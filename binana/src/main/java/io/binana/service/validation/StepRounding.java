package io.binana.service.validation;

import java.math.BigDecimal;
import java.math.RoundingMode;

/**
 * Truncation onto an exchange increment grid (tick size, step size).
 */
public final class StepRounding {

    /**
     * Largest multiple of {@code step} that is &lt;= {@code value} (for value &gt;= 0).
     * A zero or negative step leaves the value unchanged.
     */
    public static BigDecimal roundDown(BigDecimal value, BigDecimal step) {
        if (step == null || step.signum() <= 0) {
            return value;
        }
        BigDecimal steps = value.divide(step, 0, RoundingMode.DOWN);
        BigDecimal rounded = steps.multiply(step);
        int scale = Math.max(step.stripTrailingZeros().scale(), 0);
        return rounded.setScale(scale, RoundingMode.DOWN);
    }

    private StepRounding() {}
}
