package io.binana.domain.allocation;

/**
 * Thrown when an allocation declaration violates its invariants.
 * Raised at construction time, before any exchange call is made.
 */
public class InvalidAllocationException extends RuntimeException {

    private final double weightSum;
    private final double tolerance;

    public InvalidAllocationException(String message) {
        this(message, Double.NaN, Double.NaN);
    }

    public InvalidAllocationException(String message, double weightSum, double tolerance) {
        super(message);
        this.weightSum = weightSum;
        this.tolerance = tolerance;
    }

    /**
     * Weight sum that failed verification, or NaN when the failure was not about the sum.
     */
    public double getWeightSum() {
        return weightSum;
    }

    public double getTolerance() {
        return tolerance;
    }
}
