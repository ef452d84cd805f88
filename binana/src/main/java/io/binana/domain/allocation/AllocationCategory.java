package io.binana.domain.allocation;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Named group of assets with their target weights (e.g. "Large Cap").
 * Asset order is the declaration order.
 */
public record AllocationCategory(String name, Map<String, Double> weights) {

    public AllocationCategory {
        if (name == null || name.isBlank()) {
            throw new InvalidAllocationException("Category name cannot be null or empty");
        }
        if (weights == null) {
            throw new InvalidAllocationException("Category " + name + " has no assets");
        }
        weights = Collections.unmodifiableMap(new LinkedHashMap<>(weights));
    }

    public static AllocationCategory of(String name, Map<String, Double> weights) {
        return new AllocationCategory(name, weights);
    }

    public double totalWeight() {
        double sum = 0.0;
        for (double w : weights.values()) {
            sum += w;
        }
        return sum;
    }
}
