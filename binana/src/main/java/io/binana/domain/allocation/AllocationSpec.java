package io.binana.domain.allocation;

import java.util.ArrayList;
import java.util.Collections;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Target allocation of the portfolio: ordered categories of (symbol, weight).
 *
 * Invariants enforced by {@link #verify()}:
 * - every weight is &gt;= 0
 * - weights across all categories sum to 1.0 within {@link #WEIGHT_TOLERANCE}
 * - a symbol appears at most once across the whole spec
 *
 * Instances are immutable. Build once at startup, verify, then share.
 */
public final class AllocationSpec {

    public static final double WEIGHT_TOLERANCE = 1e-6;

    private final List<AllocationCategory> categories;

    private AllocationSpec(List<AllocationCategory> categories) {
        this.categories = Collections.unmodifiableList(new ArrayList<>(categories));
    }

    /**
     * Build the allocation tree. Call {@link #verify()} before use.
     */
    public static AllocationSpec build(List<AllocationCategory> categories) {
        if (categories == null || categories.isEmpty()) {
            throw new InvalidAllocationException("Allocation must declare at least one category");
        }
        return new AllocationSpec(categories);
    }

    /**
     * Check the invariants.
     *
     * @return this spec
     * @throws InvalidAllocationException on negative weights, duplicate symbols or a bad weight sum
     */
    public AllocationSpec verify() {
        Set<String> seen = new HashSet<>();
        double sum = 0.0;

        for (AllocationCategory category : categories) {
            for (Map.Entry<String, Double> entry : category.weights().entrySet()) {
                String symbol = entry.getKey();
                Double weight = entry.getValue();

                if (symbol == null || symbol.isBlank()) {
                    throw new InvalidAllocationException(
                        "Category " + category.name() + " contains a blank symbol");
                }
                if (weight == null || weight.isNaN() || weight < 0.0) {
                    throw new InvalidAllocationException(String.format(
                        "Weight of %s in category %s must be >= 0, got %s",
                        symbol, category.name(), weight));
                }
                if (!seen.add(symbol)) {
                    throw new InvalidAllocationException(String.format(
                        "Symbol %s appears more than once (category %s)", symbol, category.name()));
                }
                sum += weight;
            }
        }

        if (Math.abs(sum - 1.0) > WEIGHT_TOLERANCE) {
            throw new InvalidAllocationException(String.format(
                "Allocation weights sum to %.9f, expected 1.0 within %.1e", sum, WEIGHT_TOLERANCE),
                sum, WEIGHT_TOLERANCE);
        }
        return this;
    }

    /**
     * All asset symbols in declaration order, without duplicates.
     */
    public List<String> listSymbols() {
        Set<String> symbols = new LinkedHashSet<>();
        for (AllocationCategory category : categories) {
            symbols.addAll(category.weights().keySet());
        }
        return List.copyOf(symbols);
    }

    /**
     * Target weight of a symbol, 0 when the symbol is not part of the allocation.
     */
    public double weightOf(String symbol) {
        for (AllocationCategory category : categories) {
            Double weight = category.weights().get(symbol);
            if (weight != null) {
                return weight;
            }
        }
        return 0.0;
    }

    /**
     * Symbol to weight, in declaration order.
     */
    public Map<String, Double> weights() {
        Map<String, Double> all = new LinkedHashMap<>();
        for (AllocationCategory category : categories) {
            category.weights().forEach(all::putIfAbsent);
        }
        return Collections.unmodifiableMap(all);
    }

    public List<AllocationCategory> categories() {
        return categories;
    }

    public boolean contains(String symbol) {
        for (AllocationCategory category : categories) {
            if (category.weights().containsKey(symbol)) {
                return true;
            }
        }
        return false;
    }

    @Override
    public String toString() {
        return "AllocationSpec" + categories;
    }
}
