package io.binana.config;

import com.fasterxml.jackson.annotation.JsonProperty;
import io.binana.domain.allocation.AllocationCategory;
import io.binana.domain.allocation.AllocationSpec;
import io.binana.domain.allocation.InvalidAllocationException;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;

/**
 * Target allocation as stored in the allocation file:
 * <pre>
 * {"categories": [{"name": "Large Cap", "assets": {"ETH": 0.23, "BTC": 0.18}}]}
 * </pre>
 */
public record AllocationConfig(
    @JsonProperty("categories")
    List<Category> categories
) {
    public record Category(
        @JsonProperty("name")
        String name,

        @JsonProperty("assets")
        LinkedHashMap<String, Double> assets
    ) {}

    /**
     * Built-in allocation used when no file is configured.
     */
    public static AllocationConfig defaults() {
        LinkedHashMap<String, Double> largeCap = new LinkedHashMap<>();
        largeCap.put("ETH", 0.23);
        largeCap.put("BTC", 0.18);
        largeCap.put("ADA", 0.14);
        largeCap.put("SOL", 0.05);

        LinkedHashMap<String, Double> midCap = new LinkedHashMap<>();
        midCap.put("LINK", 0.13);
        midCap.put("MATIC", 0.13);
        midCap.put("UNI", 0.09);
        midCap.put("DOT", 0.05);

        // held but not bought
        LinkedHashMap<String, Double> other = new LinkedHashMap<>();
        other.put("BNB", 0.0);

        return new AllocationConfig(List.of(
            new Category("Large Cap", largeCap),
            new Category("Mid Cap", midCap),
            new Category("Other", other)
        ));
    }

    /**
     * Build and verify the allocation.
     *
     * @throws InvalidAllocationException if the allocation is malformed or weights do not sum to 1
     */
    public AllocationSpec toSpec() {
        if (categories == null) {
            throw new InvalidAllocationException("Allocation has no categories");
        }
        List<AllocationCategory> built = new ArrayList<>();
        for (Category category : categories) {
            built.add(AllocationCategory.of(category.name(), category.assets()));
        }
        return AllocationSpec.build(built).verify();
    }
}
