package io.binana.service.report;

import com.fasterxml.jackson.core.JsonGenerator;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import io.binana.domain.allocation.AllocationCategory;
import io.binana.domain.allocation.AllocationSpec;
import io.binana.domain.portfolio.AssetPosition;

import java.io.PrintStream;
import java.math.BigDecimal;
import java.math.RoundingMode;
import java.util.List;
import java.util.Map;
import java.util.function.Function;
import java.util.stream.Collectors;

/**
 * Human-readable output of a run: the order report and the allocation summary.
 */
public final class ReportPrinter {

    private static final ObjectMapper MAPPER = new ObjectMapper()
        .enable(SerializationFeature.INDENT_OUTPUT)
        .enable(JsonGenerator.Feature.WRITE_BIGDECIMAL_AS_PLAIN);

    private final PrintStream out;

    public ReportPrinter() {
        this(System.out);
    }

    public ReportPrinter(PrintStream out) {
        this.out = out;
    }

    /**
     * Print every result as JSON, then the batch totals.
     */
    public void printReport(BatchReport report) {
        out.println(renderResults(report));
        out.printf("%nMode: %s | Status: %s | Success: %d | Failed: %d | Rejected: %d%n",
            report.mode(), report.status(), report.successCount(), report.failedCount(), report.rejectedCount());
        out.printf("Cash spent: $%s%n", report.totalNotionalSpent().setScale(3, RoundingMode.DOWN).toPlainString());
    }

    /**
     * Print category and asset weights before and after this cycle's purchases.
     *
     * @param spec Target allocation
     * @param positions Positions returned by the balancer
     */
    public void printAllocation(AllocationSpec spec, List<AssetPosition> positions) {
        Map<String, AssetPosition> bySymbol = positions.stream()
            .collect(Collectors.toMap(AssetPosition::symbol, Function.identity(), (a, b) -> a));

        long totalBefore = positions.stream().mapToLong(AssetPosition::valueCents).sum();
        long totalAfter = positions.stream().mapToLong(AssetPosition::valueAfterInvestment).sum();

        out.println();
        out.printf("%-12s %10s %10s %10s%n", "Category", "Current", "Target", "After");
        for (AllocationCategory category : spec.categories()) {
            long before = 0L;
            long after = 0L;
            for (String symbol : category.weights().keySet()) {
                AssetPosition position = bySymbol.get(symbol);
                if (position != null) {
                    before += position.valueCents();
                    after += position.valueAfterInvestment();
                }
            }
            out.printf("%-12s %9s%% %9s%% %9s%%%n", category.name(),
                percent(before, totalBefore), percent(category.totalWeight()), percent(after, totalAfter));
        }

        out.println();
        out.printf("%-8s %18s %12s %12s %9s %9s %9s%n",
            "Asset", "Quantity", "Value", "Invested", "Current", "Target", "After");
        for (AssetPosition position : positions) {
            out.printf("%-8s %18s %12s %12s %8s%% %8s%% %8s%%%n",
                position.symbol(),
                position.quantity().stripTrailingZeros().toPlainString(),
                "$" + AssetPosition.toDollars(position.valueCents()).toPlainString(),
                "$" + AssetPosition.toDollars(position.amountToInvest()).toPlainString(),
                percent(position.valueCents(), totalBefore),
                percent(spec.weightOf(position.symbol())),
                percent(position.valueAfterInvestment(), totalAfter));
        }
    }

    /**
     * Results as an indented JSON array.
     */
    public String renderResults(BatchReport report) {
        try {
            return MAPPER.writeValueAsString(report.results());
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Failed to render order results", e);
        }
    }

    private static String percent(long part, long total) {
        if (total <= 0) {
            return "0.00";
        }
        return BigDecimal.valueOf(part * 100L)
            .divide(BigDecimal.valueOf(total), 2, RoundingMode.HALF_UP)
            .toPlainString();
    }

    private static String percent(double weight) {
        return BigDecimal.valueOf(weight * 100.0).setScale(2, RoundingMode.HALF_UP).toPlainString();
    }
}
