package io.binana.service.report;

import io.binana.domain.allocation.AllocationCategory;
import io.binana.domain.allocation.AllocationSpec;
import io.binana.domain.order.FailureType;
import io.binana.domain.order.OrderRequest;
import io.binana.domain.order.OrderResult;
import io.binana.domain.order.SubmissionMode;
import io.binana.domain.portfolio.AssetPosition;
import org.junit.jupiter.api.Test;

import java.io.ByteArrayOutputStream;
import java.io.PrintStream;
import java.math.BigDecimal;
import java.nio.charset.StandardCharsets;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

class ReportPrinterTest {

    private final ByteArrayOutputStream buffer = new ByteArrayOutputStream();
    private final ReportPrinter printer = new ReportPrinter(new PrintStream(buffer, true, StandardCharsets.UTF_8));

    private String output() {
        return buffer.toString(StandardCharsets.UTF_8);
    }

    @Test
    void testReportListsResultsAndTotals() {
        OrderRequest eth = new OrderRequest("ETH", new BigDecimal("0.0125"), new BigDecimal("2000.00"));
        OrderRequest btc = new OrderRequest("BTC", new BigDecimal("0.00187"), new BigDecimal("40000.00"));
        BatchReport report = new ResultAggregator().aggregate(List.of(
            OrderResult.success(eth, null),
            OrderResult.failed(btc, FailureType.NETWORK, "Connection reset")
        ), SubmissionMode.TEST);

        printer.printReport(report);

        String out = output();
        assertTrue(out.contains("\"symbol\" : \"ETH\""), out);
        assertTrue(out.contains("\"reason\" : \"NETWORK: Connection reset\""), out);
        assertTrue(out.contains("\"quantity\" : 0.00187"), "BigDecimals are written plain: " + out);
        assertFalse(out.contains("\"response\""), "Null fields are omitted: " + out);
        assertTrue(out.contains("Status: PARTIAL"), out);
        assertTrue(out.contains("Cash spent: $25.000"), out);
    }

    @Test
    void testAllocationSummary() {
        Map<String, Double> weights = new LinkedHashMap<>();
        weights.put("ETH", 0.5);
        weights.put("BTC", 0.5);
        AllocationSpec spec = AllocationSpec.build(List.of(AllocationCategory.of("Large Cap", weights))).verify();
        List<AssetPosition> positions = List.of(
            new AssetPosition("ETH", new BigDecimal("0.025"), 5_000L, 2_500L),
            new AssetPosition("BTC", BigDecimal.ZERO, 0L, 7_500L)
        );

        printer.printAllocation(spec, positions);

        String out = output();
        assertTrue(out.contains("Large Cap"), out);
        assertTrue(out.contains("100.00%"), out);
        assertTrue(out.contains("50.00%"), out);
        assertTrue(out.contains("$75.00"), out);
    }
}
