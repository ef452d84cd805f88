package io.binana.service.report;

import io.binana.domain.order.OrderResult;
import io.binana.domain.order.SubmissionMode;

import java.math.BigDecimal;
import java.util.List;

/**
 * Every order's fate in one run, plus totals.
 */
public record BatchReport(
    SubmissionMode mode,
    List<OrderResult> results,
    BigDecimal totalNotionalSpent,
    int successCount,
    int failedCount,
    int rejectedCount,
    BatchStatus status
) {
    public BatchReport {
        results = List.copyOf(results);
    }

    /**
     * Orders that reached the exchange.
     */
    public int submittedCount() {
        return successCount + failedCount;
    }
}
