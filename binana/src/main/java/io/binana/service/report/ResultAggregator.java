package io.binana.service.report;

import io.binana.domain.order.OrderResult;
import io.binana.domain.order.SubmissionMode;

import java.math.BigDecimal;
import java.util.List;

/**
 * Folds per-order results into a BatchReport. Pure: no I/O, no logging.
 */
public final class ResultAggregator {

    public BatchReport aggregate(List<OrderResult> results, SubmissionMode mode) {
        BigDecimal spent = BigDecimal.ZERO;
        int success = 0;
        int failed = 0;
        int rejected = 0;

        for (OrderResult result : results) {
            switch (result.outcome()) {
                case SUCCESS -> {
                    success++;
                    spent = spent.add(result.notional());
                }
                case FAILED -> failed++;
                case REJECTED -> rejected++;
            }
        }

        return new BatchReport(mode, results, spent, success, failed, rejected,
            classify(success, failed));
    }

    private static BatchStatus classify(int success, int failed) {
        if (success == 0 && failed == 0) {
            return BatchStatus.NO_ORDERS;
        }
        if (failed == 0) {
            return BatchStatus.ALL_SUCCEEDED;
        }
        return success == 0 ? BatchStatus.ALL_FAILED : BatchStatus.PARTIAL;
    }
}
