package io.binana.application.service;

import io.binana.domain.portfolio.AssetPosition;
import io.binana.domain.run.RunContext;
import io.binana.service.report.BatchReport;

import java.util.List;

/**
 * What a completed run did: its context, the balanced positions and the order report.
 */
public record RunOutcome(
    RunContext context,
    List<AssetPosition> positions,
    BatchReport report
) {
    public RunOutcome {
        positions = List.copyOf(positions);
    }
}
