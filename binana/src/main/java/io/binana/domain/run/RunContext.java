package io.binana.domain.run;

import io.binana.domain.order.SubmissionMode;

/**
 * Run-scoped settings. Fixed before any remote call and passed explicitly to every stage.
 */
public record RunContext(
    SubmissionMode mode,
    long investableCash,     // cents
    String quoteAsset        // e.g. USD; market symbol = asset + quoteAsset
) {
    public RunContext {
        if (mode == null) {
            throw new IllegalArgumentException("Submission mode cannot be null");
        }
        if (quoteAsset == null || quoteAsset.isBlank()) {
            throw new IllegalArgumentException("Quote asset cannot be null or empty");
        }
    }

    public boolean isTest() {
        return mode == SubmissionMode.TEST;
    }
}
