package org.veridrive.driver.api;

import java.util.Objects;

/**
 * What the proof engine's solving step reports for one unit.
 *
 * @param outcome    Normally {@link PipelineOutcome#VERIFICATION_COMPLETED}.
 * @param statistics The counters for the unit.
 */
public record VerificationResult(PipelineOutcome outcome, PipelineStatistics statistics) {
    public VerificationResult {
        Objects.requireNonNull(outcome, "outcome");
        Objects.requireNonNull(statistics, "statistics");
    }

    public static VerificationResult completed(PipelineStatistics statistics) {
        return new VerificationResult(PipelineOutcome.VERIFICATION_COMPLETED, statistics);
    }
}
