package org.veridrive.driver.verify;

import org.veridrive.driver.api.PipelineOutcome;
import org.veridrive.driver.api.PipelineStatistics;

import java.time.Duration;
import java.util.Objects;

/**
 * What verifying one unit produced.
 *
 * @param unitName   The unit name.
 * @param statistics The unit's counters; empty unless solving ran.
 * @param outcome    The stage reached.
 * @param elapsed    Wall-clock time spent on the unit, {@link Duration#ZERO} if not measured.
 */
public record UnitResult(String unitName, PipelineStatistics statistics, PipelineOutcome outcome, Duration elapsed) {

    public UnitResult {
        Objects.requireNonNull(unitName, "unitName");
        Objects.requireNonNull(statistics, "statistics");
        Objects.requireNonNull(outcome, "outcome");
        elapsed = elapsed != null ? elapsed : Duration.ZERO;
    }

    public UnitResult(String unitName, PipelineStatistics statistics, PipelineOutcome outcome) {
        this(unitName, statistics, outcome, Duration.ZERO);
    }

    public UnitResult withElapsed(Duration duration) {
        return new UnitResult(unitName, statistics, outcome, duration);
    }

    /**
     * A unit is verified when it had nothing to verify or solving completed, and no error,
     * inconclusive, time out or out-of-memory count is non-zero.
     *
     * @return the unit-level verdict.
     */
    public boolean isVerified() {
        return (outcome == PipelineOutcome.DONE || outcome == PipelineOutcome.VERIFICATION_COMPLETED)
                && !statistics.hasFailures();
    }
}
