package org.veridrive.driver.api;

import java.util.Collection;

/**
 * Per-unit verification counters reported by the proof engine, split into results computed in
 * this run and results reused from an earlier snapshot. Instances are immutable and summable.
 *
 * @param verifiedCount            Procedures proven correct.
 * @param errorCount               Procedures with at least one failing proof obligation.
 * @param inconclusiveCount        Procedures the solver could not decide.
 * @param timeoutCount             Procedures that hit the solver time limit.
 * @param outOfMemoryCount         Procedures that exhausted solver memory.
 * @param cachedVerifiedCount      Verified results reused from a previous snapshot.
 * @param cachedErrorCount         Error results reused from a previous snapshot.
 * @param cachedInconclusiveCount  Inconclusive results reused from a previous snapshot.
 * @param cachedTimeoutCount       Time out results reused from a previous snapshot.
 * @param cachedOutOfMemoryCount   Out-of-memory results reused from a previous snapshot.
 */
public record PipelineStatistics(
        int verifiedCount,
        int errorCount,
        int inconclusiveCount,
        int timeoutCount,
        int outOfMemoryCount,
        int cachedVerifiedCount,
        int cachedErrorCount,
        int cachedInconclusiveCount,
        int cachedTimeoutCount,
        int cachedOutOfMemoryCount
) {
    /** Statistics with every counter at zero. */
    public static final PipelineStatistics EMPTY = new PipelineStatistics(0, 0, 0, 0, 0, 0, 0, 0, 0, 0);

    public PipelineStatistics {
        if (verifiedCount < 0 || errorCount < 0 || inconclusiveCount < 0 || timeoutCount < 0 || outOfMemoryCount < 0
                || cachedVerifiedCount < 0 || cachedErrorCount < 0 || cachedInconclusiveCount < 0
                || cachedTimeoutCount < 0 || cachedOutOfMemoryCount < 0) {
            throw new IllegalArgumentException("Statistics counters must not be negative");
        }
    }

    /**
     * Convenience factory for statistics without cached results.
     */
    public static PipelineStatistics fresh(int verified, int errors, int inconclusive, int timeouts, int outOfMemory) {
        return new PipelineStatistics(verified, errors, inconclusive, timeouts, outOfMemory, 0, 0, 0, 0, 0);
    }

    /**
     * Component-wise addition.
     *
     * @param other the statistics to add.
     * @return a new instance holding the sums.
     */
    public PipelineStatistics plus(PipelineStatistics other) {
        return new PipelineStatistics(
                verifiedCount + other.verifiedCount,
                errorCount + other.errorCount,
                inconclusiveCount + other.inconclusiveCount,
                timeoutCount + other.timeoutCount,
                outOfMemoryCount + other.outOfMemoryCount,
                cachedVerifiedCount + other.cachedVerifiedCount,
                cachedErrorCount + other.cachedErrorCount,
                cachedInconclusiveCount + other.cachedInconclusiveCount,
                cachedTimeoutCount + other.cachedTimeoutCount,
                cachedOutOfMemoryCount + other.cachedOutOfMemoryCount);
    }

    /**
     * Sums a collection of statistics.
     *
     * @param all the statistics to add up; may be empty.
     * @return the field-wise total, {@link #EMPTY} for an empty collection.
     */
    public static PipelineStatistics sum(Collection<PipelineStatistics> all) {
        PipelineStatistics total = EMPTY;
        for (PipelineStatistics stats : all) {
            total = total.plus(stats);
        }
        return total;
    }

    /**
     * @return {@code true} if any error, inconclusive, time out or out-of-memory count is non-zero.
     */
    public boolean hasFailures() {
        return errorCount > 0 || inconclusiveCount > 0 || timeoutCount > 0 || outOfMemoryCount > 0;
    }

    /**
     * @return {@code true} if any cached counter is non-zero.
     */
    public boolean hasCachedResults() {
        return cachedVerifiedCount > 0 || cachedErrorCount > 0 || cachedInconclusiveCount > 0
                || cachedTimeoutCount > 0 || cachedOutOfMemoryCount > 0;
    }
}
